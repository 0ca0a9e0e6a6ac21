package com.topology.core.service.probe.passive;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CdpFrameParserTest {

    private final CdpFrameParser parser = new CdpFrameParser();

    @Test
    @DisplayName("Decodes device id, address, port, capabilities and platform")
    void parsesSwitchAnnouncement() throws Exception {
        var advertisement = parser.parse(FrameFixtures.cdpSwitchFrame()).orElseThrow();

        assertThat(advertisement.protocol()).isEqualTo("cdp");
        assertThat(advertisement.sourceMac()).isEqualTo("aa:bb:cc:dd:ee:01");
        assertThat(advertisement.chassisId()).isEqualTo("sw2.lab");
        assertThat(advertisement.systemName()).isEqualTo("sw2.lab");
        assertThat(advertisement.managementAddress()).isEqualTo("10.0.0.2");
        assertThat(advertisement.portId()).isEqualTo("GigabitEthernet0/2");
        assertThat(advertisement.deviceType()).isEqualTo("switch");
        assertThat(advertisement.platform()).isEqualTo("cisco WS-C2960-24TT-L");
        assertThat(advertisement.softwareVersion())
                .isEqualTo("Cisco IOS Software, C2960 Software, Version 15.0(2)SE");
    }

    @Test
    void ignoresFramesToOtherDestinations() throws Exception {
        var frame = FrameFixtures.cdpSwitchFrame();
        frame[5] = 0x0d;

        assertThat(parser.parse(frame)).isEmpty();
    }

    @Test
    @DisplayName("Rejects a TLV whose declared length exceeds the frame")
    void rejectsOverlongTlv() {
        var frame = new FrameFixtures.CdpFrame()
                .text(0x0001, "sw2.lab")
                .rawTlv(0x0003, 200, new byte[]{0x47, 0x69})
                .build();

        assertThatThrownBy(() -> parser.parse(frame))
                .isInstanceOf(MalformedFrameException.class)
                .hasMessageContaining("invalid length");
    }

    @Test
    void rejectsFrameWithoutDeviceId() {
        var frame = new FrameFixtures.CdpFrame()
                .text(0x0003, "GigabitEthernet0/2")
                .build();

        assertThatThrownBy(() -> parser.parse(frame))
                .isInstanceOf(MalformedFrameException.class)
                .hasMessageContaining("device id");
    }

    @Test
    void mapsCapabilitiesToDeviceType() {
        assertThat(CdpFrameParser.deviceTypeFor(0x01)).isEqualTo("router");
        assertThat(CdpFrameParser.deviceTypeFor(0x08)).isEqualTo("switch");
        assertThat(CdpFrameParser.deviceTypeFor(0x90)).isEqualTo("phone");
        assertThat(CdpFrameParser.deviceTypeFor(0x10)).isEqualTo("server");
    }
}
