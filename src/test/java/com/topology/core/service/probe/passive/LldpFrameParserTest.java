package com.topology.core.service.probe.passive;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LldpFrameParserTest {

    private final LldpFrameParser parser = new LldpFrameParser();

    @Test
    @DisplayName("Decodes chassis, port, system and management TLVs")
    void parsesSwitchAnnouncement() throws Exception {
        var advertisement = parser.parse(FrameFixtures.lldpSwitchFrame()).orElseThrow();

        assertThat(advertisement.protocol()).isEqualTo("lldp");
        assertThat(advertisement.sourceMac()).isEqualTo("aa:bb:cc:dd:ee:01");
        assertThat(advertisement.chassisMac()).isEqualTo("aa:bb:cc:dd:ee:ff");
        assertThat(advertisement.identityMac()).isEqualTo("aa:bb:cc:dd:ee:ff");
        assertThat(advertisement.portId()).isEqualTo("Gi0/1");
        assertThat(advertisement.systemName()).isEqualTo("sw1");
        assertThat(advertisement.systemDescription()).startsWith("Cisco IOS");
        assertThat(advertisement.managementAddress()).isEqualTo("10.0.0.1");
        assertThat(advertisement.deviceType()).isEqualTo("switch");
    }

    @Test
    @DisplayName("Skips an 802.1Q tag before the LLDP ethertype")
    void parsesVlanTaggedFrame() throws Exception {
        var frame = new FrameFixtures.LldpFrame()
                .vlanTagged()
                .chassisMac(FrameFixtures.SWITCH_MAC)
                .portName("ether1")
                .end()
                .build();

        var advertisement = parser.parse(frame);

        assertThat(advertisement).isPresent();
        assertThat(advertisement.get().portId()).isEqualTo("ether1");
    }

    @Test
    @DisplayName("Keeps a textual chassis id when no MAC is advertised")
    void keepsTextualChassisId() throws Exception {
        var frame = new FrameFixtures.LldpFrame()
                .chassisName("core-router")
                .portName("xe-0/0/0")
                .end()
                .build();

        var advertisement = parser.parse(frame).orElseThrow();

        assertThat(advertisement.chassisMac()).isNull();
        assertThat(advertisement.chassisId()).isEqualTo("core-router");
        assertThat(advertisement.identityMac()).isEqualTo("aa:bb:cc:dd:ee:01");
    }

    @Test
    void ignoresOtherEthertypes() throws Exception {
        var frame = new byte[60];
        frame[12] = 0x08;
        frame[13] = 0x00;

        assertThat(parser.parse(frame)).isEmpty();
    }

    @Test
    void ignoresRuntFrames() throws Exception {
        assertThat(parser.parse(new byte[10])).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }

    @Test
    @DisplayName("Rejects a TLV whose length runs past the end of the frame")
    void rejectsTruncatedTlv() {
        var frame = new FrameFixtures.LldpFrame()
                .chassisMac(FrameFixtures.SWITCH_MAC)
                .portName("Gi0/1")
                .truncatedTlv(5, 40)
                .build();

        assertThatThrownBy(() -> parser.parse(frame))
                .isInstanceOf(MalformedFrameException.class)
                .hasMessageContaining("Truncated");
    }

    @Test
    void rejectsFrameWithoutPortTlv() {
        var frame = new FrameFixtures.LldpFrame()
                .chassisMac(FrameFixtures.SWITCH_MAC)
                .ttl(120)
                .end()
                .build();

        assertThatThrownBy(() -> parser.parse(frame))
                .isInstanceOf(MalformedFrameException.class)
                .hasMessageContaining("mandatory");
    }

    @Test
    void mapsEnabledCapabilitiesToDeviceType() {
        assertThat(LldpFrameParser.deviceTypeFor(0x0014)).isEqualTo("router");
        assertThat(LldpFrameParser.deviceTypeFor(0x0004)).isEqualTo("switch");
        assertThat(LldpFrameParser.deviceTypeFor(0x0008)).isEqualTo("access_point");
        assertThat(LldpFrameParser.deviceTypeFor(0)).isNull();
    }
}
