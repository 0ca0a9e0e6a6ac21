package com.topology.core.service.probe.passive;

import com.topology.core.service.model.MacAddresses;

import java.util.Optional;

import static com.topology.core.service.probe.passive.FrameBytes.ascii;
import static com.topology.core.service.probe.passive.FrameBytes.ipv4;
import static com.topology.core.service.probe.passive.FrameBytes.u16;
import static com.topology.core.service.probe.passive.FrameBytes.u8;

/**
 * IEEE 802.1AB (LLDP) frame decoder.
 *
 * Reads the mandatory chassis and port TLVs plus system name, description,
 * capabilities and the first IPv4 management address.
 */
public class LldpFrameParser implements FrameParser {

    static final int ETHERTYPE_LLDP = 0x88cc;
    private static final int ETHERTYPE_VLAN = 0x8100;
    private static final int ETHERNET_HEADER = 14;

    private static final int TLV_END = 0;
    private static final int TLV_CHASSIS_ID = 1;
    private static final int TLV_PORT_ID = 2;
    private static final int TLV_PORT_DESCRIPTION = 4;
    private static final int TLV_SYSTEM_NAME = 5;
    private static final int TLV_SYSTEM_DESCRIPTION = 6;
    private static final int TLV_CAPABILITIES = 7;
    private static final int TLV_MANAGEMENT_ADDRESS = 8;

    private static final int CHASSIS_SUBTYPE_MAC = 4;
    private static final int CHASSIS_SUBTYPE_NETWORK_ADDRESS = 5;
    private static final int PORT_SUBTYPE_MAC = 3;
    private static final int ADDRESS_FAMILY_IPV4 = 1;

    private static final int CAP_STATION = 0x0080;
    private static final int CAP_TELEPHONE = 0x0020;
    private static final int CAP_ROUTER = 0x0010;
    private static final int CAP_WLAN_AP = 0x0008;
    private static final int CAP_BRIDGE = 0x0004;

    @Override
    public String protocol() {
        return "lldp";
    }

    @Override
    public String captureFilter() {
        return "ether proto 0x88cc";
    }

    @Override
    public Optional<NeighborAdvertisement> parse(byte[] frame) throws MalformedFrameException {
        if (frame == null || frame.length < ETHERNET_HEADER) {
            return Optional.empty();
        }
        int offset = 12;
        int etherType = u16(frame, offset);
        if (etherType == ETHERTYPE_VLAN) {
            offset += 4;
            etherType = u16(frame, offset);
        }
        if (etherType != ETHERTYPE_LLDP) {
            return Optional.empty();
        }

        var builder = NeighborAdvertisement.builder()
                .protocol(protocol())
                .sourceMac(MacAddresses.format(frame, 6));
        boolean chassisSeen = false;
        boolean portSeen = false;

        int pos = offset + 2;
        while (pos < frame.length) {
            int header = u16(frame, pos);
            int type = header >>> 9;
            int length = header & 0x1ff;
            int value = pos + 2;
            FrameBytes.require(frame, value, length);

            if (type == TLV_END) {
                break;
            }
            switch (type) {
                case TLV_CHASSIS_ID -> {
                    readChassis(frame, value, length, builder);
                    chassisSeen = true;
                }
                case TLV_PORT_ID -> {
                    builder.portId(readPort(frame, value, length));
                    portSeen = true;
                }
                case TLV_PORT_DESCRIPTION, TLV_SYSTEM_NAME, TLV_SYSTEM_DESCRIPTION ->
                        readText(type, ascii(frame, value, length), builder);
                case TLV_CAPABILITIES -> {
                    if (length >= 4) {
                        builder.deviceType(deviceTypeFor(u16(frame, value + 2)));
                    }
                }
                case TLV_MANAGEMENT_ADDRESS -> readManagementAddress(frame, value, length, builder);
                default -> {
                    // organisationally specific and TTL TLVs are not needed
                }
            }
            pos = value + length;
        }

        if (!chassisSeen || !portSeen) {
            throw new MalformedFrameException("LLDP frame without mandatory chassis or port TLV");
        }
        return Optional.of(builder.build());
    }

    // ==================== TLV Readers ====================

    private void readChassis(byte[] frame, int value, int length,
                             NeighborAdvertisement.NeighborAdvertisementBuilder builder)
            throws MalformedFrameException {
        if (length < 2) {
            throw new MalformedFrameException("LLDP chassis TLV too short: " + length);
        }
        int subtype = u8(frame, value);
        if (subtype == CHASSIS_SUBTYPE_MAC && length == 7) {
            builder.chassisMac(MacAddresses.format(frame, value + 1));
        } else if (subtype == CHASSIS_SUBTYPE_NETWORK_ADDRESS && length == 6
                && u8(frame, value + 1) == ADDRESS_FAMILY_IPV4) {
            var address = ipv4(frame, value + 2);
            builder.chassisId(address).managementAddress(address);
        } else {
            builder.chassisId(ascii(frame, value + 1, length - 1));
        }
    }

    private String readPort(byte[] frame, int value, int length) throws MalformedFrameException {
        if (length < 2) {
            throw new MalformedFrameException("LLDP port TLV too short: " + length);
        }
        int subtype = u8(frame, value);
        if (subtype == PORT_SUBTYPE_MAC && length == 7) {
            return MacAddresses.format(frame, value + 1);
        }
        return ascii(frame, value + 1, length - 1);
    }

    private void readText(int type, String text, NeighborAdvertisement.NeighborAdvertisementBuilder builder) {
        if (type == TLV_SYSTEM_NAME) {
            builder.systemName(text);
        } else if (type == TLV_SYSTEM_DESCRIPTION) {
            builder.systemDescription(text);
        }
    }

    private void readManagementAddress(byte[] frame, int value, int length,
                                       NeighborAdvertisement.NeighborAdvertisementBuilder builder)
            throws MalformedFrameException {
        if (length < 2) {
            throw new MalformedFrameException("LLDP management address TLV too short: " + length);
        }
        int addressLength = u8(frame, value);
        int family = u8(frame, value + 1);
        if (family == ADDRESS_FAMILY_IPV4 && addressLength == 5) {
            builder.managementAddress(ipv4(frame, value + 2));
        }
    }

    static String deviceTypeFor(int enabledCapabilities) {
        if ((enabledCapabilities & CAP_ROUTER) != 0) return "router";
        if ((enabledCapabilities & CAP_BRIDGE) != 0) return "switch";
        if ((enabledCapabilities & CAP_WLAN_AP) != 0) return "access_point";
        if ((enabledCapabilities & CAP_TELEPHONE) != 0) return "phone";
        if ((enabledCapabilities & CAP_STATION) != 0) return "workstation";
        return null;
    }
}
