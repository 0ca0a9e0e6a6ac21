package com.topology.core.service.probe.passive;

import com.topology.core.service.model.MacAddresses;

import java.util.Optional;

import static com.topology.core.service.probe.passive.FrameBytes.ascii;
import static com.topology.core.service.probe.passive.FrameBytes.ipv4;
import static com.topology.core.service.probe.passive.FrameBytes.u16;
import static com.topology.core.service.probe.passive.FrameBytes.u8;

/**
 * MikroTik Neighbor Discovery Protocol decoder.
 *
 * MNDP announcements are UDP broadcasts to port 5678 carrying a 4-byte
 * header (type, sequence) followed by big-endian type/length/value fields.
 * A payload holding only the header is a discovery request and is ignored.
 */
public class MndpFrameParser implements FrameParser {

    static final int MNDP_PORT = 5678;

    private static final int ETHERNET_HEADER = 14;
    private static final int ETHERTYPE_VLAN = 0x8100;
    private static final int ETHERTYPE_IPV4 = 0x0800;
    private static final int IP_PROTOCOL_UDP = 17;
    private static final int UDP_HEADER = 8;
    private static final int MNDP_HEADER = 4;
    private static final int TLV_HEADER = 4;

    private static final int TLV_MAC = 1;
    private static final int TLV_IDENTITY = 5;
    private static final int TLV_VERSION = 7;
    private static final int TLV_PLATFORM = 8;
    private static final int TLV_SOFTWARE_ID = 11;
    private static final int TLV_BOARD = 12;
    private static final int TLV_INTERFACE = 16;
    private static final int TLV_IPV4 = 17;

    @Override
    public String protocol() {
        return "mndp";
    }

    @Override
    public String captureFilter() {
        return "udp port " + MNDP_PORT;
    }

    @Override
    public Optional<NeighborAdvertisement> parse(byte[] frame) throws MalformedFrameException {
        if (frame == null || frame.length < ETHERNET_HEADER) {
            return Optional.empty();
        }
        int ip = ETHERNET_HEADER;
        int etherType = u16(frame, 12);
        if (etherType == ETHERTYPE_VLAN) {
            etherType = u16(frame, 16);
            ip += 4;
        }
        if (etherType != ETHERTYPE_IPV4 || ip + 20 > frame.length || u8(frame, ip + 9) != IP_PROTOCOL_UDP) {
            return Optional.empty();
        }
        int udp = ip + (u8(frame, ip) & 0x0f) * 4;
        if (udp + UDP_HEADER > frame.length || u16(frame, udp + 2) != MNDP_PORT) {
            return Optional.empty();
        }
        int payload = udp + UDP_HEADER;
        int end = Math.min(frame.length, udp + u16(frame, udp + 4));
        if (end - payload <= MNDP_HEADER) {
            return Optional.empty();
        }

        var builder = NeighborAdvertisement.builder()
                .protocol(protocol())
                .sourceMac(MacAddresses.format(frame, 6))
                .deviceType("router");
        String sourceAddress = ipv4(frame, ip + 12);
        String address = null;
        String platform = null;
        String version = null;

        int pos = payload + MNDP_HEADER;
        while (pos + TLV_HEADER <= end) {
            int type = u16(frame, pos);
            int length = u16(frame, pos + 2);
            int value = pos + TLV_HEADER;
            if (value + length > end) {
                throw new MalformedFrameException("MNDP TLV " + type + " has invalid length " + length);
            }
            switch (type) {
                case TLV_MAC -> {
                    if (length != 6) {
                        throw new MalformedFrameException("MNDP MAC TLV has length " + length);
                    }
                    builder.chassisMac(MacAddresses.format(frame, value));
                }
                case TLV_IDENTITY -> builder.systemName(ascii(frame, value, length));
                case TLV_VERSION -> version = ascii(frame, value, length);
                case TLV_PLATFORM -> platform = ascii(frame, value, length);
                case TLV_SOFTWARE_ID -> builder.chassisId(ascii(frame, value, length));
                case TLV_BOARD -> builder.platform(ascii(frame, value, length));
                case TLV_INTERFACE -> builder.portId(ascii(frame, value, length));
                case TLV_IPV4 -> {
                    if (length == 4) {
                        address = ipv4(frame, value);
                    }
                }
                default -> {
                    // uptime, unpack, IPv6 are ignored
                }
            }
            pos = value + length;
        }

        return Optional.of(builder
                .managementAddress(address != null ? address : sourceAddress)
                .softwareVersion(version)
                .systemDescription(describe(platform, version))
                .build());
    }

    private static String describe(String platform, String version) {
        if (platform == null) {
            return version == null ? null : "RouterOS " + version;
        }
        return version == null ? platform : platform + " " + version;
    }
}
