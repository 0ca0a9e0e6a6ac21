package com.topology.core.service.probe.passive;

import com.topology.core.service.model.MacAddresses;

import java.util.Optional;

import static com.topology.core.service.probe.passive.FrameBytes.ascii;
import static com.topology.core.service.probe.passive.FrameBytes.ipv4;
import static com.topology.core.service.probe.passive.FrameBytes.u16;
import static com.topology.core.service.probe.passive.FrameBytes.u32;
import static com.topology.core.service.probe.passive.FrameBytes.u8;

/**
 * Cisco Discovery Protocol (v1/v2) frame decoder.
 *
 * CDP rides on 802.3 + LLC/SNAP (OUI 00:00:0c, protocol 0x2000) to the
 * multicast address 01:00:0c:cc:cc:cc.
 */
public class CdpFrameParser implements FrameParser {

    static final String CDP_MULTICAST = "01:00:0c:cc:cc:cc";
    private static final int SNAP_HEADER_END = 22;
    private static final int CDP_HEADER = 4;
    private static final int TLV_HEADER = 4;
    private static final int SNAP_PROTOCOL_CDP = 0x2000;

    private static final int TLV_DEVICE_ID = 0x0001;
    private static final int TLV_ADDRESSES = 0x0002;
    private static final int TLV_PORT_ID = 0x0003;
    private static final int TLV_CAPABILITIES = 0x0004;
    private static final int TLV_SOFTWARE_VERSION = 0x0005;
    private static final int TLV_PLATFORM = 0x0006;

    private static final int PROTOCOL_TYPE_NLPID = 1;
    private static final int NLPID_IP = 0xcc;

    private static final long CAP_ROUTER = 0x01;
    private static final long CAP_TRANSPARENT_BRIDGE = 0x02;
    private static final long CAP_SWITCH = 0x08;
    private static final long CAP_HOST = 0x10;
    private static final long CAP_PHONE = 0x80;

    @Override
    public String protocol() {
        return "cdp";
    }

    @Override
    public String captureFilter() {
        return "ether dst 01:00:0c:cc:cc:cc";
    }

    @Override
    public Optional<NeighborAdvertisement> parse(byte[] frame) throws MalformedFrameException {
        if (frame == null || frame.length < SNAP_HEADER_END || !isCdp(frame)) {
            return Optional.empty();
        }
        int end = Math.min(frame.length, 14 + u16(frame, 12));
        var builder = NeighborAdvertisement.builder()
                .protocol(protocol())
                .sourceMac(MacAddresses.format(frame, 6));
        boolean deviceIdSeen = false;

        int pos = SNAP_HEADER_END + CDP_HEADER;
        while (pos + TLV_HEADER <= end) {
            int type = u16(frame, pos);
            int length = u16(frame, pos + 2);
            if (length < TLV_HEADER || pos + length > end) {
                throw new MalformedFrameException("CDP TLV 0x" + Integer.toHexString(type)
                        + " has invalid length " + length);
            }
            int value = pos + TLV_HEADER;
            int valueLength = length - TLV_HEADER;

            switch (type) {
                case TLV_DEVICE_ID -> {
                    builder.chassisId(ascii(frame, value, valueLength));
                    deviceIdSeen = true;
                }
                case TLV_ADDRESSES -> readFirstIpv4(frame, value, value + valueLength)
                        .ifPresent(builder::managementAddress);
                case TLV_PORT_ID -> builder.portId(ascii(frame, value, valueLength));
                case TLV_CAPABILITIES -> {
                    if (valueLength >= 4) {
                        builder.deviceType(deviceTypeFor(u32(frame, value)));
                    }
                }
                case TLV_SOFTWARE_VERSION -> builder.softwareVersion(firstLine(ascii(frame, value, valueLength)));
                case TLV_PLATFORM -> builder.platform(ascii(frame, value, valueLength));
                default -> {
                    // VTP domain, native VLAN, duplex etc. are ignored
                }
            }
            pos += length;
        }

        if (!deviceIdSeen) {
            throw new MalformedFrameException("CDP frame without device id TLV");
        }
        var advertisement = builder.build();
        return Optional.of(advertisement.toBuilder()
                .systemName(advertisement.chassisId())
                .systemDescription(advertisement.softwareVersion())
                .build());
    }

    private boolean isCdp(byte[] frame) throws MalformedFrameException {
        return CDP_MULTICAST.equals(MacAddresses.format(frame, 0))
                && u8(frame, 14) == 0xaa
                && u8(frame, 15) == 0xaa
                && u8(frame, 16) == 0x03
                && u8(frame, 17) == 0x00 && u8(frame, 18) == 0x00 && u8(frame, 19) == 0x0c
                && u16(frame, 20) == SNAP_PROTOCOL_CDP;
    }

    private Optional<String> readFirstIpv4(byte[] frame, int start, int end) throws MalformedFrameException {
        long count = u32(frame, start);
        int pos = start + 4;
        for (long i = 0; i < count && pos < end; i++) {
            int protocolType = u8(frame, pos);
            int protocolLength = u8(frame, pos + 1);
            int protocolValue = protocolLength == 1 ? u8(frame, pos + 2) : -1;
            pos += 2 + protocolLength;
            int addressLength = u16(frame, pos);
            pos += 2;
            FrameBytes.require(frame, pos, addressLength);
            if (protocolType == PROTOCOL_TYPE_NLPID && protocolValue == NLPID_IP && addressLength == 4) {
                return Optional.of(ipv4(frame, pos));
            }
            pos += addressLength;
        }
        return Optional.empty();
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline).trim();
    }

    static String deviceTypeFor(long capabilities) {
        if ((capabilities & CAP_ROUTER) != 0) return "router";
        if ((capabilities & (CAP_SWITCH | CAP_TRANSPARENT_BRIDGE)) != 0) return "switch";
        if ((capabilities & CAP_PHONE) != 0) return "phone";
        if ((capabilities & CAP_HOST) != 0) return "server";
        return null;
    }
}
