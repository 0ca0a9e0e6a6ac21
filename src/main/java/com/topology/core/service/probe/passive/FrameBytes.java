package com.topology.core.service.probe.passive;

import java.nio.charset.StandardCharsets;

/**
 * Bounds-checked reads over a captured frame.
 */
final class FrameBytes {

    private FrameBytes() {
    }

    static int u8(byte[] frame, int offset) throws MalformedFrameException {
        require(frame, offset, 1);
        return frame[offset] & 0xff;
    }

    static int u16(byte[] frame, int offset) throws MalformedFrameException {
        require(frame, offset, 2);
        return ((frame[offset] & 0xff) << 8) | (frame[offset + 1] & 0xff);
    }

    static long u32(byte[] frame, int offset) throws MalformedFrameException {
        require(frame, offset, 4);
        return ((long) u16(frame, offset) << 16) | u16(frame, offset + 2);
    }

    static String ascii(byte[] frame, int offset, int length) throws MalformedFrameException {
        require(frame, offset, length);
        return new String(frame, offset, length, StandardCharsets.UTF_8).trim();
    }

    static String ipv4(byte[] frame, int offset) throws MalformedFrameException {
        require(frame, offset, 4);
        return (frame[offset] & 0xff) + "." + (frame[offset + 1] & 0xff) + "."
                + (frame[offset + 2] & 0xff) + "." + (frame[offset + 3] & 0xff);
    }

    static void require(byte[] frame, int offset, int length) throws MalformedFrameException {
        if (offset < 0 || length < 0 || offset + length > frame.length) {
            throw new MalformedFrameException("Truncated frame: need " + length
                    + " bytes at offset " + offset + ", frame is " + frame.length);
        }
    }
}
