package com.topology.core.service.model;

import java.util.Locale;
import java.util.Optional;

/**
 * MAC address parsing and formatting.
 *
 * Accepted input forms: {@code aa:bb:cc:dd:ee:ff}, {@code AA-BB-CC-DD-EE-FF},
 * {@code aabb.ccdd.eeff} and {@code aabbccddeeff}. Output is always lower-case
 * colon separated.
 */
public final class MacAddresses {

    private static final String ZERO = "00:00:00:00:00:00";
    private static final String BROADCAST = "ff:ff:ff:ff:ff:ff";

    private MacAddresses() {
    }

    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var hex = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[:.\\-\\s]", "");
        if (hex.length() != 12 || !hex.chars().allMatch(MacAddresses::isHexDigit)) {
            return Optional.empty();
        }
        var formatted = new StringBuilder(17);
        for (int i = 0; i < 12; i += 2) {
            if (i > 0) formatted.append(':');
            formatted.append(hex, i, i + 2);
        }
        var mac = formatted.toString();
        if (ZERO.equals(mac) || BROADCAST.equals(mac)) {
            return Optional.empty();
        }
        return Optional.of(mac);
    }

    /**
     * Formats six bytes starting at {@code offset} as a colon separated MAC.
     */
    public static String format(byte[] bytes, int offset) {
        var formatted = new StringBuilder(17);
        for (int i = 0; i < 6; i++) {
            if (i > 0) formatted.append(':');
            formatted.append(String.format("%02x", bytes[offset + i] & 0xff));
        }
        return formatted.toString();
    }

    private static boolean isHexDigit(int c) {
        return (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f');
    }
}
