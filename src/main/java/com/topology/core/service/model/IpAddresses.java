package com.topology.core.service.model;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * IP literal validation. Never performs name lookups.
 */
public final class IpAddresses {

    private static final Pattern IPV4 = Pattern.compile(
            "^((25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)\\.){3}(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");
    private static final Pattern HEX_GROUP = Pattern.compile("^[0-9a-fA-F]{1,4}$");

    private IpAddresses() {
    }

    /**
     * Returns the address in canonical form, or empty if it is not a usable
     * unicast literal.
     */
    public static Optional<String> normalize(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        var value = raw.trim();
        if (IPV4.matcher(value).matches()) {
            if (value.equals("0.0.0.0") || value.equals("255.255.255.255")) {
                return Optional.empty();
            }
            return Optional.of(value);
        }
        if (isIpv6Literal(value)) {
            try {
                // Validated literal, so getByName only parses it.
                var address = InetAddress.getByName(value);
                if (address.isAnyLocalAddress()) {
                    return Optional.empty();
                }
                return Optional.of(address.getHostAddress().toLowerCase());
            } catch (UnknownHostException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * Structural IPv6 check: eight hex groups, at most one "::", and an
     * optional dotted IPv4 tail worth two groups. Zone ids and ports are
     * rejected.
     */
    static boolean isIpv6Literal(String value) {
        if (!value.contains(":") || !IPV6_CHARS.matcher(value).matches()) {
            return false;
        }
        int gap = value.indexOf("::");
        if (gap >= 0 && value.indexOf("::", gap + 1) >= 0) {
            return false;
        }
        var groups = new ArrayList<String>();
        if (gap >= 0) {
            split(value.substring(0, gap), groups);
            split(value.substring(gap + 2), groups);
        } else {
            split(value, groups);
        }

        int count = 0;
        for (int i = 0; i < groups.size(); i++) {
            var group = groups.get(i);
            if (group.contains(".")) {
                if (i != groups.size() - 1 || !IPV4.matcher(group).matches()) {
                    return false;
                }
                count += 2;
            } else if (HEX_GROUP.matcher(group).matches()) {
                count++;
            } else {
                return false;
            }
        }
        return gap >= 0 ? count < 8 : count == 8;
    }

    private static void split(String part, List<String> groups) {
        if (part.isEmpty()) {
            return;
        }
        groups.addAll(Arrays.asList(part.split(":", -1)));
    }
}
