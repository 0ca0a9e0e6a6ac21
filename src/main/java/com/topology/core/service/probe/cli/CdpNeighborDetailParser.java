package com.topology.core.service.probe.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code show cdp neighbors detail} output of IOS, IOS-XE and NX-OS.
 *
 * Each neighbour entry starts at a "Device ID" line. Fields missing from an
 * entry are left null; an entry is never dropped for lacking optional fields.
 */
public final class CdpNeighborDetailParser {

    private static final Pattern DEVICE_ID = Pattern.compile("^\\s*Device ID\\s*:\\s*(.+?)\\s*$");
    private static final Pattern ADDRESS = Pattern.compile("^\\s*(?:IP address|IPv4 Address)\\s*:\\s*(\\d{1,3}(?:\\.\\d{1,3}){3})\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLATFORM = Pattern.compile("^\\s*Platform\\s*:\\s*([^,]+?)\\s*(?:,|$)");
    private static final Pattern CAPABILITIES = Pattern.compile("Capabilities\\s*:\\s*(.*?)\\s*$");
    private static final Pattern INTERFACES = Pattern.compile(
            "^\\s*Interface\\s*:\\s*([^,]+?)\\s*,\\s*Port ID \\(outgoing port\\)\\s*:\\s*(.+?)\\s*$");
    private static final Pattern VERSION_HEADER = Pattern.compile("^\\s*Version\\s*:\\s*$");
    private static final Pattern SERIAL_SUFFIX = Pattern.compile("\\([^)]*\\)$");

    private static final String CDP_DISABLED = "% CDP is not enabled";

    private CdpNeighborDetailParser() {
    }

    /**
     * A neighbour as reported by the queried device.
     *
     * @param localInterface interface of the queried device facing the neighbour
     * @param remotePort     the neighbour's port on that link
     */
    public record CdpNeighbor(
            String deviceId,
            String ipAddress,
            String platform,
            String capabilities,
            String localInterface,
            String remotePort,
            String softwareVersion
    ) {

        /**
         * Device ID without the NX-OS serial suffix.
         */
        public String hostname() {
            return SERIAL_SUFFIX.matcher(deviceId).replaceFirst("").trim();
        }

        public String deviceType() {
            if (capabilities == null) {
                return null;
            }
            var caps = capabilities.toLowerCase(Locale.ROOT);
            if (caps.contains("router")) return "router";
            if (caps.contains("switch") || caps.contains("trans-bridge")) return "switch";
            if (caps.contains("phone")) return "phone";
            if (caps.contains("host")) return "server";
            return null;
        }
    }

    /**
     * True when the device rejected the command, e.g. "% Invalid input".
     * A device with CDP disabled is not an error: it simply has no neighbours.
     */
    public static boolean isCommandError(String output) {
        return output.lines()
                .map(String::trim)
                .anyMatch(line -> line.startsWith("%") && !line.startsWith(CDP_DISABLED));
    }

    public static List<CdpNeighbor> parse(String output) {
        var neighbours = new ArrayList<CdpNeighbor>();
        List<String> entry = null;
        for (var line : output.split("\\R")) {
            if (DEVICE_ID.matcher(line).matches()) {
                if (entry != null) {
                    neighbours.add(parseEntry(entry));
                }
                entry = new ArrayList<>();
            }
            if (entry != null) {
                entry.add(line);
            }
        }
        if (entry != null) {
            neighbours.add(parseEntry(entry));
        }
        return neighbours;
    }

    private static CdpNeighbor parseEntry(List<String> lines) {
        String deviceId = null;
        String address = null;
        String platform = null;
        String capabilities = null;
        String localInterface = null;
        String remotePort = null;
        String version = null;
        boolean versionNext = false;

        for (var line : lines) {
            if (versionNext) {
                if (!line.isBlank()) {
                    version = line.trim();
                    versionNext = false;
                }
                continue;
            }
            Matcher m;
            if ((m = DEVICE_ID.matcher(line)).matches()) {
                deviceId = m.group(1);
            } else if (address == null && (m = ADDRESS.matcher(line)).matches()) {
                address = m.group(1);
            } else if ((m = INTERFACES.matcher(line)).find()) {
                localInterface = m.group(1);
                remotePort = m.group(2);
            } else if (VERSION_HEADER.matcher(line).matches()) {
                versionNext = true;
            } else if ((m = PLATFORM.matcher(line)).find()) {
                platform = m.group(1);
                var caps = CAPABILITIES.matcher(line);
                if (caps.find()) {
                    capabilities = caps.group(1);
                }
            } else if (capabilities == null && (m = CAPABILITIES.matcher(line)).find()) {
                capabilities = m.group(1);
            }
        }
        return new CdpNeighbor(deviceId, address, platform, blankToNull(capabilities),
                localInterface, remotePort, version);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
