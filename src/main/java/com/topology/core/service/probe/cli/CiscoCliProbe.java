package com.topology.core.service.probe.cli;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.LinkType;
import com.topology.core.service.model.ObservationFields;
import com.topology.core.service.probe.AbstractProbe;
import com.topology.core.service.probe.ProbeDeadline;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeException;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import com.topology.core.service.probe.VendorFingerprint;
import com.topology.core.service.probe.cli.CdpNeighborDetailParser.CdpNeighbor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Cisco command-line probe over SSH.
 *
 * Reads the device's own identity from {@code show version}, then its CDP
 * neighbour table. Each neighbour yields a device record and a PHYSICAL link
 * record carrying the interfaces on both ends. Neighbours are keyed by their
 * CDP device ID so they merge with what the CDP listener hears.
 */
@Slf4j
@Component
public class CiscoCliProbe extends AbstractProbe {

    static final double DEVICE_CONFIDENCE = 0.85;
    static final double NEIGHBOR_CONFIDENCE = 0.75;
    static final String SHOW_VERSION = "show version";
    static final String SHOW_CDP_NEIGHBORS = "show cdp neighbors detail";

    private static final String VENDOR = "Cisco";
    private static final Pattern HOSTNAME = Pattern.compile("(?m)^(\\S+) uptime is ");
    private static final Pattern OS_VERSION = Pattern.compile("Version ([^,\\s]+)");
    private static final Pattern MODEL = Pattern.compile("(?mi)^cisco (\\S+) .*(?:processor|memory)");

    private final CliClient.Factory clientFactory;

    public CiscoCliProbe(CliClient.Factory clientFactory, Clock clock) {
        super(clock);
        this.clientFactory = clientFactory;
    }

    @Override
    public ProbeKind kind() {
        return ProbeKind.CISCO_CLI;
    }

    @Override
    protected void collect(ProbeTarget target, ProbeDeadline deadline,
                           List<DiscoveryRecord> collector) throws ProbeException {
        try (var client = clientFactory.connect(target, deadline.remaining())) {
            deadline.checkpoint();
            var version = run(client, SHOW_VERSION, deadline, target);
            var device = devicePayload(target, version);
            collector.add(DiscoveryRecord.device(id(), sourceKind(), target.label(), clock.instant(),
                    DEVICE_CONFIDENCE, device));

            deadline.checkpoint();
            var neighbours = CdpNeighborDetailParser.parse(run(client, SHOW_CDP_NEIGHBORS, deadline, target));
            for (var neighbour : neighbours) {
                var payload = neighbourPayload(neighbour);
                var now = clock.instant();
                collector.add(DiscoveryRecord.device(id(), sourceKind(), target.label(), now,
                        NEIGHBOR_CONFIDENCE, payload));
                collector.add(DiscoveryRecord.link(id(), sourceKind(), target.label(), now,
                        NEIGHBOR_CONFIDENCE, linkPayload(device, payload, neighbour)));
            }
            log.debug("{} on {}: {} CDP neighbours", id(), target.label(), neighbours.size());
        }
    }

    private static String run(CliClient client, String command, ProbeDeadline deadline,
                              ProbeTarget target) throws ProbeException {
        var output = client.execute(command, deadline.remaining());
        if (CdpNeighborDetailParser.isCommandError(output)) {
            throw new ProbeException(ProbeErrorType.MALFORMED_RESPONSE,
                    "'" + command + "' rejected by " + target.label() + ": " + firstLine(output));
        }
        return output;
    }

    // ==================== Record Building ====================

    private static Map<String, String> devicePayload(ProbeTarget target, String version) {
        var payload = new HashMap<String, String>();
        putIfPresent(payload, ObservationFields.MAC, target.mac());
        putIfPresent(payload, ObservationFields.IP, target.isAddressLiteral() ? target.host() : null);
        putIfPresent(payload, ObservationFields.STABLE_ID, target.isAddressLiteral() ? null : target.host());
        putIfPresent(payload, ObservationFields.HOSTNAME, group(HOSTNAME, version));
        putIfPresent(payload, ObservationFields.OS_VERSION, group(OS_VERSION, version));
        putIfPresent(payload, ObservationFields.MODEL, group(MODEL, version));
        putIfPresent(payload, ObservationFields.DESCRIPTION, firstLine(version));
        payload.put(ObservationFields.VENDOR, VENDOR);
        return payload;
    }

    private static Map<String, String> neighbourPayload(CdpNeighbor neighbour) {
        var payload = new HashMap<String, String>();
        putIfPresent(payload, ObservationFields.STABLE_ID, "cdp:" + neighbour.deviceId());
        putIfPresent(payload, ObservationFields.IP, neighbour.ipAddress());
        putIfPresent(payload, ObservationFields.HOSTNAME, neighbour.hostname());
        putIfPresent(payload, ObservationFields.MODEL, neighbour.platform());
        putIfPresent(payload, ObservationFields.OS_VERSION, neighbour.softwareVersion());
        putIfPresent(payload, ObservationFields.DEVICE_TYPE, neighbour.deviceType());
        VendorFingerprint.vendorFromDescription(neighbour.platform() + " " + neighbour.softwareVersion())
                .ifPresent(vendor -> payload.put(ObservationFields.VENDOR, vendor));
        return payload;
    }

    private static Map<String, String> linkPayload(Map<String, String> device, Map<String, String> neighbour,
                                                   CdpNeighbor entry) {
        var payload = new HashMap<String, String>();
        payload.put(ObservationFields.LINK_TYPE, LinkType.PHYSICAL.name());
        for (var field : List.of(ObservationFields.MAC, ObservationFields.IP, ObservationFields.STABLE_ID)) {
            putIfPresent(payload, ObservationFields.endpointA(field), device.get(field));
            putIfPresent(payload, ObservationFields.endpointB(field), neighbour.get(field));
        }
        putIfPresent(payload, ObservationFields.endpointA(ObservationFields.PORT), entry.localInterface());
        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.PORT), entry.remotePort());
        return payload;
    }

    // ==================== Helpers ====================

    private static String group(Pattern pattern, String text) {
        var matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String firstLine(String text) {
        return text.lines().map(String::trim).filter(line -> !line.isEmpty()).findFirst().orElse(null);
    }

    private static void putIfPresent(Map<String, String> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value);
        }
    }
}
