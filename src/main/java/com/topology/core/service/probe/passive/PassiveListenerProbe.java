package com.topology.core.service.probe.passive;

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
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Listens on a local interface for neighbour announcements.
 *
 * Each distinct announcement yields a device record for the neighbour and a
 * PHYSICAL link record between the listening device and that neighbour.
 * Frames that fail to decode are logged and dropped; the rest of the window
 * is still used.
 */
@Slf4j
public class PassiveListenerProbe extends AbstractProbe {

    static final double PASSIVE_CONFIDENCE = 0.6;

    private final ProbeKind kind;
    private final FrameParser parser;
    private final FrameSource frameSource;
    private final Duration listenWindow;
    private final int snapLength;

    public PassiveListenerProbe(ProbeKind kind, FrameParser parser, FrameSource frameSource,
                                Duration listenWindow, int snapLength, Clock clock) {
        super(clock);
        this.kind = kind;
        this.parser = parser;
        this.frameSource = frameSource;
        this.listenWindow = listenWindow;
        this.snapLength = snapLength;
    }

    @Override
    public ProbeKind kind() {
        return kind;
    }

    @Override
    protected void collect(ProbeTarget target, ProbeDeadline deadline,
                           List<DiscoveryRecord> collector) throws ProbeException {
        var window = listenWindow.compareTo(deadline.remaining()) < 0 ? listenWindow : deadline.remaining();
        long windowEnd = System.nanoTime() + window.toNanos();
        var seen = new HashSet<String>();
        int dropped = 0;

        try (var capture = frameSource.open(target.interfaceName(), parser.captureFilter(), snapLength)) {
            while (System.nanoTime() - windowEnd < 0 && !deadline.isExpired()) {
                ensureNotInterrupted();
                var frame = capture.nextFrame();
                if (frame == null) {
                    continue;
                }
                try {
                    var parsed = parser.parse(frame);
                    if (parsed.isPresent()) {
                        recordAdvertisement(target, parsed.get(), seen, collector);
                    }
                } catch (MalformedFrameException e) {
                    dropped++;
                    log.warn("Dropped malformed {} frame on {}: {}", parser.protocol(), target.label(), e.getMessage());
                }
            }
        }
        logWindowSummary(target, seen.size(), dropped);
    }

    // ==================== Record Building ====================

    private void recordAdvertisement(ProbeTarget target, NeighborAdvertisement advertisement,
                                     Set<String> seen, List<DiscoveryRecord> collector) {
        if (!seen.add(advertisement.announcementKey())) {
            return;
        }
        var now = clock.instant();
        collector.add(DiscoveryRecord.device(id(), sourceKind(), target.label(), now,
                PASSIVE_CONFIDENCE, devicePayload(advertisement)));
        collector.add(DiscoveryRecord.link(id(), sourceKind(), target.label(), now,
                PASSIVE_CONFIDENCE, linkPayload(target, advertisement)));
    }

    private Map<String, String> devicePayload(NeighborAdvertisement advertisement) {
        var payload = new HashMap<String, String>();
        putIfPresent(payload, ObservationFields.MAC, advertisement.identityMac());
        putIfPresent(payload, ObservationFields.IP, advertisement.managementAddress());
        putIfPresent(payload, ObservationFields.STABLE_ID, stableIdOf(advertisement));
        putIfPresent(payload, ObservationFields.HOSTNAME, advertisement.systemName());
        putIfPresent(payload, ObservationFields.DESCRIPTION, advertisement.systemDescription());
        putIfPresent(payload, ObservationFields.MODEL, advertisement.platform());
        putIfPresent(payload, ObservationFields.OS_VERSION, advertisement.softwareVersion());
        putIfPresent(payload, ObservationFields.DEVICE_TYPE, advertisement.deviceType());
        var fingerprintSource = advertisement.platform() != null
                ? advertisement.platform() + " " + advertisement.systemDescription()
                : advertisement.systemDescription();
        VendorFingerprint.vendorFromDescription(fingerprintSource)
                .ifPresent(vendor -> payload.put(ObservationFields.VENDOR, vendor));
        return payload;
    }

    private Map<String, String> linkPayload(ProbeTarget target, NeighborAdvertisement advertisement) {
        var payload = new HashMap<String, String>();
        payload.put(ObservationFields.LINK_TYPE, LinkType.PHYSICAL.name());

        putIfPresent(payload, ObservationFields.endpointA(ObservationFields.MAC), target.mac());
        if (target.isAddressLiteral()) {
            payload.put(ObservationFields.endpointA(ObservationFields.IP), target.host());
        } else if (target.host() != null) {
            payload.put(ObservationFields.endpointA(ObservationFields.STABLE_ID), target.host());
        }
        putIfPresent(payload, ObservationFields.endpointA(ObservationFields.PORT), target.interfaceName());

        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.MAC), advertisement.identityMac());
        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.IP), advertisement.managementAddress());
        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.STABLE_ID), stableIdOf(advertisement));
        putIfPresent(payload, ObservationFields.endpointB(ObservationFields.PORT), advertisement.portId());
        return payload;
    }

    private String stableIdOf(NeighborAdvertisement advertisement) {
        return advertisement.chassisId() == null ? null : parser.protocol() + ":" + advertisement.chassisId();
    }

    // ==================== Helpers ====================

    private void ensureNotInterrupted() throws ProbeException {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProbeException(ProbeErrorType.CANCELLED, "Listener interrupted");
        }
    }

    private static void putIfPresent(Map<String, String> payload, String key, String value) {
        if (value != null && !value.isBlank()) {
            payload.put(key, value);
        }
    }

    private void logWindowSummary(ProbeTarget target, int neighbours, int dropped) {
        if (dropped > 0) {
            log.info("{} on {}: {} neighbours, {} malformed frames dropped",
                    id(), target.label(), neighbours, dropped);
        } else {
            log.debug("{} on {}: {} neighbours", id(), target.label(), neighbours);
        }
    }
}
