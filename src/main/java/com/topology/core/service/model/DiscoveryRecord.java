package com.topology.core.service.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * A single raw observation produced by a probe.
 *
 * The payload holds probe-specific fields before normalization, keyed by
 * {@link ObservationFields}. Records are ephemeral: they live for the
 * duration of a round and in the audit trail.
 */
public record DiscoveryRecord(
        String sourceProbe,
        SourceKind sourceKind,
        String target,
        Instant timestamp,
        double confidenceHint,
        RecordType type,
        Map<String, String> payload
) {

    public DiscoveryRecord {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(payload));
    }

    public static DiscoveryRecord device(String sourceProbe, SourceKind sourceKind, String target,
                                         Instant timestamp, double confidence, Map<String, String> payload) {
        return new DiscoveryRecord(sourceProbe, sourceKind, target, timestamp, confidence,
                RecordType.DEVICE, payload);
    }

    public static DiscoveryRecord link(String sourceProbe, SourceKind sourceKind, String target,
                                       Instant timestamp, double confidence, Map<String, String> payload) {
        return new DiscoveryRecord(sourceProbe, sourceKind, target, timestamp, confidence,
                RecordType.LINK, payload);
    }

    public String field(String key) {
        return payload.get(key);
    }

    /**
     * Stable textual fingerprint used for exact-duplicate detection.
     */
    public String fingerprint() {
        return String.join("|",
                sourceProbe,
                String.valueOf(type),
                String.valueOf(target),
                timestamp == null ? "" : String.valueOf(timestamp.toEpochMilli()),
                payload.toString());
    }
}
