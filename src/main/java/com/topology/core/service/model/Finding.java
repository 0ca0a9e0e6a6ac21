package com.topology.core.service.model;

import lombok.Builder;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A structural or reconciliation issue detected in the topology.
 *
 * Finding ids are derived from the type and the affected elements, so the
 * same issue detected twice carries the same id.
 */
@Builder
public record Finding(
        String findingId,
        FindingType type,
        Severity severity,
        int riskScore,
        List<String> affectedDevices,
        List<String> affectedLinks,
        String description,
        String recommendation,
        long graphVersion,
        Instant detectedAt
) {

    public Finding {
        affectedDevices = affectedDevices == null ? List.of() : List.copyOf(affectedDevices);
        affectedLinks = affectedLinks == null ? List.of() : List.copyOf(affectedLinks);
        if (findingId == null) {
            findingId = deriveId(type, affectedDevices, affectedLinks);
        }
    }

    public static String deriveId(FindingType type, List<String> devices, List<String> links) {
        var seed = type + "|" + String.join(",", devices) + "|" + String.join(",", links);
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
