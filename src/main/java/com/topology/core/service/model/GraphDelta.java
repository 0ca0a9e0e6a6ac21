package com.topology.core.service.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Changes computed by the identity resolver for one discovery round.
 *
 * @param deviceUpserts  devices to insert or replace
 * @param deviceRemovals provisional keys folded into another device
 * @param linkUpserts    links to insert or replace
 * @param linkRemovals   link keys superseded by re-keying
 * @param rekeys         provisional key to canonical key
 * @param findings       reconciliation findings raised while resolving
 */
public record GraphDelta(
        String roundId,
        Instant observedAt,
        List<Device> deviceUpserts,
        Set<String> deviceRemovals,
        List<Link> linkUpserts,
        Set<LinkKey> linkRemovals,
        Map<String, String> rekeys,
        List<Finding> findings
) {

    public GraphDelta {
        deviceUpserts = deviceUpserts == null ? List.of() : List.copyOf(deviceUpserts);
        deviceRemovals = deviceRemovals == null ? Set.of() : Set.copyOf(deviceRemovals);
        linkUpserts = linkUpserts == null ? List.of() : List.copyOf(linkUpserts);
        linkRemovals = linkRemovals == null ? Set.of() : Set.copyOf(linkRemovals);
        rekeys = rekeys == null ? Map.of() : Map.copyOf(rekeys);
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static GraphDelta empty(String roundId, Instant observedAt) {
        return new GraphDelta(roundId, observedAt, List.of(), Set.of(), List.of(), Set.of(), Map.of(), List.of());
    }

    public boolean hasGraphChanges() {
        return !deviceUpserts.isEmpty() || !deviceRemovals.isEmpty()
                || !linkUpserts.isEmpty() || !linkRemovals.isEmpty();
    }
}
