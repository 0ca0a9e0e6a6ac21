package com.topology.core.service.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Undirected link between two devices of a snapshot.
 */
@Builder(toBuilder = true)
public record Link(
        LinkKey key,
        Set<String> discoveredVia,
        Instant firstSeen,
        Instant lastSeen,
        LinkState state
) {

    public Link {
        discoveredVia = discoveredVia == null
                ? Set.of()
                : Collections.unmodifiableSet(new TreeSet<>(discoveredVia));
        state = state == null ? LinkState.UP : state;
    }

    public String endpointA() {
        return key.endpointA();
    }

    public String endpointB() {
        return key.endpointB();
    }

    public LinkType linkType() {
        return key.linkType();
    }

    public Link withState(LinkState newState) {
        return toBuilder().state(newState).build();
    }
}
