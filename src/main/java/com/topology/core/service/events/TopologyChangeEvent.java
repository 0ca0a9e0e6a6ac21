package com.topology.core.service.events;

import java.time.Instant;

/**
 * One change to the topology, published once per transition.
 *
 * @param subject device identity key, link key or finding id
 * @param from    previous status or state, if the change is a transition
 * @param to      new status, state or severity
 * @param version snapshot version in which the change became visible
 */
public record TopologyChangeEvent(
        ChangeType type,
        String subject,
        String from,
        String to,
        long version,
        Instant occurredAt
) {
}
