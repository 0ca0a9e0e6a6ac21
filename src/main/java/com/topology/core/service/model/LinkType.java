package com.topology.core.service.model;

/**
 * How a link between two devices was established.
 */
public enum LinkType {
    /** Directly connected ports, as reported by a neighbour protocol. */
    PHYSICAL,
    /** Layer-3 adjacency or tunnel. */
    LOGICAL,
    /** Derived from indirect evidence such as an ARP entry. */
    INFERRED
}
