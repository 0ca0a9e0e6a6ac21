package com.topology.core.service.model;

/**
 * Category of discovery source that produced an observation.
 *
 * The rank breaks precedence ties between otherwise equal observations:
 * an answer to a direct query beats a vendor API, which beats a frame
 * overheard on the wire.
 */
public enum SourceKind {
    PASSIVE_LISTENER(1),
    VENDOR_API(2),
    ACTIVE_QUERY(3);

    private final int rank;

    SourceKind(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }
}
