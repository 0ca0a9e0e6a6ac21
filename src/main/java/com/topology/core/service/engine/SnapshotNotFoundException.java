package com.topology.core.service.engine;

/**
 * Requested snapshot version was never published or has left the history.
 */
public class SnapshotNotFoundException extends RuntimeException {

    private final long version;

    public SnapshotNotFoundException(long version) {
        super("Snapshot version " + version + " not found");
        this.version = version;
    }

    public long getVersion() {
        return version;
    }
}
