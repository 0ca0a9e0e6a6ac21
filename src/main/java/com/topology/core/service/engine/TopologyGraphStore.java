package com.topology.core.service.engine;

import com.topology.core.service.model.GraphDelta;
import com.topology.core.service.model.TopologyGraph;

import java.time.Instant;
import java.util.Optional;

/**
 * Holds the current versioned topology snapshot.
 *
 * Readers get immutable snapshots without locking; applies are serialized.
 */
public interface TopologyGraphStore {

    /**
     * Returns the current snapshot. Never null; version 0 is the empty graph.
     */
    TopologyGraph current();

    /**
     * Applies a delta and runs the lifecycle sweep as of {@code now}.
     *
     * @return the new snapshot, or the current one if nothing changed
     * @throws GraphInvariantViolationException if the result would be inconsistent
     */
    TopologyGraph apply(GraphDelta delta, Instant now);

    /**
     * Looks up a snapshot still held in the history.
     */
    Optional<TopologyGraph> findVersion(long version);

    /**
     * Diff between two retained versions.
     *
     * @throws SnapshotNotFoundException if either version is not retained
     */
    GraphDiff diff(long fromVersion, long toVersion);

    /**
     * Replaces an empty store with a previously persisted snapshot.
     *
     * @return true if the snapshot was installed
     */
    boolean seed(TopologyGraph snapshot);
}
