package com.topology.core.service.audit;

import com.topology.core.service.model.DiscoveryRecord;

/**
 * Detects exact duplicate records within a round.
 */
public interface RecordDeduplicator {

    /**
     * Returns true if an identical record was already seen for this round.
     */
    boolean isDuplicate(String roundId, DiscoveryRecord record);

    void clearRound(String roundId);

    void clearAll();

    /**
     * Number of fingerprints currently tracked.
     */
    int size();
}
