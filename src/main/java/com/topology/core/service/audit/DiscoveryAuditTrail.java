package com.topology.core.service.audit;

import com.topology.core.service.discovery.RoundResult;

import java.util.List;
import java.util.Optional;

/**
 * Keeps raw records and per-pair reports of recent rounds.
 *
 * Records are not retained beyond this trail; entries expire by TTL once
 * the round reached a terminal phase.
 */
public interface DiscoveryAuditTrail {

    /**
     * Registers a round as queued.
     *
     * @param trigger what requested the round (api, inventory, schedule)
     */
    void registerQueued(String roundId, String trigger);

    /**
     * Forgets a queued round that never ran, such as one merged into an
     * identical waiting round.
     */
    void discard(String roundId);

    void markRunning(String roundId);

    /**
     * Stores the outcome of the probe phase.
     *
     * @return the round result with exact duplicate records removed
     */
    RoundResult recordResult(RoundResult result);

    void markCommitted(String roundId, long version, int findingCount);

    void markFailed(String roundId, String reason);

    Optional<RoundAudit> find(String roundId);

    /**
     * Most recent rounds first.
     */
    List<RoundAudit> recent(int limit);

    int count();

    /**
     * Removes terminal rounds past their TTL and trims to the configured maximum.
     *
     * @return number of rounds evicted
     */
    int evictExpired();
}
