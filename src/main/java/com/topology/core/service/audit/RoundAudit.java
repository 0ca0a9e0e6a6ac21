package com.topology.core.service.audit;

import com.topology.core.service.discovery.PairOutcome;
import com.topology.core.service.discovery.RoundOutcome;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.probe.ProbeError;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of one round in the audit trail.
 *
 * @param committedVersion snapshot version produced by the round, if it committed
 * @param failureReason    set when the round failed before or during commit
 */
public record RoundAudit(
        String roundId,
        String trigger,
        RoundPhase phase,
        Instant queuedAt,
        Instant startedAt,
        Instant finishedAt,
        RoundOutcome outcome,
        List<PairOutcome> pairs,
        List<DiscoveryRecord> records,
        ProbeError aggregatedError,
        Long committedVersion,
        int findingCount,
        String failureReason
) {

    public RoundAudit {
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
        records = records == null ? List.of() : List.copyOf(records);
    }
}
