package com.topology.core.service.discovery;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.probe.ProbeError;

import java.time.Instant;
import java.util.List;

/**
 * Everything a round produced: the records of all pairs and a status per pair.
 *
 * @param aggregatedError set only when the outcome is FAILED
 */
public record RoundResult(
        String roundId,
        Instant startedAt,
        Instant finishedAt,
        List<DiscoveryRecord> records,
        List<PairOutcome> pairs,
        RoundOutcome outcome,
        ProbeError aggregatedError
) {

    public RoundResult {
        records = records == null ? List.of() : List.copyOf(records);
        pairs = pairs == null ? List.of() : List.copyOf(pairs);
    }

    public RoundResult withRecords(List<DiscoveryRecord> replacement) {
        return new RoundResult(roundId, startedAt, finishedAt, replacement, pairs, outcome, aggregatedError);
    }

    public long failedPairs() {
        return pairs.stream().filter(pair -> pair.status() == PairStatus.FAILED).count();
    }
}
