package com.topology.core.service.audit;

import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.config.RetentionConfig;
import com.topology.core.service.discovery.PairOutcome;
import com.topology.core.service.discovery.RoundOutcome;
import com.topology.core.service.discovery.RoundResult;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.probe.ProbeError;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * In-memory implementation of DiscoveryAuditTrail.
 *
 * Thread-safe using ConcurrentHashMap; each entry is only mutated while
 * holding its own monitor.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryDiscoveryAuditTrail implements DiscoveryAuditTrail {

    private final RecordDeduplicator deduplicator;
    private final MetricsConfig metricsConfig;
    private final RetentionConfig retentionConfig;
    private final Clock clock;

    private final Map<String, MutableRound> rounds = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerStoreGauge(
                "topology.audit.rounds.count",
                "Number of rounds in the audit trail",
                this::count
        );
        log.info("InMemoryDiscoveryAuditTrail initialized, TTL: {} minutes, max rounds: {}",
                retentionConfig.getAudit().getTtlMinutes(),
                retentionConfig.getAudit().getMaxRounds());
    }

    @Override
    public void registerQueued(String roundId, String trigger) {
        rounds.putIfAbsent(roundId, new MutableRound(roundId, trigger, clock.instant()));
        log.debug("Round registered: {} ({})", roundId, trigger);
    }

    @Override
    public void discard(String roundId) {
        rounds.remove(roundId);
    }

    @Override
    public void markRunning(String roundId) {
        var round = rounds.computeIfAbsent(roundId, id -> new MutableRound(id, "direct", clock.instant()));
        synchronized (round) {
            round.phase = RoundPhase.RUNNING;
            round.startedAt = clock.instant();
        }
    }

    @Override
    public RoundResult recordResult(RoundResult result) {
        var unique = new ArrayList<DiscoveryRecord>(result.records().size());
        for (var record : result.records()) {
            if (deduplicator.isDuplicate(result.roundId(), record)) {
                metricsConfig.getDeduplicatedRecords().increment();
                log.debug("Duplicate record skipped: round={}, probe={}", result.roundId(), record.sourceProbe());
                continue;
            }
            unique.add(record);
        }
        deduplicator.clearRound(result.roundId());

        var round = rounds.computeIfAbsent(result.roundId(),
                id -> new MutableRound(id, "direct", result.startedAt()));
        synchronized (round) {
            round.startedAt = result.startedAt();
            round.finishedAt = result.finishedAt();
            round.outcome = result.outcome();
            round.pairs = result.pairs();
            round.records = List.copyOf(unique);
            round.aggregatedError = result.aggregatedError();
        }
        return result.withRecords(unique);
    }

    @Override
    public void markCommitted(String roundId, long version, int findingCount) {
        update(roundId, round -> {
            round.phase = RoundPhase.COMMITTED;
            round.committedVersion = version;
            round.findingCount = findingCount;
            round.completedAt = clock.instant();
        });
    }

    @Override
    public void markFailed(String roundId, String reason) {
        update(roundId, round -> {
            round.phase = RoundPhase.FAILED;
            round.failureReason = reason;
            round.completedAt = clock.instant();
        });
    }

    @Override
    public Optional<RoundAudit> find(String roundId) {
        return Optional.ofNullable(rounds.get(roundId))
                .map(MutableRound::toImmutable);
    }

    @Override
    public List<RoundAudit> recent(int limit) {
        return rounds.values().stream()
                .map(MutableRound::toImmutable)
                .sorted(Comparator.comparing(RoundAudit::queuedAt).reversed())
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public int count() {
        return rounds.size();
    }

    @Override
    @Scheduled(fixedDelayString = "${topology.retention.audit.eviction-interval-ms:60000}")
    public int evictExpired() {
        var settings = retentionConfig.getAudit();
        var cutoff = clock.instant().minus(Duration.ofMinutes(settings.getTtlMinutes()));
        var toEvict = new ArrayList<String>();

        for (var round : rounds.values()) {
            synchronized (round) {
                if (settings.getTtlMinutes() > 0 && round.phase.isTerminal()
                        && round.completedAt != null && round.completedAt.isBefore(cutoff)) {
                    toEvict.add(round.roundId);
                }
            }
        }
        toEvict.forEach(rounds::remove);

        int overflow = rounds.size() - settings.getMaxRounds();
        if (overflow > 0) {
            var oldestTerminal = rounds.values().stream()
                    .map(MutableRound::toImmutable)
                    .filter(round -> round.phase().isTerminal())
                    .sorted(Comparator.comparing(RoundAudit::queuedAt))
                    .limit(overflow)
                    .map(RoundAudit::roundId)
                    .toList();
            oldestTerminal.forEach(rounds::remove);
            toEvict.addAll(oldestTerminal);
        }

        if (!toEvict.isEmpty()) {
            log.info("Evicted {} rounds from the audit trail", toEvict.size());
        }
        return toEvict.size();
    }

    // --- Private helpers ---

    private void update(String roundId, Consumer<MutableRound> change) {
        var round = rounds.get(roundId);
        if (round == null) {
            log.debug("Round {} no longer in audit trail", roundId);
            return;
        }
        synchronized (round) {
            change.accept(round);
        }
    }

    /**
     * Mutable round for internal use.
     */
    private static class MutableRound {
        final String roundId;
        final String trigger;
        final Instant queuedAt;
        RoundPhase phase = RoundPhase.QUEUED;
        Instant startedAt;
        Instant finishedAt;
        Instant completedAt;
        RoundOutcome outcome;
        List<PairOutcome> pairs = List.of();
        List<DiscoveryRecord> records = List.of();
        ProbeError aggregatedError;
        Long committedVersion;
        int findingCount;
        String failureReason;

        MutableRound(String roundId, String trigger, Instant queuedAt) {
            this.roundId = roundId;
            this.trigger = trigger;
            this.queuedAt = queuedAt;
        }

        synchronized RoundAudit toImmutable() {
            return new RoundAudit(roundId, trigger, phase, queuedAt, startedAt, finishedAt, outcome,
                    pairs, records, aggregatedError, committedVersion, findingCount, failureReason);
        }
    }
}
