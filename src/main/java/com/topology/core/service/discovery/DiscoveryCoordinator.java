package com.topology.core.service.discovery;

import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.probe.Probe;
import com.topology.core.service.probe.ProbeError;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeResult;
import com.topology.core.service.probe.ProbeTarget;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a discovery round: one task per (target, probe) pair on the probe
 * executor, bounded by the round's concurrency ceiling.
 *
 * Each attempt runs as its own task bounded by the per-probe timeout, and a
 * pair retries transient failures with exponential backoff. A failing pair
 * never affects its siblings. Pairs still running at the round deadline are
 * cancelled and reported as timed out.
 */
@Slf4j
@Component
public class DiscoveryCoordinator {

    /**
     * Extra wait past the round deadline for probes that honour their own timeout.
     */
    private static final Duration CANCEL_GRACE = Duration.ofMillis(250);

    /**
     * Extra wait past the per-probe timeout so a probe that honours its own
     * deadline can return its typed error.
     */
    private static final Duration ATTEMPT_GRACE = Duration.ofMillis(50);

    private final ExecutorService probeExecutor;
    private final ExecutorService attemptExecutor;
    private final ProbeRegistry probeRegistry;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DiscoveryCoordinator(@Qualifier("probeExecutor") ExecutorService probeExecutor,
                                @Qualifier("probeAttemptExecutor") ExecutorService attemptExecutor,
                                ProbeRegistry probeRegistry,
                                MetricsConfig metricsConfig,
                                Clock clock) {
        this.probeExecutor = probeExecutor;
        this.attemptExecutor = attemptExecutor;
        this.probeRegistry = probeRegistry;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    // ==================== Round Execution ====================

    /**
     * Runs every allowed (target, probe) pair and waits for all of them or the
     * round deadline, whichever comes first.
     *
     * @throws DiscoveryException INVALID_PROBE if the probe set names an unregistered kind
     */
    public RoundResult runRound(String roundId, List<ProbeTarget> targets,
                                Collection<ProbeKind> probeSet, RoundConfig config) {
        var probes = probeRegistry.resolve(probeSet);
        var startedAt = clock.instant();
        long deadlineNanos = System.nanoTime() + config.roundDeadline().toNanos();
        var permits = new Semaphore(config.maxConcurrency());

        log.info("Round {} starting: {} targets, probes {}", roundId, targets.size(), probeSet);

        var tasks = new ArrayList<PairTask>();
        for (var target : targets) {
            for (var probe : probes) {
                if (!target.allows(probe.kind())) {
                    continue;
                }
                if (!target.supports(probe.kind())) {
                    log.debug("Skipping {} on {}: target has no {}", probe.id(), target.label(),
                            probe.kind().isPassive() ? "interface" : "host");
                    continue;
                }
                var records = new AttemptRecords();
                var future = probeExecutor.submit(
                        () -> runPair(target, probe, config, permits, deadlineNanos, records));
                tasks.add(new PairTask(target, probe, future, records));
            }
        }

        var records = new ArrayList<DiscoveryRecord>();
        var pairs = new ArrayList<PairOutcome>();
        for (var task : tasks) {
            var report = await(task, deadlineNanos);
            records.addAll(report.records());
            pairs.add(report.outcome());
            if (report.outcome().status() == PairStatus.FAILED) {
                metricsConfig.getPairsFailed().increment();
            }
        }

        var result = summarize(roundId, startedAt, records, pairs);
        log.info("Round {} finished {}: {} pairs, {} failed, {} records",
                roundId, result.outcome(), pairs.size(), result.failedPairs(), records.size());
        return result;
    }

    private PairReport await(PairTask task, long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime() + CANCEL_GRACE.toNanos();
        try {
            return task.future().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            task.future().cancel(true);
            log.warn("Round deadline reached, cancelling {} on {}", task.probe().id(), task.target().label());
            return failed(task, ProbeError.of(ProbeErrorType.TIMEOUT, "Round deadline exceeded"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future().cancel(true);
            return failed(task, ProbeError.of(ProbeErrorType.CANCELLED, "Round interrupted"));
        } catch (CancellationException e) {
            return failed(task, ProbeError.of(ProbeErrorType.CANCELLED, "Pair cancelled"));
        } catch (ExecutionException e) {
            log.error("Pair {} on {} failed unexpectedly", task.probe().id(), task.target().label(), e.getCause());
            return failed(task, ProbeError.of(ProbeErrorType.INTERNAL, String.valueOf(e.getCause())));
        }
    }

    // ==================== Pair Execution ====================

    private PairReport runPair(ProbeTarget target, Probe probe, RoundConfig config,
                               Semaphore permits, long deadlineNanos, AttemptRecords records) {
        long startNanos = System.nanoTime();
        try {
            if (!permits.tryAcquire(Math.max(0, deadlineNanos - startNanos), TimeUnit.NANOSECONDS)) {
                return report(target, probe, List.of(), 0,
                        ProbeError.of(ProbeErrorType.TIMEOUT, "No concurrency slot before round deadline"), startNanos);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return report(target, probe, List.of(), 0,
                    ProbeError.of(ProbeErrorType.CANCELLED, "Interrupted waiting for a slot"), startNanos);
        }

        try {
            return attemptWithRetries(target, probe, config, deadlineNanos, startNanos, records);
        } finally {
            permits.release();
        }
    }

    private PairReport attemptWithRetries(ProbeTarget target, Probe probe, RoundConfig config,
                                          long deadlineNanos, long startNanos, AttemptRecords records) {
        ProbeError lastError = null;
        int attempts = 0;
        int retries = 0;

        while (true) {
            long remaining = deadlineNanos - System.nanoTime();
            if (remaining <= 0) {
                lastError = ProbeError.of(ProbeErrorType.TIMEOUT, "Round deadline exceeded");
                break;
            }
            var timeout = min(config.probeTimeout(), Duration.ofNanos(remaining));
            attempts++;
            ProbeResult result = attempt(target, probe, timeout, records.begin());
            records.finish(result);

            if (result.isSuccess()) {
                lastError = null;
                break;
            }
            lastError = result.error();
            log.debug("{} on {} attempt {} failed: {}", probe.id(), target.label(), attempts, lastError);

            int limit = config.retryLimitFor(lastError.type() == ProbeErrorType.UNREACHABLE);
            if (!lastError.isRetryable() || retries >= limit || Thread.currentThread().isInterrupted()) {
                break;
            }
            retries++;
            var delay = config.backoffDelay(retries);
            if (System.nanoTime() + delay.toNanos() >= deadlineNanos) {
                break;
            }
            if (!sleep(delay)) {
                lastError = ProbeError.of(ProbeErrorType.CANCELLED, "Interrupted during backoff");
                break;
            }
            metricsConfig.getProbeRetries().increment();
        }
        return report(target, probe, records.snapshot(), attempts, lastError, startNanos);
    }

    /**
     * Runs one attempt on the attempt executor and waits at most its timeout.
     * An attempt that overruns is interrupted and reported as a timeout,
     * keeping whatever it had already put in the sink.
     */
    private ProbeResult attempt(ProbeTarget target, Probe probe, Duration timeout,
                                List<DiscoveryRecord> sink) {
        Future<ProbeResult> future = attemptExecutor.submit(() -> probe.run(target, timeout, sink));
        try {
            return future.get(timeout.plus(ATTEMPT_GRACE).toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} on {} overran its {}ms timeout, abandoning attempt",
                    probe.id(), target.label(), timeout.toMillis());
            return ProbeResult.partial(snapshot(sink), ProbeError.of(ProbeErrorType.TIMEOUT,
                    "Probe exceeded its " + timeout.toMillis() + "ms timeout"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProbeResult.partial(snapshot(sink),
                    ProbeError.of(ProbeErrorType.CANCELLED, "Pair interrupted"));
        } catch (ExecutionException e) {
            log.error("{} on {} threw out of run", probe.id(), target.label(), e.getCause());
            return ProbeResult.partial(snapshot(sink),
                    ProbeError.of(ProbeErrorType.INTERNAL, String.valueOf(e.getCause())));
        }
    }

    private boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // ==================== Result Assembly ====================

    private PairReport report(ProbeTarget target, Probe probe, List<DiscoveryRecord> records,
                              int attempts, ProbeError error, long startNanos) {
        PairStatus status;
        if (error == null) {
            status = PairStatus.SUCCESS;
        } else if (!records.isEmpty()) {
            status = PairStatus.PARTIAL_SUCCESS;
        } else {
            status = PairStatus.FAILED;
        }
        var outcome = new PairOutcome(target.label(), probe.kind(), status, attempts, records.size(),
                error, Duration.ofNanos(System.nanoTime() - startNanos));
        return new PairReport(snapshot(records), outcome);
    }

    /**
     * Report for a pair that did not return in time. Records it had already
     * parsed are kept, which makes the pair a partial success.
     */
    private PairReport failed(PairTask task, ProbeError error) {
        var records = task.records().snapshot();
        var status = records.isEmpty() ? PairStatus.FAILED : PairStatus.PARTIAL_SUCCESS;
        var outcome = new PairOutcome(task.target().label(), task.probe().kind(), status,
                0, records.size(), error, Duration.ZERO);
        return new PairReport(records, outcome);
    }

    private static List<DiscoveryRecord> snapshot(List<DiscoveryRecord> records) {
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    private RoundResult summarize(String roundId, Instant startedAt,
                                  List<DiscoveryRecord> records, List<PairOutcome> pairs) {
        var finishedAt = clock.instant();
        if (pairs.isEmpty()) {
            return new RoundResult(roundId, startedAt, finishedAt, records, pairs, RoundOutcome.COMPLETED, null);
        }
        boolean anyData = pairs.stream().anyMatch(PairOutcome::producedData);
        if (!anyData) {
            return new RoundResult(roundId, startedAt, finishedAt, records, pairs,
                    RoundOutcome.FAILED, aggregate(pairs));
        }
        boolean allSucceeded = pairs.stream().allMatch(pair -> pair.status() == PairStatus.SUCCESS);
        var outcome = allSucceeded ? RoundOutcome.COMPLETED : RoundOutcome.DEGRADED;
        return new RoundResult(roundId, startedAt, finishedAt, records, pairs, outcome, null);
    }

    /**
     * Folds the per-pair errors of a failed round into one error, typed by
     * the most frequent error type.
     */
    private ProbeError aggregate(List<PairOutcome> pairs) {
        var counts = new EnumMap<ProbeErrorType, Integer>(ProbeErrorType.class);
        for (var pair : pairs) {
            if (pair.error() != null) {
                counts.merge(pair.error().type(), 1, Integer::sum);
            }
        }
        var dominant = counts.entrySet().stream()
                .max(Comparator.comparing(Map.Entry<ProbeErrorType, Integer>::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(ProbeErrorType.INTERNAL);
        return ProbeError.of(dominant, String.format("All %d pairs failed (%s)", pairs.size(), counts));
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private record PairTask(ProbeTarget target, Probe probe, Future<PairReport> future,
                            AttemptRecords records) {
    }

    /**
     * Records of a pair across its attempts. Only the latest attempt that
     * produced anything counts, so a retry never duplicates what an earlier
     * partial attempt already reported.
     */
    private static final class AttemptRecords {

        private volatile List<DiscoveryRecord> kept = List.of();
        private volatile List<DiscoveryRecord> current = List.of();

        List<DiscoveryRecord> begin() {
            current = Collections.synchronizedList(new ArrayList<>());
            return current;
        }

        void finish(ProbeResult result) {
            if (result.hasRecords()) {
                kept = result.records();
            }
            current = List.of();
        }

        List<DiscoveryRecord> snapshot() {
            var inFlight = DiscoveryCoordinator.snapshot(current);
            return inFlight.isEmpty() ? kept : inFlight;
        }
    }

    private record PairReport(List<DiscoveryRecord> records, PairOutcome outcome) {
    }
}
