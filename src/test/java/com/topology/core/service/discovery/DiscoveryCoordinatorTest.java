package com.topology.core.service.discovery;

import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.ObservationFields;
import com.topology.core.service.probe.Probe;
import com.topology.core.service.probe.ProbeError;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeResult;
import com.topology.core.service.probe.ProbeTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiscoveryCoordinatorTest {

    private ExecutorService executor;
    private MetricsConfig metricsConfig;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    // ==================== Retries ====================

    @Test
    @DisplayName("A transient timeout is retried and the pair succeeds")
    void retriesTransientFailure() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> attempt == 1
                ? ProbeResult.failure(ProbeError.of(ProbeErrorType.TIMEOUT, "no answer"))
                : ProbeResult.success(List.of(deviceRecord(target))));

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config(2, 1));

        assertThat(result.outcome()).isEqualTo(RoundOutcome.COMPLETED);
        assertThat(result.records()).hasSize(1);
        assertThat(result.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.status()).isEqualTo(PairStatus.SUCCESS);
            assertThat(pair.attempts()).isEqualTo(2);
        });
        assertThat(metricsConfig.getProbeRetries().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Authentication failures are not retried")
    void doesNotRetryAuthFailure() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) ->
                ProbeResult.failure(ProbeError.of(ProbeErrorType.AUTH_FAILURE, "bad community")));

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config(3, 3));

        assertThat(result.pairs().get(0).attempts()).isEqualTo(1);
        assertThat(result.outcome()).isEqualTo(RoundOutcome.FAILED);
        assertThat(result.aggregatedError().type()).isEqualTo(ProbeErrorType.AUTH_FAILURE);
    }

    @Test
    @DisplayName("Unreachable targets use the smaller retry budget")
    void capsRetriesForUnreachableTargets() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) ->
                ProbeResult.failure(ProbeError.of(ProbeErrorType.UNREACHABLE, "host down")));

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config(3, 0));

        assertThat(result.pairs().get(0).attempts()).isEqualTo(1);
        assertThat(result.pairs().get(0).error().type()).isEqualTo(ProbeErrorType.UNREACHABLE);
    }

    // ==================== Isolation ====================

    @Test
    @DisplayName("One failing target does not affect its siblings")
    void isolatesFailingPairs() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> target.host().equals("10.0.0.2")
                ? ProbeResult.failure(ProbeError.of(ProbeErrorType.AUTH_FAILURE, "denied"))
                : ProbeResult.success(List.of(deviceRecord(target))));

        var result = coordinator(probe).runRound("r1",
                List.of(ProbeTarget.host("10.0.0.1"), ProbeTarget.host("10.0.0.2"), ProbeTarget.host("10.0.0.3")),
                Set.of(ProbeKind.SNMP_QUERY), config(1, 0));

        assertThat(result.outcome()).isEqualTo(RoundOutcome.DEGRADED);
        assertThat(result.aggregatedError()).isNull();
        assertThat(result.records()).hasSize(2);
        assertThat(result.failedPairs()).isEqualTo(1);
        assertThat(metricsConfig.getPairsFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Records gathered before an error make the pair a partial success")
    void keepsPartialRecords() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> ProbeResult.partial(
                List.of(deviceRecord(target)), ProbeError.of(ProbeErrorType.MALFORMED_RESPONSE, "bad varbind")));

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config(2, 1));

        assertThat(result.pairs().get(0).status()).isEqualTo(PairStatus.PARTIAL_SUCCESS);
        assertThat(result.outcome()).isEqualTo(RoundOutcome.DEGRADED);
        assertThat(result.records()).hasSize(1);
    }

    @Test
    void runsOnlyProbesAllowedForTarget() {
        var snmp = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> ProbeResult.success(List.of()));
        var lldp = new ScriptedProbe(ProbeKind.LLDP_LISTENER, (target, attempt) -> ProbeResult.success(List.of()));
        var target = new ProbeTarget("10.0.0.1", null, null, null, Set.of(ProbeKind.SNMP_QUERY));

        var result = coordinator(snmp, lldp).runRound("r1", List.of(target),
                Set.of(ProbeKind.SNMP_QUERY, ProbeKind.LLDP_LISTENER), config(0, 0));

        assertThat(result.pairs()).extracting(PairOutcome::probe).containsExactly(ProbeKind.SNMP_QUERY);
        assertThat(lldp.calls.get()).isZero();
    }

    @Test
    @DisplayName("An interface-only target never reaches a host-querying probe")
    void skipsActiveProbeForInterfaceOnlyTarget() {
        var snmp = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> ProbeResult.success(List.of()));
        var lldp = new ScriptedProbe(ProbeKind.LLDP_LISTENER, (target, attempt) -> ProbeResult.success(List.of()));
        var target = new ProbeTarget(null, "eth0", null, null, Set.of());

        var result = coordinator(snmp, lldp).runRound("r1", List.of(target),
                Set.of(ProbeKind.SNMP_QUERY, ProbeKind.LLDP_LISTENER), config(0, 0));

        assertThat(result.pairs()).extracting(PairOutcome::probe).containsExactly(ProbeKind.LLDP_LISTENER);
        assertThat(snmp.calls.get()).isZero();
    }

    @Test
    void rejectsUnregisteredProbeKind() {
        var snmp = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> ProbeResult.success(List.of()));

        assertThatThrownBy(() -> coordinator(snmp).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.ROUTEROS_API), config(0, 0)))
                .isInstanceOf(DiscoveryException.class)
                .extracting("errorCode")
                .isEqualTo(DiscoveryException.INVALID_PROBE);
    }

    // ==================== Deadlines and Concurrency ====================

    @Test
    @DisplayName("Pairs still running at the round deadline are cancelled as timed out")
    void cancelsPairsAtRoundDeadline() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProbeResult.failure(ProbeError.of(ProbeErrorType.CANCELLED, "interrupted"));
        });
        var config = config(0, 0).toBuilder().roundDeadline(Duration.ofMillis(300)).build();

        long start = System.nanoTime();
        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMillis).isLessThan(3_000);
        assertThat(result.outcome()).isEqualTo(RoundOutcome.FAILED);
        assertThat(result.pairs().get(0).error().type()).isEqualTo(ProbeErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("An attempt that ignores its timeout is abandoned and reported as timed out")
    void abandonsAttemptOverrunningItsTimeout() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> {
            try {
                Thread.sleep(1_500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProbeResult.success(List.of(deviceRecord(target)));
        });
        var config = config(0, 0).toBuilder().probeTimeout(Duration.ofMillis(100)).build();

        long start = System.nanoTime();
        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config);
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - start).toMillis();

        assertThat(elapsedMillis).isLessThan(1_000);
        assertThat(result.outcome()).isEqualTo(RoundOutcome.FAILED);
        assertThat(result.records()).isEmpty();
        assertThat(result.pairs()).singleElement().satisfies(pair -> {
            assertThat(pair.status()).isEqualTo(PairStatus.FAILED);
            assertThat(pair.error().type()).isEqualTo(ProbeErrorType.TIMEOUT);
        });
    }

    @Test
    @DisplayName("Records streamed before an overrun survive the abandoned attempt")
    void keepsStreamedRecordsOfAbandonedAttempt() {
        var probe = new StreamingProbe(Duration.ofMillis(1_500));
        var config = config(0, 0).toBuilder().probeTimeout(Duration.ofMillis(100)).build();

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config);

        assertThat(result.records()).hasSize(1);
        assertThat(result.pairs().get(0).status()).isEqualTo(PairStatus.PARTIAL_SUCCESS);
        assertThat(result.pairs().get(0).error().type()).isEqualTo(ProbeErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("A retry replaces the records of an earlier partial attempt")
    void retryDoesNotDuplicateRecords() {
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> attempt == 1
                ? ProbeResult.partial(List.of(deviceRecord(target)), ProbeError.of(ProbeErrorType.TIMEOUT, "slow"))
                : ProbeResult.success(List.of(deviceRecord(target))));

        var result = coordinator(probe).runRound("r1", List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), config(2, 1));

        assertThat(result.pairs().get(0).attempts()).isEqualTo(2);
        assertThat(result.pairs().get(0).status()).isEqualTo(PairStatus.SUCCESS);
        assertThat(result.records()).hasSize(1);
    }

    @Test
    void respectsConcurrencyCeiling() {
        var running = new AtomicInteger();
        var peak = new AtomicInteger();
        var probe = new ScriptedProbe(ProbeKind.SNMP_QUERY, (target, attempt) -> {
            peak.accumulateAndGet(running.incrementAndGet(), Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return ProbeResult.success(List.of(deviceRecord(target)));
        });
        var targets = List.of("10.0.0.1", "10.0.0.2", "10.0.0.3", "10.0.0.4", "10.0.0.5", "10.0.0.6").stream()
                .map(ProbeTarget::host)
                .toList();
        var config = config(0, 0).toBuilder().maxConcurrency(2).build();

        var result = coordinator(probe).runRound("r1", targets, Set.of(ProbeKind.SNMP_QUERY), config);

        assertThat(result.outcome()).isEqualTo(RoundOutcome.COMPLETED);
        assertThat(result.records()).hasSize(6);
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void backoffGrowsExponentiallyUpToCap() {
        var config = RoundConfig.builder()
                .probeTimeout(Duration.ofSeconds(1))
                .maxConcurrency(1)
                .backoffInitial(Duration.ofMillis(100))
                .backoffMultiplier(2.0)
                .backoffMax(Duration.ofMillis(350))
                .roundDeadline(Duration.ofSeconds(10))
                .build();

        assertThat(config.backoffDelay(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(config.backoffDelay(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(config.backoffDelay(3)).isEqualTo(Duration.ofMillis(350));
    }

    // ==================== Helpers ====================

    private DiscoveryCoordinator coordinator(Probe... probes) {
        return new DiscoveryCoordinator(executor, executor, new ProbeRegistry(List.of(probes)), metricsConfig,
                Clock.systemUTC());
    }

    private static RoundConfig config(int maxRetries, int unreachableMaxRetries) {
        return RoundConfig.builder()
                .probeTimeout(Duration.ofSeconds(1))
                .maxConcurrency(4)
                .maxRetries(maxRetries)
                .unreachableMaxRetries(unreachableMaxRetries)
                .backoffInitial(Duration.ofMillis(5))
                .backoffMultiplier(2.0)
                .backoffMax(Duration.ofMillis(20))
                .roundDeadline(Duration.ofSeconds(5))
                .build();
    }

    private static DiscoveryRecord deviceRecord(ProbeTarget target) {
        return DiscoveryRecord.device("snmp-query", ProbeKind.SNMP_QUERY.sourceKind(), target.label(),
                Instant.now(), 0.9, Map.of(ObservationFields.IP, target.host()));
    }

    /**
     * Probe whose answer depends on the target and the attempt number.
     */
    private static final class ScriptedProbe implements Probe {

        private final ProbeKind kind;
        private final BiFunction<ProbeTarget, Integer, ProbeResult> script;
        private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
        private final AtomicInteger calls = new AtomicInteger();

        ScriptedProbe(ProbeKind kind, BiFunction<ProbeTarget, Integer, ProbeResult> script) {
            this.kind = kind;
            this.script = script;
        }

        @Override
        public ProbeKind kind() {
            return kind;
        }

        @Override
        public ProbeResult run(ProbeTarget target, Duration timeout) {
            calls.incrementAndGet();
            int attempt = attempts.computeIfAbsent(target.label(), key -> new AtomicInteger()).incrementAndGet();
            return script.apply(target, attempt);
        }
    }

    /**
     * Probe that hands one record to the caller's sink, then blocks past any
     * reasonable timeout.
     */
    private static final class StreamingProbe implements Probe {

        private final Duration stall;

        StreamingProbe(Duration stall) {
            this.stall = stall;
        }

        @Override
        public ProbeKind kind() {
            return ProbeKind.SNMP_QUERY;
        }

        @Override
        public ProbeResult run(ProbeTarget target, Duration timeout) {
            return run(target, timeout, new ArrayList<>());
        }

        @Override
        public ProbeResult run(ProbeTarget target, Duration timeout, List<DiscoveryRecord> sink) {
            sink.add(deviceRecord(target));
            try {
                Thread.sleep(stall.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProbeResult.success(sink);
        }
    }
}
