package com.topology.core.service.discovery;

import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class DefaultRoundQueueTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final RoundConfig CONFIG = RoundConfig.from(new DiscoveryConfig().getRound());

    private MetricsConfig metricsConfig;
    private DefaultRoundQueue queue;

    @BeforeEach
    void setUp() {
        var discoveryConfig = new DiscoveryConfig();
        discoveryConfig.getQueue().setCapacity(2);
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());
        queue = new DefaultRoundQueue(discoveryConfig, metricsConfig);
        queue.init();
    }

    @Test
    @DisplayName("Repeated submissions of the same scope occupy one queue slot")
    void identicalWaitingRoundsCoalesce() {
        var first = queue.offer(targeted("round-1", "10.0.0.1"), 0);
        var second = queue.offer(targeted("round-2", "10.0.0.1"), 0);

        assertThat(first).isEqualTo(RoundQueue.Admission.queued("round-1"));
        assertThat(second).isEqualTo(RoundQueue.Admission.coalesced("round-1"));
        assertThat(queue.size()).isEqualTo(1);
        assertThat(metricsConfig.getRoundsCoalesced().count()).isEqualTo(1.0);
    }

    @Test
    void scheduledInventoryRoundsCoalesce() {
        var first = queue.offer(new RoundWorkItem.InventoryRound("round-1", Set.of(), CONFIG, NOW), 0);
        var second = queue.offer(new RoundWorkItem.InventoryRound("round-2", Set.of(), CONFIG, NOW.plusSeconds(300)), 0);

        assertThat(second.status()).isEqualTo(RoundQueue.Admission.Status.COALESCED);
        assertThat(second.roundId()).isEqualTo(first.roundId());
    }

    @Test
    void differentScopesQueueSeparately() {
        queue.offer(targeted("round-1", "10.0.0.1"), 0);
        var other = queue.offer(targeted("round-2", "10.0.0.2"), 0);

        assertThat(other.status()).isEqualTo(RoundQueue.Admission.Status.QUEUED);
        assertThat(queue.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Once a round is taken by a worker, the same scope queues again")
    void dequeuedScopeQueuesAgain() {
        queue.offer(targeted("round-1", "10.0.0.1"), 0);

        assertThat(queue.dequeue(0)).map(RoundWorkItem::getRoundId).contains("round-1");
        assertThat(queue.offer(targeted("round-2", "10.0.0.1"), 0))
                .isEqualTo(RoundQueue.Admission.queued("round-2"));
    }

    @Test
    void fullQueueRejectsAndForgetsTheScope() {
        queue.offer(targeted("round-1", "10.0.0.1"), 0);
        queue.offer(targeted("round-2", "10.0.0.2"), 0);

        var rejected = queue.offer(targeted("round-3", "10.0.0.3"), 10);
        assertThat(rejected).isEqualTo(RoundQueue.Admission.rejected("round-3"));

        queue.dequeue(0);
        assertThat(queue.offer(targeted("round-4", "10.0.0.3"), 0).status())
                .isEqualTo(RoundQueue.Admission.Status.QUEUED);
    }

    @Test
    void clearForgetsWaitingScopes() {
        queue.offer(targeted("round-1", "10.0.0.1"), 0);
        queue.clear();

        assertThat(queue.size()).isZero();
        assertThat(queue.offer(targeted("round-2", "10.0.0.1"), 0).status())
                .isEqualTo(RoundQueue.Admission.Status.QUEUED);
    }

    private static RoundWorkItem targeted(String roundId, String host) {
        return new RoundWorkItem.TargetedRound(roundId, List.of(ProbeTarget.host(host)),
                Set.of(ProbeKind.SNMP_QUERY), CONFIG, NOW);
    }
}
