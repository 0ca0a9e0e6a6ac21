package com.topology.core.service.discovery;

import com.topology.core.service.audit.DiscoveryAuditTrail;
import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.config.InventoryConfig;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.config.TopologyConfig;
import com.topology.core.service.engine.GraphInvariantViolationException;
import com.topology.core.service.engine.TopologyCommitService;
import com.topology.core.service.engine.TopologyCommitService.CommitResult;
import com.topology.core.service.probe.ProbeError;
import com.topology.core.service.probe.ProbeErrorType;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DiscoveryServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private RoundQueue roundQueue;
    private DiscoveryCoordinator coordinator;
    private ProbeRegistry probeRegistry;
    private InventoryConfig inventoryConfig;
    private DiscoveryAuditTrail auditTrail;
    private TopologyCommitService commitService;
    private TopologyConfig topologyConfig;
    private MetricsConfig metricsConfig;
    private DiscoveryService service;

    @BeforeEach
    void setUp() {
        roundQueue = mock(RoundQueue.class);
        coordinator = mock(DiscoveryCoordinator.class);
        probeRegistry = mock(ProbeRegistry.class);
        auditTrail = mock(DiscoveryAuditTrail.class);
        commitService = mock(TopologyCommitService.class);
        inventoryConfig = new InventoryConfig();
        topologyConfig = new TopologyConfig();
        metricsConfig = new MetricsConfig(new SimpleMeterRegistry());

        when(roundQueue.offer(any(), anyLong())).thenAnswer(invocation ->
                RoundQueue.Admission.queued(invocation.<RoundWorkItem>getArgument(0).getRoundId()));
        when(auditTrail.recordResult(any())).thenAnswer(invocation -> invocation.getArgument(0));

        service = new DiscoveryService(roundQueue, coordinator, probeRegistry, new TargetInventory(inventoryConfig),
                auditTrail, commitService, new DiscoveryConfig(), topologyConfig, metricsConfig,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ==================== Submission ====================

    @Test
    void queuesTargetedRound() {
        var roundId = service.submitTargeted(List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.SNMP_QUERY), null);

        assertThat(roundId).startsWith("round-");
        var captor = ArgumentCaptor.forClass(RoundWorkItem.class);
        verify(roundQueue).offer(captor.capture(), eq(1000L));
        assertThat(captor.getValue()).isInstanceOf(RoundWorkItem.TargetedRound.class);
        assertThat(captor.getValue().getConfig().maxRetries()).isEqualTo(2);
        assertThat(captor.getValue().getCreatedAt()).isEqualTo(NOW);
        verify(auditTrail).registerQueued(roundId, DiscoveryService.TRIGGER_API);
        verify(probeRegistry).resolve(Set.of(ProbeKind.SNMP_QUERY));
    }

    @Test
    @DisplayName("An unknown probe is rejected before anything is queued")
    void rejectsUnavailableProbe() {
        when(probeRegistry.resolve(any())).thenThrow(new DiscoveryException("No probe registered for ROUTEROS_API",
                "ROUTEROS_API", DiscoveryException.INVALID_PROBE));

        assertThatThrownBy(() -> service.submitTargeted(List.of(ProbeTarget.host("10.0.0.1")),
                Set.of(ProbeKind.ROUTEROS_API), null))
                .isInstanceOf(DiscoveryException.class)
                .extracting(e -> ((DiscoveryException) e).getErrorCode())
                .isEqualTo(DiscoveryException.INVALID_PROBE);
        verify(roundQueue, never()).offer(any(), anyLong());
    }

    @Test
    void rejectsWhenQueueIsFull() {
        when(roundQueue.offer(any(), anyLong())).thenAnswer(invocation ->
                RoundQueue.Admission.rejected(invocation.<RoundWorkItem>getArgument(0).getRoundId()));

        assertThatThrownBy(() -> service.submitTargeted(List.of(ProbeTarget.host("10.0.0.1")), Set.of(), null))
                .isInstanceOf(DiscoveryException.class)
                .extracting(e -> ((DiscoveryException) e).getErrorCode())
                .isEqualTo(DiscoveryException.QUEUE_FULL);
        verify(auditTrail).markFailed(anyString(), eq("Rejected: round queue full"));
    }

    @Test
    @DisplayName("A round identical to a waiting one returns the waiting round id")
    void coalescedRoundReturnsWaitingRoundId() {
        when(roundQueue.offer(any(), anyLong())).thenReturn(RoundQueue.Admission.coalesced("round-waiting"));

        var roundId = service.submitTargeted(List.of(ProbeTarget.host("10.0.0.1")), Set.of(), null);

        assertThat(roundId).isEqualTo("round-waiting");
        var captor = ArgumentCaptor.forClass(String.class);
        verify(auditTrail).registerQueued(captor.capture(), eq(DiscoveryService.TRIGGER_API));
        verify(auditTrail).discard(captor.getValue());
        verify(auditTrail, never()).markFailed(anyString(), anyString());
    }

    @Test
    void rejectsWhenDiscoveryDisabled() {
        topologyConfig.setEnabled(false);

        assertThatThrownBy(() -> service.submitTargeted(List.of(ProbeTarget.host("10.0.0.1")), Set.of(), null))
                .isInstanceOf(DiscoveryException.class)
                .extracting(e -> ((DiscoveryException) e).getErrorCode())
                .isEqualTo(DiscoveryException.DISCOVERY_DISABLED);
    }

    @Test
    void rejectsInventoryRoundWithoutTargets() {
        assertThatThrownBy(() -> service.submitInventory(Set.of(), null, DiscoveryService.TRIGGER_INVENTORY))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No inventory targets");
    }

    // ==================== Execution ====================

    @Test
    void executesAndCommitsRound() {
        var item = targeted("r1", Set.of());
        var raw = result("r1", RoundOutcome.COMPLETED, null);
        when(coordinator.runRound(eq("r1"), any(), any(), any())).thenReturn(raw);
        when(commitService.commit(raw)).thenReturn(new CommitResult("r1", 0, 1, true, List.of()));

        var execution = service.execute(item);

        assertThat(execution.committed()).isTrue();
        assertThat(execution.commit().toVersion()).isEqualTo(1);
        verify(auditTrail).markRunning("r1");
        verify(auditTrail).markCommitted("r1", 1, 0);
        verify(coordinator).runRound(eq("r1"), any(), eq(Set.of(ProbeKind.SNMP_QUERY)), any());
        assertThat(metricsConfig.getRoundsCompleted().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A round where every pair failed is not committed")
    void failedRoundSkipsCommit() {
        var error = ProbeError.of(ProbeErrorType.UNREACHABLE, "All pairs failed: host unreachable");
        when(coordinator.runRound(eq("r1"), any(), any(), any()))
                .thenReturn(result("r1", RoundOutcome.FAILED, error));

        var execution = service.execute(targeted("r1", Set.of()));

        assertThat(execution.committed()).isFalse();
        verify(commitService, never()).commit(any());
        verify(auditTrail).markFailed("r1", "All pairs failed: host unreachable");
        assertThat(metricsConfig.getRoundsFailed().count()).isEqualTo(1.0);
    }

    @Test
    void degradedRoundStillCommits() {
        var raw = result("r1", RoundOutcome.DEGRADED, null);
        when(coordinator.runRound(eq("r1"), any(), any(), any())).thenReturn(raw);
        when(commitService.commit(raw)).thenReturn(new CommitResult("r1", 3, 4, true, List.of()));

        var execution = service.execute(targeted("r1", Set.of()));

        assertThat(execution.committed()).isTrue();
        verify(auditTrail).markCommitted("r1", 4, 0);
    }

    @Test
    void rejectedCommitMarksRoundFailed() {
        var raw = result("r1", RoundOutcome.COMPLETED, null);
        when(coordinator.runRound(eq("r1"), any(), any(), any())).thenReturn(raw);
        when(commitService.commit(raw)).thenThrow(new GraphInvariantViolationException("r1", "Self link x"));

        assertThatThrownBy(() -> service.execute(targeted("r1", Set.of())))
                .isInstanceOf(GraphInvariantViolationException.class);
        verify(auditTrail).markFailed("r1", "Self link x");
    }

    @Test
    @DisplayName("An inventory probe override replaces each target's own probes")
    void inventoryOverrideReplacesTargetProbes() {
        var props = new InventoryConfig.TargetProperties();
        props.setHost("10.0.0.254");
        props.setProbes(List.of("routeros-api"));
        inventoryConfig.getTargets().add(props);
        var item = new RoundWorkItem.InventoryRound("r1", Set.of(ProbeKind.SNMP_QUERY),
                RoundConfig.from(new DiscoveryConfig().getRound()), NOW);
        when(coordinator.runRound(eq("r1"), any(), any(), any())).thenReturn(result("r1", RoundOutcome.FAILED, null));

        service.execute(item);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ProbeTarget>> targets = ArgumentCaptor.forClass(List.class);
        verify(coordinator).runRound(eq("r1"), targets.capture(), eq(Set.of(ProbeKind.SNMP_QUERY)), any());
        assertThat(targets.getValue()).singleElement().satisfies(target -> {
            assertThat(target.host()).isEqualTo("10.0.0.254");
            assertThat(target.probes()).containsExactly(ProbeKind.SNMP_QUERY);
        });
    }

    // ==================== Helpers ====================

    private static RoundWorkItem.TargetedRound targeted(String roundId, Set<ProbeKind> probes) {
        return new RoundWorkItem.TargetedRound(roundId, List.of(ProbeTarget.host("10.0.0.1")), probes,
                RoundConfig.from(new DiscoveryConfig().getRound()), NOW);
    }

    private static RoundResult result(String roundId, RoundOutcome outcome, ProbeError error) {
        return new RoundResult(roundId, NOW, NOW, List.of(), List.of(), outcome, error);
    }
}
