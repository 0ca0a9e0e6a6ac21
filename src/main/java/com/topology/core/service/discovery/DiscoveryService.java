package com.topology.core.service.discovery;

import com.topology.core.service.audit.DiscoveryAuditTrail;
import com.topology.core.service.config.DiscoveryConfig;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.config.TopologyConfig;
import com.topology.core.service.engine.GraphInvariantViolationException;
import com.topology.core.service.engine.TopologyCommitService;
import com.topology.core.service.engine.TopologyCommitService.CommitResult;
import com.topology.core.service.probe.ProbeKind;
import com.topology.core.service.probe.ProbeTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Accepts discovery rounds and runs them through probing, audit and commit.
 *
 * Rounds submitted over HTTP or by the scheduler are queued and executed by
 * {@link RoundWorker}; {@link #execute(RoundWorkItem)} runs one inline.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiscoveryService {

    public static final String TRIGGER_API = "api";
    public static final String TRIGGER_INVENTORY = "inventory";
    public static final String TRIGGER_SCHEDULE = "schedule";

    private final RoundQueue roundQueue;
    private final DiscoveryCoordinator coordinator;
    private final ProbeRegistry probeRegistry;
    private final TargetInventory inventory;
    private final DiscoveryAuditTrail auditTrail;
    private final TopologyCommitService commitService;
    private final DiscoveryConfig discoveryConfig;
    private final TopologyConfig topologyConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // ==================== Submission ====================

    /**
     * Queues a round over explicit targets.
     *
     * @param probes probe set; empty uses the union of the targets' own probe kinds
     * @param config round settings, or null for the configured defaults
     * @return the round id
     * @throws DiscoveryException QUEUE_FULL, INVALID_PROBE or DISCOVERY_DISABLED
     */
    public String submitTargeted(List<ProbeTarget> targets, Set<ProbeKind> probes, RoundConfig config) {
        var item = new RoundWorkItem.TargetedRound(newRoundId(), targets, probes,
                orDefaults(config), clock.instant());
        probeRegistry.resolve(probeSet(item));
        return submit(item, TRIGGER_API);
    }

    /**
     * Queues a round over the configured inventory.
     *
     * @throws IllegalArgumentException if no inventory targets are configured
     */
    public String submitInventory(Set<ProbeKind> probeOverride, RoundConfig config, String trigger) {
        if (inventory.isEmpty()) {
            throw new IllegalArgumentException("No inventory targets configured");
        }
        var item = new RoundWorkItem.InventoryRound(newRoundId(), probeOverride,
                orDefaults(config), clock.instant());
        if (!item.probeOverride().isEmpty()) {
            probeRegistry.resolve(item.probeOverride());
        }
        return submit(item, trigger);
    }

    private String submit(RoundWorkItem item, String trigger) {
        if (!topologyConfig.isEnabled()) {
            throw new DiscoveryException("Discovery is disabled", item.getRoundId(),
                    DiscoveryException.DISCOVERY_DISABLED);
        }
        auditTrail.registerQueued(item.getRoundId(), trigger);
        var admission = roundQueue.offer(item, discoveryConfig.getQueue().getEnqueueTimeoutMs());
        switch (admission.status()) {
            case QUEUED -> log.info("Round {} queued by {}", item.getRoundId(), trigger);
            case COALESCED -> auditTrail.discard(item.getRoundId());
            case REJECTED -> {
                auditTrail.markFailed(item.getRoundId(), "Rejected: round queue full");
                throw new DiscoveryException("Round queue is full, retry later", item.getRoundId(),
                        DiscoveryException.QUEUE_FULL);
            }
        }
        return admission.roundId();
    }

    // ==================== Execution ====================

    /**
     * Runs one round to completion: probes, audit, then commit.
     *
     * A round whose every pair failed is recorded as failed and leaves the
     * topology untouched; partial failures still commit what was gathered.
     *
     * @throws GraphInvariantViolationException if the commit was rejected
     */
    public RoundExecution execute(RoundWorkItem item) {
        return metricsConfig.getRoundTimer().record(() -> doExecute(item));
    }

    private RoundExecution doExecute(RoundWorkItem item) {
        var roundId = item.getRoundId();
        auditTrail.markRunning(roundId);

        RoundResult result;
        try {
            var targets = targetsOf(item);
            var raw = coordinator.runRound(roundId, targets, probeSet(item, targets), item.getConfig());
            result = auditTrail.recordResult(raw);
        } catch (DiscoveryException e) {
            fail(roundId, e.getMessage());
            throw e;
        }

        if (result.outcome() == RoundOutcome.FAILED) {
            var reason = result.aggregatedError() != null
                    ? result.aggregatedError().message()
                    : "All pairs failed";
            fail(roundId, reason);
            return new RoundExecution(result, null);
        }

        try {
            var commit = commitService.commit(result);
            auditTrail.markCommitted(roundId, commit.toVersion(), commit.newFindings().size());
            metricsConfig.getRoundsCompleted().increment();
            return new RoundExecution(result, commit);
        } catch (GraphInvariantViolationException e) {
            fail(roundId, e.getMessage());
            throw e;
        }
    }

    // ==================== Helper Methods ====================

    private List<ProbeTarget> targetsOf(RoundWorkItem item) {
        if (item instanceof RoundWorkItem.TargetedRound targeted) {
            return targeted.targets();
        }
        var inventoryRound = (RoundWorkItem.InventoryRound) item;
        var targets = inventory.targets();
        if (inventoryRound.probeOverride().isEmpty()) {
            return targets;
        }
        return targets.stream()
                .map(target -> new ProbeTarget(target.host(), target.interfaceName(), target.mac(),
                        target.credentials(), inventoryRound.probeOverride()))
                .toList();
    }

    private Set<ProbeKind> probeSet(RoundWorkItem.TargetedRound item) {
        return probeSet(item, item.targets());
    }

    private Set<ProbeKind> probeSet(RoundWorkItem item, List<ProbeTarget> targets) {
        if (item instanceof RoundWorkItem.TargetedRound targeted && !targeted.probes().isEmpty()) {
            return targeted.probes();
        }
        if (item instanceof RoundWorkItem.InventoryRound inventoryRound && !inventoryRound.probeOverride().isEmpty()) {
            return inventoryRound.probeOverride();
        }
        var kinds = EnumSet.noneOf(ProbeKind.class);
        for (var target : targets) {
            kinds.addAll(target.probes().isEmpty() ? inventory.defaultProbes() : target.probes());
        }
        return kinds;
    }

    private void fail(String roundId, String reason) {
        auditTrail.markFailed(roundId, reason);
        metricsConfig.getRoundsFailed().increment();
        log.warn("Round {} failed: {}", roundId, reason);
    }

    private RoundConfig orDefaults(RoundConfig config) {
        return config != null ? config : RoundConfig.from(discoveryConfig.getRound());
    }

    private static String newRoundId() {
        return "round-" + UUID.randomUUID();
    }

    /**
     * Result of executing a round.
     *
     * @param commit null when the round failed before commit
     */
    public record RoundExecution(RoundResult result, CommitResult commit) {

        public boolean committed() {
            return commit != null;
        }
    }
}
