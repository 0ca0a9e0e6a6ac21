package com.topology.core.service.engine;

import com.topology.core.service.analytics.AnalysisReport;
import com.topology.core.service.analytics.GraphAnalyticsEngine;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.discovery.RoundResult;
import com.topology.core.service.events.ChangeType;
import com.topology.core.service.events.TopologyChangeEvent;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.GraphDelta;
import com.topology.core.service.model.TopologyGraph;
import com.topology.core.service.persistence.TopologyPersistence;
import com.topology.core.service.resolve.IdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns a finished round into a published snapshot.
 *
 * Resolves the round against the current snapshot, applies the delta,
 * writes what changed to the persistence collaborator, analyzes the new
 * snapshot and appends findings not seen before.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologyCommitService {

    static final String LIFECYCLE_SWEEP = "lifecycle-sweep";

    private final IdentityResolver identityResolver;
    private final TopologyGraphStore graphStore;
    private final TopologyPersistence persistence;
    private final GraphAnalyticsEngine analyticsEngine;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final AtomicReference<AnalysisReport> lastReport = new AtomicReference<>();

    // ==================== Public API ====================

    /**
     * Commits one round. Rounds are committed one at a time so that each
     * delta is computed against the snapshot it is applied to.
     *
     * @throws GraphInvariantViolationException if the delta would break the graph
     */
    public synchronized CommitResult commit(RoundResult round) {
        var previous = graphStore.current();
        var delta = identityResolver.resolve(round, previous);
        var next = graphStore.apply(delta, clock.instant());
        boolean changed = next.version() != previous.version();

        if (changed) {
            persistChanges(previous, next, delta);
        }

        var report = currentReport();
        var raised = new ArrayList<Finding>();
        raised.addAll(appendFindings(delta.findings(), next.version()));
        raised.addAll(appendFindings(report.findings(), next.version()));

        log.info("Committed round {}: v{} -> v{}, {} new findings",
                round.roundId(), previous.version(), next.version(), raised.size());
        return new CommitResult(round.roundId(), previous.version(), next.version(), changed, List.copyOf(raised));
    }

    /**
     * Runs the lifecycle sweep without new observations, serialized with
     * round commits so no commit resolves against a snapshot the sweep
     * replaces. Pruned devices and links are removed from persistence.
     */
    @Scheduled(fixedDelayString = "${topology.retention.device.sweep-interval-ms:60000}",
            initialDelayString = "${topology.retention.device.sweep-interval-ms:60000}")
    public synchronized void sweepExpired() {
        var now = clock.instant();
        var previous = graphStore.current();
        var delta = GraphDelta.empty(LIFECYCLE_SWEEP, now);
        try {
            var next = graphStore.apply(delta, now);
            if (next.version() != previous.version()) {
                persistChanges(previous, next, delta);
                log.debug("Lifecycle sweep moved v{} -> v{}", previous.version(), next.version());
            }
        } catch (GraphInvariantViolationException e) {
            log.error("Lifecycle sweep rejected: {}", e.getMessage(), e);
        }
    }

    /**
     * Analysis of the current snapshot, cached per version.
     */
    public AnalysisReport currentReport() {
        var snapshot = graphStore.current();
        var cached = lastReport.get();
        if (cached != null && cached.graphVersion() == snapshot.version()) {
            return cached;
        }
        var report = analyticsEngine.analyze(snapshot);
        lastReport.set(report);
        return report;
    }

    // ==================== Persistence ====================

    private void persistChanges(TopologyGraph previous, TopologyGraph next, GraphDelta delta) {
        try {
            for (var device : next.devices().values()) {
                if (!device.equals(previous.devices().get(device.identityKey()))) {
                    persistence.saveDevice(device);
                }
            }
            for (var key : previous.devices().keySet()) {
                if (!next.devices().containsKey(key)) {
                    persistence.removeDevice(key);
                }
            }
            for (var link : next.links().values()) {
                if (!link.equals(previous.links().get(link.key()))) {
                    persistence.saveLink(link);
                }
            }
            for (var key : previous.links().keySet()) {
                if (!next.links().containsKey(key)) {
                    persistence.removeLink(key);
                }
            }
            persistence.markVersion(next.version(), next.createdAt());
            log.debug("Persisted v{} for {} to {}", next.version(), delta.roundId(), persistence.backend());
        } catch (RuntimeException e) {
            log.error("Failed to persist snapshot v{} to {}", next.version(), persistence.backend(), e);
        }
    }

    private List<Finding> appendFindings(List<Finding> findings, long version) {
        var appended = new ArrayList<Finding>();
        for (var finding : findings) {
            boolean added;
            try {
                added = persistence.appendFinding(finding);
            } catch (RuntimeException e) {
                log.error("Failed to append finding {} to {}", finding.findingId(), persistence.backend(), e);
                continue;
            }
            if (!added) {
                continue;
            }
            appended.add(finding);
            metricsConfig.getFindingsRaised().increment();
            eventPublisher.publishEvent(new TopologyChangeEvent(ChangeType.FINDING_RAISED, finding.findingId(),
                    null, finding.severity().name(), version, clock.instant()));
            log.warn("{} finding {} [{}]: {}", finding.type(), finding.findingId(), finding.severity(),
                    finding.description());
        }
        return appended;
    }

    /**
     * Outcome of committing one round.
     *
     * @param changed whether a new snapshot version was published
     */
    public record CommitResult(
            String roundId,
            long fromVersion,
            long toVersion,
            boolean changed,
            List<Finding> newFindings
    ) {
    }
}
