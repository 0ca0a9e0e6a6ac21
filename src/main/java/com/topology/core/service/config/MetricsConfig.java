package com.topology.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the topology service.
 *
 * Provides custom metrics for discovery rounds, identity resolution,
 * snapshot application, analytics and export.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter roundsCompleted;
    private final Counter roundsFailed;
    private final Counter roundsCoalesced;
    private final Counter pairsFailed;
    private final Counter probeRetries;
    private final Counter recordsResolved;
    private final Counter recordsDropped;
    private final Counter deduplicatedRecords;
    private final Counter resolverConflicts;
    private final Counter snapshotsApplied;
    private final Counter findingsRaised;
    private final Counter exportsCompleted;

    // Timers
    private final Timer roundTimer;
    private final Timer applyTimer;
    private final Timer analysisTimer;
    private final Timer exportTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.roundsCompleted = Counter.builder("topology.discovery.rounds.count")
                .description("Number of discovery rounds that committed")
                .tag("outcome", "committed")
                .register(registry);

        this.roundsFailed = Counter.builder("topology.discovery.rounds.count")
                .description("Number of discovery rounds that failed")
                .tag("outcome", "failed")
                .register(registry);

        this.roundsCoalesced = Counter.builder("topology.discovery.rounds.coalesced")
                .description("Number of submitted rounds merged into an identical waiting round")
                .register(registry);

        this.pairsFailed = Counter.builder("topology.discovery.pairs.failed")
                .description("Number of target/probe pairs that failed")
                .register(registry);

        this.probeRetries = Counter.builder("topology.discovery.retries")
                .description("Number of probe retry attempts")
                .register(registry);

        this.recordsResolved = Counter.builder("topology.resolve.records.count")
                .description("Number of discovery records merged")
                .register(registry);

        this.recordsDropped = Counter.builder("topology.resolve.records.dropped")
                .description("Number of malformed or unusable observations dropped")
                .register(registry);

        this.deduplicatedRecords = Counter.builder("topology.dedup.count")
                .description("Number of duplicate records skipped")
                .register(registry);

        this.resolverConflicts = Counter.builder("topology.resolve.conflicts")
                .description("Number of MAC/IP binding conflicts")
                .register(registry);

        this.snapshotsApplied = Counter.builder("topology.store.snapshots.count")
                .description("Number of snapshot versions published")
                .register(registry);

        this.findingsRaised = Counter.builder("topology.analytics.findings.count")
                .description("Number of findings raised")
                .register(registry);

        this.exportsCompleted = Counter.builder("topology.export.count")
                .description("Number of export operations completed")
                .register(registry);

        this.roundTimer = Timer.builder("topology.discovery.round.duration")
                .description("Time taken to run a discovery round")
                .register(registry);

        this.applyTimer = Timer.builder("topology.store.apply.duration")
                .description("Time taken to apply a delta")
                .register(registry);

        this.analysisTimer = Timer.builder("topology.analytics.duration")
                .description("Time taken to analyze a snapshot")
                .register(registry);

        this.exportTimer = Timer.builder("topology.export.duration")
                .description("Time taken for export operations")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
