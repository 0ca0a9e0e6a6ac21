package com.topology.core.service.probe;

import com.topology.core.service.model.DiscoveryRecord;
import com.topology.core.service.model.SourceKind;

import java.time.Duration;
import java.util.List;

/**
 * One discovery technique.
 *
 * Probes are stateless per invocation and safe to run concurrently against
 * different targets. {@link #run} never throws: failures come back typed in
 * the result, together with any records collected before the failure.
 */
public interface Probe {

    ProbeKind kind();

    /**
     * Identifier written into the records this probe produces.
     */
    default String id() {
        return kind().probeId();
    }

    default SourceKind sourceKind() {
        return kind().sourceKind();
    }

    /**
     * Runs the probe against a target within the given hard deadline.
     *
     * @param target  what to probe
     * @param timeout deadline for this attempt
     * @return the records collected and the error that ended the attempt, if any
     */
    ProbeResult run(ProbeTarget target, Duration timeout);

    /**
     * Runs the probe, also appending each record to {@code sink} as soon as it
     * is parsed. A caller that abandons the attempt at its deadline keeps
     * whatever reached the sink.
     *
     * @param sink thread-safe list shared with the caller
     */
    default ProbeResult run(ProbeTarget target, Duration timeout, List<DiscoveryRecord> sink) {
        var result = run(target, timeout);
        sink.addAll(result.records());
        return result;
    }
}
