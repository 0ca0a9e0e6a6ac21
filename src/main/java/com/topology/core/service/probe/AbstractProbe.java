package com.topology.core.service.probe;

import com.topology.core.service.model.DiscoveryRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class handling the deadline and error mapping common to all probes.
 *
 * Subclasses add records to the collector as they parse them, so an attempt
 * cut short by its deadline still returns everything parsed so far.
 */
@Slf4j
public abstract class AbstractProbe implements Probe {

    protected final Clock clock;

    protected AbstractProbe(Clock clock) {
        this.clock = clock;
    }

    @Override
    public final ProbeResult run(ProbeTarget target, Duration timeout) {
        return run(target, timeout, Collections.synchronizedList(new ArrayList<>()));
    }

    /**
     * Collects straight into {@code collected}, which must start empty and
     * belong to this attempt alone.
     */
    @Override
    public final ProbeResult run(ProbeTarget target, Duration timeout, List<DiscoveryRecord> collected) {
        var deadline = ProbeDeadline.after(timeout);

        try {
            collect(target, deadline, collected);
            return ProbeResult.success(collected);
        } catch (ProbeException e) {
            return handleProbeError(target, collected, e);
        } catch (RuntimeException e) {
            log.error("Probe {} failed unexpectedly on {}", id(), target.label(), e);
            return ProbeResult.partial(collected,
                    ProbeError.of(ProbeErrorType.INTERNAL, e.getClass().getSimpleName() + ": " + e.getMessage()));
        }
    }

    /**
     * Collects records for a target, checking the deadline between units of work.
     */
    protected abstract void collect(ProbeTarget target, ProbeDeadline deadline,
                                    List<DiscoveryRecord> collector) throws ProbeException;

    private ProbeResult handleProbeError(ProbeTarget target, List<DiscoveryRecord> collected,
                                         ProbeException e) {
        log.debug("Probe {} on {} stopped with {} after {} records: {}",
                id(), target.label(), e.getErrorType(), collected.size(), e.getMessage());
        return ProbeResult.partial(collected, ProbeError.from(e));
    }
}
