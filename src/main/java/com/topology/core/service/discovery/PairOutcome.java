package com.topology.core.service.discovery;

import com.topology.core.service.probe.ProbeError;
import com.topology.core.service.probe.ProbeKind;

import java.time.Duration;

/**
 * Per (target, probe) report of a round.
 */
public record PairOutcome(
        String target,
        ProbeKind probe,
        PairStatus status,
        int attempts,
        int recordCount,
        ProbeError error,
        Duration elapsed
) {

    public boolean producedData() {
        return status != PairStatus.FAILED;
    }
}
