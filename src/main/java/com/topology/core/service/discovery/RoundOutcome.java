package com.topology.core.service.discovery;

/**
 * Overall result of a round. FAILED means no pair produced anything.
 */
public enum RoundOutcome {
    COMPLETED,
    DEGRADED,
    FAILED
}
