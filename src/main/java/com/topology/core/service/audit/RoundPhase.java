package com.topology.core.service.audit;

public enum RoundPhase {
    QUEUED,
    RUNNING,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED;
    }
}
