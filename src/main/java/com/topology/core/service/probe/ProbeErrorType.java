package com.topology.core.service.probe;

/**
 * Typed failure of a probe attempt.
 */
public enum ProbeErrorType {
    TIMEOUT(true),
    UNREACHABLE(true),
    AUTH_FAILURE(false),
    MALFORMED_RESPONSE(false),
    CANCELLED(false),
    INTERNAL(false);

    private final boolean retryable;

    ProbeErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
