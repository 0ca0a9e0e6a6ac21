package com.topology.core.service.engine;

/**
 * Raised when a delta would publish a snapshot that breaks a structural
 * invariant, such as a link whose endpoint device is missing. The apply is
 * aborted and the previous snapshot stays current.
 */
public class GraphInvariantViolationException extends RuntimeException {

    private final String roundId;

    public GraphInvariantViolationException(String roundId, String message) {
        super(message);
        this.roundId = roundId;
    }

    public String getRoundId() {
        return roundId;
    }
}
