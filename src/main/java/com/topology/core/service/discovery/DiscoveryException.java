package com.topology.core.service.discovery;

/**
 * Exception thrown when a discovery round cannot be accepted or processed.
 */
public class DiscoveryException extends RuntimeException {

    public static final String QUEUE_FULL = "QUEUE_FULL";
    public static final String ROUND_NOT_FOUND = "ROUND_NOT_FOUND";
    public static final String INVALID_PROBE = "INVALID_PROBE";
    public static final String UNKNOWN_CREDENTIALS = "UNKNOWN_CREDENTIALS";
    public static final String DISCOVERY_DISABLED = "DISCOVERY_DISABLED";

    private final String entityId;
    private final String errorCode;

    public DiscoveryException(String message) {
        super(message);
        this.entityId = null;
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryException(String message, Throwable cause) {
        super(message, cause);
        this.entityId = null;
        this.errorCode = "DISCOVERY_ERROR";
    }

    public DiscoveryException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public DiscoveryException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
