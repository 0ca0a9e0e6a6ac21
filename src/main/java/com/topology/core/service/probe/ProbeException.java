package com.topology.core.service.probe;

/**
 * Raised inside a probe when an attempt cannot continue.
 */
public class ProbeException extends Exception {

    private final ProbeErrorType errorType;

    public ProbeException(ProbeErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public ProbeException(ProbeErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ProbeErrorType getErrorType() {
        return errorType;
    }

    public static ProbeException timeout(String message) {
        return new ProbeException(ProbeErrorType.TIMEOUT, message);
    }

    public static ProbeException malformed(String message) {
        return new ProbeException(ProbeErrorType.MALFORMED_RESPONSE, message);
    }
}
