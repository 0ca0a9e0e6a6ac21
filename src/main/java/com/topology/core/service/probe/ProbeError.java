package com.topology.core.service.probe;

public record ProbeError(ProbeErrorType type, String message) {

    public static ProbeError of(ProbeErrorType type, String message) {
        return new ProbeError(type, message);
    }

    public static ProbeError from(ProbeException e) {
        return new ProbeError(e.getErrorType(), e.getMessage());
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }
}
