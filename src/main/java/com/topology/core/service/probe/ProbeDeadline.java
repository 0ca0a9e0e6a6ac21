package com.topology.core.service.probe;

import java.time.Duration;

/**
 * Cooperative deadline for a single probe attempt.
 *
 * Probes call {@link #checkpoint()} between units of work; it fails once the
 * deadline has passed or the running thread was interrupted.
 */
public final class ProbeDeadline {

    private final long deadlineNanos;
    private final Duration budget;

    private ProbeDeadline(Duration budget) {
        this.budget = budget;
        this.deadlineNanos = System.nanoTime() + budget.toNanos();
    }

    public static ProbeDeadline after(Duration budget) {
        return new ProbeDeadline(budget.isNegative() ? Duration.ZERO : budget);
    }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return deadlineNanos - System.nanoTime() <= 0;
    }

    public Duration budget() {
        return budget;
    }

    public void checkpoint() throws ProbeException {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProbeException(ProbeErrorType.CANCELLED, "Probe interrupted");
        }
        if (isExpired()) {
            throw ProbeException.timeout("Probe exceeded its " + budget.toMillis() + "ms deadline");
        }
    }
}
