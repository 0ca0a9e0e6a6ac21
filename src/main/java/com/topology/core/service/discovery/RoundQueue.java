package com.topology.core.service.discovery;

import java.util.Optional;

/**
 * Bounded queue of discovery rounds waiting for a worker.
 *
 * Decouples HTTP endpoints and the scheduler from round execution.
 */
public interface RoundQueue {

    /**
     * Attempts to enqueue a round with timeout.
     *
     * A round whose scope equals one still waiting is not queued again; the
     * admission then names the waiting round.
     *
     * @param item the round to enqueue
     * @param timeoutMs timeout in milliseconds
     * @return how the round was admitted
     */
    Admission offer(RoundWorkItem item, long timeoutMs);

    /**
     * Attempts to dequeue a round with timeout.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the round if available, empty otherwise
     */
    Optional<RoundWorkItem> dequeue(long timeoutMs);

    int size();

    int getCapacity();

    /**
     * Gets the queue utilization as a percentage.
     *
     * @return utilization percentage (0-100)
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    default boolean isFull() {
        return size() >= getCapacity();
    }

    void clear();

    /**
     * @param roundId the round that will run: the offered one when queued,
     *                the waiting one when coalesced
     */
    record Admission(Status status, String roundId) {

        public enum Status {
            QUEUED,
            COALESCED,
            REJECTED
        }

        public static Admission queued(String roundId) {
            return new Admission(Status.QUEUED, roundId);
        }

        public static Admission coalesced(String roundId) {
            return new Admission(Status.COALESCED, roundId);
        }

        public static Admission rejected(String roundId) {
            return new Admission(Status.REJECTED, roundId);
        }
    }
}
