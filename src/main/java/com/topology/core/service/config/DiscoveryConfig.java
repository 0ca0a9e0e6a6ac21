package com.topology.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the discovery pipeline.
 *
 * Controls the round queue, round workers, the default round settings
 * (timeouts, concurrency, retries) and the passive listen window.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "topology.discovery")
public class DiscoveryConfig {

    private QueueConfig queue = new QueueConfig();

    private WorkerConfig worker = new WorkerConfig();

    /**
     * Defaults applied to every round unless the request overrides them.
     */
    private RoundDefaults round = new RoundDefaults();

    private ScheduleConfig schedule = new ScheduleConfig();

    private PassiveConfig passive = new PassiveConfig();

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum number of queued rounds.
         */
        private int capacity = 100;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;

        /**
         * Enqueue timeout in milliseconds.
         */
        private long enqueueTimeoutMs = 1000;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of rounds processed concurrently.
         */
        private int threadCount = 2;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;
    }

    @Getter
    @Setter
    public static class RoundDefaults {

        /**
         * Hard deadline for a single probe attempt.
         */
        private long probeTimeoutMs = 10000;

        /**
         * Upper bound on probe tasks running at once within a round.
         */
        private int maxConcurrency = 16;

        /**
         * Retries after the first attempt for retryable failures.
         */
        private int maxRetries = 2;

        /**
         * Retries allowed when the target is unreachable; never more than maxRetries.
         */
        private int unreachableMaxRetries = 1;

        private long backoffInitialMs = 500;

        private double backoffMultiplier = 2.0;

        private long backoffMaxMs = 5000;

        /**
         * Deadline for the whole round; pending pairs are cancelled after it.
         */
        private long roundDeadlineMs = 120000;
    }

    @Getter
    @Setter
    public static class ScheduleConfig {

        /**
         * Interval between scheduled inventory rounds.
         */
        private long intervalMs = 300000;

        private long initialDelayMs = 30000;
    }

    @Getter
    @Setter
    public static class PassiveConfig {

        /**
         * How long passive listeners capture frames per run.
         */
        private long listenWindowMs = 30000;

        /**
         * Capture snapshot length in bytes.
         */
        private int snapLength = 1518;
    }
}
