package com.topology.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for device lifecycle and data retention.
 *
 * Controls when unseen devices go offline and are pruned, how many
 * snapshots are kept for diffs and how long round audit data lives.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "topology.retention")
public class RetentionConfig {

    private DeviceRetention device = new DeviceRetention();

    private SnapshotRetention snapshot = new SnapshotRetention();

    private AuditRetention audit = new AuditRetention();

    @Getter
    @Setter
    public static class DeviceRetention {

        /**
         * Unseen for this long, a device is marked OFFLINE.
         */
        private Duration gracePeriod = Duration.ofMinutes(10);

        /**
         * Unseen for this long, a device is removed from the graph.
         */
        private Duration retentionPeriod = Duration.ofHours(24);

        /**
         * Interval of the background lifecycle sweep in milliseconds.
         */
        private long sweepIntervalMs = 60000;
    }

    @Getter
    @Setter
    public static class SnapshotRetention {

        /**
         * Number of past snapshots kept for version lookups and diffs.
         */
        private int historySize = 50;
    }

    @Getter
    @Setter
    public static class AuditRetention {

        /**
         * TTL for finished rounds in minutes.
         */
        private long ttlMinutes = 60;

        /**
         * Maximum number of rounds kept.
         */
        private int maxRounds = 500;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000;
    }
}
