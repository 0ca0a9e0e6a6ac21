package com.topology.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the topology service.
 *
 * Contains the master toggle and feature flags.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "topology")
public class TopologyConfig {

    /**
     * Enable or disable discovery processing.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional capabilities.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Persist devices, links and findings to Neo4j instead of memory.
         */
        private boolean neo4jExportEnabled = false;

        /**
         * Periodically run a discovery round over the configured inventory.
         */
        private boolean scheduledDiscoveryEnabled = false;

        /**
         * Drop exact duplicate records within a round.
         */
        private boolean deduplicationEnabled = true;

        /**
         * Stream change events to server-sent event subscribers.
         */
        private boolean eventStreamEnabled = true;

        /**
         * Seed the graph store from persistence on startup.
         */
        private boolean loadSnapshotOnStartup = true;
    }
}
