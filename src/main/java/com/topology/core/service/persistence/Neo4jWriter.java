package com.topology.core.service.persistence;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Exports the current topology snapshot to Neo4j.
 *
 * Provides both Cypher generation and direct push capabilities.
 */
public interface Neo4jWriter {

    /**
     * Generates Cypher statements for the current snapshot.
     *
     * @return list of Cypher statements
     */
    List<String> generateCypher();

    /**
     * Pushes the current snapshot to Neo4j asynchronously.
     *
     * @return future that completes when export is done
     */
    CompletableFuture<ExportResult> pushToNeo4j();

    /**
     * Checks if Neo4j connection is available.
     *
     * @return true if connected
     */
    boolean isConnected();

    /**
     * Result of an export operation.
     */
    record ExportResult(
            long version,
            boolean success,
            int devicesExported,
            int linksExported,
            long durationMs,
            String errorMessage
    ) {
        public static ExportResult success(long version, int devices, int links, long durationMs) {
            return new ExportResult(version, true, devices, links, durationMs, null);
        }

        public static ExportResult failure(long version, String error) {
            return new ExportResult(version, false, 0, 0, 0, error);
        }
    }
}
