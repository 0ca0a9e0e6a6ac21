package com.topology.core.service.analytics;

import com.topology.core.service.model.Finding;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Structural metrics and findings for one snapshot.
 *
 * Only devices that are not OFFLINE and links that are UP take part.
 *
 * @param diameter          longest shortest path in hops; null when the graph
 *                          is empty or disconnected
 * @param betweenness       normalized node betweenness in [0, 1]
 * @param linkPathShare     share of connected device pairs whose shortest paths
 *                          cross each link, keyed by link key
 */
public record AnalysisReport(
        long graphVersion,
        Instant analyzedAt,
        int nodeCount,
        int linkCount,
        double averageDegree,
        double density,
        Map<String, Integer> degrees,
        Map<Integer, Integer> degreeDistribution,
        int componentCount,
        int largestComponentSize,
        Integer diameter,
        Map<String, Double> clustering,
        double averageClustering,
        Map<String, Double> betweenness,
        Map<String, Double> linkPathShare,
        List<Finding> findings
) {

    public boolean isConnected() {
        return componentCount <= 1;
    }
}
