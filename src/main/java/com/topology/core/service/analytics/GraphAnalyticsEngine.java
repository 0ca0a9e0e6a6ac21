package com.topology.core.service.analytics;

import com.topology.core.service.config.AnalyticsConfig;
import com.topology.core.service.config.MetricsConfig;
import com.topology.core.service.model.Device;
import com.topology.core.service.model.Finding;
import com.topology.core.service.model.FindingType;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.TopologyGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes structural metrics and vulnerability findings over a read-only
 * snapshot. Tolerates empty, disconnected and single-node graphs.
 */
@Slf4j
@Component
public class GraphAnalyticsEngine {

    private static final String NODE_RECOMMENDATION =
            "Implement redundancy: add a second path around this device or a standby device";
    private static final String LINK_RECOMMENDATION =
            "Implement load balancing or a redundant link to spread traffic off this link";

    private final AnalyticsConfig config;
    private final MetricsConfig metricsConfig;
    private final SeverityScorer scorer;
    private final Clock clock;

    public GraphAnalyticsEngine(AnalyticsConfig config, MetricsConfig metricsConfig, Clock clock) {
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.scorer = new SeverityScorer(config.getScoring());
        this.clock = clock;
    }

    // ==================== Analysis ====================

    public AnalysisReport analyze(TopologyGraph snapshot) {
        return metricsConfig.getAnalysisTimer().record(() -> doAnalyze(snapshot));
    }

    private AnalysisReport doAnalyze(TopologyGraph snapshot) {
        var graph = IndexedGraph.of(snapshot);
        int n = graph.nodeCount();
        int m = graph.edgeCount();
        var analyzedAt = clock.instant();

        var degrees = new LinkedHashMap<String, Integer>();
        var distribution = new TreeMap<Integer, Integer>();
        var clustering = new LinkedHashMap<String, Double>();
        double clusteringSum = 0.0;
        for (int v = 0; v < n; v++) {
            int degree = graph.degree(v);
            degrees.put(graph.keys.get(v), degree);
            distribution.merge(degree, 1, Integer::sum);
            double coefficient = GraphAlgorithms.clustering(graph, v);
            clustering.put(graph.keys.get(v), coefficient);
            clusteringSum += coefficient;
        }

        var components = GraphAlgorithms.components(graph, -1);
        int componentCount = GraphAlgorithms.componentCount(components);
        Integer diameter = componentCount == 1 ? GraphAlgorithms.diameter(graph, -1) : null;

        var raw = GraphAlgorithms.betweenness(graph);
        var normalized = normalizeNodes(raw.nodes(), n);
        var betweenness = new LinkedHashMap<String, Double>();
        for (int v = 0; v < n; v++) {
            betweenness.put(graph.keys.get(v), normalized[v]);
        }

        long connectedPairs = connectedPairs(components);
        var edgeShares = new LinkedHashMap<Long, Double>();
        raw.edges().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(entry -> edgeShares.put(entry.getKey(),
                        connectedPairs == 0 ? 0.0 : entry.getValue() / connectedPairs));
        var linkPathShare = new LinkedHashMap<String, Double>();
        edgeShares.forEach((edge, share) -> {
            for (var key : graph.edgeLinks.get(edge)) {
                linkPathShare.put(key.toString(), share);
            }
        });

        var findings = n < config.getMinNodesForFindings()
                ? List.<Finding>of()
                : findVulnerabilities(snapshot, graph, components, diameter, normalized, edgeShares, analyzedAt);

        log.debug("Analyzed v{}: {} nodes, {} links, {} components, diameter {}, {} findings",
                snapshot.version(), n, m, componentCount, diameter, findings.size());

        return new AnalysisReport(
                snapshot.version(),
                analyzedAt,
                n,
                m,
                n == 0 ? 0.0 : (2.0 * m) / n,
                n < 2 ? 0.0 : (2.0 * m) / (n * (n - 1.0)),
                degrees,
                distribution,
                componentCount,
                GraphAlgorithms.largestComponentSize(components),
                diameter,
                clustering,
                n == 0 ? 0.0 : clusteringSum / n,
                betweenness,
                linkPathShare,
                findings);
    }

    // ==================== Findings ====================

    private List<Finding> findVulnerabilities(TopologyGraph snapshot, IndexedGraph graph, int[] components,
                                              Integer diameter, double[] betweenness,
                                              Map<Long, Double> edgeShares, Instant analyzedAt) {
        int n = graph.nodeCount();
        int m = graph.edgeCount();
        var cuts = GraphAlgorithms.cuts(graph);
        var findings = new ArrayList<Finding>();

        boolean diameterCheck = diameter != null && diameter > 0 && n <= config.getRemovalAnalysisMaxNodes();
        for (int v = 0; v < n; v++) {
            int cutOff = 0;
            String reason = null;
            if (cuts.articulationPoints().contains(v)) {
                cutOff = devicesCutOff(graph, components, v);
                reason = String.format("removing it disconnects %d device(s) from the rest of the network", cutOff);
            } else if (diameterCheck) {
                var reduced = GraphAlgorithms.diameter(graph, v);
                if (reduced != null && reduced > diameter * config.getDiameterIncreaseFactor()) {
                    reason = String.format("removing it raises the network diameter from %d to %d hops",
                            diameter, reduced);
                }
            }
            if (reason == null) {
                continue;
            }
            double nodeFraction = n > 1 ? cutOff / (n - 1.0) : 0.0;
            double linkFraction = m > 0 ? graph.degree(v) / (double) m : 0.0;
            double percentile = SeverityScorer.percentile(betweenness[v], betweenness);
            int score = scorer.score(nodeFraction, linkFraction, percentile);
            var key = graph.keys.get(v);
            findings.add(Finding.builder()
                    .type(FindingType.SINGLE_POINT_OF_FAILURE)
                    .severity(scorer.severity(score))
                    .riskScore(score)
                    .affectedDevices(List.of(key))
                    .affectedLinks(incidentLinks(graph, v))
                    .description(String.format("%s is a %s: %s",
                            describe(snapshot, key), FindingType.SINGLE_POINT_OF_FAILURE.label().toLowerCase(), reason))
                    .recommendation(NODE_RECOMMENDATION)
                    .graphVersion(snapshot.version())
                    .detectedAt(analyzedAt)
                    .build());
        }

        var shares = edgeShares.values().stream().mapToDouble(Double::doubleValue).toArray();
        for (var entry : edgeShares.entrySet()) {
            double share = round(entry.getValue());
            if (share < config.getBottleneckPathShare()) {
                continue;
            }
            long edge = entry.getKey();
            int a = IndexedGraph.edgeLow(edge);
            int b = IndexedGraph.edgeHigh(edge);
            int cutOff = cuts.bridges().contains(edge) ? smallerSide(graph, components, edge) : 0;
            double nodeFraction = n > 1 ? cutOff / (n - 1.0) : 0.0;
            double linkFraction = m > 0 ? 1.0 / m : 0.0;
            double percentile = SeverityScorer.percentile(entry.getValue(), shares);
            int score = scorer.score(nodeFraction, linkFraction, percentile);
            var keyA = graph.keys.get(a);
            var keyB = graph.keys.get(b);
            findings.add(Finding.builder()
                    .type(FindingType.BOTTLENECK_LINK)
                    .severity(scorer.severity(score))
                    .riskScore(score)
                    .affectedDevices(List.of(keyA, keyB))
                    .affectedLinks(graph.edgeLinks.get(edge).stream().map(LinkKey::toString).sorted().toList())
                    .description(String.format("Link %s - %s carries %.0f%% of shortest paths",
                            describe(snapshot, keyA), describe(snapshot, keyB), share * 100))
                    .recommendation(LINK_RECOMMENDATION)
                    .graphVersion(snapshot.version())
                    .detectedAt(analyzedAt)
                    .build());
        }

        findings.sort(Comparator.comparingInt(Finding::riskScore).reversed()
                .thenComparing(Finding::findingId));
        return List.copyOf(findings);
    }

    /**
     * Devices of {@code node}'s component that lose contact with the largest
     * piece left after removing it.
     */
    private int devicesCutOff(IndexedGraph graph, int[] components, int node) {
        int componentSize = sizeOf(components, components[node]);
        var reduced = GraphAlgorithms.components(graph, node);
        var sizes = new TreeMap<Integer, Integer>();
        for (int v = 0; v < reduced.length; v++) {
            if (v != node && components[v] == components[node]) {
                sizes.merge(reduced[v], 1, Integer::sum);
            }
        }
        int largest = sizes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
        return componentSize - 1 - largest;
    }

    private int smallerSide(IndexedGraph graph, int[] components, long edge) {
        int a = IndexedGraph.edgeLow(edge);
        var distance = GraphAlgorithms.distances(graph, a, -1, edge);
        int side = 0;
        for (int d : distance) {
            if (d != GraphAlgorithms.UNREACHABLE) side++;
        }
        int componentSize = sizeOf(components, components[a]);
        return Math.min(side, componentSize - side);
    }

    private List<String> incidentLinks(IndexedGraph graph, int node) {
        var keys = new ArrayList<String>();
        for (int w : graph.adjacency[node]) {
            graph.edgeLinks.get(IndexedGraph.edgeId(node, w)).forEach(key -> keys.add(key.toString()));
        }
        keys.sort(Comparator.naturalOrder());
        return keys;
    }

    // ==================== Helper Methods ====================

    private static double[] normalizeNodes(double[] raw, int n) {
        var normalized = new double[n];
        if (n < 3) {
            return normalized;
        }
        double pairs = (n - 1.0) * (n - 2.0) / 2.0;
        for (int v = 0; v < n; v++) {
            normalized[v] = raw[v] / pairs;
        }
        return normalized;
    }

    private static long connectedPairs(int[] components) {
        var sizes = new TreeMap<Integer, Long>();
        for (int c : components) {
            if (c != GraphAlgorithms.UNREACHABLE) sizes.merge(c, 1L, Long::sum);
        }
        return sizes.values().stream().mapToLong(size -> size * (size - 1) / 2).sum();
    }

    private static int sizeOf(int[] components, int component) {
        int size = 0;
        for (int c : components) {
            if (c == component) size++;
        }
        return size;
    }

    private static String describe(TopologyGraph snapshot, String key) {
        return snapshot.findDevice(key).map(Device::displayName).orElse(key);
    }

    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
