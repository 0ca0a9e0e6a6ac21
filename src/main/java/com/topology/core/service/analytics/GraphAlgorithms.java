package com.topology.core.service.analytics;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Unweighted graph algorithms over {@link IndexedGraph}. All methods are
 * iterative so deep graphs cannot overflow the stack.
 */
final class GraphAlgorithms {

    static final int UNREACHABLE = -1;

    private GraphAlgorithms() {
    }

    // ==================== Traversal ====================

    /**
     * Hop distances from {@code source}; {@link #UNREACHABLE} for other
     * components and for the excluded node.
     *
     * @param excludedNode node treated as removed, or -1
     * @param excludedEdge edge treated as removed, or -1
     */
    static int[] distances(IndexedGraph graph, int source, int excludedNode, long excludedEdge) {
        var distance = new int[graph.nodeCount()];
        Arrays.fill(distance, UNREACHABLE);
        if (source == excludedNode) {
            return distance;
        }
        var queue = new ArrayDeque<Integer>();
        distance[source] = 0;
        queue.add(source);
        while (!queue.isEmpty()) {
            int v = queue.poll();
            for (int w : graph.adjacency[v]) {
                if (w == excludedNode || distance[w] != UNREACHABLE
                        || (excludedEdge >= 0 && IndexedGraph.edgeId(v, w) == excludedEdge)) {
                    continue;
                }
                distance[w] = distance[v] + 1;
                queue.add(w);
            }
        }
        return distance;
    }

    /**
     * Component id per node, numbered from 0.
     */
    static int[] components(IndexedGraph graph, int excludedNode) {
        int n = graph.nodeCount();
        var component = new int[n];
        Arrays.fill(component, UNREACHABLE);
        int next = 0;
        for (int start = 0; start < n; start++) {
            if (start == excludedNode || component[start] != UNREACHABLE) {
                continue;
            }
            var distance = distances(graph, start, excludedNode, -1);
            for (int v = 0; v < n; v++) {
                if (distance[v] != UNREACHABLE) {
                    component[v] = next;
                }
            }
            next++;
        }
        return component;
    }

    static int componentCount(int[] component) {
        return (int) Arrays.stream(component).filter(c -> c != UNREACHABLE).distinct().count();
    }

    static int largestComponentSize(int[] component) {
        var sizes = new HashMap<Integer, Integer>();
        for (int c : component) {
            if (c != UNREACHABLE) sizes.merge(c, 1, Integer::sum);
        }
        return sizes.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * Longest shortest path, or null if the graph (minus the excluded node)
     * is empty or disconnected.
     */
    static Integer diameter(IndexedGraph graph, int excludedNode) {
        int n = graph.nodeCount();
        int remaining = excludedNode >= 0 ? n - 1 : n;
        if (remaining <= 0) {
            return null;
        }
        int diameter = 0;
        for (int source = 0; source < n; source++) {
            if (source == excludedNode) continue;
            var distance = distances(graph, source, excludedNode, -1);
            for (int v = 0; v < n; v++) {
                if (v == excludedNode) continue;
                if (distance[v] == UNREACHABLE) {
                    return null;
                }
                diameter = Math.max(diameter, distance[v]);
            }
        }
        return diameter;
    }

    // ==================== Clustering ====================

    static double clustering(IndexedGraph graph, int node) {
        var neighbours = graph.adjacency[node];
        int k = neighbours.length;
        if (k < 2) {
            return 0.0;
        }
        var set = new HashSet<Integer>();
        for (int w : neighbours) set.add(w);
        int triangles = 0;
        for (int u : neighbours) {
            for (int w : graph.adjacency[u]) {
                if (w > u && set.contains(w)) {
                    triangles++;
                }
            }
        }
        return (2.0 * triangles) / (k * (k - 1.0));
    }

    // ==================== Betweenness ====================

    /**
     * Node and edge betweenness for unordered pairs (Brandes). Values are raw
     * pair counts: each unordered pair contributes at most 1 to any element.
     */
    record Betweenness(double[] nodes, Map<Long, Double> edges) {
    }

    static Betweenness betweenness(IndexedGraph graph) {
        int n = graph.nodeCount();
        var nodeScore = new double[n];
        var edgeScore = new HashMap<Long, Double>();

        for (int s = 0; s < n; s++) {
            var stack = new ArrayDeque<Integer>();
            var sigma = new double[n];
            var distance = new int[n];
            Arrays.fill(distance, UNREACHABLE);
            sigma[s] = 1.0;
            distance[s] = 0;
            var queue = new ArrayDeque<Integer>();
            queue.add(s);
            while (!queue.isEmpty()) {
                int v = queue.poll();
                stack.push(v);
                for (int w : graph.adjacency[v]) {
                    if (distance[w] == UNREACHABLE) {
                        distance[w] = distance[v] + 1;
                        queue.add(w);
                    }
                    if (distance[w] == distance[v] + 1) {
                        sigma[w] += sigma[v];
                    }
                }
            }

            var delta = new double[n];
            while (!stack.isEmpty()) {
                int w = stack.pop();
                if (w == s) {
                    continue;
                }
                for (int v : graph.adjacency[w]) {
                    if (distance[v] == distance[w] - 1) {
                        double share = sigma[v] / sigma[w] * (1.0 + delta[w]);
                        edgeScore.merge(IndexedGraph.edgeId(v, w), share, Double::sum);
                        delta[v] += share;
                    }
                }
                nodeScore[w] += delta[w];
            }
        }

        // Every unordered pair was visited from both ends.
        for (int v = 0; v < n; v++) {
            nodeScore[v] /= 2.0;
        }
        edgeScore.replaceAll((edge, score) -> score / 2.0);
        return new Betweenness(nodeScore, edgeScore);
    }

    // ==================== Cut Vertices and Bridges ====================

    record Cuts(Set<Integer> articulationPoints, Set<Long> bridges) {
    }

    /**
     * Articulation points and bridges (Tarjan), run with an explicit stack.
     */
    static Cuts cuts(IndexedGraph graph) {
        int n = graph.nodeCount();
        var discovery = new int[n];
        var low = new int[n];
        var parent = new int[n];
        var nextChild = new int[n];
        Arrays.fill(discovery, UNREACHABLE);
        Arrays.fill(parent, UNREACHABLE);
        var articulation = new HashSet<Integer>();
        var bridges = new HashSet<Long>();
        int time = 0;

        for (int root = 0; root < n; root++) {
            if (discovery[root] != UNREACHABLE) {
                continue;
            }
            int rootChildren = 0;
            var stack = new ArrayDeque<Integer>();
            discovery[root] = low[root] = time++;
            stack.push(root);

            while (!stack.isEmpty()) {
                int v = stack.peek();
                if (nextChild[v] < graph.adjacency[v].length) {
                    int w = graph.adjacency[v][nextChild[v]++];
                    if (discovery[w] == UNREACHABLE) {
                        parent[w] = v;
                        if (v == root) rootChildren++;
                        discovery[w] = low[w] = time++;
                        stack.push(w);
                    } else if (w != parent[v]) {
                        low[v] = Math.min(low[v], discovery[w]);
                    }
                    continue;
                }
                stack.pop();
                int p = parent[v];
                if (p != UNREACHABLE) {
                    low[p] = Math.min(low[p], low[v]);
                    if (low[v] > discovery[p]) {
                        bridges.add(IndexedGraph.edgeId(p, v));
                    }
                    if (p != root && low[v] >= discovery[p]) {
                        articulation.add(p);
                    }
                }
            }
            if (rootChildren > 1) {
                articulation.add(root);
            }
        }
        return new Cuts(articulation, bridges);
    }
}
