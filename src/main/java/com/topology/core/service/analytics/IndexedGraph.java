package com.topology.core.service.analytics;

import com.topology.core.service.model.DeviceStatus;
import com.topology.core.service.model.LinkKey;
import com.topology.core.service.model.LinkState;
import com.topology.core.service.model.TopologyGraph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Simple undirected graph over the live part of a snapshot, with devices
 * mapped to dense integer ids in key order.
 *
 * Parallel links of different types between the same pair collapse into one
 * edge; the original link keys are kept per edge.
 */
final class IndexedGraph {

    final List<String> keys;
    final int[][] adjacency;
    final Map<Long, List<LinkKey>> edgeLinks;

    private IndexedGraph(List<String> keys, int[][] adjacency, Map<Long, List<LinkKey>> edgeLinks) {
        this.keys = keys;
        this.adjacency = adjacency;
        this.edgeLinks = edgeLinks;
    }

    /**
     * Builds the graph of non-OFFLINE devices and UP links between them.
     */
    static IndexedGraph of(TopologyGraph snapshot) {
        var keys = snapshot.devices().values().stream()
                .filter(device -> device.status() != DeviceStatus.OFFLINE)
                .map(device -> device.identityKey())
                .sorted()
                .toList();
        var index = new HashMap<String, Integer>();
        for (int i = 0; i < keys.size(); i++) {
            index.put(keys.get(i), i);
        }

        var neighbours = new ArrayList<TreeSet<Integer>>();
        keys.forEach(key -> neighbours.add(new TreeSet<>()));
        var edgeLinks = new HashMap<Long, List<LinkKey>>();
        for (var link : snapshot.links().values()) {
            if (link.state() != LinkState.UP) {
                continue;
            }
            var a = index.get(link.endpointA());
            var b = index.get(link.endpointB());
            if (a == null || b == null || a.equals(b)) {
                continue;
            }
            neighbours.get(a).add(b);
            neighbours.get(b).add(a);
            edgeLinks.computeIfAbsent(edgeId(a, b), id -> new ArrayList<>()).add(link.key());
        }

        var adjacency = new int[keys.size()][];
        for (int i = 0; i < keys.size(); i++) {
            adjacency[i] = neighbours.get(i).stream().mapToInt(Integer::intValue).toArray();
        }
        return new IndexedGraph(keys, adjacency, edgeLinks);
    }

    int nodeCount() {
        return keys.size();
    }

    int edgeCount() {
        return edgeLinks.size();
    }

    int degree(int node) {
        return adjacency[node].length;
    }

    /**
     * Order-independent id of the edge between two nodes.
     */
    static long edgeId(int a, int b) {
        int low = Math.min(a, b);
        int high = Math.max(a, b);
        return ((long) low << 32) | high;
    }

    static int edgeLow(long edgeId) {
        return (int) (edgeId >>> 32);
    }

    static int edgeHigh(long edgeId) {
        return (int) edgeId;
    }
}
