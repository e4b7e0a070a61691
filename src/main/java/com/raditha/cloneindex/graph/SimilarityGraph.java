package com.raditha.cloneindex.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Undirected similarity graph stored as adjacency lists keyed by content hash.
 * Every record the graph was built over is a node, with or without edges.
 * Neighbor lists are ordered by descending similarity.
 */
public class SimilarityGraph {

    private static final Comparator<Neighbor> BY_SIMILARITY_DESC = Comparator
            .comparingDouble(Neighbor::similarity).reversed()
            .thenComparing(Neighbor::contentHash);

    private final Map<String, List<Neighbor>> adjacency;

    private SimilarityGraph(Map<String, List<Neighbor>> adjacency) {
        this.adjacency = adjacency;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimilarityGraph empty() {
        return new SimilarityGraph(Map.of());
    }

    /**
     * Neighbors of a node, most similar first; empty for unknown nodes.
     */
    public List<Neighbor> neighbors(String contentHash) {
        return adjacency.getOrDefault(contentHash, List.of());
    }

    public boolean containsNode(String contentHash) {
        return adjacency.containsKey(contentHash);
    }

    public Set<String> nodes() {
        return adjacency.keySet();
    }

    public int nodeCount() {
        return adjacency.size();
    }

    /**
     * Number of undirected edges.
     */
    public int edgeCount() {
        int directed = 0;
        for (List<Neighbor> neighbors : adjacency.values()) {
            directed += neighbors.size();
        }
        return directed / 2;
    }

    /**
     * Read-only view of the adjacency lists.
     */
    public Map<String, List<Neighbor>> asMap() {
        return adjacency;
    }

    /**
     * Connected components with at least {@code minSize} nodes, largest first.
     */
    public List<Set<String>> connectedComponents(int minSize) {
        List<Set<String>> components = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        for (String start : adjacency.keySet()) {
            if (!visited.add(start)) {
                continue;
            }
            Set<String> component = new HashSet<>();
            Deque<String> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                String node = stack.pop();
                component.add(node);
                for (Neighbor neighbor : neighbors(node)) {
                    if (visited.add(neighbor.contentHash())) {
                        stack.push(neighbor.contentHash());
                    }
                }
            }
            if (component.size() >= minSize) {
                components.add(Collections.unmodifiableSet(component));
            }
        }
        components.sort(Comparator.comparingInt(Set<String>::size).reversed());
        return components;
    }

    @Override
    public String toString() {
        return String.format("SimilarityGraph[nodes=%d, edges=%d]", nodeCount(), edgeCount());
    }

    /**
     * Accumulates nodes and edges; each edge is added to both endpoints.
     */
    public static class Builder {
        private final Map<String, List<Neighbor>> adjacency = new LinkedHashMap<>();

        public Builder addNode(String contentHash) {
            adjacency.computeIfAbsent(contentHash, h -> new ArrayList<>());
            return this;
        }

        public Builder addEdge(String a, String b, double similarity) {
            if (a.equals(b)) {
                throw new IllegalArgumentException("self edges are not allowed: " + a);
            }
            adjacency.computeIfAbsent(a, h -> new ArrayList<>()).add(new Neighbor(b, similarity));
            adjacency.computeIfAbsent(b, h -> new ArrayList<>()).add(new Neighbor(a, similarity));
            return this;
        }

        public SimilarityGraph build() {
            Map<String, List<Neighbor>> frozen = new LinkedHashMap<>();
            for (Map.Entry<String, List<Neighbor>> entry : adjacency.entrySet()) {
                List<Neighbor> neighbors = new ArrayList<>(entry.getValue());
                neighbors.sort(BY_SIMILARITY_DESC);
                frozen.put(entry.getKey(), List.copyOf(neighbors));
            }
            return new SimilarityGraph(Collections.unmodifiableMap(frozen));
        }
    }
}
