package com.raditha.cloneindex.graph;

/**
 * One adjacency entry of a similarity graph.
 *
 * @param contentHash Hash of the neighboring record
 * @param similarity  Structural similarity of the edge (0.0-1.0)
 */
public record Neighbor(String contentHash, double similarity) {
}
