package com.raditha.cloneindex.graph;

/**
 * Outcome of an adaptive threshold search.
 *
 * @param graph          Graph over all units at the selected threshold
 * @param threshold      Selected similarity threshold
 * @param estimatedEdges Edge estimate of the winning probe (extrapolated when sampled)
 * @param iterations     Number of probes made
 * @param accepted       Whether a probe landed inside the accepted edge band
 */
public record AdaptiveGraphResult(
        SimilarityGraph graph,
        double threshold,
        double estimatedEdges,
        int iterations,
        boolean accepted) {
}
