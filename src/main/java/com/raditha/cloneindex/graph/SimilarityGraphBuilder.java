package com.raditha.cloneindex.graph;

import com.raditha.cloneindex.config.DetectionConfig;
import com.raditha.cloneindex.detection.CandidatePairs;
import com.raditha.cloneindex.detection.ProgressReporter;
import com.raditha.cloneindex.filter.UnitFilter;
import com.raditha.cloneindex.index.MetricIndex;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import com.raditha.cloneindex.similarity.StructuralSimilarity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds similarity graphs from the same candidate generation as duplicate
 * search, keeping every qualifying edge. No unit is filtered out.
 */
public class SimilarityGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(SimilarityGraphBuilder.class);

    private final DetectionConfig config;
    private final StructuralSimilarity similarity;
    private boolean silent;

    public SimilarityGraphBuilder(DetectionConfig config) {
        this(config, new StructuralSimilarity());
    }

    public SimilarityGraphBuilder(DetectionConfig config, StructuralSimilarity similarity) {
        this.config = config;
        this.similarity = similarity;
    }

    public SimilarityGraphBuilder silent(boolean silent) {
        this.silent = silent;
        return this;
    }

    public SimilarityGraph buildGraph(List<RegisteredUnit> units, double threshold, SearchMode mode) {
        return buildGraph(units, threshold, mode, null);
    }

    /**
     * Build the graph of all pairs with similarity at or above the threshold.
     *
     * @param units     record set; each becomes a node
     * @param threshold minimum edge similarity
     * @param mode      fast uses fingerprint candidates, exhaustive compares all pairs
     * @param index     fingerprint index for fast mode, null to build one
     */
    public SimilarityGraph buildGraph(List<RegisteredUnit> units, double threshold, SearchMode mode,
                                      @Nullable MetricIndex<CodeRecord> index) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
        SimilarityGraph.Builder graph = SimilarityGraph.builder();
        for (RegisteredUnit unit : units) {
            graph.addNode(unit.contentHash());
        }

        Map<String, Map<String, Integer>> frequencies = new HashMap<>();
        ProgressReporter progress = new ProgressReporter("Building similarity graph", units.size(), silent);
        if (mode == SearchMode.FAST) {
            CandidatePairs.fast(units, index, config.hammingBoundFor(threshold), UnitFilter.none(), progress,
                    (a, b) -> addIfSimilar(graph, a, b, threshold, frequencies));
        } else {
            CandidatePairs.exhaustive(units, UnitFilter.none(), progress,
                    (a, b) -> addIfSimilar(graph, a, b, threshold, frequencies));
        }

        SimilarityGraph built = graph.build();
        logger.debug("Built {} at threshold {} ({} mode)", built, threshold, mode.name().toLowerCase());
        return built;
    }

    private void addIfSimilar(SimilarityGraph.Builder graph, RegisteredUnit a, RegisteredUnit b, double threshold,
                              Map<String, Map<String, Integer>> frequencies) {
        double score = similarity.calculate(
                frequencies.computeIfAbsent(a.contentHash(), h -> StructuralSimilarity.frequencies(a.unit().tokens())),
                frequencies.computeIfAbsent(b.contentHash(), h -> StructuralSimilarity.frequencies(b.unit().tokens())));
        if (score >= threshold) {
            graph.addEdge(a.contentHash(), b.contentHash(), score);
        }
    }
}
