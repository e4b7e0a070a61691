package com.raditha.cloneindex.graph;

import com.raditha.cloneindex.config.DetectionConfig;
import com.raditha.cloneindex.index.MetricIndex;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Binary-searches a similarity threshold whose graph has roughly the wanted
 * number of edges.
 * <p>
 * An estimate is accepted when it lies in {@code [0.8 * target, max]}. Above
 * the band the threshold goes up, below it the threshold goes down. Edge count
 * is not monotone in the threshold, so this is a heuristic bounded by
 * {@link DetectionConfig#maxAdaptiveIterations()} probes. Record sets larger
 * than {@link DetectionConfig#sampleSize()} are probed on a seeded random
 * sample and the edge count is scaled by {@code (n / sampleSize)^2}.
 */
public class AdaptiveThresholdFinder {

    private static final Logger logger = LoggerFactory.getLogger(AdaptiveThresholdFinder.class);

    static final double LOWER_BAND_FACTOR = 0.8;

    private final DetectionConfig config;
    private final SimilarityGraphBuilder graphBuilder;

    public AdaptiveThresholdFinder(DetectionConfig config, SimilarityGraphBuilder graphBuilder) {
        this.config = config;
        this.graphBuilder = graphBuilder;
    }

    /**
     * @param units         record set
     * @param targetEdges   wanted number of undirected edges
     * @param maxEdges      upper limit on undirected edges
     * @param minThreshold  lowest threshold to try
     * @param maxThreshold  highest threshold to try
     * @param mode          mode for the final graph
     * @param index         fingerprint index for a fast final graph, may be null
     * @throws IllegalArgumentException for inconsistent bounds
     */
    public AdaptiveGraphResult findAdaptiveThreshold(List<RegisteredUnit> units, int targetEdges, int maxEdges,
                                                     double minThreshold, double maxThreshold, SearchMode mode,
                                                     @Nullable MetricIndex<CodeRecord> index) {
        if (minThreshold < 0.0 || maxThreshold > 1.0 || minThreshold > maxThreshold) {
            throw new IllegalArgumentException(
                    String.format("threshold bounds must satisfy 0 <= min <= max <= 1, got [%s, %s]",
                            minThreshold, maxThreshold));
        }
        if (targetEdges < 0 || targetEdges > maxEdges) {
            throw new IllegalArgumentException(
                    String.format("edge bounds must satisfy 0 <= target <= max, got target=%d max=%d",
                            targetEdges, maxEdges));
        }

        int n = units.size();
        boolean sampled = n > config.sampleSize();
        List<RegisteredUnit> probeUnits = sampled ? sample(units) : units;
        double scale = sampled ? Math.pow((double) n / probeUnits.size(), 2) : 1.0;
        double lowerBand = targetEdges * LOWER_BAND_FACTOR;

        logger.info("Adaptive threshold search over {} units (probing {}), target {} edges, max {}",
                n, probeUnits.size(), targetEdges, maxEdges);

        double low = minThreshold;
        double high = maxThreshold;
        double bestThreshold = (low + high) / 2;
        double bestEstimate = Double.NaN;
        double bestGap = Double.POSITIVE_INFINITY;
        boolean accepted = false;
        int iterations = 0;

        while (iterations < config.maxAdaptiveIterations()) {
            iterations++;
            double mid = (low + high) / 2;
            int probeEdges = graphBuilder.buildGraph(probeUnits, mid, SearchMode.EXHAUSTIVE, null).edgeCount();
            double estimate = probeEdges * scale;
            double gap = estimate > maxEdges ? estimate - maxEdges : Math.max(0.0, lowerBand - estimate);

            logger.debug("Iteration {}: threshold={} edges={} estimated={}",
                    iterations, String.format("%.3f", mid), probeEdges, String.format("%.0f", estimate));

            if (gap < bestGap) {
                bestGap = gap;
                bestThreshold = mid;
                bestEstimate = estimate;
            }
            if (estimate > maxEdges) {
                low = mid;
            } else if (estimate < lowerBand) {
                high = mid;
            } else {
                accepted = true;
                break;
            }
        }

        SimilarityGraph graph = graphBuilder.buildGraph(units, bestThreshold, mode, index);
        logger.info("Selected threshold {} after {} iterations ({}): {}",
                String.format("%.3f", bestThreshold), iterations, accepted ? "accepted" : "closest probe", graph);
        return new AdaptiveGraphResult(graph, bestThreshold, bestEstimate, iterations, accepted);
    }

    private List<RegisteredUnit> sample(List<RegisteredUnit> units) {
        List<RegisteredUnit> shuffled = new ArrayList<>(units);
        Collections.shuffle(shuffled, new Random(config.randomSeed()));
        return shuffled.subList(0, config.sampleSize());
    }
}
