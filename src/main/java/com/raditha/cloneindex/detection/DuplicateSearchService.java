package com.raditha.cloneindex.detection;

import com.raditha.cloneindex.config.DetectionConfig;
import com.raditha.cloneindex.filter.TrivialUnitFilter;
import com.raditha.cloneindex.filter.UnitFilter;
import com.raditha.cloneindex.index.MetricIndex;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.CodeUnit;
import com.raditha.cloneindex.model.DuplicatePair;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import com.raditha.cloneindex.model.SimilarMatch;
import com.raditha.cloneindex.similarity.StructuralSimilarity;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds pairs of structurally similar units in a record set.
 * <p>
 * Two strategies share the same filtering and scoring: {@link SearchMode#FAST}
 * only scores pairs whose fingerprints lie within a Hamming radius derived from
 * the threshold, {@link SearchMode#EXHAUSTIVE} scores every unordered pair.
 * Fast results are therefore always a subset of exhaustive results.
 */
public class DuplicateSearchService {

    private static final Logger logger = LoggerFactory.getLogger(DuplicateSearchService.class);

    static final double SWEEP_START = 0.95;
    static final double SWEEP_FLOOR = 0.30;
    static final double SWEEP_STEP = 0.05;

    private final DetectionConfig config;
    private final StructuralSimilarity similarity;
    private boolean silent;

    public DuplicateSearchService(DetectionConfig config) {
        this(config, new StructuralSimilarity());
    }

    public DuplicateSearchService(DetectionConfig config, StructuralSimilarity similarity) {
        this.config = config;
        this.similarity = similarity;
    }

    /**
     * Turn progress logging on or off.
     */
    public DuplicateSearchService silent(boolean silent) {
        this.silent = silent;
        return this;
    }

    /**
     * Find duplicates, building a temporary fingerprint index in fast mode.
     */
    public List<DuplicatePair> findDuplicates(List<RegisteredUnit> units, double threshold,
                                              SearchMode mode, boolean includeTrivial) {
        return findDuplicates(units, threshold, mode, includeTrivial, null);
    }

    /**
     * Find all pairs with structural similarity at or above the threshold.
     *
     * @param units          record set
     * @param threshold      minimum similarity (0.0-1.0)
     * @param mode           candidate strategy
     * @param includeTrivial keep trivial and test units
     * @param index          fingerprint index used in fast mode, null to build one
     * @return pairs sorted by descending similarity
     */
    public List<DuplicatePair> findDuplicates(List<RegisteredUnit> units, double threshold, SearchMode mode,
                                              boolean includeTrivial, @Nullable MetricIndex<CodeRecord> index) {
        checkThreshold(threshold);
        UnitFilter filter = filterFor(includeTrivial);
        Map<String, Map<String, Integer>> frequencies = new HashMap<>();
        List<DuplicatePair> duplicates = new ArrayList<>();

        int compared;
        if (mode == SearchMode.FAST) {
            ProgressReporter progress = new ProgressReporter("Finding duplicates (fast mode)", units.size(), silent);
            compared = CandidatePairs.fast(units, index, config.hammingBoundFor(threshold), filter, progress,
                    (a, b) -> score(a, b, threshold, frequencies, duplicates));
        } else {
            ProgressReporter progress = new ProgressReporter("Finding duplicates (exhaustive)", units.size(), silent);
            compared = CandidatePairs.exhaustive(units, filter, progress,
                    (a, b) -> score(a, b, threshold, frequencies, duplicates));
        }

        duplicates.sort(DuplicatePair.BY_SIMILARITY_DESC);
        logger.info("Found {} duplicate pairs at threshold {} using {} mode ({} pairs compared)",
                duplicates.size(), threshold, mode.name().toLowerCase(), compared);
        return duplicates;
    }

    /**
     * Report the top {@code percent}% of all possible pairs by lowering the
     * threshold from 0.95 towards 0.30 until enough pairs are found.
     *
     * @param percent share of the {@code n(n-1)/2} possible pairs, in (0, 100]
     * @return at most the target number of pairs, most similar first
     * @throws IllegalArgumentException if percent is outside (0, 100]
     */
    public List<DuplicatePair> findTopPercent(List<RegisteredUnit> units, double percent, SearchMode mode,
                                              boolean includeTrivial, @Nullable MetricIndex<CodeRecord> index) {
        if (!(percent > 0.0 && percent <= 100.0)) {
            throw new IllegalArgumentException("percent must be in (0, 100], got " + percent);
        }
        long totalPairs = possiblePairs(units, includeTrivial);
        long target = (long) Math.floor(percent / 100.0 * totalPairs);
        if (target == 0) {
            logger.info("Top {}% of {} possible pairs is empty", percent, totalPairs);
            return List.of();
        }
        return sweep(units, target, mode, includeTrivial, index);
    }

    /**
     * Report the {@code count} most similar pairs, using the same threshold
     * sweep as {@link #findTopPercent}. A count above the number of possible
     * pairs is capped.
     *
     * @throws IllegalArgumentException if count is negative
     */
    public List<DuplicatePair> findTopN(List<RegisteredUnit> units, int count, SearchMode mode,
                                        boolean includeTrivial, @Nullable MetricIndex<CodeRecord> index) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, got " + count);
        }
        long totalPairs = possiblePairs(units, includeTrivial);
        long target = count;
        if (target > totalPairs) {
            logger.warn("Requested {} pairs but only {} possible pairs exist", count, totalPairs);
            target = totalPairs;
        }
        if (target == 0) {
            return List.of();
        }
        return sweep(units, target, mode, includeTrivial, index);
    }

    private long possiblePairs(List<RegisteredUnit> units, boolean includeTrivial) {
        long n = CandidatePairs.eligible(units, filterFor(includeTrivial)).size();
        return n * (n - 1) / 2;
    }

    private List<DuplicatePair> sweep(List<RegisteredUnit> units, long target, SearchMode mode,
                                      boolean includeTrivial, @Nullable MetricIndex<CodeRecord> index) {
        List<DuplicatePair> found = List.of();
        for (double threshold : sweepThresholds()) {
            found = findDuplicates(units, threshold, mode, includeTrivial, index);
            logger.debug("Threshold {} produced {} pairs (target {})", threshold, found.size(), target);
            if (found.size() >= target) {
                logger.info("Top {} pairs found at threshold {}", target, threshold);
                return List.copyOf(found.subList(0, (int) target));
            }
        }
        logger.info("Threshold floor {} reached with {} of {} pairs", SWEEP_FLOOR, found.size(), target);
        return found;
    }

    /**
     * Registered units that resemble an arbitrary unit.
     *
     * @param target            query unit, need not be registered
     * @param targetFingerprint fingerprint of the query unit
     * @param units             record set to draw matches from
     * @param index             fingerprint index over the record set
     * @param hammingThreshold  candidate radius
     * @param threshold         minimum structural similarity
     * @param limit             maximum number of matches
     * @return matches, most similar first
     */
    public List<SimilarMatch> findSimilar(CodeUnit target, long targetFingerprint, List<RegisteredUnit> units,
                                          MetricIndex<CodeRecord> index, int hammingThreshold,
                                          double threshold, int limit) {
        checkThreshold(threshold);
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative, got " + limit);
        }
        Map<String, RegisteredUnit> byHash = new HashMap<>();
        for (RegisteredUnit unit : units) {
            byHash.putIfAbsent(unit.contentHash(), unit);
        }
        String targetHash = target.contentHash();
        Map<String, Integer> targetCounts = StructuralSimilarity.frequencies(target.tokens());

        List<SimilarMatch> matches = new ArrayList<>();
        for (MetricIndex.Match<CodeRecord> candidate : index.search(targetFingerprint, hammingThreshold)) {
            RegisteredUnit unit = byHash.get(candidate.item().contentHash());
            if (unit == null || unit.contentHash().equals(targetHash)) {
                continue;
            }
            double score = similarity.calculate(targetCounts, StructuralSimilarity.frequencies(unit.unit().tokens()));
            if (score >= threshold) {
                matches.add(new SimilarMatch(unit.record(), score, candidate.distance()));
            }
        }
        matches.sort(Comparator.comparingDouble(SimilarMatch::similarity).reversed()
                .thenComparingInt(SimilarMatch::hammingDistance)
                .thenComparing(m -> m.record().contentHash()));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : matches;
    }

    /**
     * Structural similarity of two registered units.
     */
    public double similarity(RegisteredUnit a, RegisteredUnit b) {
        return similarity.calculate(a.unit().tokens(), b.unit().tokens());
    }

    UnitFilter filterFor(boolean includeTrivial) {
        return includeTrivial ? UnitFilter.none() : new TrivialUnitFilter(config.includeTests(), 0);
    }

    static List<Double> sweepThresholds() {
        List<Double> thresholds = new ArrayList<>();
        int steps = (int) Math.round((SWEEP_START - SWEEP_FLOOR) / SWEEP_STEP);
        for (int i = 0; i <= steps; i++) {
            thresholds.add(Math.round((SWEEP_START - i * SWEEP_STEP) * 100) / 100.0);
        }
        return thresholds;
    }

    private void score(RegisteredUnit a, RegisteredUnit b, double threshold,
                       Map<String, Map<String, Integer>> frequencies, List<DuplicatePair> out) {
        double score = similarity.calculate(
                frequencies.computeIfAbsent(a.contentHash(), h -> StructuralSimilarity.frequencies(a.unit().tokens())),
                frequencies.computeIfAbsent(b.contentHash(), h -> StructuralSimilarity.frequencies(b.unit().tokens())));
        if (score >= threshold) {
            out.add(DuplicatePair.of(a.record(), b.record(), score));
        }
    }

    private static void checkThreshold(double threshold) {
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0, got " + threshold);
        }
    }
}
