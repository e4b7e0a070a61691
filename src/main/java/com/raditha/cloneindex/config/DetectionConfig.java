package com.raditha.cloneindex.config;

import com.raditha.cloneindex.model.SearchMode;
import org.jspecify.annotations.Nullable;

/**
 * Configuration for near-duplicate detection.
 * Defines thresholds, search strategy and filtering rules.
 *
 * @param hammingThreshold      Maximum fingerprint distance for single-unit similarity queries (0-64)
 * @param similarityThreshold   Minimum structural similarity to report (0.0-1.0)
 * @param useFastMode           Use the fingerprint index to pre-filter candidates
 * @param includeTrivial        Keep trivial units (accessors, boilerplate) in duplicate search
 * @param includeTests          Keep test code in duplicate search
 * @param topPercent            If set, report the top N% most similar pairs instead of using a threshold
 * @param minHammingBound       Lower clamp for the Hamming radius derived from a similarity threshold
 * @param sampleSize            Sample size used by the adaptive threshold search on large record sets
 * @param maxAdaptiveIterations Iteration cap for the adaptive threshold search
 * @param randomSeed            Seed for sampling, so adaptive searches are reproducible
 */
public record DetectionConfig(
        int hammingThreshold,
        double similarityThreshold,
        boolean useFastMode,
        boolean includeTrivial,
        boolean includeTests,
        @Nullable Double topPercent,
        int minHammingBound,
        int sampleSize,
        int maxAdaptiveIterations,
        long randomSeed) {

    public static final int FINGERPRINT_BITS = 64;

    /**
     * Validate configuration.
     */
    public DetectionConfig {
        if (hammingThreshold < 0 || hammingThreshold > FINGERPRINT_BITS) {
            throw new IllegalArgumentException("hammingThreshold must be between 0 and 64");
        }
        if (similarityThreshold < 0.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be between 0.0 and 1.0");
        }
        if (topPercent != null && (topPercent <= 0.0 || topPercent > 100.0)) {
            throw new IllegalArgumentException("topPercent must be in (0, 100]");
        }
        if (minHammingBound < 0 || minHammingBound > FINGERPRINT_BITS) {
            throw new IllegalArgumentException("minHammingBound must be between 0 and 64");
        }
        if (sampleSize < 2) {
            throw new IllegalArgumentException("sampleSize must be >= 2");
        }
        if (maxAdaptiveIterations < 1) {
            throw new IllegalArgumentException("maxAdaptiveIterations must be >= 1");
        }
    }

    /**
     * Default preset: 70% similarity, Hamming radius 10, fast mode.
     */
    public static DetectionConfig defaults() {
        return new DetectionConfig(
                10, // hammingThreshold
                0.70, // similarityThreshold
                true, // useFastMode
                false, // includeTrivial
                false, // includeTests
                null, // topPercent
                3, // minHammingBound
                100, // sampleSize
                10, // maxAdaptiveIterations
                42L); // randomSeed
    }

    /**
     * Strict preset: high confidence duplicates only (90% similarity, radius 5).
     */
    public static DetectionConfig strict() {
        return new DetectionConfig(5, 0.90, true, false, false, null, 3, 100, 10, 42L);
    }

    /**
     * Lenient preset: exhaustive search at 50% similarity, including trivial code.
     * Finds more candidates at quadratic cost.
     */
    public static DetectionConfig lenient() {
        return new DetectionConfig(16, 0.50, false, true, false, null, 3, 100, 10, 42L);
    }

    public SearchMode searchMode() {
        return SearchMode.of(useFastMode);
    }

    public DetectionConfig withSimilarityThreshold(double threshold) {
        return new DetectionConfig(hammingThreshold, threshold, useFastMode, includeTrivial, includeTests,
                topPercent, minHammingBound, sampleSize, maxAdaptiveIterations, randomSeed);
    }

    public DetectionConfig withFastMode(boolean fast) {
        return new DetectionConfig(hammingThreshold, similarityThreshold, fast, includeTrivial, includeTests,
                topPercent, minHammingBound, sampleSize, maxAdaptiveIterations, randomSeed);
    }

    public DetectionConfig withTopPercent(@Nullable Double percent) {
        return new DetectionConfig(hammingThreshold, similarityThreshold, useFastMode, includeTrivial, includeTests,
                percent, minHammingBound, sampleSize, maxAdaptiveIterations, randomSeed);
    }

    /**
     * Hamming radius that approximates a similarity threshold:
     * {@code round(64 * (1 - threshold))}, clamped below by {@link #minHammingBound()}.
     */
    public int hammingBoundFor(double threshold) {
        int bound = (int) Math.round(FINGERPRINT_BITS * (1.0 - threshold));
        return Math.min(FINGERPRINT_BITS, Math.max(minHammingBound, bound));
    }
}
