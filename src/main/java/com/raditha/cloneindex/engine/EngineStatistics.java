package com.raditha.cloneindex.engine;

/**
 * Snapshot of what an engine currently holds.
 *
 * @param totalUnits       Registered units
 * @param files            Distinct source files among them
 * @param functions        Units of kind FUNCTION
 * @param classes          Units of kind CLASS
 * @param modules          Units of kind MODULE
 * @param hammingThreshold Configured Hamming radius for similarity queries
 * @param indexSize        Live entries in the fingerprint index
 * @param indexDepth       Depth of the fingerprint index
 * @param cachedResults    Duplicate-search results held by the cache
 */
public record EngineStatistics(
        int totalUnits,
        int files,
        int functions,
        int classes,
        int modules,
        int hammingThreshold,
        int indexSize,
        int indexDepth,
        int cachedResults) {
}
