package com.raditha.cloneindex.model;

/**
 * Candidate generation strategy for duplicate search and graph building.
 */
public enum SearchMode {
    /** Fingerprint index pre-filtering; fast but may miss pairs */
    FAST,

    /** All unordered pairs; quadratic but no fingerprint false negatives */
    EXHAUSTIVE;

    public static SearchMode of(boolean useFastMode) {
        return useFastMode ? FAST : EXHAUSTIVE;
    }
}
