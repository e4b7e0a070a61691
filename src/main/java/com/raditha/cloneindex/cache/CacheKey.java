package com.raditha.cloneindex.cache;

import com.raditha.cloneindex.model.SearchMode;

/**
 * Identifies one duplicate-search query over a record set of a given size.
 *
 * @param threshold      Similarity threshold
 * @param mode           Search mode
 * @param includeTrivial Whether trivial units were kept
 * @param recordCount    Size of the record set the query ran over
 */
public record CacheKey(
        double threshold,
        SearchMode mode,
        boolean includeTrivial,
        int recordCount) {
}
