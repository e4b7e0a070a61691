package com.raditha.cloneindex.cache;

import com.raditha.cloneindex.model.DuplicatePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Memoizes duplicate-search results.
 * <p>
 * An entry is served only while no record is newer than the entry: the caller
 * passes the newest record timestamp and stale entries read as misses. Stale
 * entries stay in the map until overwritten or cleared.
 * <p>
 * All methods are synchronized so one cache can back several searching threads.
 */
public class ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    private final Map<CacheKey, CacheEntry> entries = new HashMap<>();
    private long hits;
    private long misses;

    /**
     * Cached result, if present and not older than the newest record.
     *
     * @param key                 query identity
     * @param currentMaxTimestamp newest {@code createdAt} over the record set
     */
    public synchronized Optional<List<DuplicatePair>> get(CacheKey key, Instant currentMaxTimestamp) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        if (entry.dataTimestamp().isBefore(currentMaxTimestamp)) {
            logger.debug("Cached result for {} is stale ({} < {})", key, entry.dataTimestamp(), currentMaxTimestamp);
            misses++;
            return Optional.empty();
        }
        hits++;
        logger.debug("Using cached result for {}", key);
        return Optional.of(entry.result());
    }

    public synchronized void put(CacheKey key, List<DuplicatePair> result, Instant timestamp) {
        entries.put(key, new CacheEntry(List.copyOf(result), timestamp));
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long hits() {
        return hits;
    }

    public synchronized long misses() {
        return misses;
    }

    /**
     * A stored result and the data timestamp it was computed against.
     */
    record CacheEntry(List<DuplicatePair> result, Instant dataTimestamp) {
    }
}
