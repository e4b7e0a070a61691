package com.raditha.cloneindex.cache;

import com.raditha.cloneindex.TestUnits;
import com.raditha.cloneindex.model.DuplicatePair;
import com.raditha.cloneindex.model.RegisteredUnit;
import com.raditha.cloneindex.model.SearchMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ResultCacheTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ResultCache cache;
    private CacheKey key;
    private List<DuplicatePair> result;

    @BeforeEach
    void setUp() {
        cache = new ResultCache();
        key = new CacheKey(0.8, SearchMode.FAST, false, 3);
        List<RegisteredUnit> units = TestUnits.abc();
        result = List.of(DuplicatePair.of(units.get(0).record(), units.get(1).record(), 1.0));
    }

    @Test
    void testMissOnEmptyCache() {
        assertTrue(cache.get(key, T0).isEmpty());
        assertEquals(1, cache.misses());
        assertEquals(0, cache.hits());
    }

    @Test
    void testHitWhenNoNewerData() {
        cache.put(key, result, T0);

        Optional<List<DuplicatePair>> cached = cache.get(key, T0);
        assertTrue(cached.isPresent());
        assertEquals(result, cached.get());
        assertTrue(cache.get(key, T0.minusSeconds(5)).isPresent());
        assertEquals(2, cache.hits());
    }

    @Test
    void testNewerDataInvalidatesEntry() {
        cache.put(key, result, T0);

        assertTrue(cache.get(key, T0.plusMillis(1)).isEmpty(), "A newer record makes the entry stale");
        assertEquals(1, cache.misses());
    }

    @Test
    void testKeysDifferByEveryComponent() {
        cache.put(key, result, T0);

        assertTrue(cache.get(new CacheKey(0.9, SearchMode.FAST, false, 3), T0).isEmpty());
        assertTrue(cache.get(new CacheKey(0.8, SearchMode.EXHAUSTIVE, false, 3), T0).isEmpty());
        assertTrue(cache.get(new CacheKey(0.8, SearchMode.FAST, true, 3), T0).isEmpty());
        assertTrue(cache.get(new CacheKey(0.8, SearchMode.FAST, false, 4), T0).isEmpty());
        assertTrue(cache.get(new CacheKey(0.8, SearchMode.FAST, false, 3), T0).isPresent());
    }

    @Test
    void testStoredResultIsACopy() {
        List<DuplicatePair> mutable = new ArrayList<>(result);
        cache.put(key, mutable, T0);
        mutable.clear();

        assertEquals(1, cache.get(key, T0).orElseThrow().size());
    }

    @Test
    void testClear() {
        cache.put(key, result, T0);
        assertEquals(1, cache.size());

        cache.clear();
        assertEquals(0, cache.size());
        assertTrue(cache.get(key, T0).isEmpty());
    }

    @Test
    void testConcurrentAccess() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            int n = i;
            pool.submit(() -> {
                CacheKey k = new CacheKey(0.5, SearchMode.FAST, false, n % 10);
                cache.put(k, result, T0);
                cache.get(k, T0);
            });
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));

        assertEquals(10, cache.size());
        assertEquals(200, cache.hits());
    }
}
