package com.raditha.cloneindex.index;

import java.util.List;

/**
 * Range-searchable index over 64-bit fingerprints under Hamming distance.
 *
 * @param <T> type of the indexed item; the index holds references only and
 *            does not own item lifetime
 */
public interface MetricIndex<T> {

    /**
     * Add an item under its fingerprint.
     */
    void insert(long fingerprint, T item);

    /**
     * All live items whose fingerprint lies within {@code maxDistance} of the
     * query. Results are unordered.
     *
     * @throws IllegalArgumentException if maxDistance is negative
     */
    List<Match<T>> search(long query, int maxDistance);

    /**
     * Remove the item with the given id stored under exactly this fingerprint.
     *
     * @return true if an item was found and removed
     */
    boolean remove(long fingerprint, String itemId);

    /**
     * Number of live items.
     */
    int size();

    boolean isEmpty();

    IndexStats stats();

    void clear();

    /**
     * An indexed item and its distance to the query.
     */
    record Match<T>(T item, int distance) {
    }
}
