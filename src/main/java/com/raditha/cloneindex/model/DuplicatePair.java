package com.raditha.cloneindex.model;

import java.util.Comparator;

/**
 * Two records whose structural similarity passed the threshold.
 * The first record always has the smaller content hash so that a pair has a
 * single canonical form.
 *
 * @param first      Record with the lexicographically smaller content hash
 * @param second     The other record
 * @param similarity Structural similarity score (0.0-1.0)
 */
public record DuplicatePair(
        CodeRecord first,
        CodeRecord second,
        double similarity) {

    /**
     * Highest similarity first, then by hashes so ordering is deterministic.
     */
    public static final Comparator<DuplicatePair> BY_SIMILARITY_DESC = Comparator
            .comparingDouble(DuplicatePair::similarity).reversed()
            .thenComparing(p -> p.first().contentHash())
            .thenComparing(p -> p.second().contentHash());

    public DuplicatePair {
        if (first == null || second == null) {
            throw new IllegalArgumentException("both records are required");
        }
        if (first.contentHash().compareTo(second.contentHash()) > 0) {
            throw new IllegalArgumentException("records must be in canonical order, use DuplicatePair.of");
        }
        if (similarity < 0.0 || similarity > 1.0) {
            throw new IllegalArgumentException("similarity must be between 0.0 and 1.0");
        }
    }

    /**
     * Create a pair, ordering the records canonically.
     */
    public static DuplicatePair of(CodeRecord a, CodeRecord b, double similarity) {
        if (a.contentHash().compareTo(b.contentHash()) <= 0) {
            return new DuplicatePair(a, b, similarity);
        }
        return new DuplicatePair(b, a, similarity);
    }

    /**
     * Canonical key identifying the unordered pair.
     */
    public static String pairKey(String hashA, String hashB) {
        return hashA.compareTo(hashB) <= 0 ? hashA + ":" + hashB : hashB + ":" + hashA;
    }

    public String pairKey() {
        return pairKey(first.contentHash(), second.contentHash());
    }
}
