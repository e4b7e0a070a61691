package com.raditha.cloneindex.model;

/**
 * A registered record that resembles a query unit.
 *
 * @param record          Matching record
 * @param similarity      Structural similarity to the query (0.0-1.0)
 * @param hammingDistance Fingerprint distance to the query (0-64)
 */
public record SimilarMatch(
        CodeRecord record,
        double similarity,
        int hammingDistance) {
}
