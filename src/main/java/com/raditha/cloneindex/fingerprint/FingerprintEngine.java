package com.raditha.cloneindex.fingerprint;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Weighted SimHash over structural token n-grams.
 * <p>
 * The feature multiset holds every unigram, bigram and trigram of consecutive
 * tokens, weighted by how often it occurs. Each distinct feature is hashed to
 * 64 bits and votes on every bit with its weight; a bit is set when the vote is
 * strictly positive. Close token sequences therefore land at a small Hamming
 * distance from each other.
 * <p>
 * Instances are stateless and safe to share between threads.
 */
public class FingerprintEngine {

    public static final int BITS = 64;
    static final String SEPARATOR = "|";

    private final int maxGram;

    /**
     * Engine using unigrams, bigrams and trigrams.
     */
    public FingerprintEngine() {
        this(3);
    }

    /**
     * @param maxGram Longest n-gram to include (1 = bag of tokens).
     */
    public FingerprintEngine(int maxGram) {
        if (maxGram < 1) {
            throw new IllegalArgumentException("maxGram must be >= 1");
        }
        this.maxGram = maxGram;
    }

    /**
     * Compute the 64-bit fingerprint of a token sequence.
     * The result uses all 64 bits; treat it as unsigned.
     *
     * @param tokens ordered structural tokens
     * @return SimHash, 0 for an empty sequence
     */
    public long fingerprint(List<String> tokens) {
        Map<String, Integer> features = features(tokens);
        if (features.isEmpty()) {
            return 0L;
        }

        MessageDigest md5 = newDigest();
        long[] accumulator = new long[BITS];
        for (Map.Entry<String, Integer> feature : features.entrySet()) {
            long hash = hash64(md5, feature.getKey());
            int weight = feature.getValue();
            for (int bit = 0; bit < BITS; bit++) {
                if ((hash & (1L << bit)) != 0) {
                    accumulator[bit] += weight;
                } else {
                    accumulator[bit] -= weight;
                }
            }
        }

        long fingerprint = 0L;
        for (int bit = 0; bit < BITS; bit++) {
            if (accumulator[bit] > 0) {
                fingerprint |= 1L << bit;
            }
        }
        return fingerprint;
    }

    /**
     * Weighted feature multiset: n-gram string to occurrence count, in first
     * occurrence order. Blank tokens are skipped.
     */
    public Map<String, Integer> features(List<String> tokens) {
        Map<String, Integer> features = new LinkedHashMap<>();
        if (tokens == null || tokens.isEmpty()) {
            return features;
        }
        List<String> cleaned = tokens.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(String::trim)
                .toList();

        for (int n = 1; n <= maxGram; n++) {
            for (int i = 0; i + n <= cleaned.size(); i++) {
                String gram = n == 1 ? cleaned.get(i) : String.join(SEPARATOR, cleaned.subList(i, i + n));
                features.merge(gram, 1, Integer::sum);
            }
        }
        return features;
    }

    /**
     * Number of differing bits between two fingerprints, always in [0, 64].
     */
    public static int hammingDistance(long a, long b) {
        return Long.bitCount(a ^ b);
    }

    /**
     * Fingerprint agreement as a fraction: {@code 1 - hamming / 64}.
     */
    public static double fingerprintSimilarity(long a, long b) {
        return 1.0 - (double) hammingDistance(a, b) / BITS;
    }

    /**
     * Low 64 bits of the MD5 digest, read big-endian.
     */
    static long hash64(MessageDigest md5, String feature) {
        byte[] digest = md5.digest(feature.getBytes(StandardCharsets.UTF_8));
        long hash = 0L;
        for (int i = digest.length - 8; i < digest.length; i++) {
            hash = (hash << 8) | (digest[i] & 0xFFL);
        }
        return hash;
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
