package com.raditha.cloneindex.similarity;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bag-of-words similarity between two structural token sequences.
 * <p>
 * Each side becomes a token frequency multiset. The shared weight is the sum of
 * {@code min(countA, countB)} over common tokens, normalized by the geometric
 * mean of both multiset sizes. Repeated structure therefore counts: five calls
 * to {@code print} match five calls better than they match one.
 * <p>
 * This score is the ground truth used to confirm fingerprint candidates.
 */
public class StructuralSimilarity {

    /**
     * Calculate similarity between two token sequences.
     *
     * @param tokens1 First token sequence
     * @param tokens2 Second token sequence
     * @return Similarity score (0.0 to 1.0), 0.0 if either side is empty
     */
    public double calculate(List<String> tokens1, List<String> tokens2) {
        if (tokens1 == null || tokens2 == null || tokens1.isEmpty() || tokens2.isEmpty()) {
            return 0.0;
        }
        return calculate(frequencies(tokens1), frequencies(tokens2));
    }

    /**
     * Calculate similarity between two precomputed frequency multisets.
     */
    public double calculate(Map<String, Integer> counts1, Map<String, Integer> counts2) {
        long total1 = total(counts1);
        long total2 = total(counts2);
        if (total1 == 0 || total2 == 0) {
            return 0.0;
        }

        // Iterate the smaller side
        Map<String, Integer> small = counts1.size() <= counts2.size() ? counts1 : counts2;
        Map<String, Integer> large = small == counts1 ? counts2 : counts1;
        long intersection = 0;
        for (Map.Entry<String, Integer> entry : small.entrySet()) {
            Integer other = large.get(entry.getKey());
            if (other != null) {
                intersection += Math.min(entry.getValue(), other);
            }
        }

        double magnitude = Math.sqrt((double) total1 * (double) total2);
        return Math.min(1.0, intersection / magnitude);
    }

    /**
     * Token frequency multiset. Blank tokens are ignored.
     */
    public static Map<String, Integer> frequencies(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            if (token != null && !token.isBlank()) {
                counts.merge(token.trim(), 1, Integer::sum);
            }
        }
        return counts;
    }

    private static long total(Map<String, Integer> counts) {
        long total = 0;
        for (int count : counts.values()) {
            total += count;
        }
        return total;
    }
}
