package com.raditha.cloneindex.detection;

import com.raditha.cloneindex.filter.UnitFilter;
import com.raditha.cloneindex.index.BKTree;
import com.raditha.cloneindex.index.MetricIndex;
import com.raditha.cloneindex.model.CodeRecord;
import com.raditha.cloneindex.model.DuplicatePair;
import com.raditha.cloneindex.model.RegisteredUnit;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * Candidate pair generation shared by duplicate search and graph building.
 * <p>
 * Both strategies hand every unordered pair to the consumer at most once, and
 * never a unit paired with itself (same identity, or same file and start line).
 * Units rejected by the filter are neither queried nor returned as candidates.
 */
public class CandidatePairs {

    private static final Logger logger = LoggerFactory.getLogger(CandidatePairs.class);

    private CandidatePairs() {
    }

    /**
     * Index-prefiltered candidates: each fingerprinted unit is paired with the
     * units within {@code hammingBound} bits of it.
     *
     * @param units        record set to search
     * @param index        fingerprint index; may hold records outside {@code units},
     *                     which are ignored. Null builds a throw-away index.
     * @param hammingBound search radius in bits
     * @param filter       exclusion filter
     * @param progress     progress sink
     * @param consumer     receives each candidate pair once
     * @return number of pairs handed to the consumer
     */
    public static int fast(List<RegisteredUnit> units, @Nullable MetricIndex<CodeRecord> index, int hammingBound,
                           UnitFilter filter, ProgressReporter progress,
                           BiConsumer<RegisteredUnit, RegisteredUnit> consumer) {
        Map<String, RegisteredUnit> eligible = eligible(units, filter);
        MetricIndex<CodeRecord> searchIndex = index != null ? index : buildIndex(eligible.values());

        Set<String> seenPairs = new HashSet<>();
        int emitted = 0;
        int position = 0;
        for (RegisteredUnit unit : eligible.values()) {
            progress.update(++position);
            Long fingerprint = unit.record().fingerprint();
            if (fingerprint == null) {
                continue;
            }
            for (MetricIndex.Match<CodeRecord> match : searchIndex.search(fingerprint, hammingBound)) {
                RegisteredUnit candidate = eligible.get(match.item().contentHash());
                if (candidate == null || unit.sameCodeAs(candidate)) {
                    continue;
                }
                if (!seenPairs.add(DuplicatePair.pairKey(unit.contentHash(), candidate.contentHash()))) {
                    continue;
                }
                consumer.accept(unit, candidate);
                emitted++;
            }
        }
        progress.finish();
        logger.debug("Fast candidate generation: {} pairs from {} units (radius {})",
                emitted, eligible.size(), hammingBound);
        return emitted;
    }

    /**
     * All unordered pairs of eligible units.
     *
     * @return number of pairs handed to the consumer
     */
    public static int exhaustive(List<RegisteredUnit> units, UnitFilter filter, ProgressReporter progress,
                                 BiConsumer<RegisteredUnit, RegisteredUnit> consumer) {
        List<RegisteredUnit> eligible = new ArrayList<>(eligible(units, filter).values());
        int emitted = 0;
        for (int i = 0; i < eligible.size(); i++) {
            progress.update(i + 1);
            RegisteredUnit first = eligible.get(i);
            for (int j = i + 1; j < eligible.size(); j++) {
                RegisteredUnit second = eligible.get(j);
                if (first.sameCodeAs(second)) {
                    continue;
                }
                consumer.accept(first, second);
                emitted++;
            }
        }
        progress.finish();
        logger.debug("Exhaustive candidate generation: {} pairs from {} units", emitted, eligible.size());
        return emitted;
    }

    /**
     * Units that pass the filter, keyed by content hash, first occurrence wins.
     */
    static Map<String, RegisteredUnit> eligible(List<RegisteredUnit> units, UnitFilter filter) {
        Map<String, RegisteredUnit> eligible = new LinkedHashMap<>();
        for (RegisteredUnit unit : units) {
            if (!filter.shouldExclude(unit)) {
                eligible.putIfAbsent(unit.contentHash(), unit);
            }
        }
        return eligible;
    }

    /**
     * Index over the fingerprinted units of a record set.
     */
    public static BKTree<CodeRecord> buildIndex(Iterable<RegisteredUnit> units) {
        BKTree<CodeRecord> tree = new BKTree<>(CodeRecord::contentHash);
        for (RegisteredUnit unit : units) {
            if (unit.record().hasFingerprint()) {
                tree.insert(unit.record().fingerprint(), unit.record());
            }
        }
        return tree;
    }
}
