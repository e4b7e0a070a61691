package com.raditha.cloneindex.index;

import com.raditha.cloneindex.fingerprint.FingerprintEngine;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BKTreeTest {

    private BKTree<String> tree;

    @BeforeEach
    void setUp() {
        tree = new BKTree<>(item -> item);
    }

    private Set<String> ids(List<MetricIndex.Match<String>> matches) {
        return matches.stream().map(MetricIndex.Match::item).collect(Collectors.toSet());
    }

    @Test
    void testSearchOnEmptyTreeReturnsEmpty() {
        assertTrue(tree.search(0L, 10).isEmpty());
        assertTrue(tree.isEmpty());
        assertEquals(IndexStats.empty(), tree.stats());
    }

    @Test
    void testNegativeDistanceRejected() {
        tree.insert(1L, "a");
        assertThrows(IllegalArgumentException.class, () -> tree.search(1L, -1));
    }

    @Test
    void testSearchReturnsItemsWithinDistance() {
        tree.insert(0b0000L, "zero");
        tree.insert(0b0001L, "one-bit");
        tree.insert(0b0011L, "two-bits");
        tree.insert(0b1111L, "four-bits");

        assertEquals(Set.of("zero"), ids(tree.search(0L, 0)));
        assertEquals(Set.of("zero", "one-bit"), ids(tree.search(0L, 1)));
        assertEquals(Set.of("zero", "one-bit", "two-bits"), ids(tree.search(0L, 2)));
        assertEquals(4, tree.search(0L, 64).size());

        MetricIndex.Match<String> match = tree.search(0b0011L, 0).get(0);
        assertEquals("two-bits", match.item());
        assertEquals(0, match.distance());
    }

    @Test
    void testIdenticalFingerprintsAreAllKept() {
        tree.insert(99L, "a");
        tree.insert(99L, "b");
        tree.insert(99L, "c");

        assertEquals(Set.of("a", "b", "c"), ids(tree.search(99L, 0)));
        assertEquals(3, tree.size());
        assertEquals(2, tree.stats().depth(), "identical fingerprints chain along the 0 edge");
    }

    @Test
    void testRemoveLeafDetachesIt() {
        tree.insert(0L, "root");
        tree.insert(1L, "leaf");

        assertTrue(tree.remove(1L, "leaf"));
        assertEquals(Set.of("root"), ids(tree.search(0L, 64)));
        assertEquals(0, tree.stats().tombstones());
        assertEquals(0, tree.stats().depth());
    }

    @Test
    void testRemoveInternalNodeLeavesTombstone() {
        tree.insert(0L, "root");
        tree.insert(0b1L, "middle");
        tree.insert(0b111L, "three-bits");
        tree.insert(0b1111_0000L, "other");

        assertTrue(tree.remove(0L, "root"));

        assertEquals(3, tree.size());
        assertEquals(1, tree.stats().tombstones());
        assertEquals(Set.of("middle", "three-bits", "other"), ids(tree.search(0L, 64)));
        assertFalse(ids(tree.search(0L, 0)).contains("root"));
    }

    @Test
    void testRemoveUnknownItemReturnsFalse() {
        tree.insert(5L, "a");

        assertFalse(tree.remove(5L, "b"));
        assertFalse(tree.remove(6L, "a"));
        assertFalse(new BKTree<String>(s -> s).remove(5L, "a"));
        assertEquals(1, tree.size());
    }

    @Test
    void testReinsertRevivesTombstone() {
        tree.insert(0L, "root");
        tree.insert(1L, "child");
        tree.remove(0L, "root");
        assertEquals(1, tree.stats().tombstones());

        tree.insert(0L, "root");

        assertEquals(0, tree.stats().tombstones());
        assertEquals(2, tree.size());
        assertEquals(Set.of("root"), ids(tree.search(0L, 0)));
    }

    @Test
    void testCompactionDropsTombstones() {
        Random random = new Random(3);
        long[] fingerprints = new long[40];
        for (int i = 0; i < fingerprints.length; i++) {
            fingerprints[i] = random.nextLong();
            tree.insert(fingerprints[i], "item" + i);
        }

        for (int i = 0; i < 30; i++) {
            assertTrue(tree.remove(fingerprints[i], "item" + i));
        }

        IndexStats stats = tree.stats();
        assertEquals(10, stats.size());
        assertTrue(stats.tombstones() <= stats.size(), "tombstones never outnumber live entries");
        for (int i = 30; i < 40; i++) {
            assertTrue(ids(tree.search(fingerprints[i], 0)).contains("item" + i));
        }

        tree.compact();
        assertEquals(0, tree.stats().tombstones());
        assertEquals(10, tree.items().size());
    }

    @Test
    void testClear() {
        tree.insert(1L, "a");
        tree.insert(2L, "b");
        tree.clear();

        assertTrue(tree.isEmpty());
        assertTrue(tree.search(1L, 64).isEmpty());
    }

    @Test
    void testDeepDegenerateTreeDoesNotOverflow() {
        // Equal fingerprints form a single chain along the 0 edge
        for (int i = 0; i < 10_000; i++) {
            tree.insert(7L, "item" + i);
        }
        assertEquals(10_000, tree.search(7L, 0).size());
        assertEquals(9_999, tree.stats().depth());
    }

    @Property(tries = 50)
    void searchMatchesLinearScan(@ForAll @Size(min = 1, max = 60) List<Long> fingerprints,
                                 @ForAll long query,
                                 @ForAll @IntRange(min = 0, max = 64) int radius) {
        BKTree<String> index = new BKTree<>(item -> item);
        Set<String> expected = new HashSet<>();
        for (int i = 0; i < fingerprints.size(); i++) {
            index.insert(fingerprints.get(i), "item" + i);
            if (FingerprintEngine.hammingDistance(fingerprints.get(i), query) <= radius) {
                expected.add("item" + i);
            }
        }

        List<MetricIndex.Match<String>> matches = index.search(query, radius);

        assertEquals(expected, ids(matches));
        for (MetricIndex.Match<String> match : matches) {
            assertTrue(match.distance() <= radius);
        }
    }
}
