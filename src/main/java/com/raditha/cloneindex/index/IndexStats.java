package com.raditha.cloneindex.index;

/**
 * Shape of a BK-tree, useful for spotting near-linear trees when fingerprints
 * cluster.
 *
 * @param size         Live (searchable) entries
 * @param depth        Longest root-to-leaf path in edges
 * @param tombstones   Soft-deleted nodes still present in the structure
 * @param rootChildren Distinct edge distances under the root
 */
public record IndexStats(int size, int depth, int tombstones, int rootChildren) {

    public static IndexStats empty() {
        return new IndexStats(0, 0, 0, 0);
    }
}
