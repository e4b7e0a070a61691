package com.raditha.cloneindex.index;

import com.raditha.cloneindex.fingerprint.FingerprintEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Burkhard-Keller tree over Hamming distance.
 * <p>
 * Every child is keyed by its distance to the parent. A range query for radius
 * {@code r} at a node at distance {@code d} from the query only needs to visit
 * edges {@code e} with {@code |e - d| <= r}; the triangle inequality rules out
 * everything else.
 * <p>
 * Removal policy: leaves are detached; a node that still has children is
 * tombstoned and skipped by searches, because re-parenting its subtree would
 * invalidate the distance keys below it. Once tombstones make up more than half
 * of the nodes the tree is rebuilt from the live entries.
 * <p>
 * Single writer. Concurrent readers are fine once building has finished.
 *
 * @param <T> indexed item type
 */
public class BKTree<T> implements MetricIndex<T> {

    private static final Logger logger = LoggerFactory.getLogger(BKTree.class);

    private final Function<? super T, String> idExtractor;
    private Node<T> root;
    private int liveCount;
    private int tombstoneCount;

    /**
     * @param idExtractor stable identity of an item, used by {@link #remove}
     */
    public BKTree(Function<? super T, String> idExtractor) {
        this.idExtractor = idExtractor;
    }

    @Override
    public void insert(long fingerprint, T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (root == null) {
            root = new Node<>(fingerprint, item);
            liveCount = 1;
            return;
        }

        String id = idExtractor.apply(item);
        Node<T> node = root;
        while (true) {
            int distance = FingerprintEngine.hammingDistance(node.fingerprint, fingerprint);
            if (distance == 0 && node.deleted && id.equals(idExtractor.apply(node.item))) {
                // Same entry coming back: revive instead of growing the tree
                node.item = item;
                node.deleted = false;
                tombstoneCount--;
                liveCount++;
                return;
            }
            Node<T> child = node.children.get(distance);
            if (child == null) {
                node.children.put(distance, new Node<>(fingerprint, item));
                liveCount++;
                return;
            }
            node = child;
        }
    }

    @Override
    public List<Match<T>> search(long query, int maxDistance) {
        if (maxDistance < 0) {
            throw new IllegalArgumentException("maxDistance must be >= 0");
        }
        List<Match<T>> results = new ArrayList<>();
        if (root == null) {
            return results;
        }

        Deque<Node<T>> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node<T> node = pending.pop();
            int distance = FingerprintEngine.hammingDistance(node.fingerprint, query);
            if (distance <= maxDistance && !node.deleted) {
                results.add(new Match<>(node.item, distance));
            }
            for (Map.Entry<Integer, Node<T>> edge : node.children.entrySet()) {
                if (Math.abs(edge.getKey() - distance) <= maxDistance) {
                    pending.push(edge.getValue());
                }
            }
        }
        return results;
    }

    @Override
    public boolean remove(long fingerprint, String itemId) {
        if (root == null) {
            return false;
        }

        // Entries with an identical fingerprint hang off the 0-edge chain of the
        // first such node, so the walk follows exact distances only.
        Node<T> parent = null;
        int parentEdge = -1;
        Node<T> node = root;
        while (node != null) {
            int distance = FingerprintEngine.hammingDistance(node.fingerprint, fingerprint);
            if (distance == 0 && !node.deleted && itemId.equals(idExtractor.apply(node.item))) {
                detachOrTombstone(parent, parentEdge, node);
                return true;
            }
            parent = node;
            parentEdge = distance;
            node = node.children.get(distance);
        }
        return false;
    }

    private void detachOrTombstone(Node<T> parent, int parentEdge, Node<T> node) {
        liveCount--;
        if (node.children.isEmpty()) {
            if (parent == null) {
                root = null;
            } else {
                parent.children.remove(parentEdge);
            }
        } else {
            node.deleted = true;
            tombstoneCount++;
            logger.debug("Tombstoned BK-tree node for {} ({} children kept)",
                    idExtractor.apply(node.item), node.children.size());
        }
        if (tombstoneCount > liveCount) {
            compact();
        }
    }

    /**
     * Rebuild the tree from its live entries, dropping all tombstones.
     */
    public void compact() {
        if (tombstoneCount == 0) {
            return;
        }
        List<Node<T>> live = new ArrayList<>(liveCount);
        collect(live);
        int dropped = tombstoneCount;

        root = null;
        liveCount = 0;
        tombstoneCount = 0;
        for (Node<T> node : live) {
            insert(node.fingerprint, node.item);
        }
        logger.debug("Compacted BK-tree: {} live entries, {} tombstones dropped", liveCount, dropped);
    }

    /**
     * All live items in breadth-first order.
     */
    public List<T> items() {
        List<Node<T>> live = new ArrayList<>(liveCount);
        collect(live);
        return live.stream().map(n -> n.item).toList();
    }

    private void collect(List<Node<T>> sink) {
        if (root == null) {
            return;
        }
        Deque<Node<T>> pending = new ArrayDeque<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            Node<T> node = pending.poll();
            if (!node.deleted) {
                sink.add(node);
            }
            pending.addAll(node.children.values());
        }
    }

    @Override
    public int size() {
        return liveCount;
    }

    @Override
    public boolean isEmpty() {
        return liveCount == 0;
    }

    @Override
    public IndexStats stats() {
        if (root == null) {
            return IndexStats.empty();
        }
        return new IndexStats(liveCount, depth(), tombstoneCount, root.children.size());
    }

    private int depth() {
        int maxDepth = 0;
        Deque<Node<T>> nodes = new ArrayDeque<>();
        Deque<Integer> depths = new ArrayDeque<>();
        nodes.push(root);
        depths.push(0);
        while (!nodes.isEmpty()) {
            Node<T> node = nodes.pop();
            int depth = depths.pop();
            maxDepth = Math.max(maxDepth, depth);
            for (Node<T> child : node.children.values()) {
                nodes.push(child);
                depths.push(depth + 1);
            }
        }
        return maxDepth;
    }

    @Override
    public void clear() {
        root = null;
        liveCount = 0;
        tombstoneCount = 0;
    }

    private static final class Node<T> {
        private final long fingerprint;
        private final Map<Integer, Node<T>> children = new HashMap<>();
        private T item;
        private boolean deleted;

        private Node(long fingerprint, T item) {
            this.fingerprint = fingerprint;
            this.item = item;
        }
    }
}
