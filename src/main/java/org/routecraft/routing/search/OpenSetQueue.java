package org.routecraft.routing.search;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Binary min-heap of node ids keyed by f-score, used as the A* open set.
 * <p>
 * <strong>Key Features:</strong>
 * <ul>
 * <li><strong>Primitive storage:</strong> parallel {@code int}/{@code float} arrays, no per-entry objects.</li>
 * <li><strong>Decrease-Key:</strong> an id-to-slot index gives O(log n) rescoring instead of a linear scan.</li>
 * <li><strong>Bounded:</strong> a full queue rejects inserts with a {@code false} result instead of growing.</li>
 * </ul>
 * </p>
 * <p>Each id is held at most once. Entries with equal scores come out in heap order;
 * callers must not rely on any tie order.</p>
 * <p><strong>Usage Warning:</strong> This class is NOT thread-safe.</p>
 */
public class OpenSetQueue {

    // 1-based heap: children of k are 2k and 2k+1
    private final int[] heapIds;
    private final float[] heapScores;

    // positions[nodeId] = heap slot, 0 means absent
    private final int[] positions;

    @Getter
    @Accessors(fluent = true)
    private int size = 0;

    @Getter
    @Accessors(fluent = true)
    private int peakSize = 0;

    /**
     * Creates an empty queue.
     *
     * @param maxNodeId largest node id that will ever be queued. Must be non-negative.
     * @param capacity  maximum number of simultaneous entries. Must be positive.
     * @throws IllegalArgumentException on invalid bounds.
     */
    public OpenSetQueue(int maxNodeId, int capacity) {
        if (maxNodeId < 0) {
            throw new IllegalArgumentException("maxNodeId must be non-negative");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.heapIds = new int[capacity + 1];
        this.heapScores = new float[capacity + 1];
        this.positions = new int[maxNodeId + 1];
    }

    /**
     * Inserts a node that is not yet queued.
     *
     * @param nodeId node id (must be &le; maxNodeId).
     * @param score  f-score.
     * @return {@code false} when the queue is full; the entry is not added.
     * @throws IllegalArgumentException if nodeId is out of bounds.
     * @throws IllegalStateException    if nodeId is already queued.
     */
    public boolean push(int nodeId, float score) {
        checkBounds(nodeId);
        if (positions[nodeId] != 0) {
            throw new IllegalStateException("node " + nodeId + " is already queued; use decreaseOrInsert");
        }
        if (size >= heapIds.length - 1) {
            return false;
        }
        size++;
        heapIds[size] = nodeId;
        heapScores[size] = score;
        positions[nodeId] = size;
        if (size > peakSize) {
            peakSize = size;
        }
        swim(size);
        return true;
    }

    /**
     * Lowers the score of a queued node, or inserts it when absent.
     * <p>
     * A score that is not strictly lower than the stored one leaves the entry unchanged.
     * </p>
     *
     * @return {@code false} only when an insert was needed and the queue is full.
     * @throws IllegalArgumentException if nodeId is out of bounds.
     */
    public boolean decreaseOrInsert(int nodeId, float score) {
        checkBounds(nodeId);
        int slot = positions[nodeId];
        if (slot == 0) {
            return push(nodeId, score);
        }
        if (score < heapScores[slot]) {
            heapScores[slot] = score;
            swim(slot);
        }
        return true;
    }

    /**
     * Removes and returns the node with the minimum score.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public int pop() {
        if (isEmpty()) {
            throw new EmptyQueueException("pop");
        }
        int min = heapIds[1];
        positions[min] = 0;
        if (size == 1) {
            size = 0;
            return min;
        }
        move(size, 1);
        size--;
        sink(1);
        return min;
    }

    /**
     * Returns the minimum score without removing it.
     *
     * @throws EmptyQueueException if the queue is empty.
     */
    public float peekScore() {
        if (isEmpty()) {
            throw new EmptyQueueException("peek");
        }
        return heapScores[1];
    }

    /**
     * Checks whether a node currently has an entry.
     */
    public boolean contains(int nodeId) {
        return nodeId >= 0 && nodeId < positions.length && positions[nodeId] != 0;
    }

    /**
     * Stored score of a queued node.
     *
     * @throws IllegalStateException if the node is not queued.
     */
    public float scoreOf(int nodeId) {
        if (!contains(nodeId)) {
            throw new IllegalStateException("node " + nodeId + " is not queued");
        }
        return heapScores[positions[nodeId]];
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int capacity() {
        return heapIds.length - 1;
    }

    /**
     * Drops every entry. Peak size is kept.
     */
    public void clear() {
        for (int i = 1; i <= size; i++) {
            positions[heapIds[i]] = 0;
        }
        size = 0;
    }

    // --- Heap Helper Methods ---

    private void swim(int k) {
        while (k > 1 && greater(k / 2, k)) {
            swap(k, k / 2);
            k = k / 2;
        }
    }

    private void sink(int k) {
        while (2 * k <= size) {
            int j = 2 * k;
            if (j < size && greater(j, j + 1)) j++;
            if (!greater(k, j)) break;
            swap(k, j);
            k = j;
        }
    }

    private boolean greater(int i, int j) {
        return Float.compare(heapScores[i], heapScores[j]) > 0;
    }

    private void swap(int i, int j) {
        int id = heapIds[i];
        float score = heapScores[i];
        heapIds[i] = heapIds[j];
        heapScores[i] = heapScores[j];
        heapIds[j] = id;
        heapScores[j] = score;
        positions[heapIds[i]] = i;
        positions[heapIds[j]] = j;
    }

    private void move(int from, int to) {
        heapIds[to] = heapIds[from];
        heapScores[to] = heapScores[from];
        positions[heapIds[to]] = to;
    }

    private void checkBounds(int nodeId) {
        if (nodeId < 0 || nodeId >= positions.length) {
            throw new IllegalArgumentException("nodeId " + nodeId + " out of bounds (max: " + (positions.length - 1) + ")");
        }
    }
}
