package org.routecraft.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Search output: ordered node ids from start to goal (inclusive), total cost and stats.
 *
 * <p>The caller that received a result owns it and must {@link #close()} it when done,
 * typically with try-with-resources. Reading the path after release fails.</p>
 *
 * <p>A not-found result carries no path and a cost of {@code 0}.</p>
 */
public final class PathResult implements AutoCloseable {
    private IntArrayList nodes;
    @Getter
    @Accessors(fluent = true)
    private final float totalCost;
    @Getter
    @Accessors(fluent = true)
    private final boolean found;
    @Getter
    @Accessors(fluent = true)
    private final AStarStats stats;
    private boolean released;

    private PathResult(IntArrayList nodes, float totalCost, boolean found, AStarStats stats) {
        this.nodes = nodes;
        this.totalCost = totalCost;
        this.found = found;
        this.stats = stats;
    }

    static PathResult found(IntArrayList nodes, float totalCost, AStarStats stats) {
        return new PathResult(nodes, totalCost, true, stats);
    }

    static PathResult notFound(AStarStats stats) {
        return new PathResult(null, 0.0f, false, stats);
    }

    /**
     * Number of nodes in the path, {@code 0} when not found or released.
     */
    public int length() {
        return nodes == null ? 0 : nodes.size();
    }

    /**
     * Copy of the path node ids from start to goal.
     *
     * @return path ids, empty when not found.
     * @throws IllegalStateException if the result was already released.
     */
    public int[] path() {
        ensureNotReleased();
        return nodes == null ? new int[0] : nodes.toIntArray();
    }

    /**
     * Node id at one path position.
     *
     * @throws IllegalStateException if the result was already released.
     * @throws IndexOutOfBoundsException if the index is outside the path.
     */
    public int nodeAt(int index) {
        ensureNotReleased();
        if (nodes == null || index < 0 || index >= nodes.size()) {
            throw new IndexOutOfBoundsException("path index " + index + " out of bounds [0, " + length() + ")");
        }
        return nodes.getInt(index);
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Releases the path storage. Safe to call more than once.
     */
    @Override
    public void close() {
        nodes = null;
        released = true;
    }

    private void ensureNotReleased() {
        if (released) {
            throw new IllegalStateException("path result already released");
        }
    }

    @Override
    public String toString() {
        return "PathResult{" +
                "found=" + found +
                ", totalCost=" + totalCost +
                ", path=" + (released ? "<released>" : String.valueOf(nodes)) +
                ", stats=" + stats +
                '}';
    }
}
