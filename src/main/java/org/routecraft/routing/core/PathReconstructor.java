package org.routecraft.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Walks predecessor links from goal back to start.
 */
final class PathReconstructor {
    static final int NO_PREDECESSOR = -1;

    private PathReconstructor() {
    }

    /**
     * Materializes the start-to-goal path.
     *
     * <p>The walk is bounded by {@code nodeCount} steps, so a cyclic or broken predecessor
     * chain ends in {@code null} instead of looping.</p>
     *
     * @param cameFrom predecessor per node id, {@link #NO_PREDECESSOR} when unset.
     * @param startId start node id.
     * @param goalId goal node id.
     * @param nodeCount number of node slots in the graph.
     * @return path from start to goal inclusive, or {@code null} when the chain does not reach start.
     */
    static IntArrayList reconstruct(int[] cameFrom, int startId, int goalId, int nodeCount) {
        IntArrayList reversed = new IntArrayList();
        int current = goalId;
        for (int steps = 0; steps < nodeCount; steps++) {
            reversed.add(current);
            if (current == startId) {
                IntArrayList path = new IntArrayList(reversed.size());
                for (int i = reversed.size() - 1; i >= 0; i--) {
                    path.add(reversed.getInt(i));
                }
                return path;
            }
            current = cameFrom[current];
            if (current == NO_PREDECESSOR) {
                return null;
            }
        }
        return null;
    }
}
