package org.routecraft.routing.core;

/**
 * Observational counters for one search run.
 *
 * @param nodesExplored number of open-set pops, including skipped stale entries.
 * @param nodesInOpenSet open-set size when the search stopped.
 * @param maxOpenSetSize peak open-set size during the run.
 * @param searchTimeMs wall-clock duration in milliseconds.
 */
public record AStarStats(
        int nodesExplored,
        int nodesInOpenSet,
        int maxOpenSetSize,
        double searchTimeMs
) {
    /**
     * Stats for a search that never started.
     */
    static AStarStats empty(double searchTimeMs) {
        return new AStarStats(0, 0, 0, searchTimeMs);
    }
}
