package org.routecraft.routing.heuristic;

/**
 * Remaining-cost estimate toward one fixed goal, keyed by node id.
 *
 * <p>Called once per relaxed edge, so implementations read coordinates directly and do not allocate.</p>
 */
@FunctionalInterface
public interface GoalBoundHeuristic {

    /**
     * @param nodeId active node id.
     * @return weighted estimate, never negative or non-finite.
     */
    double estimateFromNode(int nodeId);

    /**
     * Estimator that gives no guidance; A* then settles nodes in Dijkstra order.
     */
    static GoalBoundHeuristic none() {
        return nodeId -> 0.0d;
    }
}
