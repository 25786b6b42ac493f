package org.routecraft.routing.heuristic;

import lombok.experimental.UtilityClass;
import org.routecraft.graph.MapGraph;
import org.routecraft.graph.MapNode;

import java.util.Objects;

/**
 * Heuristic evaluator over planar node coordinates.
 *
 * <p>The estimate is scaled by a non-negative weight. A weight of {@code 1.0} keeps an
 * admissible metric admissible, so A* stays optimal. Weights above {@code 1.0} make the search
 * greedier: fewer nodes explored, but the result may no longer be the cheapest path.</p>
 */
@UtilityClass
public final class PlanarHeuristic {
    private static final GoalBoundHeuristic ZERO_HEURISTIC = GoalBoundHeuristic.none();

    /**
     * Unweighted estimate between two positions.
     */
    public static double estimate(double ax, double ay, double bx, double by, HeuristicType type) {
        Objects.requireNonNull(type, "type");
        double estimate = switch (type) {
            case EUCLIDEAN -> GeometryDistance.euclideanDistance(ax, ay, bx, by);
            case MANHATTAN -> GeometryDistance.manhattanDistance(ax, ay, bx, by);
            case CHEBYSHEV -> GeometryDistance.chebyshevDistance(ax, ay, bx, by);
            case ZERO -> 0.0d;
        };
        if (!Double.isFinite(estimate)) {
            // Overflowing coordinates must not poison the queue ordering.
            return 0.0d;
        }
        return estimate;
    }

    /**
     * Unweighted estimate between two nodes. Either node being {@code null} yields zero.
     */
    public static double estimate(MapNode a, MapNode b, HeuristicType type) {
        if (a == null || b == null) {
            return 0.0d;
        }
        return estimate(a.x(), a.y(), b.x(), b.y(), type);
    }

    /**
     * Binds a weighted estimator to one goal node.
     *
     * @param graph graph providing coordinates.
     * @param goalNodeId goal node id; must be an active node.
     * @param type metric.
     * @param weight non-negative finite multiplier.
     * @return estimator returning {@code weight * metric(node, goal)}.
     * @throws IllegalArgumentException when the goal is not active or the weight is invalid.
     */
    public static GoalBoundHeuristic bindGoal(MapGraph graph, int goalNodeId, HeuristicType type, double weight) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(type, "type");
        if (!Double.isFinite(weight) || weight < 0.0d) {
            throw new IllegalArgumentException("heuristic weight must be finite and >= 0, got " + weight);
        }
        MapNode goal = graph.node(goalNodeId);
        if (goal == null) {
            throw new IllegalArgumentException("goalNodeId is not an active node: " + goalNodeId);
        }
        if (type == HeuristicType.ZERO || weight == 0.0d) {
            return ZERO_HEURISTIC;
        }
        double goalX = goal.x();
        double goalY = goal.y();
        return nodeId -> {
            MapNode node = graph.nodeSlot(nodeId);
            double scaled = estimate(node.x(), node.y(), goalX, goalY, type) * weight;
            return Double.isFinite(scaled) ? scaled : 0.0d;
        };
    }
}
