package org.routecraft.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.routecraft.graph.MapEdge;
import org.routecraft.graph.MapGraph;
import org.routecraft.routing.heuristic.GoalBoundHeuristic;
import org.routecraft.routing.heuristic.HeuristicType;
import org.routecraft.routing.heuristic.PlanarHeuristic;
import org.routecraft.routing.search.OpenSetQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Node-based A* shortest-path planner over a {@link MapGraph}.
 *
 * <p>Per-run working storage ({@code g}, {@code f}, predecessor, open/closed membership and the
 * open-set heap) is allocated fresh for every call and dropped before it returns. Priority is
 * {@code g + weight * h}; with {@code weight = 1.0} and an admissible metric the first time the
 * goal is popped its cost is optimal.</p>
 *
 * <p>Failures never throw: an inactive or out-of-range start/goal, exhausted working storage, or
 * an unreachable goal all yield a not-found {@link PathResult}. Null arguments are programming
 * errors and fail fast.</p>
 *
 * <p>The graph must not be mutated while a call is running.</p>
 */
public final class AStarPlanner {
    private static final Logger log = LoggerFactory.getLogger(AStarPlanner.class);

    public static final String REASON_INVALID_REFERENCE = "ASTAR_INVALID_REFERENCE";
    public static final String REASON_ALLOCATION_FAILURE = "ASTAR_ALLOCATION_FAILURE";
    public static final String REASON_QUEUE_FULL = "ASTAR_QUEUE_FULL";
    public static final String REASON_NOT_FOUND = "ASTAR_NOT_FOUND";

    /** Configuration used by the exploration trace when none is given. */
    public static final AStarConfig EXPLORATION_CONFIG = AStarConfig.builder()
            .heuristic(HeuristicType.EUCLIDEAN)
            .heuristicWeight(1.0d)
            .build();

    private static final float INF = Float.POSITIVE_INFINITY;

    /**
     * Finds the cheapest path with the standard configuration.
     */
    public PathResult findPath(MapGraph graph, int startId, int goalId) {
        return findPath(graph, startId, goalId, AStarConfig.standard());
    }

    /**
     * Finds a path from {@code startId} to {@code goalId}.
     *
     * @param graph graph to search; read-only for the duration of the call.
     * @param startId start node id.
     * @param goalId goal node id.
     * @param config heuristic selection and weight.
     * @return owned result; close it when done.
     */
    public PathResult findPath(MapGraph graph, int startId, int goalId, AStarConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        SearchRun run = search(graph, startId, goalId, config, null, 0);
        if (run.path() == null) {
            return PathResult.notFound(run.stats());
        }
        return PathResult.found(run.path(), run.goalCost(), run.stats());
    }

    /**
     * Records the order in which nodes are finalized, using the Euclidean heuristic at weight 1.0.
     *
     * <p>This trace is advisory. When a search runs with a different heuristic or weight its
     * visitation order can differ from this trace; use
     * {@link #explorationOrder(MapGraph, int, int, int, AStarConfig)} with the same configuration
     * to get a matching trace.</p>
     *
     * @param maxNodes cap on recorded ids; the run stops once it is reached.
     * @return node ids in closing order, ending with the goal when it was reached within the cap.
     */
    public int[] explorationOrder(MapGraph graph, int startId, int goalId, int maxNodes) {
        return explorationOrder(graph, startId, goalId, maxNodes, EXPLORATION_CONFIG);
    }

    /**
     * Records the order in which nodes are finalized by a search with {@code config}.
     *
     * @param maxNodes cap on recorded ids; the run stops once it is reached.
     * @return node ids in closing order; empty for invalid ids or a non-positive cap.
     */
    public int[] explorationOrder(MapGraph graph, int startId, int goalId, int maxNodes, AStarConfig config) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(config, "config");
        if (maxNodes <= 0) {
            return new int[0];
        }
        IntArrayList trace = new IntArrayList(Math.min(maxNodes, Math.max(graph.nodeCount(), 1)));
        search(graph, startId, goalId, config, trace, maxNodes);
        return trace.toIntArray();
    }

    /**
     * Shared search loop.
     *
     * @param trace receives closed node ids when non-null; path reconstruction is skipped then.
     * @param traceCap stop once {@code trace} holds this many ids.
     */
    private SearchRun search(
            MapGraph graph,
            int startId,
            int goalId,
            AStarConfig config,
            IntArrayList trace,
            int traceCap
    ) {
        long startNanos = System.nanoTime();
        if (!graph.isActiveNode(startId) || !graph.isActiveNode(goalId)) {
            log.debug("[{}] search {}->{} rejected", REASON_INVALID_REFERENCE, startId, goalId);
            return SearchRun.notFound(AStarStats.empty(elapsedMs(startNanos)));
        }

        int nodeCount = graph.nodeCount();
        Workspace ws = Workspace.allocate(nodeCount);
        if (ws == null) {
            log.warn("[{}] search {}->{} could not allocate working storage for {} nodes",
                    REASON_ALLOCATION_FAILURE, startId, goalId, nodeCount);
            return SearchRun.notFound(AStarStats.empty(elapsedMs(startNanos)));
        }

        GoalBoundHeuristic heuristic = PlanarHeuristic.bindGoal(
                graph,
                goalId,
                config.heuristic(),
                config.heuristicWeight()
        );

        ws.gScore[startId] = 0.0f;
        ws.fScore[startId] = (float) heuristic.estimateFromNode(startId);
        ws.openSet.push(startId, ws.fScore[startId]);
        ws.inOpenSet.set(startId);

        int explored = 0;
        IntArrayList path = null;

        while (!ws.openSet.isEmpty()) {
            int current = ws.openSet.pop();
            ws.inOpenSet.clear(current);
            explored++;

            // Stale duplicate of an already finalized node.
            if (ws.inClosedSet.get(current)) {
                continue;
            }
            ws.inClosedSet.set(current);

            if (trace != null) {
                trace.add(current);
                if (trace.size() >= traceCap) {
                    break;
                }
            }

            if (current == goalId) {
                if (trace == null) {
                    path = PathReconstructor.reconstruct(ws.cameFrom, startId, goalId, nodeCount);
                }
                break;
            }

            relaxOutgoing(graph, heuristic, ws, current);
        }

        AStarStats stats = new AStarStats(
                explored,
                ws.openSet.size(),
                ws.openSet.peakSize(),
                elapsedMs(startNanos)
        );
        if (path == null) {
            if (trace == null) {
                log.debug("[{}] search {}->{} exhausted after {} pops", REASON_NOT_FOUND, startId, goalId, explored);
            }
            return SearchRun.notFound(stats);
        }
        log.debug("search {}->{} found {} nodes, cost {}, {}", startId, goalId, path.size(), ws.gScore[goalId], stats);
        return new SearchRun(path, ws.gScore[goalId], stats);
    }

    /**
     * Relaxes every active edge from {@code current} to an active, not yet closed neighbor.
     */
    private static void relaxOutgoing(MapGraph graph, GoalBoundHeuristic heuristic, Workspace ws, int current) {
        List<MapEdge> slots = graph.edgeSlots(current);
        float currentG = ws.gScore[current];
        for (int i = 0; i < slots.size(); i++) {
            MapEdge edge = slots.get(i);
            if (!edge.active()) {
                continue;
            }
            int neighbor = edge.to();
            if (!graph.isActiveNode(neighbor) || ws.inClosedSet.get(neighbor)) {
                continue;
            }

            float tentativeG = currentG + edge.weight();
            if (!(tentativeG < ws.gScore[neighbor])) {
                continue;
            }
            ws.cameFrom[neighbor] = current;
            ws.gScore[neighbor] = tentativeG;
            ws.fScore[neighbor] = (float) (tentativeG + heuristic.estimateFromNode(neighbor));

            if (!ws.inOpenSet.get(neighbor)) {
                if (ws.openSet.push(neighbor, ws.fScore[neighbor])) {
                    ws.inOpenSet.set(neighbor);
                } else {
                    log.warn("[{}] frontier full, skipping node {}", REASON_QUEUE_FULL, neighbor);
                }
            } else {
                ws.openSet.decreaseOrInsert(neighbor, ws.fScore[neighbor]);
            }
        }
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0d;
    }

    /**
     * Outcome of one loop run before it is wrapped for the caller.
     */
    private record SearchRun(IntArrayList path, float goalCost, AStarStats stats) {
        static SearchRun notFound(AStarStats stats) {
            return new SearchRun(null, 0.0f, stats);
        }
    }

    /**
     * Working storage owned by exactly one search call.
     */
    private static final class Workspace {
        final float[] gScore;
        final float[] fScore;
        final int[] cameFrom;
        final BitSet inOpenSet;
        final BitSet inClosedSet;
        final OpenSetQueue openSet;

        private Workspace(int nodeCount) {
            this.gScore = new float[nodeCount];
            this.fScore = new float[nodeCount];
            this.cameFrom = new int[nodeCount];
            this.inOpenSet = new BitSet(nodeCount);
            this.inClosedSet = new BitSet(nodeCount);
            this.openSet = new OpenSetQueue(nodeCount - 1, nodeCount);
            Arrays.fill(gScore, INF);
            Arrays.fill(fScore, INF);
            Arrays.fill(cameFrom, PathReconstructor.NO_PREDECESSOR);
        }

        /**
         * @return fresh storage, or {@code null} when the heap cannot hold it.
         */
        static Workspace allocate(int nodeCount) {
            try {
                return new Workspace(nodeCount);
            } catch (OutOfMemoryError err) {
                return null;
            }
        }
    }
}
