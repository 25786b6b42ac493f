package org.routecraft.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.routecraft.graph.GraphLimits;
import org.routecraft.graph.MapGraph;
import org.routecraft.routing.heuristic.HeuristicType;
import org.routecraft.testutil.GraphFixtures;
import org.routecraft.testutil.GraphFixtures.Triangle;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("A* Planner Tests")
class AStarPlannerTest {
    private final AStarPlanner planner = new AStarPlanner();

    @Nested
    @DisplayName("1. Triangle Scenarios")
    class TriangleTests {

        @Test
        @DisplayName("Two cheap hops beat one expensive edge")
        void testPrefersCheaperDetour() {
            Triangle t = GraphFixtures.triangle();
            try (PathResult result = planner.findPath(t.graph(), t.a(), t.c())) {
                assertTrue(result.found());
                assertArrayEquals(new int[]{t.a(), t.b(), t.c()}, result.path());
                assertEquals(20.0f, result.totalCost(), 1e-4f);
                assertEquals(3, result.length());
                assertEquals(t.b(), result.nodeAt(1));
            }
        }

        @Test
        @DisplayName("Removing A->B forces the direct edge")
        void testFallsBackAfterEdgeRemoval() {
            Triangle t = GraphFixtures.triangle();
            assertTrue(t.graph().removeEdge(t.a(), t.b()));
            try (PathResult result = planner.findPath(t.graph(), t.a(), t.c())) {
                assertTrue(result.found());
                assertArrayEquals(new int[]{t.a(), t.c()}, result.path());
                assertEquals(30.0f, result.totalCost(), 1e-4f);
            }
        }

        @Test
        @DisplayName("Removing the intermediate node forces the direct edge")
        void testRoutesAroundRemovedNode() {
            Triangle t = GraphFixtures.triangle();
            assertTrue(t.graph().removeNode(t.b()));
            try (PathResult result = planner.findPath(t.graph(), t.a(), t.c())) {
                assertArrayEquals(new int[]{t.a(), t.c()}, result.path());
            }
        }

        @Test
        @DisplayName("Isolated goal yields an empty not-found result")
        void testUnreachable() {
            Triangle t = GraphFixtures.triangle();
            int d = t.graph().addNode("D", 50, 50);
            try (PathResult result = planner.findPath(t.graph(), t.a(), d)) {
                assertFalse(result.found());
                assertEquals(0, result.length());
                assertEquals(0, result.path().length);
                assertEquals(0.0f, result.totalCost());
                assertEquals(3, result.stats().nodesExplored());
                assertEquals(0, result.stats().nodesInOpenSet());
            }
        }

        @Test
        @DisplayName("Edges are directed: no path back from C")
        void testDirectedEdges() {
            Triangle t = GraphFixtures.triangle();
            try (PathResult result = planner.findPath(t.graph(), t.c(), t.a())) {
                assertFalse(result.found());
            }
        }

        @Test
        @DisplayName("Start equal to goal is a one-node path of cost zero")
        void testStartIsGoal() {
            Triangle t = GraphFixtures.triangle();
            try (PathResult result = planner.findPath(t.graph(), t.b(), t.b())) {
                assertTrue(result.found());
                assertArrayEquals(new int[]{t.b()}, result.path());
                assertEquals(0.0f, result.totalCost());
                assertEquals(1, result.stats().nodesExplored());
            }
        }

        @Test
        @DisplayName("Invalid or inactive endpoints yield not-found")
        void testInvalidEndpoints() {
            Triangle t = GraphFixtures.triangle();
            assertFalse(planner.findPath(t.graph(), -1, t.c()).found());
            assertFalse(planner.findPath(t.graph(), t.a(), 99).found());
            t.graph().removeNode(t.c());
            PathResult result = planner.findPath(t.graph(), t.a(), t.c());
            assertFalse(result.found());
            assertEquals(0, result.stats().nodesExplored());
        }

        @Test
        @DisplayName("Stats are consistent with the search")
        void testStats() {
            Triangle t = GraphFixtures.triangle();
            try (PathResult result = planner.findPath(t.graph(), t.a(), t.c())) {
                AStarStats stats = result.stats();
                assertTrue(stats.nodesExplored() >= 3);
                assertTrue(stats.maxOpenSetSize() >= 2);
                assertTrue(stats.maxOpenSetSize() >= stats.nodesInOpenSet());
                assertTrue(stats.searchTimeMs() >= 0.0d);
            }
        }
    }

    @Nested
    @DisplayName("2. Result Ownership")
    class ReleaseTests {

        @Test
        @DisplayName("Released result refuses path access; close is idempotent")
        void testRelease() {
            Triangle t = GraphFixtures.triangle();
            PathResult result = planner.findPath(t.graph(), t.a(), t.c());
            assertFalse(result.isReleased());
            result.close();
            result.close();
            assertTrue(result.isReleased());
            assertEquals(0, result.length());
            assertThrows(IllegalStateException.class, result::path);
            assertThrows(IllegalStateException.class, () -> result.nodeAt(0));
            assertTrue(result.found());
            assertEquals(20.0f, result.totalCost(), 1e-4f);
        }

        @Test
        @DisplayName("Out-of-range path index")
        void testNodeAtBounds() {
            Triangle t = GraphFixtures.triangle();
            try (PathResult result = planner.findPath(t.graph(), t.a(), t.c())) {
                assertThrows(IndexOutOfBoundsException.class, () -> result.nodeAt(3));
                assertThrows(IndexOutOfBoundsException.class, () -> result.nodeAt(-1));
            }
        }
    }

    @Nested
    @DisplayName("3. Optimality Against Dijkstra")
    class OptimalityTests {

        @ParameterizedTest(name = "{0}")
        @EnumSource(value = HeuristicType.class, names = {"ZERO", "EUCLIDEAN", "CHEBYSHEV"})
        @DisplayName("Admissible metrics match Dijkstra on stretched planar graphs")
        void testMatchesDijkstra(HeuristicType type) {
            assertOptimal(type, 1.0f, 3.0f);
        }

        @Test
        @DisplayName("Manhattan matches Dijkstra when weights dominate it")
        void testManhattanMatchesDijkstra() {
            assertOptimal(HeuristicType.MANHATTAN, 1.4143f, 3.0f);
        }

        private void assertOptimal(HeuristicType type, float minStretch, float maxStretch) {
            AStarConfig config = AStarConfig.builder().heuristic(type).build();
            for (long seed = 1; seed <= 5; seed++) {
                MapGraph graph = GraphFixtures.randomPlanarGraph(seed, 120, 4, minStretch, maxStretch);
                for (int source = 0; source < graph.nodeCount(); source += 17) {
                    float[] dist = GraphFixtures.dijkstra(graph, source);
                    for (int goal = 0; goal < graph.nodeCount(); goal += 7) {
                        try (PathResult result = planner.findPath(graph, source, goal, config)) {
                            String where = type + " seed " + seed + " " + source + "->" + goal;
                            if (Float.isInfinite(dist[goal])) {
                                assertFalse(result.found(), where);
                                continue;
                            }
                            assertTrue(result.found(), where);
                            assertEquals(dist[goal], result.totalCost(), 1e-2f, where);
                            int[] path = result.path();
                            assertEquals(source, path[0], where);
                            assertEquals(goal, path[path.length - 1], where);
                            assertEquals(result.totalCost(), GraphFixtures.pathCost(graph, path), 1e-2f, where);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Greedy weight still returns a valid, possibly longer path")
        void testGreedyWeight() {
            AStarConfig greedy = AStarConfig.builder().heuristicWeight(5.0d).build();
            MapGraph graph = GraphFixtures.randomPlanarGraph(7L, 150, 4, 1.0f, 3.0f);
            float[] dist = GraphFixtures.dijkstra(graph, 0);
            for (int goal = 1; goal < graph.nodeCount(); goal += 5) {
                try (PathResult result = planner.findPath(graph, 0, goal, greedy)) {
                    assertEquals(!Float.isInfinite(dist[goal]), result.found());
                    if (result.found()) {
                        assertTrue(result.totalCost() >= dist[goal] - 1e-2f);
                        assertEquals(result.totalCost(), GraphFixtures.pathCost(graph, result.path()), 1e-2f);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("4. Exploration Order")
    class ExplorationTests {

        @Test
        @DisplayName("Trace starts at the start and ends at the goal")
        void testTriangleTrace() {
            Triangle t = GraphFixtures.triangle();
            int[] order = planner.explorationOrder(t.graph(), t.a(), t.c(), 10);
            assertArrayEquals(new int[]{t.a(), t.b(), t.c()}, order);
        }

        @Test
        @DisplayName("Trace respects the cap")
        void testCap() {
            Triangle t = GraphFixtures.triangle();
            assertArrayEquals(new int[]{t.a(), t.b()}, planner.explorationOrder(t.graph(), t.a(), t.c(), 2));
            assertEquals(0, planner.explorationOrder(t.graph(), t.a(), t.c(), 0).length);
        }

        @Test
        @DisplayName("Invalid endpoints produce an empty trace")
        void testInvalid() {
            Triangle t = GraphFixtures.triangle();
            assertEquals(0, planner.explorationOrder(t.graph(), t.a(), 42, 10).length);
            assertEquals(0, planner.explorationOrder(t.graph(), -3, t.c(), 10).length);
        }

        @Test
        @DisplayName("Unreachable goal traces every reachable node once")
        void testUnreachableTrace() {
            Triangle t = GraphFixtures.triangle();
            int d = t.graph().addNode("D", 50, 50);
            int[] order = planner.explorationOrder(t.graph(), t.a(), d, 10);
            assertEquals(3, order.length);
            assertEquals(t.a(), order[0]);
        }

        @Test
        @DisplayName("Trace with the search configuration closes as many nodes as the search")
        void testTraceMatchesSearch() {
            MapGraph graph = GraphFixtures.randomPlanarGraph(11L, 200, 4, 1.0f, 2.0f);
            AStarConfig config = AStarConfig.builder().heuristic(HeuristicType.MANHATTAN).heuristicWeight(2.0d).build();
            for (int goal = 5; goal < graph.nodeCount(); goal += 31) {
                int[] order = planner.explorationOrder(graph, 0, goal, graph.nodeCount(), config);
                try (PathResult result = planner.findPath(graph, 0, goal, config)) {
                    assertEquals(0, order[0]);
                    if (result.found()) {
                        assertEquals(goal, order[order.length - 1]);
                    } else {
                        for (int id : order) {
                            assertNotEquals(goal, id);
                        }
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("Large graph at the default node capacity")
    void testDefaultCapacityGraph() {
        GraphLimits limits = GraphLimits.builder().build();
        MapGraph graph = new MapGraph(limits);
        int side = 30;
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                graph.addNode("G" + x + "_" + y, x * 10.0f, y * 10.0f);
            }
        }
        for (int y = 0; y < side; y++) {
            for (int x = 0; x < side; x++) {
                int id = y * side + x;
                if (x + 1 < side) {
                    graph.connect(id, id + 1);
                }
                if (y + 1 < side) {
                    graph.connect(id, id + side);
                }
            }
        }
        int goal = side * side - 1;
        try (PathResult result = planner.findPath(graph, 0, goal,
                AStarConfig.builder().heuristic(HeuristicType.MANHATTAN).build())) {
            assertTrue(result.found());
            assertEquals(2 * (side - 1) * 10.0f, result.totalCost(), 1e-3f);
            assertEquals(2 * (side - 1) + 1, result.length());
        }
    }
}
