package org.routecraft.routing.core;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.routecraft.routing.heuristic.HeuristicType;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("A* Configuration Tests")
class AStarConfigTest {
    private static final String PROP_HEURISTIC = "routecraft.astar.heuristic";
    private static final String PROP_WEIGHT = "routecraft.astar.heuristicWeight";

    @AfterEach
    void clearProperties() {
        System.clearProperty(PROP_HEURISTIC);
        System.clearProperty(PROP_WEIGHT);
    }

    @Test
    @DisplayName("Standard configuration is Euclidean at weight 1.0 with diagonals")
    void testStandard() {
        AStarConfig config = AStarConfig.standard();
        assertEquals(HeuristicType.EUCLIDEAN, config.heuristic());
        assertEquals(1.0d, config.heuristicWeight());
        assertTrue(config.allowDiagonal());
        assertEquals(config, AStarConfig.builder().build());
    }

    @Test
    @DisplayName("System properties override the defaults")
    void testSystemProperties() {
        System.setProperty(PROP_HEURISTIC, " chebyshev ");
        System.setProperty(PROP_WEIGHT, "1.5");
        AStarConfig config = AStarConfig.defaults();
        assertEquals(HeuristicType.CHEBYSHEV, config.heuristic());
        assertEquals(1.5d, config.heuristicWeight());
    }

    @Test
    @DisplayName("Unparseable properties fall back to the defaults")
    void testBadProperties() {
        System.setProperty(PROP_HEURISTIC, "octile");
        System.setProperty(PROP_WEIGHT, "-2");
        AStarConfig config = AStarConfig.defaults();
        assertEquals(HeuristicType.EUCLIDEAN, config.heuristic());
        assertEquals(1.0d, config.heuristicWeight());

        System.setProperty(PROP_WEIGHT, "heavy");
        assertEquals(1.0d, AStarConfig.defaults().heuristicWeight());
    }

    @Test
    @DisplayName("Builder validates its inputs")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> AStarConfig.builder().heuristicWeight(-0.1d).build());
        assertThrows(IllegalArgumentException.class,
                () -> AStarConfig.builder().heuristicWeight(Double.POSITIVE_INFINITY).build());
        assertThrows(NullPointerException.class, () -> AStarConfig.builder().heuristic(null).build());
        assertEquals(0.0d, AStarConfig.builder().heuristicWeight(0.0d).build().heuristicWeight());
    }
}
