package org.routecraft.routing.core;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.routecraft.routing.heuristic.HeuristicType;

import java.util.Locale;
import java.util.Objects;

/**
 * A* search configuration.
 */
@Value
@Accessors(fluent = true)
public class AStarConfig {
    private static final String PROP_HEURISTIC = "routecraft.astar.heuristic";
    private static final String PROP_HEURISTIC_WEIGHT = "routecraft.astar.heuristicWeight";

    /** Heuristic metric used to order the open set. */
    HeuristicType heuristic;
    /** Multiplier on the heuristic; {@code 1.0} is standard A*, larger values are greedier. */
    double heuristicWeight;
    /** Reserved for grid maps; graph search ignores it. */
    boolean allowDiagonal;

    @Builder
    private AStarConfig(HeuristicType heuristic, double heuristicWeight, boolean allowDiagonal) {
        this.heuristic = Objects.requireNonNull(heuristic, "heuristic");
        if (!Double.isFinite(heuristicWeight) || heuristicWeight < 0.0d) {
            throw new IllegalArgumentException("heuristicWeight must be finite and >= 0, got " + heuristicWeight);
        }
        this.heuristicWeight = heuristicWeight;
        this.allowDiagonal = allowDiagonal;
    }

    /**
     * Returns a builder pre-filled with Euclidean, weight 1.0, diagonal movement on.
     */
    public static AStarConfigBuilder builder() {
        return new AStarConfigBuilder()
                .heuristic(HeuristicType.EUCLIDEAN)
                .heuristicWeight(1.0d)
                .allowDiagonal(true);
    }

    /**
     * Standard optimal A* with the Euclidean heuristic.
     */
    public static AStarConfig standard() {
        return builder().build();
    }

    /**
     * Loads the configuration from system properties, falling back to {@link #standard()} values.
     */
    public static AStarConfig defaults() {
        return builder()
                .heuristic(readHeuristic(System.getProperty(PROP_HEURISTIC)))
                .heuristicWeight(readWeight(System.getProperty(PROP_HEURISTIC_WEIGHT)))
                .build();
    }

    private static HeuristicType readHeuristic(String raw) {
        if (raw == null || raw.isBlank()) {
            return HeuristicType.EUCLIDEAN;
        }
        try {
            return HeuristicType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return HeuristicType.EUCLIDEAN;
        }
    }

    private static double readWeight(String raw) {
        if (raw == null || raw.isBlank()) {
            return 1.0d;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) && value >= 0.0d ? value : 1.0d;
        } catch (NumberFormatException ex) {
            return 1.0d;
        }
    }
}
