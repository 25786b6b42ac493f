package org.routecraft.routing.heuristic;

/**
 * Supported planar heuristic metrics.
 *
 * <p>{@code EUCLIDEAN} is the straight-line distance, {@code MANHATTAN} is {@code |dx| + |dy|},
 * {@code CHEBYSHEV} is {@code max(|dx|, |dy|)}.</p>
 * <p>{@code ZERO} disables heuristic guidance (pure Dijkstra behavior). Use it when edge weights
 * do not correlate with planar distance.</p>
 */
public enum HeuristicType {
    EUCLIDEAN,
    MANHATTAN,
    CHEBYSHEV,
    ZERO
}
