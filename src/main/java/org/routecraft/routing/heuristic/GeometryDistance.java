package org.routecraft.routing.heuristic;

import lombok.experimental.UtilityClass;

/**
 * Planar distance metrics.
 */
@UtilityClass
final class GeometryDistance {

    static double euclideanDistance(double x1, double y1, double x2, double y2) {
        return Math.hypot(x2 - x1, y2 - y1);
    }

    static double manhattanDistance(double x1, double y1, double x2, double y2) {
        return Math.abs(x2 - x1) + Math.abs(y2 - y1);
    }

    static double chebyshevDistance(double x1, double y1, double x2, double y2) {
        return Math.max(Math.abs(x2 - x1), Math.abs(y2 - y1));
    }
}
