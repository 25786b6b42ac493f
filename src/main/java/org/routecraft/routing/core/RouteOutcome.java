package org.routecraft.routing.core;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;
import org.routecraft.graph.MapGraph;

/**
 * Result of {@link RouteCraftService#route(String, String)}.
 *
 * <p>When {@code status} is {@code FOUND} or {@code NO_ROUTE}, {@code path} holds the owned
 * search result; closing the outcome releases it.</p>
 */
@Value
@Builder
@Accessors(fluent = true)
public class RouteOutcome implements AutoCloseable {
    /** Outcome category. */
    RouteStatus status;
    /** Resolved origin id, or {@link MapGraph#NO_NODE}. */
    @Builder.Default
    int originId = MapGraph.NO_NODE;
    /** Resolved destination id, or {@link MapGraph#NO_NODE}. */
    @Builder.Default
    int destinationId = MapGraph.NO_NODE;
    /** Search result; {@code null} when no search ran. */
    PathResult path;
    /** Nodes in the order the search finalized them. */
    @Builder.Default
    int[] explored = new int[0];

    /**
     * @return a copy of the trace; changing it does not affect this outcome.
     */
    public int[] explored() {
        return explored.clone();
    }

    public boolean found() {
        return status == RouteStatus.FOUND;
    }

    @Override
    public void close() {
        if (path != null) {
            path.close();
        }
    }
}
