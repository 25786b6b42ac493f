package org.routecraft.routing.core;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.routecraft.graph.MapGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Name-based routing entry point.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Resolve origin and destination with {@link MapGraph#findNodeByName(String)}.</li>
 * <li>Record the exploration trace with the same configuration as the search.</li>
 * <li>Run the search and wrap both into a {@link RouteOutcome}.</li>
 * </ul>
 */
public final class RouteCraftService {
    private static final Logger log = LoggerFactory.getLogger(RouteCraftService.class);

    @Getter
    @Accessors(fluent = true)
    private final MapGraph graph;
    @Getter
    @Accessors(fluent = true)
    private final AStarConfig config;
    private final AStarPlanner planner;

    /**
     * @param graph graph to route on.
     * @param config search configuration; system-property defaults when {@code null}.
     * @param planner planner override; a new {@link AStarPlanner} when {@code null}.
     */
    @Builder
    public RouteCraftService(MapGraph graph, AStarConfig config, AStarPlanner planner) {
        this.graph = Objects.requireNonNull(graph, "graph");
        this.config = config == null ? AStarConfig.defaults() : config;
        this.planner = planner == null ? new AStarPlanner() : planner;
    }

    /**
     * Routes between two locations given by name.
     *
     * @param fromName origin name or name fragment.
     * @param toName destination name or name fragment.
     * @return outcome; close it to release the contained path.
     */
    public RouteOutcome route(String fromName, String toName) {
        if (fromName == null || fromName.isBlank() || toName == null || toName.isBlank()) {
            return RouteOutcome.builder().status(RouteStatus.MISSING_INPUT).build();
        }
        int fromId = graph.findNodeByName(fromName);
        if (fromId == MapGraph.NO_NODE) {
            log.debug("origin '{}' not found", fromName);
            return RouteOutcome.builder().status(RouteStatus.ORIGIN_NOT_FOUND).build();
        }
        int toId = graph.findNodeByName(toName);
        if (toId == MapGraph.NO_NODE) {
            log.debug("destination '{}' not found", toName);
            return RouteOutcome.builder()
                    .status(RouteStatus.DESTINATION_NOT_FOUND)
                    .originId(fromId)
                    .build();
        }

        int[] explored = planner.explorationOrder(graph, fromId, toId, graph.limits().maxNodes(), config);
        PathResult path = planner.findPath(graph, fromId, toId, config);
        return RouteOutcome.builder()
                .status(path.found() ? RouteStatus.FOUND : RouteStatus.NO_ROUTE)
                .originId(fromId)
                .destinationId(toId)
                .path(path)
                .explored(explored)
                .build();
    }
}
