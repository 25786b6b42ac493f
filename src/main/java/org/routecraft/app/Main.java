package org.routecraft.app;

import org.routecraft.graph.MapGraph;
import org.routecraft.graph.MapNode;
import org.routecraft.graph.SampleMaps;
import org.routecraft.routing.core.AStarConfig;
import org.routecraft.routing.core.PathResult;
import org.routecraft.routing.core.RouteCraftService;
import org.routecraft.routing.core.RouteOutcome;
import org.routecraft.routing.heuristic.HeuristicType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line route finder.
 *
 * <pre>
 * routecraft [--map FILE] [--save] [--heuristic TYPE] [--weight W] FROM TO
 * </pre>
 *
 * <p>Loads the map file (default {@code map.rcg}); when it cannot be loaded the built-in city
 * map is used instead. Exit status: 0 route found, 1 no route, 2 usage or lookup error.</p>
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String DEFAULT_MAP_FILE = "map.rcg";
    static final int EXIT_FOUND = 0;
    static final int EXIT_NO_ROUTE = 1;
    static final int EXIT_USAGE = 2;

    /**
     * Launches the route finder.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != EXIT_FOUND) {
            System.exit(status);
        }
    }

    /**
     * Runs the route finder against an output stream.
     *
     * @return process exit status.
     */
    static int run(String[] args, PrintStream out) {
        Path mapFile = Path.of(DEFAULT_MAP_FILE);
        boolean save = false;
        AStarConfig.AStarConfigBuilder config = AStarConfig.builder();
        List<String> positional = new ArrayList<>();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            try {
                switch (arg) {
                    case "--map" -> mapFile = Path.of(requireValue(args, ++i, arg));
                    case "--save" -> save = true;
                    case "--heuristic" -> config.heuristic(
                            HeuristicType.valueOf(requireValue(args, ++i, arg).toUpperCase(Locale.ROOT)));
                    case "--weight" -> config.heuristicWeight(Double.parseDouble(requireValue(args, ++i, arg)));
                    default -> positional.add(arg);
                }
            } catch (IllegalArgumentException ex) {
                out.println("Invalid argument " + arg + ": " + ex.getMessage());
                printUsage(out);
                return EXIT_USAGE;
            }
        }
        if (positional.size() != 2) {
            printUsage(out);
            return EXIT_USAGE;
        }

        AStarConfig searchConfig;
        try {
            searchConfig = config.build();
        } catch (IllegalArgumentException ex) {
            out.println("Invalid configuration: " + ex.getMessage());
            return EXIT_USAGE;
        }

        MapGraph graph = new MapGraph();
        if (!graph.load(mapFile)) {
            log.info("Map file {} unavailable, using built-in city map", mapFile);
            SampleMaps.city(graph);
        }

        RouteCraftService service = RouteCraftService.builder()
                .graph(graph)
                .config(searchConfig)
                .build();

        int status;
        try (RouteOutcome outcome = service.route(positional.get(0), positional.get(1))) {
            status = report(graph, outcome, out);
        }

        if (save && !graph.save(mapFile)) {
            out.println("Could not save map to " + mapFile);
        }
        return status;
    }

    private static int report(MapGraph graph, RouteOutcome outcome, PrintStream out) {
        switch (outcome.status()) {
            case ORIGIN_NOT_FOUND -> {
                out.println("Origin location not found");
                return EXIT_USAGE;
            }
            case DESTINATION_NOT_FOUND -> {
                out.println("Destination location not found");
                return EXIT_USAGE;
            }
            case MISSING_INPUT -> {
                out.println("Please enter both From and To locations");
                return EXIT_USAGE;
            }
            case NO_ROUTE -> {
                out.println("No route found between these locations");
                return EXIT_NO_ROUTE;
            }
            default -> {
                PathResult path = outcome.path();
                StringBuilder line = new StringBuilder();
                for (int nodeId : path.path()) {
                    MapNode node = graph.nodeSlot(nodeId);
                    if (line.length() > 0) {
                        line.append(" -> ");
                    }
                    line.append(node.name());
                }
                out.println(line);
                out.printf(Locale.ROOT, "Route found! Distance: %.1f, Nodes explored: %d%n",
                        path.totalCost(), path.stats().nodesExplored());
                log.info("route {} -> {}: cost {}, {} explored", outcome.originId(), outcome.destinationId(),
                        path.totalCost(), outcome.explored().length);
                return EXIT_FOUND;
            }
        }
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: routecraft [--map FILE] [--save] [--heuristic EUCLIDEAN|MANHATTAN|CHEBYSHEV|ZERO] "
                + "[--weight W] FROM TO");
    }
}
