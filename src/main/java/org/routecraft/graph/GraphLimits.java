package org.routecraft.graph;

import lombok.Builder;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Fixed capacity bounds for one {@link MapGraph}.
 *
 * <p>{@code maxNodes} also sizes the edge-count table of the binary map format,
 * so two graphs can only exchange files when their node capacities agree.</p>
 */
@Value
@Accessors(fluent = true)
public class GraphLimits {
    public static final int DEFAULT_MAX_NODES = 1000;
    public static final int DEFAULT_MAX_EDGES_PER_NODE = 20;
    public static final int DEFAULT_MAX_NAME_BYTES = 128;

    private static final String PROP_MAX_NODES = "routecraft.graph.maxNodes";
    private static final String PROP_MAX_EDGES_PER_NODE = "routecraft.graph.maxEdgesPerNode";

    /** Maximum number of node slots, active or not. */
    int maxNodes;
    /** Maximum number of adjacency slots per source node, active or not. */
    int maxEdgesPerNode;
    /** Width of the fixed name field, including its terminating zero byte. */
    int maxNameBytes;

    @Builder
    private GraphLimits(int maxNodes, int maxEdgesPerNode, int maxNameBytes) {
        if (maxNodes <= 0) {
            throw new IllegalArgumentException("maxNodes must be > 0, got " + maxNodes);
        }
        if (maxEdgesPerNode <= 0) {
            throw new IllegalArgumentException("maxEdgesPerNode must be > 0, got " + maxEdgesPerNode);
        }
        if (maxNameBytes < 2) {
            throw new IllegalArgumentException("maxNameBytes must be >= 2, got " + maxNameBytes);
        }
        this.maxNodes = maxNodes;
        this.maxEdgesPerNode = maxEdgesPerNode;
        this.maxNameBytes = maxNameBytes;
    }

    /**
     * Returns a builder pre-filled with the built-in defaults.
     */
    public static GraphLimitsBuilder builder() {
        return new GraphLimitsBuilder()
                .maxNodes(DEFAULT_MAX_NODES)
                .maxEdgesPerNode(DEFAULT_MAX_EDGES_PER_NODE)
                .maxNameBytes(DEFAULT_MAX_NAME_BYTES);
    }

    /**
     * Loads limits from system properties, falling back to the built-in defaults.
     */
    public static GraphLimits defaults() {
        return GraphLimits.builder()
                .maxNodes(readBound(PROP_MAX_NODES, DEFAULT_MAX_NODES))
                .maxEdgesPerNode(readBound(PROP_MAX_EDGES_PER_NODE, DEFAULT_MAX_EDGES_PER_NODE))
                .build();
    }

    private static int readBound(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            return value > 0 ? value : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
