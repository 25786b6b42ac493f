package org.routecraft.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Directed weighted connection stored in its source node's adjacency slots.
 */
@Getter
@Accessors(fluent = true)
public final class MapEdge {
    private final int from;
    private final int to;
    private final float weight;
    private boolean active;

    MapEdge(int from, int to, float weight, boolean active) {
        this.from = from;
        this.to = to;
        this.weight = weight;
        this.active = active;
    }

    void deactivate() {
        this.active = false;
    }

    @Override
    public String toString() {
        return "MapEdge{" + from + "->" + to + ", w=" + weight + (active ? "" : ", inactive") + '}';
    }
}
