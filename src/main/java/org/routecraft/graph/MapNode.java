package org.routecraft.graph;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One named location on the planar map.
 *
 * <p>The id equals the slot index the node was created in and is never reused.
 * Removal only clears the {@code active} flag.</p>
 */
@Getter
@Accessors(fluent = true)
public final class MapNode {
    private final int id;
    private final String name;
    private final float x;
    private final float y;
    private boolean active;

    MapNode(int id, String name, float x, float y, boolean active) {
        this.id = id;
        this.name = name;
        this.x = x;
        this.y = y;
        this.active = active;
    }

    void deactivate() {
        this.active = false;
    }

    @Override
    public String toString() {
        return "MapNode{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", x=" + x +
                ", y=" + y +
                ", active=" + active +
                '}';
    }
}
