package org.routecraft.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectList;
import it.unimi.dsi.fastutil.objects.ObjectLists;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Capacity-bounded map graph with id-stable soft deletion.
 *
 * <p>Storage layout:</p>
 * <ul>
 * <li>Node slots are append-only. A node's id is its slot index and is never reused.</li>
 * <li>Each node owns a bounded adjacency list of directed edge slots.</li>
 * <li>Removal flips the {@code active} flag. Slots persist so ids stay stable and the
 * binary map format can reproduce inactive entries.</li>
 * </ul>
 *
 * <p>All queries treat inactive nodes and edges as absent. Mutations report failure through
 * return values ({@code false}, {@link #NO_NODE}, {@link #NO_EDGE_WEIGHT}) and leave the graph
 * unchanged when rejected.</p>
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. Searches assume no concurrent writer.</p>
 */
public final class MapGraph {
    private static final Logger log = LoggerFactory.getLogger(MapGraph.class);

    /** Sentinel id returned when a node could not be created or found. */
    public static final int NO_NODE = -1;
    /** Sentinel weight returned when no active edge exists. */
    public static final float NO_EDGE_WEIGHT = -1.0f;

    public static final String REASON_INVALID_REFERENCE = "GRAPH_INVALID_REFERENCE";
    public static final String REASON_CAPACITY_EXCEEDED = "GRAPH_CAPACITY_EXCEEDED";
    public static final String REASON_DUPLICATE_EDGE = "GRAPH_DUPLICATE_EDGE";
    public static final String REASON_INVALID_WEIGHT = "GRAPH_INVALID_WEIGHT";

    private static final int REPLACEMENT_CHAR = 0xFFFD;

    @Getter
    @Accessors(fluent = true)
    private final GraphLimits limits;
    private final ObjectArrayList<MapNode> nodes;
    private final ObjectArrayList<ObjectArrayList<MapEdge>> adjacency;

    /**
     * Creates an empty graph bounded by the configured default limits.
     */
    public MapGraph() {
        this(GraphLimits.defaults());
    }

    /**
     * Creates an empty graph with explicit limits.
     *
     * @param limits capacity bounds.
     */
    public MapGraph(GraphLimits limits) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.nodes = new ObjectArrayList<>();
        this.adjacency = new ObjectArrayList<>();
    }

    // ========================================================================
    // NODE OPERATIONS
    // ========================================================================

    /**
     * Number of node slots ever created, active or not.
     */
    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Number of node slots still active.
     */
    public int activeNodeCount() {
        int count = 0;
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i).active()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Appends a node in the next free slot.
     *
     * <p>Names longer than the fixed name field are truncated on a code-point boundary.</p>
     *
     * @param name display name.
     * @param x planar x coordinate.
     * @param y planar y coordinate.
     * @return the new node id, or {@link #NO_NODE} when the graph is full.
     */
    public int addNode(String name, float x, float y) {
        Objects.requireNonNull(name, "name");
        if (nodes.size() >= limits.maxNodes()) {
            log.debug("[{}] addNode '{}' rejected: {} slots used", REASON_CAPACITY_EXCEEDED, name, nodes.size());
            return NO_NODE;
        }
        int id = nodes.size();
        nodes.add(new MapNode(id, fitName(name, limits.maxNameBytes() - 1), x, y, true));
        adjacency.add(new ObjectArrayList<>(4));
        return id;
    }

    /**
     * Soft-deletes a node.
     *
     * <p>Clears the node's own adjacency slots and deactivates every active edge elsewhere
     * in the graph that points at it.</p>
     *
     * @param nodeId node to remove.
     * @return {@code true} when an active node was removed.
     */
    public boolean removeNode(int nodeId) {
        if (!isActiveNode(nodeId)) {
            log.debug("[{}] removeNode {} ignored", REASON_INVALID_REFERENCE, nodeId);
            return false;
        }
        nodes.get(nodeId).deactivate();
        adjacency.get(nodeId).clear();

        for (int i = 0; i < adjacency.size(); i++) {
            if (i == nodeId) {
                continue;
            }
            ObjectArrayList<MapEdge> slots = adjacency.get(i);
            for (int j = 0; j < slots.size(); j++) {
                MapEdge edge = slots.get(j);
                if (edge.active() && edge.to() == nodeId) {
                    edge.deactivate();
                }
            }
        }
        return true;
    }

    /**
     * Returns the active node with the given id.
     *
     * @return the node, or {@code null} when the id is out of range or inactive.
     */
    public MapNode node(int nodeId) {
        if (!isActiveNode(nodeId)) {
            return null;
        }
        return nodes.get(nodeId);
    }

    /**
     * Returns the raw slot for an id regardless of its active flag.
     *
     * @throws IndexOutOfBoundsException when {@code nodeId >= nodeCount()}.
     */
    public MapNode nodeSlot(int nodeId) {
        if (nodeId < 0 || nodeId >= nodes.size()) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + nodes.size() + ")");
        }
        return nodes.get(nodeId);
    }

    /**
     * Checks whether an id refers to an existing, active node.
     */
    public boolean isActiveNode(int nodeId) {
        return nodeId >= 0 && nodeId < nodes.size() && nodes.get(nodeId).active();
    }

    /**
     * Returns active nodes in id order.
     */
    public ObjectList<MapNode> activeNodes() {
        ObjectArrayList<MapNode> active = new ObjectArrayList<>(nodes.size());
        for (int i = 0; i < nodes.size(); i++) {
            MapNode node = nodes.get(i);
            if (node.active()) {
                active.add(node);
            }
        }
        return active;
    }

    /**
     * Finds a node by name.
     *
     * <p>First pass: exact case-insensitive match. Second pass: case-insensitive substring.
     * Both scan active nodes in id order and return the first hit.</p>
     *
     * @param name query text.
     * @return node id, or {@link #NO_NODE} when nothing matches or the query is blank.
     */
    public int findNodeByName(String name) {
        if (name == null || name.isBlank()) {
            return NO_NODE;
        }
        for (int i = 0; i < nodes.size(); i++) {
            MapNode node = nodes.get(i);
            if (node.active() && node.name().equalsIgnoreCase(name)) {
                return i;
            }
        }
        String needle = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < nodes.size(); i++) {
            MapNode node = nodes.get(i);
            if (node.active() && node.name().toLowerCase(Locale.ROOT).contains(needle)) {
                return i;
            }
        }
        return NO_NODE;
    }

    /**
     * Finds the closest active node strictly within {@code radius} of a point.
     *
     * <p>Compares squared distances. On equal distance the lower id wins.</p>
     *
     * @return node id, or {@link #NO_NODE} when no node is in range.
     */
    public int findNodeNear(float x, float y, float radius) {
        if (!(radius > 0.0f)) {
            return NO_NODE;
        }
        float closestDistSq = radius * radius;
        int closest = NO_NODE;
        for (int i = 0; i < nodes.size(); i++) {
            MapNode node = nodes.get(i);
            if (!node.active()) {
                continue;
            }
            float dx = node.x() - x;
            float dy = node.y() - y;
            float distSq = dx * dx + dy * dy;
            if (distSq < closestDistSq) {
                closestDistSq = distSq;
                closest = i;
            }
        }
        return closest;
    }

    /**
     * Straight-line distance between two active nodes.
     *
     * @return the distance, or {@link #NO_EDGE_WEIGHT} when either id is not active.
     */
    public float distance(int a, int b) {
        MapNode na = node(a);
        MapNode nb = node(b);
        if (na == null || nb == null) {
            return NO_EDGE_WEIGHT;
        }
        return (float) Math.hypot((double) nb.x() - na.x(), (double) nb.y() - na.y());
    }

    // ========================================================================
    // EDGE OPERATIONS
    // ========================================================================

    /**
     * Adds a directed edge.
     *
     * @param from source node id (must be active).
     * @param to target node id (must be active).
     * @param weight non-negative finite cost.
     * @return {@code false} when an endpoint is invalid, the weight is negative or not finite,
     * the source's adjacency slots are full, or an active edge for the pair already exists.
     */
    public boolean addEdge(int from, int to, float weight) {
        if (!isActiveNode(from) || !isActiveNode(to)) {
            log.debug("[{}] addEdge {}->{} rejected", REASON_INVALID_REFERENCE, from, to);
            return false;
        }
        if (!Float.isFinite(weight) || weight < 0.0f) {
            log.debug("[{}] addEdge {}->{} rejected: weight {}", REASON_INVALID_WEIGHT, from, to, weight);
            return false;
        }
        ObjectArrayList<MapEdge> slots = adjacency.get(from);
        if (slots.size() >= limits.maxEdgesPerNode()) {
            log.debug("[{}] addEdge {}->{} rejected: {} slots used", REASON_CAPACITY_EXCEEDED, from, to, slots.size());
            return false;
        }
        if (findActiveEdge(from, to) != null) {
            log.debug("[{}] addEdge {}->{} rejected", REASON_DUPLICATE_EDGE, from, to);
            return false;
        }
        slots.add(new MapEdge(from, to, weight, true));
        return true;
    }

    /**
     * Adds both directions as independent directed edges.
     *
     * @return {@code true} when at least one direction was created.
     */
    public boolean addBidirectionalEdge(int a, int b, float weight) {
        boolean forward = addEdge(a, b, weight);
        boolean backward = addEdge(b, a, weight);
        return forward || backward;
    }

    /**
     * Connects two active nodes in both directions, weighted by their straight-line distance.
     *
     * @return {@code true} when at least one direction was created.
     */
    public boolean connect(int a, int b) {
        float d = distance(a, b);
        if (d < 0.0f) {
            log.debug("[{}] connect {}<->{} rejected", REASON_INVALID_REFERENCE, a, b);
            return false;
        }
        return addBidirectionalEdge(a, b, d);
    }

    /**
     * Deactivates the active edge {@code from -> to}. The reverse direction is untouched.
     *
     * @return {@code true} when an active edge was found and deactivated.
     */
    public boolean removeEdge(int from, int to) {
        MapEdge edge = findActiveEdge(from, to);
        if (edge == null) {
            return false;
        }
        edge.deactivate();
        return true;
    }

    /**
     * Weight of the active edge {@code from -> to}.
     *
     * @return the weight, or {@link #NO_EDGE_WEIGHT} when there is no active edge.
     */
    public float edgeWeight(int from, int to) {
        MapEdge edge = findActiveEdge(from, to);
        return edge == null ? NO_EDGE_WEIGHT : edge.weight();
    }

    /**
     * Checks for an active edge {@code from -> to}.
     */
    public boolean hasEdge(int from, int to) {
        return findActiveEdge(from, to) != null;
    }

    /**
     * Targets of the active edges leaving {@code nodeId} that point at active nodes,
     * in adjacency-slot order.
     *
     * @return neighbor ids, empty for an invalid or inactive node.
     */
    public int[] neighbors(int nodeId) {
        if (!isActiveNode(nodeId)) {
            return new int[0];
        }
        ObjectArrayList<MapEdge> slots = adjacency.get(nodeId);
        IntArrayList result = new IntArrayList(slots.size());
        for (int i = 0; i < slots.size(); i++) {
            MapEdge edge = slots.get(i);
            if (edge.active() && nodes.get(edge.to()).active()) {
                result.add(edge.to());
            }
        }
        return result.toIntArray();
    }

    /**
     * Number of adjacency slots used by a node, active or not.
     */
    public int edgeSlotCount(int nodeId) {
        if (nodeId < 0 || nodeId >= adjacency.size()) {
            return 0;
        }
        return adjacency.get(nodeId).size();
    }

    /**
     * Read-only view of a node's adjacency slots, including inactive edges.
     *
     * <p>Callers must skip inactive edges and edges to inactive nodes themselves.</p>
     *
     * @throws IndexOutOfBoundsException when {@code nodeId >= nodeCount()}.
     */
    public ObjectList<MapEdge> edgeSlots(int nodeId) {
        if (nodeId < 0 || nodeId >= adjacency.size()) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds [0, " + adjacency.size() + ")");
        }
        return ObjectLists.unmodifiable(adjacency.get(nodeId));
    }

    private MapEdge findActiveEdge(int from, int to) {
        if (from < 0 || from >= adjacency.size()) {
            return null;
        }
        ObjectArrayList<MapEdge> slots = adjacency.get(from);
        for (int i = 0; i < slots.size(); i++) {
            MapEdge edge = slots.get(i);
            if (edge.active() && edge.to() == to) {
                return edge;
            }
        }
        return null;
    }

    // ========================================================================
    // LIFECYCLE & PERSISTENCE
    // ========================================================================

    /**
     * Drops every node and edge slot.
     */
    public void clear() {
        nodes.clear();
        adjacency.clear();
    }

    /**
     * Writes the graph to a file in the binary map format.
     *
     * @return {@code false} when the file could not be written.
     */
    public boolean save(Path file) {
        Objects.requireNonNull(file, "file");
        try (OutputStream out = Files.newOutputStream(file)) {
            GraphCodec.write(this, out);
        } catch (IOException ex) {
            log.warn("[{}] saving map to {} failed: {}", GraphCodec.REASON_IO_FAILURE, file, ex.getMessage());
            return false;
        }
        log.info("Saved map with {} nodes to {}", nodeCount(), file);
        return true;
    }

    /**
     * Replaces this graph's content with a map file.
     *
     * <p>The file is decoded completely before anything is replaced, so a failed load
     * leaves the graph untouched.</p>
     *
     * @return {@code false} when the file is missing, unreadable, or not a valid map.
     */
    public boolean load(Path file) {
        Objects.requireNonNull(file, "file");
        MapGraph decoded;
        try (InputStream in = Files.newInputStream(file)) {
            decoded = GraphCodec.read(in, limits);
        } catch (GraphFormatException ex) {
            log.warn("[{}] loading map from {} failed: {}", ex.reasonCode(), file, ex.getMessage());
            return false;
        } catch (IOException ex) {
            log.warn("[{}] loading map from {} failed: {}", GraphCodec.REASON_IO_FAILURE, file, ex.getMessage());
            return false;
        }
        replaceWith(decoded);
        log.info("Loaded map with {} nodes from {}", nodeCount(), file);
        return true;
    }

    /**
     * Restores one node slot exactly as decoded, including its active flag.
     */
    void restoreNode(String name, float x, float y, boolean active) {
        int id = nodes.size();
        nodes.add(new MapNode(id, name, x, y, active));
        adjacency.add(new ObjectArrayList<>(4));
    }

    /**
     * Restores one adjacency slot exactly as decoded, including its active flag.
     */
    void restoreEdge(int from, int to, float weight, boolean active) {
        adjacency.get(from).add(new MapEdge(from, to, weight, active));
    }

    private void replaceWith(MapGraph other) {
        nodes.clear();
        adjacency.clear();
        nodes.addAll(other.nodes);
        adjacency.addAll(other.adjacency);
    }

    /**
     * Cuts a name at the first NUL and to at most {@code maxBytes} UTF-8 bytes
     * without splitting a code point.
     *
     * <p>Unpaired surrogates become U+FFFD, so the stored name survives a UTF-8 round-trip.</p>
     */
    static String fitName(String name, int maxBytes) {
        int nul = name.indexOf('\0');
        String candidate = nul >= 0 ? name.substring(0, nul) : name;
        StringBuilder sb = new StringBuilder(candidate.length());
        int used = 0;
        int offset = 0;
        while (offset < candidate.length()) {
            int cp = candidate.codePointAt(offset);
            offset += Character.charCount(cp);
            if (Character.isBmpCodePoint(cp) && Character.isSurrogate((char) cp)) {
                cp = REPLACEMENT_CHAR;
            }
            int width = utf8Width(cp);
            if (used + width > maxBytes) {
                break;
            }
            sb.appendCodePoint(cp);
            used += width;
        }
        return sb.toString();
    }

    private static int utf8Width(int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        if (codePoint < 0x10000) {
            return 3;
        }
        return 4;
    }
}
