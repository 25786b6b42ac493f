package org.routecraft.graph;

import lombok.experimental.UtilityClass;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Binary map format ("RCGRAPH1").
 *
 * <pre>
 * bytes[8]            magic "RCGRAPH1"
 * int32               nodeCount
 * nodeCount x {
 *   int32             id
 *   bytes[nameBytes]  UTF-8 name, zero padded
 *   float32           x
 *   float32           y
 *   byte              active (0/1)
 * }
 * int32[maxNodes]     edgeCounts (always capacity sized)
 * for each node i &lt; nodeCount, edgeCounts[i] x {
 *   int32 from, int32 to, float32 weight, byte active
 * }
 * </pre>
 *
 * <p>All multi-byte values are little-endian, matching map files written on x86 hosts.
 * {@code nameBytes} and {@code maxNodes} come from the {@link GraphLimits} of the graph, so a file
 * is only readable by graphs with the same limits. Changing the layout requires a new magic value.</p>
 *
 * <p>Decoding re-checks what {@link MapGraph#addEdge(int, int, float)} guarantees: weights are
 * finite and non-negative, active edges join active nodes, and each ordered pair has at most
 * one active edge.</p>
 */
@UtilityClass
public final class GraphCodec {
    public static final String REASON_FORMAT_MISMATCH = "GRAPH_FORMAT_MISMATCH";
    public static final String REASON_TRUNCATED = "GRAPH_FORMAT_TRUNCATED";
    public static final String REASON_IO_FAILURE = "GRAPH_IO_FAILURE";

    private static final byte[] MAGIC = "RCGRAPH1".getBytes(StandardCharsets.US_ASCII);
    private static final int EDGE_RECORD_BYTES = 4 + 4 + 4 + 1;

    /**
     * Encodes a graph, including inactive node and edge slots.
     *
     * @param graph graph to encode.
     * @return encoded bytes.
     */
    public static byte[] encode(MapGraph graph) {
        Objects.requireNonNull(graph, "graph");
        GraphLimits limits = graph.limits();
        int nodeCount = graph.nodeCount();
        int nameBytes = limits.maxNameBytes();

        int edgeRecords = 0;
        for (int i = 0; i < nodeCount; i++) {
            edgeRecords += graph.edgeSlotCount(i);
        }
        int size = MAGIC.length + 4
                + nodeCount * nodeRecordBytes(nameBytes)
                + limits.maxNodes() * 4
                + edgeRecords * EDGE_RECORD_BYTES;

        ByteBuffer bb = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
        bb.put(MAGIC);
        bb.putInt(nodeCount);

        byte[] nameField = new byte[nameBytes];
        for (int i = 0; i < nodeCount; i++) {
            MapNode node = graph.nodeSlot(i);
            Arrays.fill(nameField, (byte) 0);
            byte[] encoded = node.name().getBytes(StandardCharsets.UTF_8);
            System.arraycopy(encoded, 0, nameField, 0, Math.min(encoded.length, nameBytes - 1));

            bb.putInt(node.id());
            bb.put(nameField);
            bb.putFloat(node.x());
            bb.putFloat(node.y());
            bb.put(node.active() ? (byte) 1 : (byte) 0);
        }

        for (int i = 0; i < limits.maxNodes(); i++) {
            bb.putInt(i < nodeCount ? graph.edgeSlotCount(i) : 0);
        }

        for (int i = 0; i < nodeCount; i++) {
            for (MapEdge edge : graph.edgeSlots(i)) {
                bb.putInt(edge.from());
                bb.putInt(edge.to());
                bb.putFloat(edge.weight());
                bb.put(edge.active() ? (byte) 1 : (byte) 0);
            }
        }
        return bb.array();
    }

    /**
     * Writes the encoded graph to a stream. The stream is not closed.
     */
    public static void write(MapGraph graph, OutputStream out) throws IOException {
        Objects.requireNonNull(out, "out");
        out.write(encode(graph));
        out.flush();
    }

    /**
     * Reads a complete map from a stream into a new graph. The stream is not closed.
     *
     * @param in source stream.
     * @param limits limits of the graph being loaded; they fix the name and table widths.
     * @return decoded graph.
     * @throws GraphFormatException when the magic is wrong, the input is short, or content is invalid.
     * @throws IOException when the stream fails.
     */
    public static MapGraph read(InputStream in, GraphLimits limits) throws IOException {
        Objects.requireNonNull(in, "in");
        return decode(in.readAllBytes(), limits);
    }

    /**
     * Decodes a complete map into a new graph.
     *
     * @throws GraphFormatException when the magic is wrong, the input is short, or content is invalid.
     */
    public static MapGraph decode(byte[] data, GraphLimits limits) throws GraphFormatException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(limits, "limits");
        ByteBuffer bb = ByteBuffer.wrap(data).order(ByteOrder.LITTLE_ENDIAN);

        require(bb, MAGIC.length, "magic");
        byte[] magic = new byte[MAGIC.length];
        bb.get(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new GraphFormatException(REASON_FORMAT_MISMATCH, "bad magic " + Arrays.toString(magic));
        }

        require(bb, 4, "node count");
        int nodeCount = bb.getInt();
        if (nodeCount < 0 || nodeCount > limits.maxNodes()) {
            throw new GraphFormatException(
                    REASON_FORMAT_MISMATCH,
                    "node count " + nodeCount + " outside [0, " + limits.maxNodes() + "]"
            );
        }

        MapGraph graph = new MapGraph(limits);
        int nameBytes = limits.maxNameBytes();
        byte[] nameField = new byte[nameBytes];
        for (int i = 0; i < nodeCount; i++) {
            require(bb, nodeRecordBytes(nameBytes), "node " + i);
            int id = bb.getInt();
            if (id != i) {
                throw new GraphFormatException(REASON_FORMAT_MISMATCH, "node slot " + i + " carries id " + id);
            }
            bb.get(nameField);
            float x = bb.getFloat();
            float y = bb.getFloat();
            boolean active = bb.get() != 0;
            graph.restoreNode(decodeName(nameField), x, y, active);
        }

        require(bb, limits.maxNodes() * 4, "edge count table");
        int[] edgeCounts = new int[nodeCount];
        for (int i = 0; i < limits.maxNodes(); i++) {
            int count = bb.getInt();
            if (i < nodeCount) {
                if (count < 0 || count > limits.maxEdgesPerNode()) {
                    throw new GraphFormatException(
                            REASON_FORMAT_MISMATCH,
                            "edge count " + count + " for node " + i + " outside [0, " + limits.maxEdgesPerNode() + "]"
                    );
                }
                edgeCounts[i] = count;
            }
        }

        for (int i = 0; i < nodeCount; i++) {
            for (int j = 0; j < edgeCounts[i]; j++) {
                require(bb, EDGE_RECORD_BYTES, "edge " + i + "/" + j);
                int from = bb.getInt();
                int to = bb.getInt();
                float weight = bb.getFloat();
                boolean active = bb.get() != 0;
                if (from != i || to < 0 || to >= nodeCount) {
                    throw new GraphFormatException(
                            REASON_FORMAT_MISMATCH,
                            "edge " + from + "->" + to + " invalid in adjacency slot of node " + i
                    );
                }
                if (!Float.isFinite(weight) || weight < 0.0f) {
                    throw new GraphFormatException(
                            REASON_FORMAT_MISMATCH,
                            "edge " + from + "->" + to + " has invalid weight " + weight
                    );
                }
                if (active) {
                    if (!graph.isActiveNode(from) || !graph.isActiveNode(to)) {
                        throw new GraphFormatException(
                                REASON_FORMAT_MISMATCH,
                                "active edge " + from + "->" + to + " touches an inactive node"
                        );
                    }
                    if (graph.hasEdge(from, to)) {
                        throw new GraphFormatException(
                                REASON_FORMAT_MISMATCH,
                                "second active edge " + from + "->" + to
                        );
                    }
                }
                graph.restoreEdge(from, to, weight, active);
            }
        }
        return graph;
    }

    private static int nodeRecordBytes(int nameBytes) {
        return 4 + nameBytes + 4 + 4 + 1;
    }

    private static String decodeName(byte[] field) {
        int end = 0;
        while (end < field.length && field[end] != 0) {
            end++;
        }
        return new String(field, 0, end, StandardCharsets.UTF_8);
    }

    private static void require(ByteBuffer bb, int bytes, String section) throws GraphFormatException {
        if (bb.remaining() < bytes) {
            throw new GraphFormatException(
                    REASON_TRUNCATED,
                    "truncated while reading " + section + ": need " + bytes + " bytes, have " + bb.remaining()
            );
        }
    }
}
