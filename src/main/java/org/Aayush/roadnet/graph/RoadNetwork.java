package org.Aayush.roadnet.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.roadnet.capacity.CapacityModel;
import org.Aayush.roadnet.core.RoadNetworkException;
import org.Aayush.roadnet.geo.GeoPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable directed road graph built for one (center, radius) query.
 * <p>
 * Layout:
 * <ul>
 * <li>SoA (Structure of Arrays) for node coordinates and edge attributes.</li>
 * <li>CSR (Compressed Sparse Row) outgoing adjacency: edges of node {@code n} occupy
 * {@code [firstEdge[n], firstEdge[n + 1])}.</li>
 * <li>External string node ids mapped to dense indices through a fastutil hash map.</li>
 * </ul>
 * Nodes keep insertion order. Edges are grouped by origin node, preserving insertion
 * order within each group.
 * </p>
 * <p>Instances are safe for concurrent reads. Algorithms that need an edge "removed"
 * work on an exclusion overlay, never on the network itself.</p>
 */
public final class RoadNetwork {

    // ========================================================================
    // ORIGIN
    // ========================================================================
    @Getter
    @Accessors(fluent = true)
    private final GeoPoint center;
    @Getter
    @Accessors(fluent = true)
    private final double radiusMeters;

    // ========================================================================
    // NODE DATA
    // ========================================================================
    private final String[] nodeIds;
    private final double[] latitudes;
    private final double[] longitudes;
    private final Object2IntOpenHashMap<String> nodeIndex;
    private final int[] inDegree;

    // ========================================================================
    // EDGE DATA (CSR)
    // ========================================================================
    private final int[] firstEdge;
    private final int[] edgeOrigin;
    private final int[] edgeTarget;
    private final double[] lengthMeters;
    private final double[] speedKph;
    private final double[] travelTimeSeconds;
    private final double[] capacityVph;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private RoadNetwork(Builder builder) {
        this.center = builder.center;
        this.radiusMeters = builder.radiusMeters;
        this.nodeCount = builder.nodeIds.size();
        this.edgeCount = builder.edgeFrom.size();

        this.nodeIds = builder.nodeIds.toArray(new String[0]);
        this.latitudes = builder.latitudes.toDoubleArray();
        this.longitudes = builder.longitudes.toDoubleArray();
        this.nodeIndex = new Object2IntOpenHashMap<>(builder.nodeIndex);
        this.nodeIndex.defaultReturnValue(-1);
        this.nodeIndex.trim();

        this.firstEdge = new int[nodeCount + 1];
        this.edgeOrigin = new int[edgeCount];
        this.edgeTarget = new int[edgeCount];
        this.lengthMeters = new double[edgeCount];
        this.speedKph = new double[edgeCount];
        this.travelTimeSeconds = new double[edgeCount];
        this.capacityVph = new double[edgeCount];
        this.inDegree = new int[nodeCount];

        for (int i = 0; i < edgeCount; i++) {
            firstEdge[builder.edgeFrom.getInt(i) + 1]++;
        }
        for (int n = 0; n < nodeCount; n++) {
            firstEdge[n + 1] += firstEdge[n];
        }

        int[] cursor = new int[nodeCount];
        System.arraycopy(firstEdge, 0, cursor, 0, nodeCount);
        CapacityModel capacityModel = builder.capacityModel;
        for (int i = 0; i < edgeCount; i++) {
            int from = builder.edgeFrom.getInt(i);
            int to = builder.edgeTo.getInt(i);
            int slot = cursor[from]++;
            double length = builder.edgeLength.getDouble(i);
            double speed = builder.edgeSpeed.getDouble(i);

            edgeOrigin[slot] = from;
            edgeTarget[slot] = to;
            lengthMeters[slot] = length;
            speedKph[slot] = speed;
            travelTimeSeconds[slot] = travelTimeSeconds(length, speed);
            capacityVph[slot] = capacityModel.capacityFor(speed);
            inDegree[to]++;
        }
    }

    /**
     * Travel time in seconds for one edge: {@code length / (speed * 1000 / 3600)}.
     */
    public static double travelTimeSeconds(double lengthMeters, double speedKph) {
        return lengthMeters / (speedKph * 1000.0d / 3600.0d);
    }

    // ========================================================================
    // NODE ACCESS
    // ========================================================================

    public boolean isEmpty() {
        return nodeCount == 0;
    }

    public String nodeId(int nodeIndex) {
        checkNode(nodeIndex);
        return nodeIds[nodeIndex];
    }

    /**
     * Returns the dense index for an external id, or {@code -1} when absent.
     */
    public int indexOf(String nodeId) {
        return nodeIndex.getInt(nodeId);
    }

    /**
     * Returns the dense index for an external id.
     *
     * @throws RoadNetworkException with {@link RoadNetworkException#REASON_UNKNOWN_NODE} when absent.
     */
    public int requireIndex(String nodeId) {
        int index = nodeIndex.getInt(nodeId);
        if (index < 0) {
            throw new RoadNetworkException(RoadNetworkException.REASON_UNKNOWN_NODE, "unknown node id: " + nodeId);
        }
        return index;
    }

    public double latitude(int nodeIndex) {
        checkNode(nodeIndex);
        return latitudes[nodeIndex];
    }

    public double longitude(int nodeIndex) {
        checkNode(nodeIndex);
        return longitudes[nodeIndex];
    }

    public GeoPoint point(int nodeIndex) {
        checkNode(nodeIndex);
        return new GeoPoint(latitudes[nodeIndex], longitudes[nodeIndex]);
    }

    public RoadNode node(int nodeIndex) {
        checkNode(nodeIndex);
        return new RoadNode(nodeIds[nodeIndex], nodeIndex, latitudes[nodeIndex], longitudes[nodeIndex]);
    }

    /**
     * All nodes in insertion order.
     */
    public List<RoadNode> nodes() {
        List<RoadNode> nodes = new ArrayList<>(nodeCount);
        for (int n = 0; n < nodeCount; n++) {
            nodes.add(node(n));
        }
        return Collections.unmodifiableList(nodes);
    }

    public int outDegree(int nodeIndex) {
        checkNode(nodeIndex);
        return firstEdge[nodeIndex + 1] - firstEdge[nodeIndex];
    }

    public int inDegree(int nodeIndex) {
        checkNode(nodeIndex);
        return inDegree[nodeIndex];
    }

    /**
     * Total degree (in + out), matching multigraph degree semantics.
     */
    public int degree(int nodeIndex) {
        return inDegree(nodeIndex) + outDegree(nodeIndex);
    }

    // ========================================================================
    // EDGE ACCESS
    // ========================================================================

    /**
     * First outgoing edge index of a node (inclusive).
     */
    public int firstOutgoingEdge(int nodeIndex) {
        checkNode(nodeIndex);
        return firstEdge[nodeIndex];
    }

    /**
     * End of a node's outgoing edge range (exclusive).
     */
    public int endOutgoingEdge(int nodeIndex) {
        checkNode(nodeIndex);
        return firstEdge[nodeIndex + 1];
    }

    /**
     * UNCHECKED - hot path accessor, caller must pass a valid edge index.
     */
    public int edgeOrigin(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount : "Edge " + edgeIndex + " out of bounds";
        return edgeOrigin[edgeIndex];
    }

    /**
     * UNCHECKED - hot path accessor, caller must pass a valid edge index.
     */
    public int edgeTarget(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount : "Edge " + edgeIndex + " out of bounds";
        return edgeTarget[edgeIndex];
    }

    public double lengthMeters(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount;
        return lengthMeters[edgeIndex];
    }

    public double speedKph(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount;
        return speedKph[edgeIndex];
    }

    public double travelTimeSeconds(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount;
        return travelTimeSeconds[edgeIndex];
    }

    public double capacityVph(int edgeIndex) {
        assert edgeIndex >= 0 && edgeIndex < edgeCount;
        return capacityVph[edgeIndex];
    }

    public RoadEdge edge(int edgeIndex) {
        checkEdge(edgeIndex);
        return new RoadEdge(
                edgeIndex,
                nodeIds[edgeOrigin[edgeIndex]],
                nodeIds[edgeTarget[edgeIndex]],
                lengthMeters[edgeIndex],
                speedKph[edgeIndex],
                travelTimeSeconds[edgeIndex],
                capacityVph[edgeIndex]
        );
    }

    /**
     * All edges in CSR order.
     */
    public List<RoadEdge> edges() {
        List<RoadEdge> edges = new ArrayList<>(edgeCount);
        for (int e = 0; e < edgeCount; e++) {
            edges.add(edge(e));
        }
        return Collections.unmodifiableList(edges);
    }

    public String edgeLabel(int edgeIndex) {
        checkEdge(edgeIndex);
        return nodeIds[edgeOrigin[edgeIndex]] + "-" + nodeIds[edgeTarget[edgeIndex]];
    }

    /**
     * Finds the first edge {@code from -> to} in CSR order.
     *
     * @return edge index, or {@code -1} when no such edge exists.
     */
    public int findEdge(int fromIndex, int toIndex) {
        checkNode(toIndex);
        for (int e = firstOutgoingEdge(fromIndex), end = endOutgoingEdge(fromIndex); e < end; e++) {
            if (edgeTarget[e] == toIndex) {
                return e;
            }
        }
        return -1;
    }

    private void checkNode(int nodeIndex) {
        if (nodeIndex < 0 || nodeIndex >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeIndex + " out of bounds [0, " + nodeCount + ")");
        }
    }

    private void checkEdge(int edgeIndex) {
        if (edgeIndex < 0 || edgeIndex >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeIndex + " out of bounds [0, " + edgeCount + ")");
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "RoadNetwork[center=%s, radius=%.0fm, nodes=%d, edges=%d]",
                center, radiusMeters, nodeCount, edgeCount);
    }

    // ========================================================================
    // CONSTRUCTION
    // ========================================================================

    public static Builder builder(GeoPoint center, double radiusMeters) {
        return new Builder(center, radiusMeters, CapacityModel.defaults());
    }

    public static Builder builder(GeoPoint center, double radiusMeters, CapacityModel capacityModel) {
        return new Builder(center, radiusMeters, capacityModel);
    }

    /**
     * Single-use mutable builder. Not thread-safe.
     */
    public static final class Builder {
        private final GeoPoint center;
        private final double radiusMeters;
        private final CapacityModel capacityModel;

        private final List<String> nodeIds = new ArrayList<>();
        private final DoubleArrayList latitudes = new DoubleArrayList();
        private final DoubleArrayList longitudes = new DoubleArrayList();
        private final Object2IntOpenHashMap<String> nodeIndex = new Object2IntOpenHashMap<>();

        private final IntArrayList edgeFrom = new IntArrayList();
        private final IntArrayList edgeTo = new IntArrayList();
        private final DoubleArrayList edgeLength = new DoubleArrayList();
        private final DoubleArrayList edgeSpeed = new DoubleArrayList();
        private boolean built;

        private Builder(GeoPoint center, double radiusMeters, CapacityModel capacityModel) {
            this.center = Objects.requireNonNull(center, "center");
            this.capacityModel = Objects.requireNonNull(capacityModel, "capacityModel");
            if (!Double.isFinite(radiusMeters) || radiusMeters <= 0.0d) {
                throw invalid("radiusMeters must be finite and > 0, got " + radiusMeters);
            }
            this.radiusMeters = radiusMeters;
            this.nodeIndex.defaultReturnValue(-1);
        }

        public Builder addNode(String id, double latitude, double longitude) {
            ensureOpen();
            if (id == null || id.isBlank()) {
                throw invalid("node id must be non-blank");
            }
            if (!GeoPoint.isValid(latitude, longitude)) {
                throw invalid("node " + id + " has invalid coordinate (" + latitude + ", " + longitude + ")");
            }
            if (nodeIndex.containsKey(id)) {
                throw invalid("duplicate node id: " + id);
            }
            nodeIndex.put(id, nodeIds.size());
            nodeIds.add(id);
            latitudes.add(latitude);
            longitudes.add(longitude);
            return this;
        }

        /**
         * Adds one directed edge. Both endpoints must already be present.
         */
        public Builder addEdge(String fromId, String toId, double lengthMeters, double speedKph) {
            ensureOpen();
            int from = nodeIndex.getInt(fromId);
            int to = nodeIndex.getInt(toId);
            if (from < 0 || to < 0) {
                throw invalid("edge " + fromId + "->" + toId + " references a missing node");
            }
            if (!Double.isFinite(lengthMeters) || lengthMeters < 0.0d) {
                throw invalid("edge " + fromId + "->" + toId + " length must be finite and >= 0");
            }
            if (!Double.isFinite(speedKph) || speedKph <= 0.0d) {
                throw invalid("edge " + fromId + "->" + toId + " speed must be finite and > 0");
            }
            edgeFrom.add(from);
            edgeTo.add(to);
            edgeLength.add(lengthMeters);
            edgeSpeed.add(speedKph);
            return this;
        }

        /**
         * Adds the two opposing directed edges of a bidirectional road.
         */
        public Builder addBidirectionalEdge(String aId, String bId, double lengthMeters, double speedKph) {
            addEdge(aId, bId, lengthMeters, speedKph);
            return addEdge(bId, aId, lengthMeters, speedKph);
        }

        public boolean containsNode(String id) {
            return nodeIndex.containsKey(id);
        }

        public RoadNetwork build() {
            ensureOpen();
            built = true;
            return new RoadNetwork(this);
        }

        private void ensureOpen() {
            if (built) {
                throw new IllegalStateException("builder already consumed");
            }
        }

        private static RoadNetworkException invalid(String message) {
            return new RoadNetworkException(RoadNetworkException.REASON_INVALID_GRAPH, message);
        }
    }
}
