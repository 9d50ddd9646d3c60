package org.Aayush.roadnet.acquisition;

import java.util.List;
import java.util.Objects;

/**
 * Provider-shaped drivable road graph before speed augmentation.
 *
 * @param nodes nodes with coordinates.
 * @param edges directed edges carrying at least a length.
 */
public record RawRoadGraph(List<RawNode> nodes, List<RawEdge> edges) {

    public RawRoadGraph {
        nodes = List.copyOf(Objects.requireNonNull(nodes, "nodes"));
        edges = List.copyOf(Objects.requireNonNull(edges, "edges"));
    }

    /**
     * @param id provider node id.
     * @param latitude WGS84 latitude.
     * @param longitude WGS84 longitude.
     */
    public record RawNode(String id, double latitude, double longitude) {
    }

    /**
     * @param fromId origin node id.
     * @param toId destination node id.
     * @param lengthMeters edge length.
     * @param highway road class tag, may be {@code null}.
     * @param maxSpeed raw speed-limit tag, may be {@code null}.
     */
    public record RawEdge(String fromId, String toId, double lengthMeters, String highway, String maxSpeed) {
    }
}
