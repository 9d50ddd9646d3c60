package org.Aayush.roadnet.graph;

import lombok.Value;

/**
 * Immutable directed edge view of a {@link RoadNetwork}.
 *
 * <p>Travel time and capacity are derived once when the network is built and never
 * recomputed afterward.</p>
 */
@Value
public class RoadEdge {
    /** Dense internal edge index (CSR position). */
    int index;
    String fromNodeId;
    String toNodeId;
    double lengthMeters;
    double speedKph;
    double travelTimeSeconds;
    double capacityVph;

    /**
     * Human-readable label {@code "<from>-<to>"}. Parallel edges share a label.
     */
    public String label() {
        return fromNodeId + "-" + toNodeId;
    }
}
