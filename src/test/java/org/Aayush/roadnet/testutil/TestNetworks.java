package org.Aayush.roadnet.testutil;

import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;

/**
 * Small hand-built networks shared by tests.
 */
public final class TestNetworks {
    public static final GeoPoint SAN_FRANCISCO = GeoPoint.of(37.7749, -122.4194);

    private TestNetworks() {
    }

    /**
     * Two-way chain {@code A - B - C}, 1 km per hop at 60 km/h.
     */
    public static RoadNetwork chain() {
        return RoadNetwork.builder(SAN_FRANCISCO, 2000)
                .addNode("A", 37.7700, -122.4200)
                .addNode("B", 37.7790, -122.4200)
                .addNode("C", 37.7880, -122.4200)
                .addBidirectionalEdge("A", "B", 1000, 60)
                .addBidirectionalEdge("B", "C", 1000, 60)
                .build();
    }

    /**
     * Diamond {@code S -> {L, R} -> T}. The left branch is faster (60 km/h) than
     * the right one (30 km/h); both are 1 km per hop.
     */
    public static RoadNetwork diamond() {
        return RoadNetwork.builder(SAN_FRANCISCO, 2000)
                .addNode("S", 37.7700, -122.4200)
                .addNode("L", 37.7750, -122.4250)
                .addNode("R", 37.7750, -122.4150)
                .addNode("T", 37.7800, -122.4200)
                .addEdge("S", "L", 1000, 60)
                .addEdge("L", "T", 1000, 60)
                .addEdge("S", "R", 1000, 30)
                .addEdge("R", "T", 1000, 30)
                .build();
    }

    /**
     * Two disconnected two-way pairs {@code A - B} and {@code X - Y}.
     */
    public static RoadNetwork disconnected() {
        return RoadNetwork.builder(SAN_FRANCISCO, 2000)
                .addNode("A", 37.7700, -122.4200)
                .addNode("B", 37.7710, -122.4200)
                .addNode("X", 37.8000, -122.3000)
                .addNode("Y", 37.8010, -122.3000)
                .addBidirectionalEdge("A", "B", 100, 50)
                .addBidirectionalEdge("X", "Y", 100, 50)
                .build();
    }

    public static RoadNetwork empty() {
        return RoadNetwork.builder(SAN_FRANCISCO, 2000).build();
    }
}
