package org.Aayush.roadnet.acquisition;

import org.Aayush.roadnet.capacity.CapacityModel;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;

import java.util.Objects;

/**
 * Deterministic fallback source: an N x N lattice centred on the query point.
 *
 * <p>Node {@code (row, col)} gets id {@code row * N + col} and sits at
 * {@code center + ((row - N/2) * spacing, (col - N/2) * spacing)}. Every horizontal and
 * vertical neighbour pair is joined by two opposing edges of uniform length and speed,
 * giving {@code 4 * N * (N - 1)} directed edges.</p>
 */
public final class GridNetworkSynthesizer implements NetworkSource {
    private final GridSynthesisConfig config;
    private final CapacityModel capacityModel;

    public GridNetworkSynthesizer() {
        this(GridSynthesisConfig.defaults(), CapacityModel.defaults());
    }

    public GridNetworkSynthesizer(GridSynthesisConfig config, CapacityModel capacityModel) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.capacityModel = Objects.requireNonNull(capacityModel, "capacityModel").validate();
    }

    @Override
    public RoadNetwork load(GeoPoint center, double radiusMeters) {
        Objects.requireNonNull(center, "center");
        int n = config.getGridSize();
        double spacing = config.spacingFor(radiusMeters);
        double length = config.getEdgeLengthMeters();
        double speed = config.getSpeedKph();

        RoadNetwork.Builder builder = RoadNetwork.builder(center, radiusMeters, capacityModel);
        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                builder.addNode(
                        nodeId(row, col, n),
                        clampLatitude(center.getLatitude() + (row - n / 2) * spacing),
                        wrapLongitude(center.getLongitude() + (col - n / 2) * spacing)
                );
            }
        }

        for (int row = 0; row < n; row++) {
            for (int col = 0; col < n; col++) {
                String node = nodeId(row, col, n);
                if (col < n - 1) {
                    builder.addBidirectionalEdge(node, nodeId(row, col + 1, n), length, speed);
                }
                if (row < n - 1) {
                    builder.addBidirectionalEdge(node, nodeId(row + 1, col, n), length, speed);
                }
            }
        }
        return builder.build();
    }

    private static String nodeId(int row, int col, int n) {
        return Integer.toString(row * n + col);
    }

    private static double clampLatitude(double latitude) {
        return Math.max(-90.0d, Math.min(90.0d, latitude));
    }

    private static double wrapLongitude(double longitude) {
        if (longitude > 180.0d) {
            return longitude - 360.0d;
        }
        if (longitude < -180.0d) {
            return longitude + 360.0d;
        }
        return longitude;
    }
}
