package org.Aayush.roadnet.capacity;

import org.Aayush.roadnet.graph.RoadNetwork;

import java.util.Objects;

/**
 * Classifies edges by estimated throughput and summarizes the capacity distribution.
 *
 * <p>Per-edge capacity is the value derived when the network was built (see
 * {@link CapacityModel#capacityFor(double)}); this class only reads it. Stateless and
 * safe to share.</p>
 */
public final class CapacityEstimator {
    private final CapacityModel model;

    public CapacityEstimator() {
        this(CapacityModel.defaults());
    }

    public CapacityEstimator(CapacityModel model) {
        this.model = Objects.requireNonNull(model, "model").validate();
    }

    public CapacityAnalysis estimateCapacity(RoadNetwork network) {
        Objects.requireNonNull(network, "network");
        int edgeCount = network.edgeCount();
        double[] capacities = new double[edgeCount];

        CapacityAnalysis.CapacityAnalysisBuilder builder = CapacityAnalysis.builder().analyzedEdges(edgeCount);
        for (int e = 0; e < edgeCount; e++) {
            double capacity = network.capacityVph(e);
            capacities[e] = capacity;
            if (model.isHighCapacity(capacity)) {
                builder.highCapacityRoad(toEdgeCapacity(network, e, capacity));
            } else if (model.isLowCapacity(capacity)) {
                builder.lowCapacityRoad(toEdgeCapacity(network, e, capacity));
            }
        }

        if (edgeCount > 0) {
            builder.distribution(CapacityStatistics.of(capacities));
        }
        return builder.build();
    }

    private static EdgeCapacity toEdgeCapacity(RoadNetwork network, int edge, double capacity) {
        return new EdgeCapacity(network.edgeLabel(edge), network.lengthMeters(edge), network.speedKph(edge), capacity);
    }
}
