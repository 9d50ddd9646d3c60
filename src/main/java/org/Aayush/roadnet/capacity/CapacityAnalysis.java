package org.Aayush.roadnet.capacity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Capacity classification and distribution for one network.
 *
 * <p>{@code distribution} is {@code null} when the network has no edges; use
 * {@link #statistics()} for an {@link Optional} view.</p>
 */
@Value
@Builder
public class CapacityAnalysis {
    @Singular("highCapacityRoad")
    List<EdgeCapacity> highCapacityRoads;
    @Singular("lowCapacityRoad")
    List<EdgeCapacity> lowCapacityRoads;
    CapacityStatistics distribution;
    int analyzedEdges;

    public Optional<CapacityStatistics> statistics() {
        return Optional.ofNullable(distribution);
    }
}
