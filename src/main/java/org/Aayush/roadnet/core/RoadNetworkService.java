package org.Aayush.roadnet.core;

import org.Aayush.roadnet.segment.SegmentGeometry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Public road-network analysis and routing contract.
 *
 * <p>Implementations validate inputs and fail with {@link RoadNetworkException}. Async
 * variants complete exceptionally with the same exception.</p>
 */
public interface RoadNetworkService {

    CompletableFuture<NetworkAnalysis> analyzeNetworkCapacityAsync(double latitude, double longitude, double radiusMeters);

    /**
     * Analyzes the road network within {@code radiusMeters} of a location.
     *
     * @return network statistics, capacity analysis, bottlenecks and sample alternates.
     */
    NetworkAnalysis analyzeNetworkCapacity(double latitude, double longitude, double radiusMeters);

    CompletableFuture<RoutingResponse> findOptimalRoutesAsync(
            double originLatitude,
            double originLongitude,
            double destinationLatitude,
            double destinationLongitude,
            List<String> avoidSegmentIds
    );

    /**
     * Fastest route between two coordinates, plus an alternate when segments to avoid are given.
     *
     * @param avoidSegmentIds optional; may be {@code null}.
     */
    RoutingResponse findOptimalRoutes(
            double originLatitude,
            double originLongitude,
            double destinationLatitude,
            double destinationLongitude,
            List<String> avoidSegmentIds
    );

    Optional<SegmentGeometry> getSegmentGeometry(String segmentId);
}
