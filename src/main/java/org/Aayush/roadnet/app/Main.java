package org.Aayush.roadnet.app;

import org.Aayush.roadnet.bottleneck.BottleneckReport;
import org.Aayush.roadnet.core.NetworkAnalysis;
import org.Aayush.roadnet.core.RoadNetworkEngine;
import org.Aayush.roadnet.core.RoutingResponse;
import org.Aayush.roadnet.route.RouteResult;

import java.util.List;
import java.util.Locale;

/**
 * Minimal application entry point used for local smoke runs.
 *
 * <p>Runs one San Francisco analysis and one San Francisco to Oakland routing request
 * against the synthesized grid.</p>
 */
public class Main {
    /**
     * @param args ignored.
     */
    public static void main(String[] args) {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            NetworkAnalysis analysis = engine.analyzeNetworkCapacity(37.7749, -122.4194, 2000);
            System.out.printf(Locale.ROOT, "Network: %d nodes, %d edges, %.2f km%n",
                    analysis.getNetworkStats().getTotalNodes(),
                    analysis.getNetworkStats().getTotalEdges(),
                    analysis.getNetworkStats().getTotalLengthKm());
            analysis.getCapacityAnalysis().statistics().ifPresent(stats ->
                    System.out.printf(Locale.ROOT, "Capacity: mean %.1f vph, min %.1f, max %.1f%n",
                            stats.getMean(), stats.getMin(), stats.getMax()));
            for (BottleneckReport bottleneck : analysis.getBottlenecks()) {
                System.out.println("Bottleneck " + bottleneck.getId() + ": " + bottleneck.getDescription());
            }

            RoutingResponse routing = engine.findOptimalRoutes(
                    37.7749, -122.4194, 37.8044, -122.2711, List.of("SEG001"));
            for (RouteResult route : routing.getRoutes()) {
                System.out.printf(Locale.ROOT, "%s: %d nodes, %.0f m, %.0f s%n",
                        route.getRouteType(),
                        route.getPathNodeIds().size(),
                        route.getDistanceMeters(),
                        route.getTravelTimeSeconds());
            }
        }
    }
}
