package org.Aayush.roadnet.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.roadnet.bottleneck.BottleneckReport;
import org.Aayush.roadnet.capacity.CapacityAnalysis;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.NetworkStats;
import org.Aayush.roadnet.route.AlternativeRouteSample;

import java.time.Instant;
import java.util.List;

/**
 * Full capacity and structure analysis of the network around one location.
 */
@Value
@Builder
public class NetworkAnalysis {
    /** Requested location, echoed unrounded. */
    GeoPoint location;
    double radiusMeters;
    NetworkStats networkStats;
    CapacityAnalysis capacityAnalysis;
    /** Ranked by descending centrality. */
    @Singular("bottleneck")
    List<BottleneckReport> bottlenecks;
    @Singular("sampleAlternativeRoute")
    List<AlternativeRouteSample> sampleAlternativeRoutes;
    /** When the analysis was computed; cached results keep the time of first computation. */
    Instant timestamp;
}
