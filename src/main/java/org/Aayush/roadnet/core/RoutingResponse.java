package org.Aayush.roadnet.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.route.RouteResult;

import java.util.List;

/**
 * Result of one origin/destination routing request.
 *
 * <p>When {@code reachable=false}, {@code routes} is empty.</p>
 */
@Value
@Builder
public class RoutingResponse {
    GeoPoint origin;
    GeoPoint destination;
    boolean reachable;
    /** Fastest route first, then the alternate when one was computed. */
    @Singular("route")
    List<RouteResult> routes;
}
