package org.Aayush.roadnet.route;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.roadnet.geo.GeoPoint;

import java.util.ArrayList;
import java.util.List;

/**
 * One computed route. {@code coordinates} is index-aligned with {@code pathNodeIds}.
 */
@Value
@Builder
public class RouteResult {

    /**
     * Why a route was produced.
     */
    public enum RouteType {
        /** Minimum travel time over the full network. */
        FASTEST,
        /** Recomputed after removing one edge of the fastest route. */
        AVOIDING_CONGESTION
    }

    RouteType routeType;
    @Singular("pathNodeId")
    List<String> pathNodeIds;
    double travelTimeSeconds;
    double distanceMeters;
    @Singular("coordinate")
    List<GeoPoint> coordinates;
    /** Label of the edge removed to produce this route; {@code null} for fastest routes. */
    String removedEdge;

    /**
     * Coordinates as GeoJSON {@code [lon, lat]} pairs.
     */
    public List<double[]> geoJsonCoordinates() {
        List<double[]> positions = new ArrayList<>(coordinates.size());
        for (GeoPoint point : coordinates) {
            positions.add(point.toGeoJson());
        }
        return positions;
    }
}
