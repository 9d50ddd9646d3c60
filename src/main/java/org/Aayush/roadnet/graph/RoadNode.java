package org.Aayush.roadnet.graph;

import lombok.Value;
import org.Aayush.roadnet.geo.GeoPoint;

/**
 * Immutable node view of a {@link RoadNetwork}.
 */
@Value
public class RoadNode {
    /** Opaque identifier, stable within its owning network. */
    String id;
    /** Dense internal index used by graph algorithms. */
    int index;
    double latitude;
    double longitude;

    public GeoPoint point() {
        return new GeoPoint(latitude, longitude);
    }
}
