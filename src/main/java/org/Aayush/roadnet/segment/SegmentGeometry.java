package org.Aayush.roadnet.segment;

import lombok.Builder;
import lombok.Value;
import org.Aayush.roadnet.geo.GeoPoint;

/**
 * Static geometric description of a monitored traffic segment.
 */
@Value
@Builder
public class SegmentGeometry {
    String segmentId;
    GeoPoint startPoint;
    GeoPoint endPoint;
    double lengthMeters;
    int lanes;
    int speedLimit;
    String roadType;
}
