package org.Aayush.roadnet.segment;

import org.Aayush.roadnet.geo.GeoPoint;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only lookup of segment geometries by id.
 *
 * <p>Segments are not tied to network edges; the catalog is a standalone registry.</p>
 */
public final class SegmentGeometryCatalog {
    private final Map<String, SegmentGeometry> segments;

    public SegmentGeometryCatalog(Collection<SegmentGeometry> geometries) {
        Objects.requireNonNull(geometries, "geometries");
        Map<String, SegmentGeometry> byId = new LinkedHashMap<>();
        for (SegmentGeometry geometry : geometries) {
            Objects.requireNonNull(geometry, "geometry");
            String id = Objects.requireNonNull(geometry.getSegmentId(), "segmentId");
            if (byId.putIfAbsent(id, geometry) != null) {
                throw new IllegalArgumentException("duplicate segment id: " + id);
            }
        }
        this.segments = Map.copyOf(byId);
    }

    /**
     * Catalog with the built-in San Francisco demo segment {@code SEG001}.
     */
    public static SegmentGeometryCatalog builtIn() {
        return new SegmentGeometryCatalog(List.of(
                SegmentGeometry.builder()
                        .segmentId("SEG001")
                        .startPoint(GeoPoint.of(37.7749, -122.4194))
                        .endPoint(GeoPoint.of(37.7759, -122.4184))
                        .lengthMeters(1200.0d)
                        .lanes(4)
                        .speedLimit(65)
                        .roadType("highway")
                        .build()
        ));
    }

    public Optional<SegmentGeometry> find(String segmentId) {
        if (segmentId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(segments.get(segmentId));
    }

    public int size() {
        return segments.size();
    }
}
