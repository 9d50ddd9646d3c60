package org.Aayush.roadnet.geo;

import lombok.Value;

import java.util.Locale;

/**
 * Immutable WGS84 coordinate in decimal degrees.
 */
@Value
public class GeoPoint {
    double latitude;
    double longitude;

    /**
     * Creates a validated point.
     *
     * @throws IllegalArgumentException when either component is non-finite or out of range.
     */
    public static GeoPoint of(double latitude, double longitude) {
        if (!isValid(latitude, longitude)) {
            throw new IllegalArgumentException(
                    "coordinate out of range: (" + latitude + ", " + longitude + ")");
        }
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Returns whether the pair is a finite latitude in [-90, 90] and longitude in [-180, 180].
     */
    public static boolean isValid(double latitude, double longitude) {
        return Double.isFinite(latitude) && Double.isFinite(longitude)
                && latitude >= -90.0d && latitude <= 90.0d
                && longitude >= -180.0d && longitude <= 180.0d;
    }

    /**
     * Midpoint in coordinate space. Adequate for the short spans routed here.
     */
    public GeoPoint midpoint(GeoPoint other) {
        return new GeoPoint(
                (latitude + other.latitude) / 2.0d,
                (longitude + other.longitude) / 2.0d
        );
    }

    /**
     * GeoJSON position order: {@code [longitude, latitude]}.
     */
    public double[] toGeoJson() {
        return new double[]{longitude, latitude};
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "(%.6f, %.6f)", latitude, longitude);
    }
}
