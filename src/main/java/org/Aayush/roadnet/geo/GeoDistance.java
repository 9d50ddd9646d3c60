package org.Aayush.roadnet.geo;

import lombok.experimental.UtilityClass;

/**
 * Great-circle distance helpers over WGS84 latitude/longitude degrees.
 */
@UtilityClass
public class GeoDistance {
    public static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double haversineMeters(double lat1Deg, double lon1Deg, double lat2Deg, double lon2Deg) {
        double lat1Rad = Math.toRadians(lat1Deg);
        double lat2Rad = Math.toRadians(lat2Deg);
        double deltaLatRad = Math.toRadians(lat2Deg - lat1Deg);
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(lon2Deg - lon1Deg));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(clamp(a, 0.0d, 1.0d)));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Point overload of {@link #haversineMeters(double, double, double, double)}.
     */
    public static double haversineMeters(GeoPoint a, GeoPoint b) {
        return haversineMeters(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        return Math.min(value, max);
    }
}
