package org.Aayush.roadnet.acquisition;

import lombok.Value;
import org.Aayush.roadnet.geo.GeoPoint;

import java.util.Locale;

/**
 * Network cache key: center rounded to a fixed number of decimal degrees plus radius
 * truncated to whole meters.
 *
 * <p>Coordinates are held as scaled integers so nearby queries collapse onto exactly the
 * same key without floating-point equality concerns.</p>
 */
@Value
public class NetworkCacheKey {
    long scaledLatitude;
    long scaledLongitude;
    int precision;
    long radiusMeters;

    public static NetworkCacheKey of(GeoPoint center, double radiusMeters, int precision) {
        if (precision < 0 || precision > 9) {
            throw new IllegalArgumentException("precision must be in [0, 9], got " + precision);
        }
        double scale = Math.pow(10, precision);
        return new NetworkCacheKey(
                Math.round(center.getLatitude() * scale),
                Math.round(center.getLongitude() * scale),
                precision,
                (long) radiusMeters
        );
    }

    /**
     * Rounded center this key stands for.
     */
    public GeoPoint center() {
        double scale = Math.pow(10, precision);
        return new GeoPoint(scaledLatitude / scale, scaledLongitude / scale);
    }

    @Override
    public String toString() {
        GeoPoint center = center();
        return String.format(Locale.ROOT, "network_%." + precision + "f_%." + precision + "f_%d",
                center.getLatitude(), center.getLongitude(), radiusMeters);
    }
}
