package org.Aayush.roadnet.acquisition;

import org.Aayush.roadnet.geo.GeoPoint;

/**
 * External source of drivable road graphs.
 *
 * <p>Implementations may block on I/O. Speed and travel-time augmentation is done by the
 * caller, so providers only need to return coordinates, lengths and raw tags.</p>
 */
@FunctionalInterface
public interface MapDataProvider {

    /**
     * Fetches the drivable network inside a circular region.
     *
     * @param center region center.
     * @param radiusMeters region radius in meters.
     * @return raw graph, possibly empty.
     * @throws MapDataProviderException when the provider cannot serve the request.
     */
    RawRoadGraph fetchDrivableNetwork(GeoPoint center, double radiusMeters);
}
