package org.Aayush.roadnet.acquisition;

import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;

/**
 * Capability that turns a (center, radius) region into a ready-to-use {@link RoadNetwork}.
 *
 * <p>Two implementations exist: {@link ProviderNetworkSource} (live map data, may fail) and
 * {@link GridNetworkSynthesizer} (deterministic, never fails). {@link NetworkAcquisition}
 * picks between them by availability.</p>
 */
@FunctionalInterface
public interface NetworkSource {

    /**
     * @throws MapDataProviderException when the source is backed by an unavailable provider.
     */
    RoadNetwork load(GeoPoint center, double radiusMeters);
}
