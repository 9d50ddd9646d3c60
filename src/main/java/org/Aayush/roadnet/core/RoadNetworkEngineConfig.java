package org.Aayush.roadnet.core;

import lombok.Builder;
import lombok.Value;
import org.Aayush.roadnet.acquisition.GridSynthesisConfig;
import org.Aayush.roadnet.capacity.CapacityModel;

import java.time.Duration;

/**
 * Runtime knobs of {@link RoadNetworkEngine}. Validated once when the engine is built.
 */
@Value
@Builder(toBuilder = true)
public class RoadNetworkEngineConfig {
    /** Lifetime of cached network analyses. */
    @Builder.Default
    Duration analysisTtl = Duration.ofHours(1);

    /** Lifetime of cached road networks. */
    @Builder.Default
    Duration networkTtl = Duration.ofHours(1);

    @Builder.Default
    int analysisCacheMaxEntries = 512;

    /** Upper bound on one map-data provider call. */
    @Builder.Default
    Duration providerTimeout = Duration.ofSeconds(30);

    /** Size of the pool running graph algorithms. */
    @Builder.Default
    int computeThreads = Math.max(1, Runtime.getRuntime().availableProcessors());

    /** Decimal degrees kept in cache keys. */
    @Builder.Default
    int coordinatePrecision = 4;

    /** Speed assigned to provider edges without usable speed tags. */
    @Builder.Default
    double defaultSpeedKph = 50.0d;

    @Builder.Default
    double bottleneckPercentile = 90.0d;

    @Builder.Default
    int maxBottlenecks = 10;

    /** Smallest network radius acquired for a routing request. */
    @Builder.Default
    double minRouteRadiusMeters = 2_000.0d;

    /** Routing radius as a multiple of the origin/destination distance. */
    @Builder.Default
    double routeRadiusFactor = 1.5d;

    @Builder.Default
    CapacityModel capacityModel = CapacityModel.defaults();

    @Builder.Default
    GridSynthesisConfig gridSynthesis = GridSynthesisConfig.defaults();

    public static RoadNetworkEngineConfig defaults() {
        return RoadNetworkEngineConfig.builder().build();
    }

    /**
     * @throws IllegalArgumentException on the first invalid field.
     */
    public RoadNetworkEngineConfig validate() {
        requirePositive(analysisTtl, "analysisTtl");
        requirePositive(networkTtl, "networkTtl");
        requirePositive(providerTimeout, "providerTimeout");
        if (analysisCacheMaxEntries <= 0) {
            throw new IllegalArgumentException("analysisCacheMaxEntries must be > 0, got " + analysisCacheMaxEntries);
        }
        if (computeThreads <= 0) {
            throw new IllegalArgumentException("computeThreads must be > 0, got " + computeThreads);
        }
        if (coordinatePrecision < 0 || coordinatePrecision > 9) {
            throw new IllegalArgumentException("coordinatePrecision must be in [0, 9], got " + coordinatePrecision);
        }
        if (!(defaultSpeedKph > 0.0d) || !Double.isFinite(defaultSpeedKph)) {
            throw new IllegalArgumentException("defaultSpeedKph must be finite and > 0, got " + defaultSpeedKph);
        }
        if (!(bottleneckPercentile >= 0.0d && bottleneckPercentile <= 100.0d)) {
            throw new IllegalArgumentException("bottleneckPercentile must be in [0, 100], got " + bottleneckPercentile);
        }
        if (maxBottlenecks < 0) {
            throw new IllegalArgumentException("maxBottlenecks must be >= 0, got " + maxBottlenecks);
        }
        if (!(minRouteRadiusMeters > 0.0d) || !Double.isFinite(minRouteRadiusMeters)) {
            throw new IllegalArgumentException("minRouteRadiusMeters must be finite and > 0, got " + minRouteRadiusMeters);
        }
        if (!(routeRadiusFactor > 0.0d) || !Double.isFinite(routeRadiusFactor)) {
            throw new IllegalArgumentException("routeRadiusFactor must be finite and > 0, got " + routeRadiusFactor);
        }
        if (capacityModel == null || gridSynthesis == null) {
            throw new IllegalArgumentException("capacityModel and gridSynthesis are required");
        }
        capacityModel.validate();
        gridSynthesis.validate();
        return this;
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }
}
