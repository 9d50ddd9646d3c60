package org.Aayush.roadnet.core;

import lombok.Builder;
import org.Aayush.roadnet.acquisition.EdgeSpeedImputer;
import org.Aayush.roadnet.acquisition.GridNetworkSynthesizer;
import org.Aayush.roadnet.acquisition.MapDataProvider;
import org.Aayush.roadnet.acquisition.NetworkAcquisition;
import org.Aayush.roadnet.acquisition.ProviderNetworkSource;
import org.Aayush.roadnet.bottleneck.BottleneckDetector;
import org.Aayush.roadnet.bottleneck.BottleneckReport;
import org.Aayush.roadnet.cache.AnalysisCache;
import org.Aayush.roadnet.capacity.CapacityEstimator;
import org.Aayush.roadnet.geo.GeoDistance;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.NetworkStats;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.Aayush.roadnet.route.AlternativeRouteSample;
import org.Aayush.roadnet.route.RoutePlanner;
import org.Aayush.roadnet.route.RouteResult;
import org.Aayush.roadnet.segment.SegmentGeometry;
import org.Aayush.roadnet.segment.SegmentGeometryCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Main road-network analysis and routing entry point.
 *
 * <p>Execution flow of one request:</p>
 * <ul>
 * <li>Validate coordinates and radius up front ({@code RN_INVALID_INPUT}).</li>
 * <li>Acquire the network asynchronously (single-flight per rounded location). Provider I/O
 * runs on the acquisition executor, never on the compute pool.</li>
 * <li>Once the network is available, run the graph algorithms on the compute pool.</li>
 * <li>Analyses go through the {@link AnalysisCache}, which holds one future per request key,
 * so concurrent requests for one location share a single analysis.</li>
 * <li>Routing acquires the network around the origin/destination midpoint and runs the
 * {@link RoutePlanner}; a disconnected pair yields an unreachable response.</li>
 * </ul>
 *
 * <p>Map-data provider failures never reach callers: the acquisition layer falls back to a
 * synthesized grid. Bottleneck or sample-route failures degrade the analysis to empty lists
 * rather than failing it.</p>
 */
public final class RoadNetworkEngine implements RoadNetworkService, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RoadNetworkEngine.class);

    private final RoadNetworkEngineConfig config;
    private final Clock clock;
    private final NetworkAcquisition acquisition;
    private final ProviderNetworkSource providerSource;
    private final AnalysisCache<CompletableFuture<NetworkAnalysis>> analysisCache;
    private final CapacityEstimator capacityEstimator;
    private final BottleneckDetector bottleneckDetector;
    private final RoutePlanner routePlanner = new RoutePlanner();
    private final SegmentGeometryCatalog segmentCatalog;
    private final ExecutorService computeExecutor;
    private final boolean ownsComputeExecutor;

    /**
     * Creates the engine.
     *
     * @param config runtime configuration; defaults to {@link RoadNetworkEngineConfig#defaults()}.
     * @param mapDataProvider live map-data provider; {@code null} means always synthesize.
     * @param clock time source for cache expiry and timestamps; defaults to UTC system clock.
     * @param segmentCatalog segment geometry lookup; defaults to the built-in catalog.
     * @param computeExecutor pool for graph algorithms; when {@code null} the engine owns one.
     */
    @Builder
    public RoadNetworkEngine(
            RoadNetworkEngineConfig config,
            MapDataProvider mapDataProvider,
            Clock clock,
            SegmentGeometryCatalog segmentCatalog,
            ExecutorService computeExecutor
    ) {
        this.config = (config == null ? RoadNetworkEngineConfig.defaults() : config).validate();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.segmentCatalog = segmentCatalog == null ? SegmentGeometryCatalog.builtIn() : segmentCatalog;

        this.providerSource = mapDataProvider == null
                ? null
                : new ProviderNetworkSource(
                        mapDataProvider,
                        new EdgeSpeedImputer(this.config.getDefaultSpeedKph()),
                        this.config.getCapacityModel(),
                        this.config.getProviderTimeout()
                );
        this.acquisition = NetworkAcquisition.builder()
                .primarySource(providerSource)
                .fallbackSource(new GridNetworkSynthesizer(this.config.getGridSynthesis(), this.config.getCapacityModel()))
                .clock(this.clock)
                .networkTtl(this.config.getNetworkTtl())
                .coordinatePrecision(this.config.getCoordinatePrecision())
                .build();
        this.analysisCache = new AnalysisCache<>(
                this.clock, this.config.getAnalysisTtl(), this.config.getAnalysisCacheMaxEntries());
        this.capacityEstimator = new CapacityEstimator(this.config.getCapacityModel());
        this.bottleneckDetector = new BottleneckDetector(this.config.getBottleneckPercentile(), this.config.getMaxBottlenecks());

        if (computeExecutor == null) {
            this.computeExecutor = Executors.newFixedThreadPool(this.config.getComputeThreads(), computeThreads());
            this.ownsComputeExecutor = true;
        } else {
            this.computeExecutor = computeExecutor;
            this.ownsComputeExecutor = false;
        }
    }

    // =========================================================================
    // Network analysis
    // =========================================================================

    @Override
    public CompletableFuture<NetworkAnalysis> analyzeNetworkCapacityAsync(double latitude, double longitude, double radiusMeters) {
        GeoPoint center;
        try {
            center = requirePoint(latitude, longitude, "location");
            requireRadius(radiusMeters);
        } catch (RoadNetworkException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        String key = AnalysisCache.analysisKey(latitude, longitude, radiusMeters, config.getCoordinatePrecision());
        CompletableFuture<NetworkAnalysis> shared;
        try {
            shared = analysisCache.getOrCompute(key, () -> onNetwork(
                    "network analysis " + key,
                    acquisition.acquireAsync(center, radiusMeters),
                    network -> computeAnalysis(center, radiusMeters, network)
            ));
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return shared.whenComplete((analysis, failure) -> {
            if (failure != null) {
                analysisCache.invalidate(key, shared);
            }
        });
    }

    @Override
    public NetworkAnalysis analyzeNetworkCapacity(double latitude, double longitude, double radiusMeters) {
        return join(analyzeNetworkCapacityAsync(latitude, longitude, radiusMeters));
    }

    private NetworkAnalysis computeAnalysis(GeoPoint center, double radiusMeters, RoadNetwork network) {
        logger.info("Analyzing network capacity for {} radius {} m", center, radiusMeters);
        if (network.isEmpty()) {
            throw new RoadNetworkException(
                    RoadNetworkException.REASON_EMPTY_NETWORK,
                    "no road nodes within " + radiusMeters + " m of " + center
            );
        }

        return NetworkAnalysis.builder()
                .location(center)
                .radiusMeters(radiusMeters)
                .networkStats(NetworkStats.of(network))
                .capacityAnalysis(capacityEstimator.estimateCapacity(network))
                .bottlenecks(findBottlenecks(network))
                .sampleAlternativeRoutes(sampleAlternativeRoutes(network))
                .timestamp(clock.instant())
                .build();
    }

    private List<BottleneckReport> findBottlenecks(RoadNetwork network) {
        try {
            return bottleneckDetector.findBottlenecks(network);
        } catch (RuntimeException ex) {
            logger.error("Bottleneck detection failed for network {}, reporting none", network.center(), ex);
            return List.of();
        }
    }

    private List<AlternativeRouteSample> sampleAlternativeRoutes(RoadNetwork network) {
        try {
            return routePlanner.sampleAlternativeRoutes(network);
        } catch (RuntimeException ex) {
            logger.error("Sample route computation failed for network {}, reporting none", network.center(), ex);
            return List.of();
        }
    }

    // =========================================================================
    // Routing
    // =========================================================================

    @Override
    public CompletableFuture<RoutingResponse> findOptimalRoutesAsync(
            double originLatitude,
            double originLongitude,
            double destinationLatitude,
            double destinationLongitude,
            List<String> avoidSegmentIds
    ) {
        GeoPoint origin;
        GeoPoint destination;
        try {
            origin = requirePoint(originLatitude, originLongitude, "origin");
            destination = requirePoint(destinationLatitude, destinationLongitude, "destination");
        } catch (RoadNetworkException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        List<String> avoid = avoidSegmentIds == null ? List.of() : List.copyOf(avoidSegmentIds);
        GeoPoint center = origin.midpoint(destination);
        double radiusMeters = routeRadiusMeters(origin, destination);
        logger.info("Finding routes {} -> {} (network center {}, radius {} m)", origin, destination, center, radiusMeters);
        return onNetwork(
                "routing " + origin + " -> " + destination,
                acquisition.acquireAsync(center, radiusMeters),
                network -> computeRoutes(origin, destination, avoid, network)
        );
    }

    @Override
    public RoutingResponse findOptimalRoutes(
            double originLatitude,
            double originLongitude,
            double destinationLatitude,
            double destinationLongitude,
            List<String> avoidSegmentIds
    ) {
        return join(findOptimalRoutesAsync(
                originLatitude, originLongitude, destinationLatitude, destinationLongitude, avoidSegmentIds));
    }

    private RoutingResponse computeRoutes(
            GeoPoint origin,
            GeoPoint destination,
            List<String> avoidSegmentIds,
            RoadNetwork network
    ) {
        RoutingResponse.RoutingResponseBuilder response = RoutingResponse.builder()
                .origin(origin)
                .destination(destination);
        try {
            List<RouteResult> routes = avoidSegmentIds.isEmpty()
                    ? List.of(routePlanner.shortestRoute(network, origin, destination))
                    : routePlanner.alternateRoute(network, origin, destination, avoidSegmentIds);
            return response.reachable(true).routes(routes).build();
        } catch (RoadNetworkException ex) {
            if (!RoadNetworkException.REASON_NO_PATH_FOUND.equals(ex.getReasonCode())) {
                throw ex;
            }
            logger.info("No route {} -> {}: {}", origin, destination, ex.getMessage());
            return response.reachable(false).build();
        }
    }

    /**
     * Radius of the network acquired for a routing request:
     * {@code max(minRouteRadiusMeters, distance * routeRadiusFactor)}.
     */
    double routeRadiusMeters(GeoPoint origin, GeoPoint destination) {
        double distanceKm = GeoDistance.haversineMeters(origin, destination) / 1000.0d;
        return Math.max(config.getMinRouteRadiusMeters(), distanceKm * 1000.0d * config.getRouteRadiusFactor());
    }

    // =========================================================================
    // Segment geometry
    // =========================================================================

    @Override
    public Optional<SegmentGeometry> getSegmentGeometry(String segmentId) {
        return segmentCatalog.find(segmentId);
    }

    // =========================================================================
    // Cache housekeeping
    // =========================================================================

    /**
     * Drops the cached analysis for one request. Returns whether an entry was present.
     */
    public boolean invalidateAnalysis(double latitude, double longitude, double radiusMeters) {
        return analysisCache.invalidate(
                AnalysisCache.analysisKey(latitude, longitude, radiusMeters, config.getCoordinatePrecision()));
    }

    /**
     * Drops every cached analysis and network.
     */
    public void clearCaches() {
        analysisCache.clear();
        acquisition.clear();
    }

    NetworkAcquisition networkAcquisition() {
        return acquisition;
    }

    AnalysisCache<CompletableFuture<NetworkAnalysis>> analysisCache() {
        return analysisCache;
    }

    @Override
    public void close() {
        if (ownsComputeExecutor) {
            computeExecutor.shutdownNow();
        }
        acquisition.close();
        if (providerSource != null) {
            providerSource.close();
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    /**
     * Runs {@code task} on the compute pool once {@code network} completes. Failures other
     * than {@link RoadNetworkException} surface as {@code RN_COMPUTE_FAILED}.
     */
    private <T> CompletableFuture<T> onNetwork(
            String description,
            CompletableFuture<RoadNetwork> network,
            Function<RoadNetwork, T> task
    ) {
        return network
                .thenApplyAsync(task, computeExecutor)
                .handle((value, failure) -> {
                    if (failure == null) {
                        return value;
                    }
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause()
                            : failure;
                    if (cause instanceof RoadNetworkException roadNetworkException) {
                        throw roadNetworkException;
                    }
                    throw new RoadNetworkException(
                            RoadNetworkException.REASON_COMPUTE_FAILED,
                            description + " failed: " + cause.getMessage(),
                            cause
                    );
                });
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }
    }

    private static GeoPoint requirePoint(double latitude, double longitude, String name) {
        if (!GeoPoint.isValid(latitude, longitude)) {
            throw new RoadNetworkException(
                    RoadNetworkException.REASON_INVALID_INPUT,
                    name + " must be a finite coordinate with latitude in [-90, 90] and longitude in [-180, 180], got ("
                            + latitude + ", " + longitude + ")"
            );
        }
        return GeoPoint.of(latitude, longitude);
    }

    private static void requireRadius(double radiusMeters) {
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0.0d) {
            throw new RoadNetworkException(
                    RoadNetworkException.REASON_INVALID_INPUT,
                    "radius must be finite and > 0, got " + radiusMeters
            );
        }
    }

    private static ThreadFactory computeThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "roadnet-compute-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
