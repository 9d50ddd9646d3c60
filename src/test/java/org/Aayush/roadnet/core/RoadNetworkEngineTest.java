package org.Aayush.roadnet.core;

import org.Aayush.roadnet.acquisition.MapDataProvider;
import org.Aayush.roadnet.acquisition.MapDataProviderException;
import org.Aayush.roadnet.acquisition.RawRoadGraph;
import org.Aayush.roadnet.bottleneck.BottleneckReport;
import org.Aayush.roadnet.capacity.CapacityStatistics;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.route.RouteResult;
import org.Aayush.roadnet.testutil.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RoadNetworkEngineTest {

    private static final double SF_LAT = 37.7749;
    private static final double SF_LON = -122.4194;
    private static final double OAKLAND_LAT = 37.8044;
    private static final double OAKLAND_LON = -122.2711;

    @Test
    @DisplayName("Scenario: San Francisco without a provider analyzes the synthesized grid")
    void testSanFranciscoAnalysis() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            NetworkAnalysis analysis = engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 2000);

            assertEquals(GeoPoint.of(SF_LAT, SF_LON), analysis.getLocation());
            assertEquals(2000.0d, analysis.getRadiusMeters());
            assertEquals(25, analysis.getNetworkStats().getTotalNodes());
            assertEquals(80, analysis.getNetworkStats().getTotalEdges());
            assertEquals(40.0d, analysis.getNetworkStats().getTotalLengthKm(), 1e-9);
            assertTrue(analysis.getNetworkStats().isConnected());

            CapacityStatistics stats = analysis.getCapacityAnalysis().statistics().orElseThrow();
            assertEquals(2000.0d, stats.getMean(), 1e-9);
            assertTrue(analysis.getCapacityAnalysis().getHighCapacityRoads().isEmpty());

            List<BottleneckReport> bottlenecks = analysis.getBottlenecks();
            assertTrue(bottlenecks.size() <= 10);
            for (int i = 1; i < bottlenecks.size(); i++) {
                assertTrue(bottlenecks.get(i - 1).getCentralityScore() >= bottlenecks.get(i).getCentralityScore());
            }
            assertEquals(2, analysis.getSampleAlternativeRoutes().size());
            assertNotNull(analysis.getTimestamp());
        }
    }

    @Test
    @DisplayName("Analysis cache: repeated requests within TTL return the same result; expiry recomputes")
    void testAnalysisCaching() {
        MutableClock clock = MutableClock.startingAtEpoch();
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().clock(clock).build()) {
            NetworkAnalysis first = engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 2000);
            NetworkAnalysis second = engine.analyzeNetworkCapacity(37.77491, -122.41941, 2000);
            assertSame(first, second);
            assertEquals(1, engine.analysisCache().computeCount());

            clock.advance(Duration.ofHours(1));
            NetworkAnalysis third = engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 2000);
            assertNotSame(first, third);
            assertEquals(2, engine.analysisCache().computeCount());

            assertTrue(engine.invalidateAnalysis(SF_LAT, SF_LON, 2000));
            engine.clearCaches();
            assertEquals(0, engine.analysisCache().size());
            assertEquals(0, engine.networkAcquisition().size());
        }
    }

    @Test
    @DisplayName("Invalid input is rejected with RN_INVALID_INPUT")
    void testInvalidInput() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            RoadNetworkException badLatitude = assertThrows(RoadNetworkException.class,
                    () -> engine.analyzeNetworkCapacity(95.0, SF_LON, 2000));
            assertEquals(RoadNetworkException.REASON_INVALID_INPUT, badLatitude.getReasonCode());

            RoadNetworkException badRadius = assertThrows(RoadNetworkException.class,
                    () -> engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 0));
            assertEquals(RoadNetworkException.REASON_INVALID_INPUT, badRadius.getReasonCode());

            RoadNetworkException badDestination = assertThrows(RoadNetworkException.class,
                    () -> engine.findOptimalRoutes(SF_LAT, SF_LON, Double.NaN, OAKLAND_LON, null));
            assertEquals(RoadNetworkException.REASON_INVALID_INPUT, badDestination.getReasonCode());

            CompletableFuture<NetworkAnalysis> async = engine.analyzeNetworkCapacityAsync(SF_LAT, SF_LON, -5);
            CompletionException ex = assertThrows(CompletionException.class, async::join);
            assertInstanceOf(RoadNetworkException.class, ex.getCause());
        }
    }

    @Test
    @DisplayName("Scenario: San Francisco to Oakland routes over the synthesized grid")
    void testSanFranciscoToOakland() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            RoutingResponse response = engine.findOptimalRoutes(SF_LAT, SF_LON, OAKLAND_LAT, OAKLAND_LON, null);

            assertTrue(response.isReachable());
            assertEquals(1, response.getRoutes().size());
            RouteResult route = response.getRoutes().get(0);
            assertEquals(RouteResult.RouteType.FASTEST, route.getRouteType());
            assertTrue(route.getDistanceMeters() > 0);
            assertTrue(route.getDistanceMeters() <= 24 * 500.0d);
            assertEquals(route.getDistanceMeters() / (50.0d / 3.6d), route.getTravelTimeSeconds(), 1e-6);
            assertEquals(route.getPathNodeIds().size(), route.getCoordinates().size());
        }
    }

    @Test
    @DisplayName("Segments to avoid trigger the midpoint-removal alternate")
    void testAlternateWithAvoidList() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            RoutingResponse response = engine.findOptimalRoutes(
                    SF_LAT, SF_LON, OAKLAND_LAT, OAKLAND_LON, List.of("SEG1"));

            assertEquals(2, response.getRoutes().size());
            RouteResult alternate = response.getRoutes().get(1);
            assertEquals(RouteResult.RouteType.AVOIDING_CONGESTION, alternate.getRouteType());
            assertNotNull(alternate.getRemovedEdge());
            assertTrue(alternate.getTravelTimeSeconds() >= response.getRoutes().get(0).getTravelTimeSeconds());
        }
    }

    @Test
    @DisplayName("Routing radius: at least 2 km, otherwise 1.5x the endpoint distance")
    void testRouteRadius() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            GeoPoint sf = GeoPoint.of(SF_LAT, SF_LON);
            assertEquals(2000.0d, engine.routeRadiusMeters(sf, GeoPoint.of(37.7750, -122.4194)), 1e-9);
            double radius = engine.routeRadiusMeters(sf, GeoPoint.of(OAKLAND_LAT, OAKLAND_LON));
            assertTrue(radius > 19_000 && radius < 21_000, "radius " + radius);
        }
    }

    @Test
    @Timeout(value = 15, unit = TimeUnit.SECONDS)
    @DisplayName("Provider timeout falls back to the synthesized grid")
    void testProviderTimeoutFallsBack() {
        MapDataProvider hung = (center, radius) -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            throw new MapDataProviderException(MapDataProviderException.REASON_UNAVAILABLE, "interrupted");
        };
        RoadNetworkEngineConfig config = RoadNetworkEngineConfig.builder()
                .providerTimeout(Duration.ofMillis(100))
                .build();
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().config(config).mapDataProvider(hung).build()) {
            NetworkAnalysis analysis = engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 2000);

            assertEquals(25, analysis.getNetworkStats().getTotalNodes());
            assertEquals(1, engine.networkAcquisition().fallbackCount());
        }
    }

    @Test
    @DisplayName("Provider network: disconnected endpoints give an unreachable response")
    void testUnreachable() {
        RawRoadGraph raw = new RawRoadGraph(
                List.of(
                        new RawRoadGraph.RawNode("A", 37.7700, -122.4200),
                        new RawRoadGraph.RawNode("B", 37.7710, -122.4200),
                        new RawRoadGraph.RawNode("X", 37.8000, -122.3000),
                        new RawRoadGraph.RawNode("Y", 37.8010, -122.3000)
                ),
                List.of(
                        new RawRoadGraph.RawEdge("A", "B", 111, "residential", null),
                        new RawRoadGraph.RawEdge("B", "A", 111, "residential", null),
                        new RawRoadGraph.RawEdge("X", "Y", 111, "residential", null),
                        new RawRoadGraph.RawEdge("Y", "X", 111, "residential", null)
                )
        );
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().mapDataProvider((center, radius) -> raw).build()) {
            RoutingResponse response = engine.findOptimalRoutes(37.7700, -122.4200, 37.8010, -122.3000, null);

            assertFalse(response.isReachable());
            assertTrue(response.getRoutes().isEmpty());
            assertEquals(0, engine.networkAcquisition().fallbackCount());
        }
    }

    @Test
    @DisplayName("Provider network without nodes fails with RN_EMPTY_NETWORK")
    void testEmptyNetwork() {
        RawRoadGraph empty = new RawRoadGraph(List.of(), List.of());
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().mapDataProvider((center, radius) -> empty).build()) {
            RoadNetworkException analysis = assertThrows(RoadNetworkException.class,
                    () -> engine.analyzeNetworkCapacity(SF_LAT, SF_LON, 2000));
            assertEquals(RoadNetworkException.REASON_EMPTY_NETWORK, analysis.getReasonCode());

            RoadNetworkException routing = assertThrows(RoadNetworkException.class,
                    () -> engine.findOptimalRoutes(SF_LAT, SF_LON, 37.7750, -122.4195, null));
            assertEquals(RoadNetworkException.REASON_EMPTY_NETWORK, routing.getReasonCode());
        }
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency: parallel analyses of one location build the network once")
    void testConcurrentAnalyses() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder()
                .config(RoadNetworkEngineConfig.builder().computeThreads(4).build())
                .build()) {
            List<CompletableFuture<NetworkAnalysis>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(engine.analyzeNetworkCapacityAsync(SF_LAT, SF_LON, 2000));
            }
            for (CompletableFuture<NetworkAnalysis> future : futures) {
                assertEquals(25, future.join().getNetworkStats().getTotalNodes());
            }
            assertEquals(1, engine.networkAcquisition().buildCount());
        }
    }

    @Test
    @Timeout(value = 20, unit = TimeUnit.SECONDS)
    @DisplayName("Concurrency: slow provider I/O for one location does not stall routing on a cached network")
    void testSlowProviderDoesNotStallComputePool() throws Exception {
        CountDownLatch fetchesStarted = new CountDownLatch(2);
        CountDownLatch releaseFetches = new CountDownLatch(1);
        RawRoadGraph pair = new RawRoadGraph(
                List.of(
                        new RawRoadGraph.RawNode("A", 37.7749, -122.4194),
                        new RawRoadGraph.RawNode("B", 37.7759, -122.4194)
                ),
                List.of(
                        new RawRoadGraph.RawEdge("A", "B", 111, "residential", null),
                        new RawRoadGraph.RawEdge("B", "A", 111, "residential", null)
                )
        );
        MapDataProvider provider = (center, radius) -> {
            if (center.getLatitude() <= 0) {
                throw new MapDataProviderException(MapDataProviderException.REASON_UNAVAILABLE, "no coverage");
            }
            fetchesStarted.countDown();
            try {
                releaseFetches.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new MapDataProviderException(MapDataProviderException.REASON_UNAVAILABLE, "interrupted", ex);
            }
            return pair;
        };
        RoadNetworkEngineConfig config = RoadNetworkEngineConfig.builder().computeThreads(2).build();
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().config(config).mapDataProvider(provider).build()) {
            assertTrue(engine.findOptimalRoutes(-10.0, 20.0, -10.001, 20.001, null).isReachable());

            CompletableFuture<NetworkAnalysis> first = engine.analyzeNetworkCapacityAsync(SF_LAT, SF_LON, 2000);
            CompletableFuture<NetworkAnalysis> second = engine.analyzeNetworkCapacityAsync(SF_LAT, SF_LON, 3000);
            try {
                assertTrue(fetchesStarted.await(5, TimeUnit.SECONDS));

                RoutingResponse cached = engine.findOptimalRoutesAsync(-10.0, 20.0, -10.001, 20.001, null)
                        .get(2, TimeUnit.SECONDS);
                assertTrue(cached.isReachable());
                assertFalse(first.isDone());
                assertFalse(second.isDone());
            } finally {
                releaseFetches.countDown();
            }

            assertEquals(2, first.get(5, TimeUnit.SECONDS).getNetworkStats().getTotalNodes());
            assertEquals(2, second.get(5, TimeUnit.SECONDS).getNetworkStats().getTotalNodes());
        }
    }

    @Test
    @DisplayName("Segment geometry lookup")
    void testSegmentGeometry() {
        try (RoadNetworkEngine engine = RoadNetworkEngine.builder().build()) {
            assertTrue(engine.getSegmentGeometry("SEG001").isPresent());
            assertTrue(engine.getSegmentGeometry("NOPE").isEmpty());
        }
    }

    @Test
    @DisplayName("Invalid configuration is rejected at construction")
    void testInvalidConfig() {
        RoadNetworkEngineConfig config = RoadNetworkEngineConfig.builder().maxBottlenecks(-1).build();
        assertThrows(IllegalArgumentException.class, () -> RoadNetworkEngine.builder().config(config).build());
    }
}
