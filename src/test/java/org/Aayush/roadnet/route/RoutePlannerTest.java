package org.Aayush.roadnet.route;

import org.Aayush.roadnet.acquisition.GridNetworkSynthesizer;
import org.Aayush.roadnet.core.RoadNetworkException;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.Aayush.roadnet.testutil.TestNetworks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoutePlannerTest {

    private final RoutePlanner planner = new RoutePlanner();

    @Test
    @DisplayName("Snapping picks the nearest node by great-circle distance")
    void testNearestNode() {
        RoadNetwork network = TestNetworks.chain();
        assertEquals("A", planner.nearestNode(network, GeoPoint.of(37.7600, -122.4200)));
        assertEquals("B", planner.nearestNode(network, GeoPoint.of(37.7800, -122.4100)));
        assertEquals("C", planner.nearestNode(network, GeoPoint.of(37.9000, -122.4200)));
    }

    @Test
    @DisplayName("Snapping on an empty network fails with RN_EMPTY_NETWORK")
    void testNearestNodeEmpty() {
        RoadNetworkException ex = assertThrows(RoadNetworkException.class,
                () -> planner.nearestNode(TestNetworks.empty(), TestNetworks.SAN_FRANCISCO));
        assertEquals(RoadNetworkException.REASON_EMPTY_NETWORK, ex.getReasonCode());
    }

    @Test
    @DisplayName("Shortest route: positive cost and coordinates aligned with nodes")
    void testShortestRoute() {
        RoadNetwork network = TestNetworks.diamond();
        RouteResult route = planner.shortestRoute(network, GeoPoint.of(37.7700, -122.4200), GeoPoint.of(37.7800, -122.4200));

        assertEquals(RouteResult.RouteType.FASTEST, route.getRouteType());
        assertEquals(List.of("S", "L", "T"), route.getPathNodeIds());
        assertEquals(route.getPathNodeIds().size(), route.getCoordinates().size());
        assertEquals(120.0d, route.getTravelTimeSeconds(), 1e-9);
        assertEquals(2000.0d, route.getDistanceMeters(), 1e-9);
        assertNull(route.getRemovedEdge());
        assertArrayEquals(new double[]{-122.4250, 37.7750}, route.geoJsonCoordinates().get(1), 1e-12);
    }

    @Test
    @DisplayName("Shortest route on the grid: every non-trivial route has positive cost")
    void testGridRoutesPositive() {
        RoadNetwork grid = new GridNetworkSynthesizer().load(TestNetworks.SAN_FRANCISCO, 2000);
        for (int target = 1; target < grid.nodeCount(); target++) {
            RouteResult route = planner.shortestRoute(grid, grid.point(0), grid.point(target));
            assertTrue(route.getTravelTimeSeconds() > 0);
            assertTrue(route.getDistanceMeters() > 0);
            assertEquals(route.getPathNodeIds().size(), route.getCoordinates().size());
            assertEquals((route.getPathNodeIds().size() - 1) * 500.0d, route.getDistanceMeters(), 1e-9);
        }
    }

    @Test
    @DisplayName("Disconnected endpoints fail with RN_NO_PATH_FOUND")
    void testNoPath() {
        RoadNetworkException ex = assertThrows(RoadNetworkException.class,
                () -> planner.shortestRoute(TestNetworks.disconnected(),
                        GeoPoint.of(37.7700, -122.4200), GeoPoint.of(37.8010, -122.3000)));
        assertEquals(RoadNetworkException.REASON_NO_PATH_FOUND, ex.getReasonCode());
    }

    @Test
    @DisplayName("Alternate route: an unmapped segment id still removes the primary midpoint edge")
    void testAlternateRemovesMidpointEdge() {
        RoadNetwork grid = new GridNetworkSynthesizer().load(TestNetworks.SAN_FRANCISCO, 2000);
        List<RouteResult> routes = planner.alternateRoute(grid, grid.point(0), grid.point(24), List.of("SEG1"));

        assertEquals(2, routes.size());
        RouteResult primary = routes.get(0);
        RouteResult alternate = routes.get(1);
        assertEquals(RouteResult.RouteType.AVOIDING_CONGESTION, alternate.getRouteType());

        List<String> nodes = primary.getPathNodeIds();
        int edgeCount = nodes.size() - 1;
        int position = Math.min(nodes.size() / 2, edgeCount - 1);
        String expectedRemoved = nodes.get(position) + "-" + nodes.get(position + 1);
        assertEquals(expectedRemoved, alternate.getRemovedEdge());
        assertNotEquals("SEG1", alternate.getRemovedEdge());

        List<String> alternateNodes = alternate.getPathNodeIds();
        for (int i = 0; i + 1 < alternateNodes.size(); i++) {
            assertNotEquals(expectedRemoved, alternateNodes.get(i) + "-" + alternateNodes.get(i + 1));
        }
        assertTrue(alternate.getTravelTimeSeconds() >= primary.getTravelTimeSeconds());
    }

    @Test
    @DisplayName("Alternate route is omitted when removing the midpoint edge disconnects the pair")
    void testAlternateOmitted() {
        RoadNetwork network = TestNetworks.chain();
        List<RouteResult> routes = planner.alternateRoute(
                network, GeoPoint.of(37.7700, -122.4200), GeoPoint.of(37.7880, -122.4200), List.of("SEG1"));

        assertEquals(1, routes.size());
        assertEquals(RouteResult.RouteType.FASTEST, routes.get(0).getRouteType());
    }

    @Test
    @DisplayName("Alternate route is omitted when origin and destination snap to one node")
    void testAlternateSameNode() {
        RoadNetwork network = TestNetworks.chain();
        List<RouteResult> routes = planner.alternateRoute(
                network, GeoPoint.of(37.7790, -122.4200), GeoPoint.of(37.7791, -122.4200), List.of());

        assertEquals(1, routes.size());
        assertEquals(List.of("B"), routes.get(0).getPathNodeIds());
        assertEquals(0.0d, routes.get(0).getTravelTimeSeconds());
    }

    @Test
    @DisplayName("Sample routes: (first, last) and (n/4, 3n/4) on the grid")
    void testSampleAlternativeRoutes() {
        RoadNetwork grid = new GridNetworkSynthesizer().load(TestNetworks.SAN_FRANCISCO, 2000);
        List<AlternativeRouteSample> samples = planner.sampleAlternativeRoutes(grid);

        assertEquals(2, samples.size());
        assertEquals("0", samples.get(0).getOriginNodeId());
        assertEquals("24", samples.get(0).getDestinationNodeId());
        assertEquals("6", samples.get(1).getOriginNodeId());
        assertEquals("18", samples.get(1).getDestinationNodeId());
        for (AlternativeRouteSample sample : samples) {
            assertEquals(
                    sample.getAlternativeRoute().getTravelTimeSeconds() - sample.getPrimaryRoute().getTravelTimeSeconds(),
                    sample.timeDifferenceSeconds(),
                    1e-9);
            assertTrue(sample.timeDifferenceSeconds() >= 0);
        }
    }

    @Test
    @DisplayName("Sample routes: small or tree-shaped networks yield none")
    void testSampleNone() {
        assertTrue(planner.sampleAlternativeRoutes(TestNetworks.chain()).isEmpty());
        RoadNetwork line = RoadNetwork.builder(TestNetworks.SAN_FRANCISCO, 2000)
                .addNode("A", 37.770, -122.42)
                .addNode("B", 37.771, -122.42)
                .addNode("C", 37.772, -122.42)
                .addNode("D", 37.773, -122.42)
                .addBidirectionalEdge("A", "B", 100, 50)
                .addBidirectionalEdge("B", "C", 100, 50)
                .addBidirectionalEdge("C", "D", 100, 50)
                .build();
        assertTrue(planner.sampleAlternativeRoutes(line).isEmpty());
    }

    @Test
    @DisplayName("Sample routes: direct one-edge primaries are not sampled even when a detour exists")
    void testSampleSkipsDirectNeighbours() {
        RoadNetwork shortcuts = RoadNetwork.builder(TestNetworks.SAN_FRANCISCO, 2000)
                .addNode("A", 37.770, -122.42)
                .addNode("B", 37.771, -122.42)
                .addNode("C", 37.772, -122.42)
                .addNode("D", 37.773, -122.42)
                .addEdge("A", "D", 100, 50)
                .addEdge("A", "B", 100, 50)
                .addEdge("B", "C", 100, 50)
                .addEdge("C", "D", 100, 50)
                .addEdge("B", "D", 100, 50)
                .build();

        // Both sampled pairs, (A, D) and (B, D), have a detour once the direct edge is gone.
        assertEquals(2, planner.alternateRoute(shortcuts, shortcuts.point(0), shortcuts.point(3), List.of("x")).size());
        assertEquals(2, planner.alternateRoute(shortcuts, shortcuts.point(1), shortcuts.point(3), List.of("x")).size());
        assertTrue(planner.sampleAlternativeRoutes(shortcuts).isEmpty());
    }

    @Test
    @DisplayName("Routing never mutates the shared network")
    void testNetworkUnchanged() {
        RoadNetwork grid = new GridNetworkSynthesizer().load(TestNetworks.SAN_FRANCISCO, 2000);
        RouteResult before = planner.shortestRoute(grid, grid.point(0), grid.point(24));
        planner.alternateRoute(grid, grid.point(0), grid.point(24), List.of("SEG1"));

        assertEquals(80, grid.edgeCount());
        assertEquals(before, planner.shortestRoute(grid, grid.point(0), grid.point(24)));
    }
}
