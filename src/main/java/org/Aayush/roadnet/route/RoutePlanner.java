package org.Aayush.roadnet.route;

import org.Aayush.roadnet.core.RoadNetworkException;
import org.Aayush.roadnet.geo.GeoDistance;
import org.Aayush.roadnet.geo.GeoPoint;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.Aayush.roadnet.search.EdgeExclusion;
import org.Aayush.roadnet.search.PathPlan;
import org.Aayush.roadnet.search.ShortestPathSearch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Snaps coordinates to network nodes and computes fastest and alternate routes.
 *
 * <p>All operations are read-only on the given network. "Removing" an edge for an alternate
 * route is an {@link EdgeExclusion} overlay that lives only for that computation.</p>
 *
 * <p>Alternate-route heuristic: drop the edge at the midpoint of the primary path
 * (edge position {@code nodeCount / 2}, clamped to the last edge) and search again.
 * Requested segment ids are accepted but not mapped to edges; no segment-to-edge
 * correspondence exists, so the midpoint edge is removed regardless of their values.</p>
 */
public final class RoutePlanner {
    private static final Logger logger = LoggerFactory.getLogger(RoutePlanner.class);

    private static final int MIN_NODES_FOR_SAMPLES = 4;
    private static final int MIN_SAMPLE_PATH_NODES = 3;

    /**
     * Returns the id of the node closest (haversine) to {@code point}, by linear scan.
     * Ties keep the earliest node in insertion order.
     *
     * @throws RoadNetworkException with {@link RoadNetworkException#REASON_EMPTY_NETWORK}.
     */
    public String nearestNode(RoadNetwork network, GeoPoint point) {
        return network.nodeId(nearestNodeIndex(network, point));
    }

    int nearestNodeIndex(RoadNetwork network, GeoPoint point) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(point, "point");
        if (network.isEmpty()) {
            throw new RoadNetworkException(RoadNetworkException.REASON_EMPTY_NETWORK, "network has no nodes to snap to");
        }
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int node = 0; node < network.nodeCount(); node++) {
            double distance = GeoDistance.haversineMeters(
                    point.getLatitude(), point.getLongitude(), network.latitude(node), network.longitude(node));
            if (distance < bestDistance) {
                bestDistance = distance;
                best = node;
            }
        }
        return best;
    }

    /**
     * Fastest route between the nodes nearest to {@code origin} and {@code destination}.
     *
     * @throws RoadNetworkException {@code RN_EMPTY_NETWORK} when nothing can be snapped,
     * {@code RN_NO_PATH_FOUND} when the snapped nodes are disconnected.
     */
    public RouteResult shortestRoute(RoadNetwork network, GeoPoint origin, GeoPoint destination) {
        int source = nearestNodeIndex(network, origin);
        int target = nearestNodeIndex(network, destination);
        PathPlan plan = ShortestPathSearch.search(network, source, target, EdgeExclusion.none());
        if (!plan.reachable()) {
            throw noPath(network, source, target);
        }
        return toRoute(network, plan, RouteResult.RouteType.FASTEST, null);
    }

    /**
     * Fastest route followed, when one exists, by the route found after removing the
     * primary path's midpoint edge.
     *
     * @param avoidSegmentIds accepted for interface compatibility; not mapped to edges.
     * @return primary route, plus the alternate when the destination is still reachable.
     * @throws RoadNetworkException as {@link #shortestRoute(RoadNetwork, GeoPoint, GeoPoint)}.
     */
    public List<RouteResult> alternateRoute(
            RoadNetwork network,
            GeoPoint origin,
            GeoPoint destination,
            Collection<String> avoidSegmentIds
    ) {
        int source = nearestNodeIndex(network, origin);
        int target = nearestNodeIndex(network, destination);
        PathPlan primary = ShortestPathSearch.search(network, source, target, EdgeExclusion.none());
        if (!primary.reachable()) {
            throw noPath(network, source, target);
        }

        List<RouteResult> routes = new ArrayList<>(2);
        routes.add(toRoute(network, primary, RouteResult.RouteType.FASTEST, null));
        if (avoidSegmentIds != null && !avoidSegmentIds.isEmpty()) {
            logger.debug("Segment ids {} have no edge mapping; removing primary midpoint edge instead", avoidSegmentIds);
        }
        alternateAfterMidpointRemoval(network, primary, source, target).ifPresent(routes::add);
        return List.copyOf(routes);
    }

    /**
     * Primary/alternate pairs for up to two node pairs in insertion order:
     * (first, last) and (n/4, 3n/4). Pairs whose primary path has fewer than three nodes,
     * or without both routes, are skipped.
     */
    public List<AlternativeRouteSample> sampleAlternativeRoutes(RoadNetwork network) {
        Objects.requireNonNull(network, "network");
        int n = network.nodeCount();
        if (n < MIN_NODES_FOR_SAMPLES) {
            return List.of();
        }

        int[][] pairs = {
                {0, n - 1},
                {n / 4, 3 * n / 4}
        };
        List<AlternativeRouteSample> samples = new ArrayList<>(pairs.length);
        for (int[] pair : pairs) {
            PathPlan primary = ShortestPathSearch.search(network, pair[0], pair[1], EdgeExclusion.none());
            if (!primary.reachable() || primary.nodePath().length < MIN_SAMPLE_PATH_NODES) {
                continue;
            }
            alternateAfterMidpointRemoval(network, primary, pair[0], pair[1]).ifPresent(alternative ->
                    samples.add(new AlternativeRouteSample(
                            network.nodeId(pair[0]),
                            network.nodeId(pair[1]),
                            toRoute(network, primary, RouteResult.RouteType.FASTEST, null),
                            alternative
                    )));
        }
        return List.copyOf(samples);
    }

    /**
     * Edge index at the midpoint of a path, or {@code -1} when the path has no edges.
     */
    static int midpointEdge(PathPlan plan) {
        int[] edges = plan.edgePath();
        if (edges.length == 0) {
            return -1;
        }
        return edges[Math.min(plan.nodePath().length / 2, edges.length - 1)];
    }

    private Optional<RouteResult> alternateAfterMidpointRemoval(RoadNetwork network, PathPlan primary, int source, int target) {
        int removed = midpointEdge(primary);
        if (removed < 0) {
            return Optional.empty();
        }
        PathPlan alternate = ShortestPathSearch.search(network, source, target, EdgeExclusion.of(network, removed));
        if (!alternate.reachable()) {
            logger.debug("No alternate route once edge {} is removed", network.edgeLabel(removed));
            return Optional.empty();
        }
        return Optional.of(toRoute(network, alternate, RouteResult.RouteType.AVOIDING_CONGESTION, network.edgeLabel(removed)));
    }

    private static RouteResult toRoute(RoadNetwork network, PathPlan plan, RouteResult.RouteType type, String removedEdge) {
        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .routeType(type)
                .travelTimeSeconds(plan.travelTimeSeconds())
                .distanceMeters(plan.distanceMeters())
                .removedEdge(removedEdge);
        for (int node : plan.nodePath()) {
            builder.pathNodeId(network.nodeId(node));
            builder.coordinate(network.point(node));
        }
        return builder.build();
    }

    private static RoadNetworkException noPath(RoadNetwork network, int source, int target) {
        return new RoadNetworkException(
                RoadNetworkException.REASON_NO_PATH_FOUND,
                "no path from node " + network.nodeId(source) + " to node " + network.nodeId(target)
        );
    }
}
