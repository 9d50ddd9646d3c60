package org.Aayush.roadnet.search;

/**
 * Internal shortest-path output in dense index space.
 *
 * @param reachable whether target is reachable from source.
 * @param travelTimeSeconds summed edge travel time ({@code +INF} when unreachable).
 * @param distanceMeters summed edge length ({@code +INF} when unreachable).
 * @param nodePath node indices from source to target (empty when unreachable).
 * @param edgePath edge indices along the path, {@code nodePath.length - 1} entries.
 * @param settledNodes count of settled nodes during search.
 */
public record PathPlan(
        boolean reachable,
        double travelTimeSeconds,
        double distanceMeters,
        int[] nodePath,
        int[] edgePath,
        int settledNodes
) {
    /**
     * Creates a canonical unreachable plan.
     */
    static PathPlan unreachable(int settledNodes) {
        return new PathPlan(false, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
                new int[0], new int[0], settledNodes);
    }
}
