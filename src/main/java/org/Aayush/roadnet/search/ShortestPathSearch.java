package org.Aayush.roadnet.search;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.roadnet.graph.RoadNetwork;

import java.util.Arrays;
import java.util.Objects;

/**
 * Point-to-point Dijkstra over edge travel times.
 *
 * <p>All weights are non-negative, so the search stops as soon as the target is settled.
 * Relaxation is strict ({@code <}); among equal-time paths the first one discovered wins,
 * which keeps results deterministic for a given network.</p>
 */
public final class ShortestPathSearch {
    private static final int NO_EDGE = -1;

    private ShortestPathSearch() {
    }

    /**
     * Computes the minimum-travel-time path between two node indices.
     *
     * @param network graph to search (read-only).
     * @param sourceNode source node index.
     * @param targetNode target node index.
     * @param exclusion edges hidden from this search.
     * @return reachable plan, or {@link PathPlan#unreachable(int)}.
     */
    public static PathPlan search(RoadNetwork network, int sourceNode, int targetNode, EdgeExclusion exclusion) {
        Objects.requireNonNull(network, "network");
        Objects.requireNonNull(exclusion, "exclusion");
        int nodeCount = network.nodeCount();
        if (sourceNode < 0 || sourceNode >= nodeCount || targetNode < 0 || targetNode >= nodeCount) {
            throw new IndexOutOfBoundsException(
                    "source/target out of bounds: " + sourceNode + ", " + targetNode + " [0, " + nodeCount + ")");
        }

        if (sourceNode == targetNode) {
            return new PathPlan(true, 0.0d, 0.0d, new int[]{sourceNode}, new int[0], 0);
        }

        double[] time = new double[nodeCount];
        int[] predecessorEdge = new int[nodeCount];
        boolean[] settled = new boolean[nodeCount];
        Arrays.fill(time, Double.POSITIVE_INFINITY);
        Arrays.fill(predecessorEdge, NO_EDGE);

        NodeHeap frontier = new NodeHeap(nodeCount);
        time[sourceNode] = 0.0d;
        frontier.insertOrDecrease(sourceNode, 0.0d);
        int settledCount = 0;

        while (!frontier.isEmpty()) {
            int node = frontier.pollMin();
            settled[node] = true;
            settledCount++;
            if (node == targetNode) {
                return toPlan(network, sourceNode, targetNode, time[targetNode], predecessorEdge, settledCount);
            }

            for (int e = network.firstOutgoingEdge(node), end = network.endOutgoingEdge(node); e < end; e++) {
                if (exclusion.isExcluded(e)) {
                    continue;
                }
                int next = network.edgeTarget(e);
                if (settled[next]) {
                    continue;
                }
                double candidate = time[node] + network.travelTimeSeconds(e);
                if (candidate < time[next]) {
                    time[next] = candidate;
                    predecessorEdge[next] = e;
                    frontier.insertOrDecrease(next, candidate);
                }
            }
        }
        return PathPlan.unreachable(settledCount);
    }

    private static PathPlan toPlan(
            RoadNetwork network,
            int sourceNode,
            int targetNode,
            double travelTime,
            int[] predecessorEdge,
            int settledCount
    ) {
        IntArrayList reversedEdges = new IntArrayList();
        int cursor = targetNode;
        while (cursor != sourceNode) {
            int edge = predecessorEdge[cursor];
            if (edge == NO_EDGE) {
                throw new IllegalStateException("broken predecessor chain at node " + cursor);
            }
            reversedEdges.add(edge);
            cursor = network.edgeOrigin(edge);
        }

        int edgeCount = reversedEdges.size();
        int[] edgePath = new int[edgeCount];
        int[] nodePath = new int[edgeCount + 1];
        nodePath[0] = sourceNode;
        double distance = 0.0d;
        for (int i = 0; i < edgeCount; i++) {
            int edge = reversedEdges.getInt(edgeCount - 1 - i);
            edgePath[i] = edge;
            nodePath[i + 1] = network.edgeTarget(edge);
            distance += network.lengthMeters(edge);
        }
        return new PathPlan(true, travelTime, distance, nodePath, edgePath, settledCount);
    }
}
