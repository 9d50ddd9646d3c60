package org.Aayush.roadnet.bottleneck;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.roadnet.graph.RoadNetwork;
import org.Aayush.roadnet.search.NodeHeap;

import java.util.Arrays;
import java.util.Objects;

/**
 * Weighted betweenness centrality (Brandes) over nodes and edges, weighted by travel time.
 *
 * <p>One single-source Dijkstra per node counts shortest paths ({@code sigma}) and records
 * predecessor edges; a reverse sweep then accumulates dependencies onto nodes and edges.
 * Parallel edges are distinct paths. Equal-length paths are detected with exact
 * floating-point equality.</p>
 *
 * <p>Normalization for directed graphs: node scores times {@code 1/((n-1)(n-2))} when
 * {@code n > 2}; edge scores times {@code 1/(n(n-1))} when {@code n > 1}.</p>
 */
public final class BetweennessCentrality {

    /**
     * Centrality scores, index-aligned with the network's node and edge indices.
     */
    public record Scores(double[] nodeScores, double[] edgeScores) {
    }

    private BetweennessCentrality() {
    }

    public static Scores compute(RoadNetwork network) {
        Objects.requireNonNull(network, "network");
        int n = network.nodeCount();
        int m = network.edgeCount();
        double[] nodeScores = new double[n];
        double[] edgeScores = new double[m];
        if (n == 0) {
            return new Scores(nodeScores, edgeScores);
        }

        double[] distance = new double[n];
        double[] sigma = new double[n];
        double[] delta = new double[n];
        boolean[] settled = new boolean[n];
        int[] order = new int[n];
        IntArrayList[] predecessorEdges = new IntArrayList[n];
        for (int i = 0; i < n; i++) {
            predecessorEdges[i] = new IntArrayList(4);
        }
        NodeHeap frontier = new NodeHeap(n);

        for (int source = 0; source < n; source++) {
            Arrays.fill(distance, Double.POSITIVE_INFINITY);
            Arrays.fill(sigma, 0.0d);
            Arrays.fill(delta, 0.0d);
            Arrays.fill(settled, false);
            for (IntArrayList predecessors : predecessorEdges) {
                predecessors.clear();
            }
            frontier.clear();

            int settledCount = singleSource(network, source, distance, sigma, settled, order, predecessorEdges, frontier);
            accumulate(network, source, sigma, delta, order, settledCount, predecessorEdges, nodeScores, edgeScores);
        }

        if (n > 2) {
            scale(nodeScores, 1.0d / ((double) (n - 1) * (n - 2)));
        }
        if (n > 1) {
            scale(edgeScores, 1.0d / ((double) n * (n - 1)));
        }
        return new Scores(nodeScores, edgeScores);
    }

    /**
     * Dijkstra from {@code source}, filling {@code order} with nodes in settle order.
     *
     * @return number of settled nodes.
     */
    private static int singleSource(
            RoadNetwork network,
            int source,
            double[] distance,
            double[] sigma,
            boolean[] settled,
            int[] order,
            IntArrayList[] predecessorEdges,
            NodeHeap frontier
    ) {
        distance[source] = 0.0d;
        sigma[source] = 1.0d;
        frontier.insertOrDecrease(source, 0.0d);
        int settledCount = 0;

        while (!frontier.isEmpty()) {
            int node = frontier.pollMin();
            settled[node] = true;
            order[settledCount++] = node;

            for (int e = network.firstOutgoingEdge(node), end = network.endOutgoingEdge(node); e < end; e++) {
                int next = network.edgeTarget(e);
                if (settled[next]) {
                    continue;
                }
                double candidate = distance[node] + network.travelTimeSeconds(e);
                if (candidate < distance[next]) {
                    distance[next] = candidate;
                    sigma[next] = sigma[node];
                    predecessorEdges[next].clear();
                    predecessorEdges[next].add(e);
                    frontier.insertOrDecrease(next, candidate);
                } else if (candidate == distance[next]) {
                    sigma[next] += sigma[node];
                    predecessorEdges[next].add(e);
                }
            }
        }
        return settledCount;
    }

    private static void accumulate(
            RoadNetwork network,
            int source,
            double[] sigma,
            double[] delta,
            int[] order,
            int settledCount,
            IntArrayList[] predecessorEdges,
            double[] nodeScores,
            double[] edgeScores
    ) {
        for (int i = settledCount - 1; i >= 0; i--) {
            int node = order[i];
            double coefficient = (1.0d + delta[node]) / sigma[node];
            IntArrayList predecessors = predecessorEdges[node];
            for (int k = 0; k < predecessors.size(); k++) {
                int edge = predecessors.getInt(k);
                int previous = network.edgeOrigin(edge);
                double contribution = sigma[previous] * coefficient;
                edgeScores[edge] += contribution;
                delta[previous] += contribution;
            }
            if (node != source) {
                nodeScores[node] += delta[node];
            }
        }
    }

    private static void scale(double[] values, double factor) {
        for (int i = 0; i < values.length; i++) {
            values[i] *= factor;
        }
    }
}
