package org.Aayush.roadnet.graph;

import lombok.Builder;
import lombok.Value;

/**
 * Basic structural statistics of a {@link RoadNetwork}.
 */
@Value
@Builder
public class NetworkStats {
    int totalNodes;
    /** Directed edge count; a two-way road counts twice. */
    int totalEdges;
    double totalLengthKm;
    /** Mean of in + out degree over all nodes; 0 for an empty network. */
    double averageDegree;
    /** {@code edges / (n * (n - 1))} for {@code n > 1}, else 0. */
    double density;
    /** Whether the network is weakly connected; false when empty. */
    boolean connected;

    /**
     * Computes statistics for one network.
     */
    public static NetworkStats of(RoadNetwork network) {
        int n = network.nodeCount();
        int m = network.edgeCount();

        double totalLength = 0.0d;
        for (int e = 0; e < m; e++) {
            totalLength += network.lengthMeters(e);
        }

        double degreeSum = 0.0d;
        for (int node = 0; node < n; node++) {
            degreeSum += network.degree(node);
        }

        return NetworkStats.builder()
                .totalNodes(n)
                .totalEdges(m)
                .totalLengthKm(totalLength / 1000.0d)
                .averageDegree(n > 0 ? degreeSum / n : 0.0d)
                .density(n > 1 ? (double) m / ((double) n * (n - 1)) : 0.0d)
                .connected(n > 0 && isWeaklyConnected(network))
                .build();
    }

    /**
     * Union-find over edges ignoring direction.
     */
    static boolean isWeaklyConnected(RoadNetwork network) {
        int n = network.nodeCount();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) {
            parent[i] = i;
        }
        int components = n;
        for (int e = 0; e < network.edgeCount(); e++) {
            int a = find(parent, network.edgeOrigin(e));
            int b = find(parent, network.edgeTarget(e));
            if (a != b) {
                parent[a] = b;
                components--;
            }
        }
        return components == 1;
    }

    private static int find(int[] parent, int node) {
        int root = node;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[node] != root) {
            int next = parent[node];
            parent[node] = root;
            node = next;
        }
        return root;
    }
}
