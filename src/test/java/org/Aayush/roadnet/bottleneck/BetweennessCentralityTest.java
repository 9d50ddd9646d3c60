package org.Aayush.roadnet.bottleneck;

import org.Aayush.roadnet.graph.RoadNetwork;
import org.Aayush.roadnet.testutil.TestNetworks;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BetweennessCentralityTest {

    @Test
    @DisplayName("Chain: only the middle node carries through traffic")
    void testChain() {
        RoadNetwork network = TestNetworks.chain();
        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(network);

        assertEquals(0.0d, scores.nodeScores()[network.requireIndex("A")], 1e-12);
        assertEquals(1.0d, scores.nodeScores()[network.requireIndex("B")], 1e-12);
        assertEquals(0.0d, scores.nodeScores()[network.requireIndex("C")], 1e-12);
        for (double edgeScore : scores.edgeScores()) {
            assertEquals(2.0d / 6.0d, edgeScore, 1e-12);
        }
    }

    @Test
    @DisplayName("Diamond: travel time steers centrality onto the fast branch")
    void testWeighted() {
        RoadNetwork network = TestNetworks.diamond();
        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(network);

        assertEquals(1.0d / 6.0d, scores.nodeScores()[network.requireIndex("L")], 1e-12);
        assertEquals(0.0d, scores.nodeScores()[network.requireIndex("R")], 1e-12);

        int s = network.requireIndex("S");
        assertEquals(2.0d / 12.0d, scores.edgeScores()[network.findEdge(s, network.requireIndex("L"))], 1e-12);
        assertEquals(1.0d / 12.0d, scores.edgeScores()[network.findEdge(s, network.requireIndex("R"))], 1e-12);
    }

    @Test
    @DisplayName("Equal-time paths split the dependency evenly")
    void testTiedPaths() {
        RoadNetwork network = RoadNetwork.builder(TestNetworks.SAN_FRANCISCO, 2000)
                .addNode("S", 37.770, -122.420)
                .addNode("L", 37.775, -122.425)
                .addNode("R", 37.775, -122.415)
                .addNode("T", 37.780, -122.420)
                .addEdge("S", "L", 1000, 50)
                .addEdge("L", "T", 1000, 50)
                .addEdge("S", "R", 1000, 50)
                .addEdge("R", "T", 1000, 50)
                .build();

        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(network);

        double left = scores.nodeScores()[network.requireIndex("L")];
        double right = scores.nodeScores()[network.requireIndex("R")];
        assertEquals(left, right, 1e-12);
        assertEquals(0.5d / 6.0d, left, 1e-12);
    }

    @Test
    @DisplayName("Parallel edges count as distinct shortest paths")
    void testParallelEdges() {
        RoadNetwork network = RoadNetwork.builder(TestNetworks.SAN_FRANCISCO, 2000)
                .addNode("A", 37.770, -122.42)
                .addNode("B", 37.771, -122.42)
                .addNode("C", 37.772, -122.42)
                .addEdge("A", "B", 100, 50)
                .addEdge("A", "B", 100, 50)
                .addEdge("B", "C", 100, 50)
                .build();

        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(network);

        int first = network.firstOutgoingEdge(network.requireIndex("A"));
        assertEquals(scores.edgeScores()[first], scores.edgeScores()[first + 1], 1e-12);
        assertEquals(1.0d / 6.0d, scores.edgeScores()[first], 1e-12);
        assertEquals(0.5d, scores.nodeScores()[network.requireIndex("B")], 1e-12);
    }

    @Test
    @DisplayName("Empty network yields empty score arrays")
    void testEmpty() {
        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(TestNetworks.empty());
        assertEquals(0, scores.nodeScores().length);
        assertEquals(0, scores.edgeScores().length);
    }
}
