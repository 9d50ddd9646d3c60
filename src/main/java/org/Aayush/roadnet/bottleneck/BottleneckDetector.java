package org.Aayush.roadnet.bottleneck;

import org.Aayush.roadnet.graph.RoadNetwork;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Flags structurally critical nodes and edges.
 *
 * <p>Node and edge thresholds are computed independently as a fixed percentile of their own
 * centrality distribution; entities strictly above their threshold are reported. The merged
 * list is sorted by descending score (stable: nodes before edges on ties) and truncated.
 * Small or sparse networks may legitimately yield no reports.</p>
 */
public final class BottleneckDetector {
    public static final double DEFAULT_PERCENTILE = 90.0d;
    public static final int DEFAULT_MAX_REPORTS = 10;

    private final double percentile;
    private final int maxReports;

    public BottleneckDetector() {
        this(DEFAULT_PERCENTILE, DEFAULT_MAX_REPORTS);
    }

    public BottleneckDetector(double percentile, int maxReports) {
        if (!(percentile >= 0.0d && percentile <= 100.0d)) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got " + percentile);
        }
        if (maxReports < 0) {
            throw new IllegalArgumentException("maxReports must be >= 0, got " + maxReports);
        }
        this.percentile = percentile;
        this.maxReports = maxReports;
    }

    public List<BottleneckReport> findBottlenecks(RoadNetwork network) {
        Objects.requireNonNull(network, "network");
        BetweennessCentrality.Scores scores = BetweennessCentrality.compute(network);

        List<BottleneckReport> reports = new ArrayList<>();
        double[] nodeScores = scores.nodeScores();
        if (nodeScores.length > 0) {
            double threshold = Percentiles.linear(nodeScores, percentile);
            for (int node = 0; node < nodeScores.length; node++) {
                if (nodeScores[node] > threshold) {
                    reports.add(nodeReport(network, node, nodeScores[node]));
                }
            }
        }

        double[] edgeScores = scores.edgeScores();
        if (edgeScores.length > 0) {
            double threshold = Percentiles.linear(edgeScores, percentile);
            for (int edge = 0; edge < edgeScores.length; edge++) {
                if (edgeScores[edge] > threshold) {
                    reports.add(edgeReport(network, edge, edgeScores[edge]));
                }
            }
        }

        reports.sort(Comparator.comparingDouble(BottleneckReport::getCentralityScore).reversed());
        if (reports.size() > maxReports) {
            return List.copyOf(reports.subList(0, maxReports));
        }
        return List.copyOf(reports);
    }

    private static BottleneckReport nodeReport(RoadNetwork network, int node, double score) {
        String id = network.nodeId(node);
        return BottleneckReport.builder()
                .type(BottleneckReport.EntityType.NODE)
                .id(id)
                .entityId(id)
                .centralityScore(score)
                .latitude(network.latitude(node))
                .longitude(network.longitude(node))
                .degree(network.degree(node))
                .description(String.format(Locale.ROOT, "High-traffic intersection (centrality: %.3f)", score))
                .build();
    }

    private static BottleneckReport edgeReport(RoadNetwork network, int edge, double score) {
        return BottleneckReport.builder()
                .type(BottleneckReport.EntityType.EDGE)
                .id(network.edgeLabel(edge))
                .entityId(network.nodeId(network.edgeOrigin(edge)))
                .entityId(network.nodeId(network.edgeTarget(edge)))
                .centralityScore(score)
                .lengthMeters(network.lengthMeters(edge))
                .speedKph(network.speedKph(edge))
                .description(String.format(Locale.ROOT, "Critical road segment (centrality: %.3f)", score))
                .build();
    }
}
