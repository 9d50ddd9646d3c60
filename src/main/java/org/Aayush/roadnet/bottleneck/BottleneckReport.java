package org.Aayush.roadnet.bottleneck;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One flagged high-centrality node or edge.
 *
 * <p>Node reports fill {@code latitude}, {@code longitude} and {@code degree}; edge reports
 * fill {@code lengthMeters} and {@code speedKph}. The other group is {@code null}.</p>
 */
@Value
@Builder
public class BottleneckReport {

    /**
     * Kind of network entity a report refers to.
     */
    public enum EntityType {
        NODE,
        EDGE
    }

    EntityType type;
    /** Node id, or edge label {@code "<from>-<to>"}. */
    String id;
    /** One node id for nodes; origin and destination node ids for edges. */
    @Singular("entityId")
    List<String> entityIds;
    double centralityScore;
    String description;

    Double latitude;
    Double longitude;
    Integer degree;

    Double lengthMeters;
    Double speedKph;
}
