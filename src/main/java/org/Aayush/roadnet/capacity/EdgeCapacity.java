package org.Aayush.roadnet.capacity;

import lombok.Value;

/**
 * Capacity estimate for one classified edge.
 */
@Value
public class EdgeCapacity {
    /** Edge label {@code "<from>-<to>"}. */
    String edge;
    double lengthMeters;
    double speedKph;
    double estimatedCapacityVph;
}
