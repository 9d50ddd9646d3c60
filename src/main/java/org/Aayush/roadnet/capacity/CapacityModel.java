package org.Aayush.roadnet.capacity;

import lombok.Builder;
import lombok.Value;

/**
 * Linear speed-to-throughput heuristic.
 *
 * <p>{@code capacity = (speedKph / baseSpeedKph) * baseCapacityVph}. Thresholds are
 * strict: an edge is high-capacity when its estimate is {@code > highCapacityThresholdVph}
 * and low-capacity when {@code < lowCapacityThresholdVph}.</p>
 */
@Value
@Builder
public class CapacityModel {
    @Builder.Default
    double baseSpeedKph = 50.0d;

    /** Vehicles per hour at {@link #baseSpeedKph}. */
    @Builder.Default
    double baseCapacityVph = 2_000.0d;

    @Builder.Default
    double highCapacityThresholdVph = 3_000.0d;

    @Builder.Default
    double lowCapacityThresholdVph = 1_000.0d;

    /**
     * Returns the default model.
     */
    public static CapacityModel defaults() {
        return CapacityModel.builder().build();
    }

    /**
     * Estimated vehicles per hour for one edge speed.
     */
    public double capacityFor(double speedKph) {
        return (speedKph / baseSpeedKph) * baseCapacityVph;
    }

    public boolean isHighCapacity(double capacityVph) {
        return capacityVph > highCapacityThresholdVph;
    }

    public boolean isLowCapacity(double capacityVph) {
        return capacityVph < lowCapacityThresholdVph;
    }

    /**
     * Validates numeric domain of the model.
     *
     * @throws IllegalArgumentException when any constant is non-finite or non-positive.
     */
    public CapacityModel validate() {
        requirePositive(baseSpeedKph, "baseSpeedKph");
        requirePositive(baseCapacityVph, "baseCapacityVph");
        requirePositive(highCapacityThresholdVph, "highCapacityThresholdVph");
        requirePositive(lowCapacityThresholdVph, "lowCapacityThresholdVph");
        if (lowCapacityThresholdVph > highCapacityThresholdVph) {
            throw new IllegalArgumentException("lowCapacityThresholdVph must not exceed highCapacityThresholdVph");
        }
        return this;
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }
}
