package org.Aayush.roadnet.acquisition;

import lombok.Builder;
import lombok.Value;

/**
 * Shape of the fallback lattice produced by {@link GridNetworkSynthesizer}.
 */
@Value
@Builder
public class GridSynthesisConfig {
    /**
     * Nodes per side; the lattice has {@code gridSize * gridSize} nodes.
     */
    @Builder.Default
    int gridSize = 5;

    /**
     * Angular node spacing (degrees) at {@link #referenceRadiusMeters}.
     * Effective spacing scales linearly with the requested radius.
     */
    @Builder.Default
    double spacingDegrees = 0.005d;

    @Builder.Default
    double referenceRadiusMeters = 2_000.0d;

    /** Uniform length of every synthesized edge. */
    @Builder.Default
    double edgeLengthMeters = 500.0d;

    /** Uniform speed of every synthesized edge. */
    @Builder.Default
    double speedKph = 50.0d;

    public static GridSynthesisConfig defaults() {
        return GridSynthesisConfig.builder().build();
    }

    /**
     * Node spacing in degrees for one radius.
     */
    public double spacingFor(double radiusMeters) {
        return spacingDegrees * (radiusMeters / referenceRadiusMeters);
    }

    /**
     * @throws IllegalArgumentException when the lattice cannot be built.
     */
    public GridSynthesisConfig validate() {
        if (gridSize < 1) {
            throw new IllegalArgumentException("gridSize must be >= 1, got " + gridSize);
        }
        requirePositive(spacingDegrees, "spacingDegrees");
        requirePositive(referenceRadiusMeters, "referenceRadiusMeters");
        requirePositive(edgeLengthMeters, "edgeLengthMeters");
        requirePositive(speedKph, "speedKph");
        return this;
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0.0d) {
            throw new IllegalArgumentException(name + " must be finite and > 0, got " + value);
        }
    }
}
