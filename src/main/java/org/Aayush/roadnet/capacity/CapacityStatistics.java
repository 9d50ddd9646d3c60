package org.Aayush.roadnet.capacity;

import lombok.Value;

import java.util.Arrays;

/**
 * Distribution summary over per-edge capacity estimates.
 *
 * <p>Standard deviation is the population form (divides by {@code n}).</p>
 */
@Value
public class CapacityStatistics {
    double mean;
    double median;
    double standardDeviation;
    double min;
    double max;

    /**
     * Summarizes a non-empty sample.
     *
     * @throws IllegalArgumentException when {@code values} is empty.
     */
    public static CapacityStatistics of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values must be non-empty");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;

        double sum = 0.0d;
        for (double value : sorted) {
            sum += value;
        }
        double mean = sum / n;

        double squaredDeviation = 0.0d;
        for (double value : sorted) {
            double delta = value - mean;
            squaredDeviation += delta * delta;
        }

        double median = (n % 2 == 1)
                ? sorted[n / 2]
                : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0d;

        return new CapacityStatistics(mean, median, Math.sqrt(squaredDeviation / n), sorted[0], sorted[n - 1]);
    }
}
