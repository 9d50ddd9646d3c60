package org.Aayush.roadnet.bottleneck;

import lombok.experimental.UtilityClass;

import java.util.Arrays;

/**
 * Percentile with linear interpolation between closest ranks.
 */
@UtilityClass
public class Percentiles {

    /**
     * @param values non-empty sample (not modified).
     * @param percentile value in {@code [0, 100]}.
     */
    public static double linear(double[] values, double percentile) {
        if (values.length == 0) {
            throw new IllegalArgumentException("values must be non-empty");
        }
        if (!(percentile >= 0.0d && percentile <= 100.0d)) {
            throw new IllegalArgumentException("percentile must be in [0, 100], got " + percentile);
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);

        double rank = percentile / 100.0d * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
