package com.trafficguardian.detector.detection;

import java.util.Arrays;

/** Linear-interpolation percentiles. */
final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param q fraction in [0, 1]
     */
    static double of(double[] values, double q) {
        if (values.length == 0) {
            throw new IllegalArgumentException("No values");
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = Math.max(0.0, Math.min(1.0, q)) * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = Math.min(sorted.length - 1, lower + 1);
        double fraction = position - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }
}
