package com.devflow.engine.stats;

/**
 * Order statistics over an ascending-sorted sample.
 *
 * <p>{@link #linear} is the "linear" method (Hyndman-Fan type 7, the default of numpy and pandas): for rank
 * {@code h = (n - 1) * q} it interpolates between the closest ranks {@code floor(h)} and {@code ceil(h)}. For
 * {@code [1, 2, 3, 4]} it yields p90 = 3.7, whereas nearest-rank would give 4.
 */
public final class Percentiles {

    private Percentiles() {}

    public static double linear(double[] sorted, double quantile) {
        requireSample(sorted);
        if (quantile < 0.0 || quantile > 1.0) {
            throw new IllegalArgumentException("Quantile must be within [0, 1]: " + quantile);
        }
        double rank = (sorted.length - 1) * quantile;
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        if (lower == upper) {
            return sorted[lower];
        }
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    /** Midpoint of the sample; the mean of the two central values when the size is even. */
    public static double median(double[] sorted) {
        requireSample(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    private static void requireSample(double[] sorted) {
        if (sorted == null || sorted.length == 0) {
            throw new IllegalArgumentException("Percentiles of an empty sample are undefined");
        }
    }
}
