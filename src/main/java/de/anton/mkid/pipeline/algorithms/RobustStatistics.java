package de.anton.mkid.pipeline.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Order statistics used by the flat-field fitter.
 * NaN values are ignored when computing a statistic; a statistic over no
 * valid values is NaN.
 */
public final class RobustStatistics {

    private static final Logger logger = LoggerFactory.getLogger(RobustStatistics.class);

    // Private constructor to prevent instantiation
    private RobustStatistics() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /** Sorted copy of the non-NaN values. */
    static double[] sortedValid(double[] values) {
        if (values == null) return new double[0];
        double[] valid = Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
        Arrays.sort(valid);
        return valid;
    }

    /**
     * Median of the non-NaN values; mean of the two middle values for an even count.
     */
    public static double median(double[] values) {
        double[] sorted = sortedValid(values);
        int n = sorted.length;
        if (n == 0) {
            logger.trace("Median of empty input requested.");
            return Double.NaN;
        }
        return n % 2 == 1 ? sorted[n / 2] : 0.5 * (sorted[n / 2 - 1] + sorted[n / 2]);
    }

    /**
     * Number of values dropped from each end for a trim fraction:
     * {@code floor(fraction * n)}.
     */
    public static int trimCount(int n, double fraction) {
        if (n <= 0 || fraction <= 0) return 0;
        return (int) Math.floor(fraction * n + 1e-9);
    }

    /**
     * Mean after dropping {@code trimEach} of the smallest and of the largest
     * non-NaN values.
     *
     * @return the trimmed mean, NaN if nothing remains after trimming
     */
    public static double trimmedMean(double[] values, int trimEach) {
        if (trimEach < 0) {
            throw new IllegalArgumentException("trimEach must not be negative, was " + trimEach);
        }
        double[] sorted = sortedValid(values);
        int from = trimEach;
        int to = sorted.length - trimEach;
        if (to <= from) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += sorted[i];
        }
        return sum / (to - from);
    }

    /** Sum of the values kept by {@link #trimmedMean(double[], int)}. */
    public static double trimmedSum(double[] values, int trimEach) {
        double[] sorted = sortedValid(values);
        double sum = 0;
        for (int i = trimEach; i < sorted.length - trimEach; i++) {
            sum += sorted[i];
        }
        return sum;
    }
}
