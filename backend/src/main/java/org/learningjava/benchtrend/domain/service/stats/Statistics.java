package org.learningjava.benchtrend.domain.service.stats;

import java.util.Arrays;
import java.util.Collection;

/**
 * Descriptive statistics over plain value arrays.
 */
public final class Statistics {

    private Statistics() { }

    public static double[] toSortedArray(Collection<Double> values) {
        double[] arr = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(arr);
        return arr;
    }

    /** Median of an already sorted, non-empty array. */
    public static double medianOfSorted(double[] sorted) {
        requireNonEmpty(sorted);
        int mid = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[mid];
        }
        return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }

    public static double median(Collection<Double> values) {
        return medianOfSorted(toSortedArray(values));
    }

    public static double mean(double[] values) {
        requireNonEmpty(values);
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** Sample standard deviation; 0 for a single value. */
    public static double standardDeviation(double[] values, double mean) {
        if (values.length < 2) return 0.0;
        double sq = 0;
        for (double v : values) {
            double d = v - mean;
            sq += d * d;
        }
        return Math.sqrt(sq / (values.length - 1));
    }

    /**
     * Linear interpolation between closest ranks; {@code p} in [0, 1].
     */
    public static double percentileOfSorted(double[] sorted, double p) {
        requireNonEmpty(sorted);
        if (p < 0 || p > 1) throw new IllegalArgumentException("Percentile out of range: " + p);
        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double frac = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }

    /** Geometric mean of strictly positive values. */
    public static double geomean(double[] values) {
        requireNonEmpty(values);
        double logSum = 0;
        for (double v : values) {
            if (v <= 0) throw new IllegalArgumentException("Geometric mean needs positive values, got " + v);
            logSum += Math.log(v);
        }
        return Math.exp(logSum / values.length);
    }

    private static void requireNonEmpty(double[] values) {
        if (values.length == 0) throw new IllegalArgumentException("No values");
    }
}
