package org.carball.autolysis.analyzer;

import java.util.Arrays;

/**
 * Percentile estimation with linear interpolation between closest ranks: the p-th percentile
 * of {@code n} sorted values sits at position {@code p * (n - 1)}.
 */
public final class Percentiles {

    private Percentiles() {
    }

    public static double[] sortedCopy(double[] values) {
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        return sorted;
    }

    /**
     * @param sorted   values in ascending order
     * @param fraction percentile as a fraction in {@code [0, 1]}
     * @return the interpolated percentile, or NaN when {@code sorted} is empty
     */
    public static double percentile(double[] sorted, double fraction) {
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("Percentile fraction must be within [0, 1], got " + fraction);
        }
        if (sorted.length == 0) {
            return Double.NaN;
        }

        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Sample standard deviation (N - 1 denominator); NaN for fewer than two values.
     */
    public static double sampleStd(double[] values, double mean) {
        if (values.length < 2) {
            return Double.NaN;
        }
        double squares = 0.0;
        for (double value : values) {
            double diff = value - mean;
            squares += diff * diff;
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
