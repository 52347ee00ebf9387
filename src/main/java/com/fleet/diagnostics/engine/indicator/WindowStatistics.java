package com.fleet.diagnostics.engine.indicator;

/**
 * Statistics over the half-open index range [from, to) of a sample array.
 *
 * Sums are accumulated relative to the first element of the range, so a
 * constant range yields its value as mean and exactly zero spread.
 */
public final class WindowStatistics {

    private WindowStatistics() {}

    public static double mean(double[] values, int from, int to) {
        checkRange(values, from, to, 1);
        double ref = values[from];
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i] - ref;
        }
        return ref + sum / (to - from);
    }

    /**
     * Sample variance (n - 1 denominator). Zero for a single element.
     */
    public static double sampleVariance(double[] values, int from, int to) {
        checkRange(values, from, to, 1);
        int n = to - from;
        if (n < 2) return 0.0;

        double mean = mean(values, from, to);
        double sumSquares = 0.0;
        for (int i = from; i < to; i++) {
            double d = values[i] - mean;
            sumSquares += d * d;
        }
        return sumSquares / (n - 1);
    }

    /**
     * Ordinary least-squares slope of y against x. Zero when x does not vary.
     */
    public static double olsSlope(double[] x, double[] y, int from, int to) {
        checkRange(x, from, to, 2);
        checkRange(y, from, to, 2);

        double xMean = mean(x, from, to);
        double yMean = mean(y, from, to);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = from; i < to; i++) {
            double dx = x[i] - xMean;
            sxy += dx * (y[i] - yMean);
            sxx += dx * dx;
        }
        return sxx > 0 ? sxy / sxx : 0.0;
    }

    private static void checkRange(double[] values, int from, int to, int minLength) {
        if (from < 0 || to > values.length || to - from < minLength) {
            throw new IllegalArgumentException(String.format(
                    "Invalid window [%d, %d) over %d values (need at least %d)", from, to, values.length, minLength));
        }
    }
}
