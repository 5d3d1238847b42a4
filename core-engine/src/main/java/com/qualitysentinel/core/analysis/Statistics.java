package com.qualitysentinel.core.analysis;

import java.util.List;

/**
 * Descriptive statistics shared by the baseline manager and the detection
 * methods.
 *
 * <p>
 * All functions are pure. Callers are expected to check the returned values
 * with {@link Double#isFinite(double)} before acting on them.
 * </p>
 *
 * @since 1.0.0
 */
public final class Statistics {

    private Statistics() {
    }

    public static double mean(List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Sample standard deviation (denominator {@code n - 1}).
     *
     * @return the deviation, or {@code NaN} for fewer than two values
     */
    public static double sampleStdDev(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquares(values, mean(values)) / (n - 1));
    }

    /**
     * Population standard deviation (denominator {@code n}).
     *
     * @return the deviation, or {@code NaN} for an empty list
     */
    public static double populationStdDev(List<Double> values) {
        if (values.isEmpty()) {
            return Double.NaN;
        }
        return Math.sqrt(sumOfSquares(values, mean(values)) / values.size());
    }

    /**
     * Ordinary least-squares slope of {@code values[i]} against the index
     * {@code i}.
     *
     * @return the slope, or {@code NaN} for fewer than two values
     */
    public static double slope(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return Double.NaN;
        }
        double xMean = (n - 1) / 2.0;
        double yMean = mean(values);
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = i - xMean;
            numerator += dx * (values.get(i) - yMean);
            denominator += dx * dx;
        }
        return numerator / denominator;
    }

    /**
     * Percentage change of {@code current} relative to {@code baseline}.
     *
     * @return the change, or {@code 0} when the baseline is zero
     */
    public static double changePercent(double current, double baseline) {
        if (baseline == 0.0) {
            return 0.0;
        }
        return (current - baseline) / baseline * 100.0;
    }

    private static double sumOfSquares(List<Double> values, double mean) {
        double sum = 0.0;
        for (double v : values) {
            double d = v - mean;
            sum += d * d;
        }
        return sum;
    }
}
