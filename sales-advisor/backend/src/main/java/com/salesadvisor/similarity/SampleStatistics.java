package com.salesadvisor.similarity;

import java.util.Arrays;
import java.util.List;

public final class SampleStatistics {

    private SampleStatistics() {
    }

    public static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    public static double median(double[] values) {
        return percentile(values, 50.0);
    }

    /**
     * Percentile with linear interpolation between the closest ranks.
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double position = (percentile / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    public static double min(double[] values) {
        return Arrays.stream(values).min().orElse(Double.NaN);
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    public static double std(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double mean = mean(values);
        double variance = Arrays.stream(values)
            .map(v -> (v - mean) * (v - mean))
            .average()
            .orElse(0.0);
        return Math.sqrt(variance);
    }

    public static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }
}
