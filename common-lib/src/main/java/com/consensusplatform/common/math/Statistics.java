package com.consensusplatform.common.math;

import java.util.Collection;

/**
 * Descriptive statistics over plain collections. Population (not sample) moments,
 * matching how agreement and outlier scores are defined.
 */
public final class Statistics {

    private Statistics() {}

    /** @return arithmetic mean, or 0.0 for an empty input */
    public static double mean(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    public static double mean(double[] values) {
        if (values.length == 0) return 0.0;
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /** @return population variance, or 0.0 for fewer than two values */
    public static double variance(Collection<Double> values) {
        if (values.size() < 2) return 0.0;
        double mean = mean(values);
        return values.stream()
            .mapToDouble(v -> (v - mean) * (v - mean))
            .sum() / values.size();
    }

    public static double variance(double[] values) {
        if (values.length < 2) return 0.0;
        double mean = mean(values);
        double sum = 0;
        for (double v : values) sum += (v - mean) * (v - mean);
        return sum / values.length;
    }

    /** @return population standard deviation */
    public static double stdDev(Collection<Double> values) {
        return Math.sqrt(variance(values));
    }

    public static double stdDev(double[] values) {
        return Math.sqrt(variance(values));
    }

    /**
     * Shannon entropy in bits of the given (not necessarily normalised) non-negative counts.
     * Zero entries are ignored.
     */
    public static double shannonEntropyBits(double[] counts) {
        double total = 0;
        for (double c : counts) total += c;
        if (total <= 0.0) return 0.0;
        double h = 0;
        for (double c : counts) {
            if (c <= 0.0) continue;
            double p = c / total;
            h -= p * (Math.log(p) / Math.log(2));
        }
        return h;
    }

    /**
     * Equal-width histogram over {@code [min, max]} with the last bin closed.
     * A zero-width range is widened to {@code [v - 0.5, v + 0.5]}.
     */
    public static double[] histogram(double[] values, int bins) {
        if (bins <= 0) throw new IllegalArgumentException("bins must be positive, got " + bins);
        double[] counts = new double[bins];
        if (values.length == 0) return counts;
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (min == max) {
            min -= 0.5;
            max += 0.5;
        }
        double width = (max - min) / bins;
        for (double v : values) {
            int bin = (int) ((v - min) / width);
            if (bin >= bins) bin = bins - 1;
            if (bin < 0) bin = 0;
            counts[bin]++;
        }
        return counts;
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
