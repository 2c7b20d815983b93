package com.consensusplatform.engine.similarity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Monte Carlo Shapley estimate over a coalition game defined by pairwise similarity.
 *
 * <h3>Coalition utility</h3>
 * <pre>
 *   u(∅)      = 0
 *   u({i})    = 1
 *   u(S), |S| ≥ 2 = mean pairwise cosine similarity within S
 * </pre>
 *
 * <p>Each sampled permutation adds players one at a time and credits each with its
 * marginal utility. Raw estimates are clipped at zero and normalised to sum to one; when
 * nothing survives clipping every player gets {@code 1/N}.
 */
public final class ShapleyValueCalculator {

    private ShapleyValueCalculator() {}

    /**
     * @param similarity   N×N cosine matrix
     * @param permutations number of sampled orderings, at least 1
     * @return normalised, non-negative weights parallel to the matrix rows
     */
    public static double[] weights(double[][] similarity, int permutations, Random random) {
        double[] raw = rawEstimates(similarity, permutations, random);
        return normalise(raw);
    }

    /** Unclipped mean marginal contributions. */
    static double[] rawEstimates(double[][] similarity, int permutations, Random random) {
        if (permutations < 1) {
            throw new IllegalArgumentException("permutations must be at least 1, got " + permutations);
        }
        int n = similarity.length;
        double[] phi = new double[n];
        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) order.add(i);

        for (int p = 0; p < permutations; p++) {
            Collections.shuffle(order, random);
            List<Integer> coalition = new ArrayList<>(n);
            double pairSum = 0;
            double previous = 0;
            for (int player : order) {
                for (int member : coalition) pairSum += similarity[player][member];
                coalition.add(player);
                double utility = utility(coalition.size(), pairSum);
                phi[player] += utility - previous;
                previous = utility;
            }
        }
        for (int i = 0; i < n; i++) phi[i] /= permutations;
        return phi;
    }

    static double[] normalise(double[] raw) {
        int n = raw.length;
        double[] out = new double[n];
        double total = 0;
        for (int i = 0; i < n; i++) {
            out[i] = Math.max(0.0, raw[i]);
            total += out[i];
        }
        if (total <= 0.0) {
            for (int i = 0; i < n; i++) out[i] = 1.0 / n;
            return out;
        }
        for (int i = 0; i < n; i++) out[i] /= total;
        return out;
    }

    private static double utility(int size, double pairSum) {
        if (size == 0) return 0.0;
        if (size == 1) return 1.0;
        double pairs = size * (size - 1) / 2.0;
        return pairSum / pairs;
    }
}
