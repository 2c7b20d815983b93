package com.consensusplatform.engine.similarity;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * DBSCAN over a precomputed cosine-similarity matrix.
 *
 * <p>Two points are neighbours when {@code 1 − sim ≤ eps}; a point's neighbourhood
 * includes itself. Points in neighbourhoods smaller than {@code minSamples} that are not
 * reachable from a core point are labelled {@link #NOISE}. Cluster labels start at 0 and
 * are assigned in input order.
 */
public final class DensityClusterer {

    public static final int NOISE = -1;
    private static final int UNVISITED = -2;

    private DensityClusterer() {}

    public static int[] cluster(double[][] similarity, double eps, int minSamples) {
        int n = similarity.length;
        int[] labels = new int[n];
        Arrays.fill(labels, UNVISITED);
        int clusterId = 0;

        for (int i = 0; i < n; i++) {
            if (labels[i] != UNVISITED) continue;

            List<Integer> neighbours = regionQuery(similarity, i, eps);
            if (neighbours.size() < minSamples) {
                labels[i] = NOISE;
                continue;
            }

            labels[i] = clusterId;
            Deque<Integer> seeds = new ArrayDeque<>(neighbours);
            while (!seeds.isEmpty()) {
                int q = seeds.poll();
                if (labels[q] == NOISE) {
                    // border point: reachable but not core
                    labels[q] = clusterId;
                }
                if (labels[q] != UNVISITED) continue;
                labels[q] = clusterId;
                List<Integer> qNeighbours = regionQuery(similarity, q, eps);
                if (qNeighbours.size() >= minSamples) {
                    seeds.addAll(qNeighbours);
                }
            }
            clusterId++;
        }
        return labels;
    }

    private static List<Integer> regionQuery(double[][] similarity, int i, double eps) {
        List<Integer> out = new ArrayList<>();
        for (int j = 0; j < similarity.length; j++) {
            if (1.0 - similarity[i][j] <= eps + 1e-12) out.add(j);
        }
        return out;
    }
}
