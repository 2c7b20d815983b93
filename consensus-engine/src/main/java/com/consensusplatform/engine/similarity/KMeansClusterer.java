package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.math.VectorMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Lloyd's k-means with k-means++ seeding, Euclidean distance on the (scaled) embeddings.
 *
 * <p>Seeding draws from the supplied {@link Random}, so a seeded generator gives a
 * reproducible partition. An emptied cluster keeps its previous centroid.
 */
public final class KMeansClusterer {

    static final int MAX_ITERATIONS = 100;
    static final int MAX_AUTO_K     = 5;

    private KMeansClusterer() {}

    /**
     * @return one label in {@code [0, k)} per vector; when {@code k >= n} every vector is
     *         its own cluster
     */
    public static int[] cluster(List<double[]> vectors, int k, Random random) {
        int n = vectors.size();
        int[] labels = new int[n];
        if (k >= n) {
            for (int i = 0; i < n; i++) labels[i] = i;
            return labels;
        }
        if (k <= 1) {
            return labels;
        }

        List<double[]> centroids = seed(vectors, k, random);
        for (int iter = 0; iter < MAX_ITERATIONS; iter++) {
            boolean changed = false;
            for (int i = 0; i < n; i++) {
                int nearest = nearest(vectors.get(i), centroids);
                if (iter == 0 || nearest != labels[i]) {
                    changed |= nearest != labels[i];
                    labels[i] = nearest;
                }
            }
            for (int c = 0; c < k; c++) {
                List<Integer> members = new ArrayList<>();
                for (int i = 0; i < n; i++) if (labels[i] == c) members.add(i);
                if (!members.isEmpty()) {
                    centroids.set(c, VectorMath.centroid(vectors, members));
                }
            }
            if (!changed && iter > 0) break;
        }
        return labels;
    }

    /**
     * Picks k in {@code [2, min(n, 5)]} maximising the summed difference between each
     * point's mean intra-cluster and mean inter-cluster cosine similarity, then returns
     * that partition. The first k reaching the best score wins.
     */
    public static int[] clusterWithAutoK(List<double[]> vectors, double[][] similarity, Random random) {
        int n = vectors.size();
        if (n <= 2) return cluster(vectors, n, random);
        int maxK = Math.min(n, MAX_AUTO_K);
        int[] best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int k = 2; k <= maxK; k++) {
            int[] labels = cluster(vectors, k, random);
            double score = separationScore(labels, similarity);
            if (score > bestScore) {
                bestScore = score;
                best = labels;
            }
        }
        return best;
    }

    static double separationScore(int[] labels, double[][] similarity) {
        double score = 0;
        for (int i = 0; i < labels.length; i++) {
            double intra = 0, inter = 0;
            int nIntra = 0, nInter = 0;
            for (int j = 0; j < labels.length; j++) {
                if (j == i) continue;
                if (labels[j] == labels[i]) {
                    intra += similarity[i][j];
                    nIntra++;
                } else {
                    inter += similarity[i][j];
                    nInter++;
                }
            }
            score += (nIntra > 0 ? intra / nIntra : 0.0) - (nInter > 0 ? inter / nInter : 0.0);
        }
        return score;
    }

    private static List<double[]> seed(List<double[]> vectors, int k, Random random) {
        List<double[]> centroids = new ArrayList<>(k);
        centroids.add(vectors.get(random.nextInt(vectors.size())).clone());
        double[] distances = new double[vectors.size()];
        while (centroids.size() < k) {
            double total = 0;
            for (int i = 0; i < vectors.size(); i++) {
                double[] v = vectors.get(i);
                distances[i] = VectorMath.squaredEuclidean(v, centroids.get(nearest(v, centroids)));
                total += distances[i];
            }
            int chosen;
            if (total == 0.0) {
                chosen = random.nextInt(vectors.size());
            } else {
                double target = random.nextDouble() * total;
                chosen = vectors.size() - 1;
                double acc = 0;
                for (int i = 0; i < distances.length; i++) {
                    acc += distances[i];
                    if (acc >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids.add(vectors.get(chosen).clone());
        }
        return centroids;
    }

    private static int nearest(double[] v, List<double[]> centroids) {
        int best = 0;
        double bestDist = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.size(); c++) {
            double d = VectorMath.squaredEuclidean(v, centroids.get(c));
            if (d < bestDist) {
                bestDist = d;
                best = c;
            }
        }
        return best;
    }
}
