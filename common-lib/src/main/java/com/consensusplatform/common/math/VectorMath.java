package com.consensusplatform.common.math;

import java.util.List;

/**
 * Pure vector utilities used by the similarity-based strategies.
 * Vectors are plain {@code double[]}; matrices are row-major {@code double[][]}.
 */
public final class VectorMath {

    private VectorMath() {}

    // ── Cosine similarity ───────────────────────────────────────────────────

    /**
     * @return cosine similarity in [-1, 1]; 0.0 when either vector has zero length
     */
    public static double cosine(double[] a, double[] b) {
        requireSameDimension(a, b);
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot   += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) return 0.0;
        double sim = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        // floating-point drift can push identical vectors marginally past 1
        return Math.max(-1.0, Math.min(1.0, sim));
    }

    /**
     * Full symmetric pairwise cosine-similarity matrix. The diagonal is 1.0.
     */
    public static double[][] similarityMatrix(List<double[]> vectors) {
        int n = vectors.size();
        double[][] sim = new double[n][n];
        for (int i = 0; i < n; i++) {
            sim[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double s = cosine(vectors.get(i), vectors.get(j));
                sim[i][j] = s;
                sim[j][i] = s;
            }
        }
        return sim;
    }

    /**
     * Mean of the upper-triangle (i &lt; j) entries of {@code sim} restricted to {@code members}.
     * A single member (or none) yields 1.0 by convention.
     */
    public static double meanPairwiseSimilarity(double[][] sim, List<Integer> members) {
        if (members.size() < 2) return 1.0;
        double sum = 0;
        int pairs = 0;
        for (int a = 0; a < members.size(); a++) {
            for (int b = a + 1; b < members.size(); b++) {
                sum += sim[members.get(a)][members.get(b)];
                pairs++;
            }
        }
        return sum / pairs;
    }

    /** Upper triangle of a square matrix, row by row, excluding the diagonal. */
    public static double[] upperTriangle(double[][] matrix) {
        int n = matrix.length;
        double[] out = new double[n * (n - 1) / 2];
        int k = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                out[k++] = matrix[i][j];
            }
        }
        return out;
    }

    /** Mean similarity of row {@code i} to every other row. 1.0 for a 1x1 matrix. */
    public static double meanSimilarityToOthers(double[][] sim, int i) {
        int n = sim.length;
        if (n < 2) return 1.0;
        double sum = 0;
        for (int j = 0; j < n; j++) {
            if (j != i) sum += sim[i][j];
        }
        return sum / (n - 1);
    }

    // ── Scaling ─────────────────────────────────────────────────────────────

    /** Copy of {@code v} scaled to unit L2 length. Zero vectors are returned unchanged. */
    public static double[] unitLength(double[] v) {
        double norm = 0;
        for (double x : v) norm += x * x;
        norm = Math.sqrt(norm);
        double[] out = v.clone();
        if (norm == 0.0) return out;
        for (int i = 0; i < out.length; i++) out[i] /= norm;
        return out;
    }

    /**
     * Column-wise z-scoring: every feature is centred on its mean and divided by its
     * population standard deviation. Constant features are only centred.
     */
    public static double[][] standardizeColumns(double[][] rows) {
        int n = rows.length;
        if (n == 0) return new double[0][];
        int dim = rows[0].length;
        double[][] out = new double[n][dim];
        for (int c = 0; c < dim; c++) {
            double mean = 0;
            for (double[] row : rows) mean += row[c];
            mean /= n;
            double var = 0;
            for (double[] row : rows) var += (row[c] - mean) * (row[c] - mean);
            double std = Math.sqrt(var / n);
            double scale = std == 0.0 ? 1.0 : std;
            for (int r = 0; r < n; r++) {
                out[r][c] = (rows[r][c] - mean) / scale;
            }
        }
        return out;
    }

    /** Element-wise mean of the selected rows. */
    public static double[] centroid(List<double[]> rows, List<Integer> members) {
        if (members.isEmpty()) {
            throw new IllegalArgumentException("centroid of an empty member list");
        }
        double[] c = new double[rows.get(members.get(0)).length];
        for (int idx : members) {
            double[] row = rows.get(idx);
            for (int d = 0; d < c.length; d++) c[d] += row[d];
        }
        for (int d = 0; d < c.length; d++) c[d] /= members.size();
        return c;
    }

    public static double squaredEuclidean(double[] a, double[] b) {
        requireSameDimension(a, b);
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return sum;
    }

    private static void requireSameDimension(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Vector dimensions differ: " + a.length + " vs " + b.length);
        }
    }
}
