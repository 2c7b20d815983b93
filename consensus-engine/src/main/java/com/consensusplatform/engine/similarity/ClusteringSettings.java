package com.consensusplatform.engine.similarity;

/**
 * Tuning for {@link SemanticClusteringStrategy}.
 *
 * <ul>
 *   <li>{@code similarityThreshold} – minimum cosine similarity for two predictions to be
 *       neighbours</li>
 *   <li>{@code minClusterSize} – density core size; also the minimum size of an eligible
 *       cluster</li>
 *   <li>{@code k} – cluster count for {@link ClusteringMethod#KMEANS}; {@code <= 0} picks k
 *       in [2, min(N, 5)] automatically</li>
 *   <li>{@code noiseEligible} – whether the density-noise group may be chosen as the
 *       dominant cluster</li>
 *   <li>{@code isolationFilter} – drop predictions with no neighbour above the threshold
 *       before clustering (only for more than two predictions)</li>
 * </ul>
 */
public record ClusteringSettings(
    double similarityThreshold,
    int minClusterSize,
    ClusteringMethod method,
    int k,
    boolean noiseEligible,
    EmbeddingScaling scaling,
    boolean isolationFilter
) {
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.7;
    public static final int    DEFAULT_MIN_CLUSTER_SIZE     = 2;
    public static final double STRICT_SIMILARITY_THRESHOLD  = 0.85;
    public static final int    STRICT_MIN_CLUSTER_SIZE      = 3;

    public ClusteringSettings {
        if (similarityThreshold < -1.0 || similarityThreshold > 1.0) {
            throw new IllegalArgumentException("similarityThreshold must be within [-1, 1], got " + similarityThreshold);
        }
        if (minClusterSize < 1) {
            throw new IllegalArgumentException("minClusterSize must be at least 1, got " + minClusterSize);
        }
        if (method == null) method = ClusteringMethod.DENSITY;
        if (scaling == null) scaling = EmbeddingScaling.UNIT_LENGTH;
    }

    public static ClusteringSettings defaults() {
        return new ClusteringSettings(DEFAULT_SIMILARITY_THRESHOLD, DEFAULT_MIN_CLUSTER_SIZE,
            ClusteringMethod.DENSITY, 0, false, EmbeddingScaling.UNIT_LENGTH, true);
    }

    public static ClusteringSettings strict() {
        return new ClusteringSettings(STRICT_SIMILARITY_THRESHOLD, STRICT_MIN_CLUSTER_SIZE,
            ClusteringMethod.DENSITY, 0, false, EmbeddingScaling.UNIT_LENGTH, true);
    }

    public ClusteringSettings withMethod(ClusteringMethod newMethod, int newK) {
        return new ClusteringSettings(similarityThreshold, minClusterSize, newMethod, newK,
            noiseEligible, scaling, isolationFilter);
    }

    public ClusteringSettings withNoiseEligible(boolean eligible) {
        return new ClusteringSettings(similarityThreshold, minClusterSize, method, k,
            eligible, scaling, isolationFilter);
    }

    public ClusteringSettings withIsolationFilter(boolean enabled) {
        return new ClusteringSettings(similarityThreshold, minClusterSize, method, k,
            noiseEligible, scaling, enabled);
    }

    /** Cosine distance radius for density clustering. */
    public double eps() {
        return 1.0 - similarityThreshold;
    }
}
