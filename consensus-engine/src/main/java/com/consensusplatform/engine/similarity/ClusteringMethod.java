package com.consensusplatform.engine.similarity;

import java.util.Locale;

public enum ClusteringMethod {
    /** Density clustering, {@code eps = 1 − similarityThreshold} on cosine distance. */
    DENSITY,
    /** Fixed-k partitioning (k-means); k chosen automatically when not positive. */
    KMEANS;

    /**
     * Resolves a configuration name. Accepts the enum names plus {@code dbscan}
     * (alias for {@link #DENSITY}).
     */
    public static ClusteringMethod fromName(String name) {
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("DBSCAN")) return DENSITY;
        return valueOf(normalized);
    }
}
