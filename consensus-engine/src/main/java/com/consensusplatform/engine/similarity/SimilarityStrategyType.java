package com.consensusplatform.engine.similarity;

import java.util.Locale;

/**
 * Similarity-based strategies a {@link RobustConsensusStrategy} can combine.
 */
public enum SimilarityStrategyType {
    SEMANTIC,
    SHAPLEY,
    ENTROPY;

    public static SimilarityStrategyType fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
