package com.consensusplatform.engine.similarity;

/**
 * How the embedding matrix is standardised before clustering.
 */
public enum EmbeddingScaling {
    /** Every row scaled to unit L2 length. Leaves cosine similarity unchanged. */
    UNIT_LENGTH,
    /** Column-wise z-scoring across the batch. */
    FEATURE_STANDARD
}
