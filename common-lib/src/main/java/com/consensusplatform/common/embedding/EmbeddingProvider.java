package com.consensusplatform.common.embedding;

import java.util.List;

/**
 * Maps text to dense vectors for similarity computation.
 *
 * <p>Contract:
 * <ul>
 *   <li>exactly one embedding per input text, in input order</li>
 *   <li>all embeddings of one call share the same dimension</li>
 *   <li>no normalisation guarantee; callers normalise explicitly when needed</li>
 * </ul>
 *
 * Implementations wrap a remote model or a local vectoriser; similarity-based
 * strategies call {@link #embed(List)} once per aggregation and never cache across calls.
 */
public interface EmbeddingProvider {

    /**
     * @param texts non-null list of texts (may be empty)
     * @return one vector per text, same order
     */
    List<double[]> embed(List<String> texts);
}
