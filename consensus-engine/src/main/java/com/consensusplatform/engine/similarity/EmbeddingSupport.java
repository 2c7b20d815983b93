package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.embedding.EmbeddingProvider;
import com.consensusplatform.common.exception.EmbeddingException;
import com.consensusplatform.common.math.VectorMath;
import com.consensusplatform.common.model.Prediction;

import java.util.ArrayList;
import java.util.List;

/**
 * Calls the {@link EmbeddingProvider} for a batch of predictions and validates its output.
 */
final class EmbeddingSupport {

    private EmbeddingSupport() {}

    /**
     * Embeds the textual form of every prediction, in order.
     *
     * @throws EmbeddingException when the provider fails, returns the wrong number of
     *                            vectors, or returns vectors of differing dimension
     */
    static List<double[]> embed(EmbeddingProvider provider, List<Prediction> predictions,
                                String strategyName) {
        List<String> texts = new ArrayList<>(predictions.size());
        for (Prediction p : predictions) texts.add(p.text());

        List<double[]> vectors;
        try {
            vectors = provider.embed(texts);
        } catch (RuntimeException e) {
            throw new EmbeddingException(strategyName, "Embedding provider failed: " + e.getMessage(), e);
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new EmbeddingException(strategyName, "Embedding provider returned "
                + (vectors == null ? "null" : vectors.size() + " vectors") + " for " + texts.size() + " texts");
        }
        int dim = vectors.get(0).length;
        for (double[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new EmbeddingException(strategyName, "Embedding dimensions are inconsistent");
            }
        }
        return vectors;
    }

    static List<double[]> scale(List<double[]> vectors, EmbeddingScaling scaling) {
        List<double[]> out = new ArrayList<>(vectors.size());
        switch (scaling) {
            case UNIT_LENGTH -> {
                for (double[] v : vectors) out.add(VectorMath.unitLength(v));
            }
            case FEATURE_STANDARD -> {
                double[][] standardized = VectorMath.standardizeColumns(vectors.toArray(new double[0][]));
                out.addAll(List.of(standardized));
            }
        }
        return out;
    }
}
