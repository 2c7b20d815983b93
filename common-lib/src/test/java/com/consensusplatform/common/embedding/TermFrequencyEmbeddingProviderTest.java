package com.consensusplatform.common.embedding;

import com.consensusplatform.common.math.VectorMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TermFrequencyEmbeddingProviderTest {

    private final TermFrequencyEmbeddingProvider provider = new TermFrequencyEmbeddingProvider();

    @Test
    @DisplayName("one unit-length vector per text, in order")
    void shapeAndNorm() {
        List<double[]> vectors = provider.embed(List.of("the capital of France is Paris", "42"));
        assertEquals(2, vectors.size());
        for (double[] v : vectors) {
            assertEquals(TermFrequencyEmbeddingProvider.DEFAULT_DIMENSION, v.length);
            double norm = 0;
            for (double x : v) norm += x * x;
            assertEquals(1.0, norm, 1e-9);
        }
    }

    @Test
    @DisplayName("case and punctuation do not change the embedding")
    void caseInsensitive() {
        List<double[]> vectors = provider.embed(List.of("Paris, France!", "paris france"));
        assertEquals(1.0, VectorMath.cosine(vectors.get(0), vectors.get(1)), 1e-12);
    }

    @Test
    @DisplayName("shared vocabulary scores higher than unrelated text")
    void similarity() {
        List<double[]> v = provider.embed(List.of(
            "the capital of France is Paris",
            "Paris is the capital city of France",
            "bananas are rich in potassium"));
        assertTrue(VectorMath.cosine(v.get(0), v.get(1)) > VectorMath.cosine(v.get(0), v.get(2)));
    }

    @Test
    @DisplayName("stop-word-only text embeds to the zero vector")
    void emptyText() {
        double[] v = provider.embed(List.of("the of and")).get(0);
        for (double x : v) assertEquals(0.0, x);
    }

    @Test
    @DisplayName("non-positive dimension is rejected")
    void badDimension() {
        assertThrows(IllegalArgumentException.class, () -> new TermFrequencyEmbeddingProvider(0));
    }
}
