package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.exception.EmbeddingException;
import com.consensusplatform.common.exception.EmptyPredictionsException;
import com.consensusplatform.common.model.Prediction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class SemanticClusteringStrategyTest {

    private FixedEmbeddings embeddings;

    @BeforeEach
    void setUp() {
        embeddings = new FixedEmbeddings();
        // six paraphrases pointing the same way, two unrelated answers
        for (int i = 0; i < 6; i++) {
            embeddings.put("paraphrase-" + i, 1.0, 0.05 * i, 0.0, 0.0);
        }
        embeddings.put("unrelated-a", 0.0, 0.0, 1.0, 0.0);
        embeddings.put("unrelated-b", 0.0, 0.0, 0.0, 1.0);
    }

    private static List<Prediction> paraphrasesAndOutliers() {
        List<Prediction> in = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            in.add(new Prediction("agent-" + i, "paraphrase-" + i, 0.5 + 0.05 * i));
        }
        in.add(new Prediction("agent-6", "unrelated-a", 0.99));
        in.add(new Prediction("agent-7", "unrelated-b", 0.99));
        return in;
    }

    private SemanticClusteringStrategy strategy(ClusteringSettings settings) {
        return new SemanticClusteringStrategy(SemanticClusteringStrategy.NAME, embeddings, settings, new Random(11));
    }

    // ── dominant cluster ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Density clustering")
    class Density {

        @Test
        @DisplayName("six paraphrases form the dominant cluster; unrelated answers are outliers")
        void dominantCluster() {
            ClusterResult result = strategy(ClusteringSettings.defaults()).cluster(paraphrasesAndOutliers());

            assertEquals(6, result.dominantCluster().size());
            assertTrue(result.dominantCluster().stream().allMatch(p -> p.text().startsWith("paraphrase")));
            assertEquals(2, result.outlierCount());
            assertFalse(result.fallback());
            assertEquals(0, result.dominantLabel());
            assertTrue(result.cohesion() > 0.95, "cohesion " + result.cohesion());
        }

        @Test
        @DisplayName("consensus takes the most confident cluster member, scaled by cohesion")
        void representative() {
            SemanticClusteringStrategy s = strategy(ClusteringSettings.defaults());
            List<Prediction> in = paraphrasesAndOutliers();
            Prediction r = s.aggregate(in);

            assertEquals(SemanticClusteringStrategy.RESULT_ID, r.contributorId());
            assertEquals("paraphrase-5", r.value());
            double cohesion = s.cluster(in).cohesion();
            assertEquals(0.75 * cohesion, r.confidence(), 1e-9);
            assertTrue(r.confidence() <= 0.75);
        }

        @Test
        @DisplayName("a tight pair of outliers is a cluster but not the dominant one")
        void smallerClusterLoses() {
            embeddings.put("unrelated-b", 0.0, 0.0, 1.0, 0.05);
            ClusterResult result = strategy(ClusteringSettings.defaults()).cluster(paraphrasesAndOutliers());

            assertEquals(6, result.dominantCluster().size());
            assertEquals(2, result.clusterCount());
            assertEquals(1, result.outlierClusters().size());
            assertEquals(2, result.outlierClusters().get(0).size());
        }

        @Test
        @DisplayName("diagnostics and history record the cluster shape")
        void diagnostics() {
            SemanticClusteringStrategy s = strategy(ClusteringSettings.defaults());
            s.aggregate(paraphrasesAndOutliers());
            s.aggregate(paraphrasesAndOutliers());

            Map<String, Object> info = s.lastDiagnostics().clusterInfo();
            assertEquals(8, info.get("originalCount"));
            assertEquals(6, info.get("filteredCount"));
            assertEquals(2, info.get("isolatedCount"));
            assertEquals(6, info.get("dominantClusterSize"));
            assertEquals(false, info.get("fallback"));
            assertTrue(s.lastDiagnostics().contributions().isEmpty());
            assertEquals(2, s.getClusterHistory().size());
        }
    }

    // ── fallback and noise ───────────────────────────────────────────────────

    @Nested
    @DisplayName("Fallback")
    class Fallback {

        @Test
        @DisplayName("no cluster at all falls back to the most confident prediction")
        void allUnrelated() {
            embeddings.put("x", 1, 0, 0).put("y", 0, 1, 0).put("z", 0, 0, 1);
            List<Prediction> in = List.of(
                new Prediction("a", "x", 0.4), new Prediction("b", "y", 0.8), new Prediction("c", "z", 0.6));

            SemanticClusteringStrategy s = strategy(ClusteringSettings.defaults());
            ClusterResult result = s.cluster(in);
            assertTrue(result.fallback());
            assertEquals(List.of(in.get(1)), result.dominantCluster());
            assertEquals(DensityClusterer.NOISE, result.dominantLabel());

            Prediction r = s.aggregate(in);
            assertEquals("y", r.value());
            assertEquals(0.8, r.confidence(), 1e-9);
        }

        @Test
        @DisplayName("noise group wins only when it is allowed to")
        void noiseEligibility() {
            embeddings.put("a1", 1, 0, 0, 0, 0).put("a2", 1, 0.05, 0, 0, 0)
                .put("b", 0, 0, 1, 0, 0).put("c", 0, 0, 0, 1, 0).put("d", 0, 0, 0, 0, 1);
            List<Prediction> in = List.of(
                new Prediction("p1", "a1", 0.5), new Prediction("p2", "a2", 0.6),
                new Prediction("p3", "b", 0.7), new Prediction("p4", "c", 0.3), new Prediction("p5", "d", 0.2));
            ClusteringSettings base = new ClusteringSettings(0.7, 3, ClusteringMethod.DENSITY, 0,
                false, EmbeddingScaling.UNIT_LENGTH, false);

            ClusterResult strictResult = strategy(base).cluster(in);
            assertTrue(strictResult.fallback());
            assertEquals("p3", strictResult.dominantCluster().get(0).contributorId());

            ClusterResult noiseResult = strategy(base.withNoiseEligible(true)).cluster(in);
            assertFalse(noiseResult.fallback());
            assertEquals(5, noiseResult.dominantCluster().size());
            assertEquals(DensityClusterer.NOISE, noiseResult.dominantLabel());
            assertTrue(noiseResult.cohesion() < 0.2);
        }

        @Test
        @DisplayName("strict settings need three members above 0.85")
        void strictNeedsThree() {
            embeddings.put("s1", 1, 0, 0).put("s2", 1, 0.05, 0).put("t", 0, 1, 0).put("u", 0, 0, 1);
            List<Prediction> in = List.of(new Prediction("a", "s1", 0.5), new Prediction("b", "s2", 0.6),
                new Prediction("c", "t", 0.9), new Prediction("d", "u", 0.1));

            SemanticClusteringStrategy strict = new SemanticClusteringStrategy(
                SemanticClusteringStrategy.STRICT_NAME, embeddings, ClusteringSettings.strict(), new Random(1));
            assertEquals(SemanticClusteringStrategy.STRICT_NAME, strict.name());
            assertTrue(strict.cluster(in).fallback());

            SemanticClusteringStrategy relaxed = strategy(ClusteringSettings.defaults());
            ClusterResult relaxedResult = relaxed.cluster(in);
            assertFalse(relaxedResult.fallback());
            assertEquals(2, relaxedResult.dominantCluster().size());
        }
    }

    // ── k-means ──────────────────────────────────────────────────────────────

    @Test
    @DisplayName("k-means with k = 2 picks the larger group")
    void kMeans() {
        embeddings.put("g1", 1, 0).put("g2", 1, 0.02).put("g3", 0.98, 0.01).put("g4", 1, 0.01)
            .put("h1", 0, 1).put("h2", 0.02, 1);
        List<Prediction> in = List.of(
            new Prediction("a", "g1", 0.5), new Prediction("b", "h1", 0.95), new Prediction("c", "g2", 0.6),
            new Prediction("d", "h2", 0.9), new Prediction("e", "g3", 0.7), new Prediction("f", "g4", 0.4));

        SemanticClusteringStrategy s = strategy(ClusteringSettings.defaults().withMethod(ClusteringMethod.KMEANS, 2));
        ClusterResult result = s.cluster(in);
        assertEquals(4, result.dominantCluster().size());
        assertEquals(2, result.clusterCount());
        assertEquals("g3", s.aggregate(in).value());
    }

    // ── errors ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Errors and edge cases")
    class Edges {

        @Test
        @DisplayName("empty input raises EmptyPredictionsException")
        void empty() {
            assertThrows(EmptyPredictionsException.class,
                () -> strategy(ClusteringSettings.defaults()).aggregate(List.of()));
        }

        @Test
        @DisplayName("a single prediction passes through without embedding")
        void singleton() {
            Prediction only = new Prediction("a", "anything", 0.3);
            assertEquals(only, strategy(ClusteringSettings.defaults()).aggregate(List.of(only)));
            assertEquals(0, embeddings.calls());
        }

        @Test
        @DisplayName("provider failure surfaces as EmbeddingException")
        void providerFailure() {
            SemanticClusteringStrategy s = new SemanticClusteringStrategy(texts -> {
                throw new IllegalStateException("model offline");
            });
            EmbeddingException ex = assertThrows(EmbeddingException.class, () -> s.aggregate(
                List.of(new Prediction("a", "x", 0.5), new Prediction("b", "y", 0.5))));
            assertEquals(SemanticClusteringStrategy.NAME, ex.getStrategyName());
            assertTrue(ex.getMessage().contains("model offline"));
        }

        @Test
        @DisplayName("wrong vector count surfaces as EmbeddingException")
        void wrongCount() {
            SemanticClusteringStrategy s = new SemanticClusteringStrategy(texts -> List.of(new double[]{1, 0}));
            assertThrows(EmbeddingException.class, () -> s.aggregate(
                List.of(new Prediction("a", "x", 0.5), new Prediction("b", "y", 0.5))));
        }

        @Test
        @DisplayName("mixed dimensions surface as EmbeddingException")
        void mixedDimensions() {
            SemanticClusteringStrategy s = new SemanticClusteringStrategy(
                texts -> List.of(new double[]{1, 0}, new double[]{1, 0, 0}));
            assertThrows(EmbeddingException.class, () -> s.aggregate(
                List.of(new Prediction("a", "x", 0.5), new Prediction("b", "y", 0.5))));
        }
    }
}
