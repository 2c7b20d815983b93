package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.embedding.EmbeddingProvider;
import com.consensusplatform.common.history.BoundedHistory;
import com.consensusplatform.common.math.Statistics;
import com.consensusplatform.common.math.VectorMath;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.strategy.BasicStrategies;
import com.consensusplatform.engine.strategy.PredictionGuard;
import com.consensusplatform.engine.strategy.StrategyDiagnostics;
import com.consensusplatform.engine.strategy.StrategyWithDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Embeds every prediction, clusters the embeddings and answers with the
 * highest-confidence member of the largest eligible cluster.
 *
 * <h3>Pipeline</h3>
 * <pre>
 *   embed → scale rows → cosine matrix
 *         → isolation filter (N &gt; 2: drop predictions with no neighbour ≥ threshold)
 *         → cluster (density or k-means)
 *         → dominant = largest eligible group, first label wins ties
 *         → representative = top confidence in dominant
 *         → confidence = rep.confidence × mean pairwise similarity of dominant (capped at 1)
 * </pre>
 *
 * <p>A group is eligible when it is a real cluster of at least {@code minClusterSize}
 * members; the density-noise group is eligible only when {@code noiseEligible} is set.
 * With no eligible group the highest-confidence surviving prediction is returned.
 *
 * <p>Each call records a summary in a history bounded to {@value #HISTORY_CAPACITY}
 * entries.
 */
public class SemanticClusteringStrategy implements StrategyWithDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(SemanticClusteringStrategy.class);

    public static final String NAME        = "semantic_clustering";
    public static final String STRICT_NAME = "semantic_clustering_strict";
    public static final String RESULT_ID   = "semantic_consensus";

    static final int HISTORY_CAPACITY = 100;

    private final String name;
    private final EmbeddingProvider embeddingProvider;
    private final ClusteringSettings settings;
    private final Random random;
    private final BoundedHistory<Map<String, Object>> clusterHistory = new BoundedHistory<>(HISTORY_CAPACITY);

    private volatile StrategyDiagnostics lastDiagnostics = StrategyDiagnostics.empty();

    public SemanticClusteringStrategy(EmbeddingProvider embeddingProvider) {
        this(NAME, embeddingProvider, ClusteringSettings.defaults(), new Random());
    }

    public SemanticClusteringStrategy(String name, EmbeddingProvider embeddingProvider,
                                      ClusteringSettings settings, Random random) {
        this.name = name;
        this.embeddingProvider = embeddingProvider;
        this.settings = settings;
        this.random = random;
    }

    @Override
    public String name() {
        return name;
    }

    public ClusteringSettings settings() {
        return settings;
    }

    @Override
    public StrategyDiagnostics lastDiagnostics() {
        return lastDiagnostics;
    }

    /** Summaries of recent clustering passes, oldest first. */
    public List<Map<String, Object>> getClusterHistory() {
        return clusterHistory.snapshot();
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        return run(predictions, true);
    }

    @Override
    public Prediction evaluate(List<Prediction> predictions) {
        return run(predictions, false);
    }

    private Prediction run(List<Prediction> predictions, boolean record) {
        if (record) {
            lastDiagnostics = StrategyDiagnostics.empty();
        }
        if (PredictionGuard.isPassThrough(predictions, name)) {
            return predictions.get(0);
        }

        ClusterResult result = cluster(predictions, record);
        Prediction representative = BasicStrategies.topConfidence(result.dominantCluster());

        double cohesion = result.cohesion();
        Prediction consensus = Prediction.clamped(RESULT_ID, representative.value(),
            representative.confidence() * cohesion);

        log.info("[SemanticClustering] strategy={} representative={} cohesion={} confidence={}",
            name, representative.contributorId(),
            String.format("%.3f", cohesion), String.format("%.3f", consensus.confidence()));

        return consensus;
    }

    /**
     * Runs the clustering pipeline without synthesising a consensus prediction.
     *
     * @throws com.consensusplatform.common.exception.EmptyPredictionsException on empty input
     * @throws com.consensusplatform.common.exception.EmbeddingException when embedding fails
     */
    public ClusterResult cluster(List<Prediction> predictions) {
        return cluster(predictions, true);
    }

    private ClusterResult cluster(List<Prediction> predictions, boolean record) {
        PredictionGuard.requireNonEmpty(predictions, name);
        int n = predictions.size();

        List<double[]> embeddings = EmbeddingSupport.embed(embeddingProvider, predictions, name);
        List<double[]> scaled = EmbeddingSupport.scale(embeddings, settings.scaling());
        double[][] similarity = VectorMath.similarityMatrix(scaled);

        List<Integer> kept = new ArrayList<>();
        List<Integer> isolated = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (settings.isolationFilter() && n > 2 && !hasNeighbour(similarity, i)) {
                isolated.add(i);
            } else {
                kept.add(i);
            }
        }

        int[] labels = new int[n];
        Arrays.fill(labels, DensityClusterer.NOISE);
        if (!kept.isEmpty()) {
            int[] subLabels = clusterSubset(kept, scaled, similarity);
            for (int i = 0; i < kept.size(); i++) labels[kept.get(i)] = subLabels[i];
        }

        // ── group kept predictions by label, in first-seen order ─────────────
        Map<Integer, List<Integer>> groups = new LinkedHashMap<>();
        for (int idx : kept) {
            groups.computeIfAbsent(labels[idx], l -> new ArrayList<>()).add(idx);
        }

        Integer dominantLabel = null;
        int dominantSize = 0;
        for (Map.Entry<Integer, List<Integer>> e : groups.entrySet()) {
            if (!isEligible(e.getKey(), e.getValue().size())) continue;
            if (e.getValue().size() > dominantSize) {
                dominantLabel = e.getKey();
                dominantSize = e.getValue().size();
            }
        }

        Map<Integer, double[]> centroids = new LinkedHashMap<>();
        for (Map.Entry<Integer, List<Integer>> e : groups.entrySet()) {
            if (e.getKey() != DensityClusterer.NOISE) {
                centroids.put(e.getKey(), VectorMath.centroid(scaled, e.getValue()));
            }
        }

        List<List<Prediction>> outliers = new ArrayList<>();
        List<Prediction> dominant;
        double cohesion = 1.0;
        boolean fallback = dominantLabel == null;
        if (fallback) {
            List<Prediction> pool = kept.isEmpty() ? predictions : select(predictions, kept);
            Prediction top = BasicStrategies.topConfidence(pool);
            dominant = List.of(top);
            for (Map.Entry<Integer, List<Integer>> e : groups.entrySet()) {
                List<Prediction> rest = new ArrayList<>(select(predictions, e.getValue()));
                rest.remove(top);
                if (!rest.isEmpty()) outliers.add(rest);
            }
            log.warn("[SemanticClustering] strategy={} no eligible cluster among n={}, falling back to top confidence",
                name, n);
        } else {
            List<Integer> members = groups.get(dominantLabel);
            dominant = select(predictions, members);
            cohesion = Statistics.clamp01(VectorMath.meanPairwiseSimilarity(similarity, members));
            for (Map.Entry<Integer, List<Integer>> e : groups.entrySet()) {
                if (!e.getKey().equals(dominantLabel)) outliers.add(select(predictions, e.getValue()));
            }
        }
        for (int idx : isolated) {
            if (!dominant.contains(predictions.get(idx))) outliers.add(List.of(predictions.get(idx)));
        }

        ClusterResult result = new ClusterResult(dominant, outliers, labels, similarity, centroids,
            fallback ? DensityClusterer.NOISE : dominantLabel, cohesion, fallback);
        if (record) {
            record(n, kept.size(), isolated.size(), result);
        }
        return result;
    }

    // ── internals ────────────────────────────────────────────────────────────

    private boolean hasNeighbour(double[][] similarity, int i) {
        for (int j = 0; j < similarity.length; j++) {
            if (j != i && similarity[i][j] >= settings.similarityThreshold()) return true;
        }
        return false;
    }

    private boolean isEligible(int label, int size) {
        if (label == DensityClusterer.NOISE) {
            return settings.noiseEligible();
        }
        return size >= settings.minClusterSize();
    }

    private int[] clusterSubset(List<Integer> kept, List<double[]> scaled, double[][] similarity) {
        int m = kept.size();
        double[][] subSimilarity = new double[m][m];
        List<double[]> subVectors = new ArrayList<>(m);
        for (int a = 0; a < m; a++) {
            subVectors.add(scaled.get(kept.get(a)));
            for (int b = 0; b < m; b++) {
                subSimilarity[a][b] = similarity[kept.get(a)][kept.get(b)];
            }
        }
        return switch (settings.method()) {
            case DENSITY -> DensityClusterer.cluster(subSimilarity, settings.eps(), settings.minClusterSize());
            case KMEANS -> settings.k() > 0
                ? KMeansClusterer.cluster(subVectors, settings.k(), random)
                : KMeansClusterer.clusterWithAutoK(subVectors, subSimilarity, random);
        };
    }

    private void record(int original, int kept, int isolated, ClusterResult result) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("method", settings.method().name());
        info.put("originalCount", original);
        info.put("filteredCount", kept);
        info.put("isolatedCount", isolated);
        info.put("clusterCount", result.clusterCount());
        info.put("dominantClusterSize", result.dominantCluster().size());
        info.put("outlierCount", result.outlierCount());
        info.put("fallback", result.fallback());
        clusterHistory.add(Map.copyOf(info));
        lastDiagnostics = StrategyDiagnostics.ofClusterInfo(info);

        log.debug("[SemanticClustering] strategy={} n={} kept={} clusters={} dominantSize={}",
            name, original, kept, result.clusterCount(), result.dominantCluster().size());
    }

    private static List<Prediction> select(List<Prediction> predictions, List<Integer> indices) {
        List<Prediction> out = new ArrayList<>(indices.size());
        for (int i : indices) out.add(predictions.get(i));
        return out;
    }
}
