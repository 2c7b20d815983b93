package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.embedding.EmbeddingProvider;
import com.consensusplatform.common.math.Statistics;
import com.consensusplatform.common.math.VectorMath;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.strategy.BasicStrategies;
import com.consensusplatform.engine.strategy.PredictionGuard;
import com.consensusplatform.engine.strategy.StrategyDiagnostics;
import com.consensusplatform.engine.strategy.StrategyWithDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Measures how much the predictions disagree and either trusts the most confident one or
 * blends all of them.
 *
 * <h3>Uncertainty</h3>
 * <pre>
 *   d_ij = 1 − clamp(sim_ij, 0, 1)              for every pair i &lt; j
 *   p_ij = d_ij / Σd                            (u = 0 when Σd = 0)
 *   H    = −Σ p ln p / ln(#pairs)               (1 when there is a single pair)
 *   u    = H × mean(d)                          ∈ [0, 1]
 * </pre>
 *
 * <p>Identical predictions give {@code u = 0}; the more and the more evenly they
 * disagree, the closer {@code u} gets to 1.
 *
 * <h3>Decision</h3>
 * <ul>
 *   <li>{@code u > threshold} – top-confidence value, confidence × (1 − u)</li>
 *   <li>otherwise – values weighted by each prediction's mean similarity to the others
 *       (weighted average when numeric, weighted vote otherwise); confidence is the
 *       similarity-weighted mean confidence × (1 − u)</li>
 * </ul>
 */
public class EntropyBasedStrategy implements StrategyWithDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(EntropyBasedStrategy.class);

    public static final String NAME      = "entropy_based";
    public static final String RESULT_ID = "entropy_consensus";

    public static final double DEFAULT_THRESHOLD = 0.5;

    static final String BRANCH_TOP_CONFIDENCE = "top_confidence";
    static final String BRANCH_WEIGHTED       = "similarity_weighted";

    private final EmbeddingProvider embeddingProvider;
    private final double threshold;

    private volatile StrategyDiagnostics lastDiagnostics = StrategyDiagnostics.empty();

    public EntropyBasedStrategy(EmbeddingProvider embeddingProvider) {
        this(embeddingProvider, DEFAULT_THRESHOLD);
    }

    public EntropyBasedStrategy(EmbeddingProvider embeddingProvider, double threshold) {
        this.embeddingProvider = embeddingProvider;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StrategyDiagnostics lastDiagnostics() {
        return lastDiagnostics;
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
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }

        List<double[]> embeddings = EmbeddingSupport.embed(embeddingProvider, predictions, NAME);
        double[][] similarity = VectorMath.similarityMatrix(embeddings);
        double u = uncertainty(similarity);

        Prediction result;
        String branch;
        if (u > threshold) {
            branch = BRANCH_TOP_CONFIDENCE;
            Prediction top = BasicStrategies.topConfidence(predictions);
            result = Prediction.clamped(RESULT_ID, top.value(), top.confidence() * (1.0 - u));
        } else {
            branch = BRANCH_WEIGHTED;
            result = similarityWeighted(predictions, similarity, u);
        }

        if (record) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("uncertainty", u);
            info.put("threshold", threshold);
            info.put("branch", branch);
            lastDiagnostics = StrategyDiagnostics.ofClusterInfo(info);
        }

        log.info("[Entropy] n={} uncertainty={} threshold={} branch={}",
            predictions.size(), String.format("%.3f", u), threshold, branch);
        return result;
    }

    /**
     * Normalised disagreement entropy of a similarity matrix, in [0, 1].
     */
    public static double uncertainty(double[][] similarity) {
        double[] pairs = VectorMath.upperTriangle(similarity);
        if (pairs.length == 0) return 0.0;

        double[] d = new double[pairs.length];
        double total = 0;
        for (int i = 0; i < pairs.length; i++) {
            d[i] = 1.0 - Statistics.clamp01(pairs[i]);
            total += d[i];
        }
        if (total <= 1e-12) return 0.0;

        double normalisedEntropy;
        if (pairs.length == 1) {
            normalisedEntropy = 1.0;
        } else {
            double h = 0;
            for (double di : d) {
                if (di <= 0) continue;
                double p = di / total;
                h -= p * Math.log(p);
            }
            normalisedEntropy = h / Math.log(pairs.length);
        }
        return Statistics.clamp01(normalisedEntropy * (total / pairs.length));
    }

    private static Prediction similarityWeighted(List<Prediction> predictions, double[][] similarity, double u) {
        int n = predictions.size();
        double[] weights = new double[n];
        double weightSum = 0;
        double weightedConfidence = 0;
        for (int i = 0; i < n; i++) {
            weights[i] = Statistics.clamp01(VectorMath.meanSimilarityToOthers(similarity, i));
            weightSum += weights[i];
            weightedConfidence += weights[i] * predictions.get(i).confidence();
        }
        double baseConfidence = weightSum > 0
            ? weightedConfidence / weightSum
            : BasicStrategies.meanConfidence(predictions);

        Object value = PredictionGuard.allNumeric(predictions)
            ? BasicStrategies.weightedMean(predictions, weights)
            : BasicStrategies.weightedVote(predictions, weights);

        return Prediction.clamped(RESULT_ID, value, baseConfidence * (1.0 - u));
    }
}
