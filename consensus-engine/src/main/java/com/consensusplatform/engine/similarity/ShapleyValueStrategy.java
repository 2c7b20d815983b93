package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.embedding.EmbeddingProvider;
import com.consensusplatform.common.history.BoundedHistory;
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
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Weights each contributor by its estimated Shapley value in the similarity game of
 * {@link ShapleyValueCalculator}, then combines the values with those weights.
 *
 * <ul>
 *   <li>numeric values – weighted average</li>
 *   <li>otherwise – weighted vote summed per distinct value, first-seen value wins ties</li>
 * </ul>
 *
 * <p>Confidence is {@code Σ(weight × confidence)}. The weights are published through
 * {@link #lastDiagnostics()} and appended to a per-contributor history bounded to
 * {@value #HISTORY_CAPACITY} entries.
 */
public class ShapleyValueStrategy implements StrategyWithDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(ShapleyValueStrategy.class);

    public static final String NAME      = "shapley_value";
    public static final String RESULT_ID = "shapley_consensus";

    public static final int DEFAULT_PERMUTATIONS = 100;
    static final int HISTORY_CAPACITY = 100;

    private final EmbeddingProvider embeddingProvider;
    private final int permutations;
    private final Random random;
    private final Map<String, BoundedHistory<Double>> contributionHistory = new ConcurrentHashMap<>();

    private volatile StrategyDiagnostics lastDiagnostics = StrategyDiagnostics.empty();

    public ShapleyValueStrategy(EmbeddingProvider embeddingProvider) {
        this(embeddingProvider, DEFAULT_PERMUTATIONS, new Random());
    }

    public ShapleyValueStrategy(EmbeddingProvider embeddingProvider, int permutations, Random random) {
        if (permutations < 1) {
            throw new IllegalArgumentException("permutations must be at least 1, got " + permutations);
        }
        this.embeddingProvider = embeddingProvider;
        this.permutations = permutations;
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StrategyDiagnostics lastDiagnostics() {
        return lastDiagnostics;
    }

    /** Recorded weights for one contributor, oldest first; empty when never seen. */
    public List<Double> getContributionHistory(String contributorId) {
        BoundedHistory<Double> history = contributionHistory.get(contributorId);
        return history == null ? List.of() : history.snapshot();
    }

    /**
     * Normalised Shapley weights parallel to {@code predictions}.
     */
    public double[] computeWeights(List<Prediction> predictions) {
        PredictionGuard.requireNonEmpty(predictions, NAME);
        List<double[]> embeddings = EmbeddingSupport.embed(embeddingProvider, predictions, NAME);
        double[][] similarity = VectorMath.similarityMatrix(embeddings);
        return ShapleyValueCalculator.weights(similarity, permutations, random);
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

        double[] weights = computeWeights(predictions);

        Object value;
        if (PredictionGuard.allNumeric(predictions)) {
            value = BasicStrategies.weightedMean(predictions, weights);
        } else {
            value = BasicStrategies.weightedVote(predictions, weights);
        }

        double confidence = 0;
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (int i = 0; i < predictions.size(); i++) {
            Prediction p = predictions.get(i);
            confidence += weights[i] * p.confidence();
            contributions.merge(p.contributorId(), weights[i], Double::sum);
        }

        if (record) {
            contributions.forEach((id, w) -> contributionHistory
                .computeIfAbsent(id, k -> new BoundedHistory<>(HISTORY_CAPACITY))
                .add(w));
            lastDiagnostics = StrategyDiagnostics.ofContributions(contributions);
        }

        Prediction consensus = Prediction.clamped(RESULT_ID, value, confidence);
        log.info("[Shapley] n={} permutations={} contributions={} confidence={}",
            predictions.size(), permutations, contributions, String.format("%.3f", consensus.confidence()));
        return consensus;
    }
}
