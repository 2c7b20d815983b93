package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Picks a basic strategy from the shape of the input.
 *
 * <h3>Routing</h3>
 * <pre>
 *   all numeric AND confidenceVariance &gt; 0.2  → weighted average   (id adaptive_weighted_avg)
 *   predictionDiversity &lt; 0.3                  → majority vote      (id adaptive_majority)
 *   otherwise                                 → top confidence     (id adaptive_top_confidence)
 * </pre>
 *
 * <p>{@code predictionDiversity = (unique − 1) / (N − 1)}. Both thresholds are heuristic
 * constants, not derived values.
 */
public class AdaptiveConsensusStrategy implements ConsensusStrategy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveConsensusStrategy.class);

    public static final String NAME = "adaptive_consensus";

    static final double CONFIDENCE_VARIANCE_THRESHOLD = 0.2;
    static final double LOW_DIVERSITY_THRESHOLD       = 0.3;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }

        boolean numeric  = PredictionGuard.allNumeric(predictions);
        double variance  = BasicStrategies.confidenceVariance(predictions);
        double diversity = BasicStrategies.predictionDiversity(predictions);

        log.info("[Adaptive] n={} numeric={} confidenceVariance={} diversity={}",
            predictions.size(), numeric,
            String.format("%.3f", variance), String.format("%.3f", diversity));

        if (numeric && variance > CONFIDENCE_VARIANCE_THRESHOLD) {
            log.info("[Adaptive] route=weighted_average");
            return new Prediction("adaptive_weighted_avg",
                BasicStrategies.weightedAverage(predictions),
                BasicStrategies.meanConfidence(predictions));
        }
        if (diversity < LOW_DIVERSITY_THRESHOLD) {
            log.info("[Adaptive] route=majority_vote");
            String winner = BasicStrategies.majorityVote(predictions);
            return new Prediction("adaptive_majority", winner,
                BasicStrategies.meanConfidenceOf(predictions, winner));
        }
        log.info("[Adaptive] route=top_confidence");
        Prediction top = BasicStrategies.topConfidence(predictions);
        return new Prediction("adaptive_top_confidence", top.value(), top.confidence());
    }
}
