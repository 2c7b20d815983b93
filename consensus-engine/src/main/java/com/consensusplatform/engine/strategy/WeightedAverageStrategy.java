package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Confidence-weighted mean of numeric predictions; confidence is the mean input confidence.
 *
 * <p>Non-numeric input does not fail: it is routed to majority vote and logged.
 */
public class WeightedAverageStrategy implements ConsensusStrategy {

    private static final Logger log = LoggerFactory.getLogger(WeightedAverageStrategy.class);

    public static final String NAME = "weighted_average";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }
        if (!PredictionGuard.allNumeric(predictions)) {
            log.warn("[WeightedAverage] Non-numeric predictions received, falling back to majority vote. n={}",
                predictions.size());
            String winner = BasicStrategies.majorityVote(predictions);
            return new Prediction(NAME, winner, BasicStrategies.meanConfidenceOf(predictions, winner));
        }
        double average = BasicStrategies.weightedAverage(predictions);
        return new Prediction(NAME, average, BasicStrategies.meanConfidence(predictions));
    }
}
