package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;

import java.util.List;

/**
 * Returns the value of the most confident prediction, keeping its confidence.
 * Ties resolve to the first-encountered prediction.
 */
public class TopConfidenceStrategy implements ConsensusStrategy {

    public static final String NAME = "top_confidence";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }
        Prediction top = BasicStrategies.topConfidence(predictions);
        return new Prediction(NAME, top.value(), top.confidence());
    }
}
