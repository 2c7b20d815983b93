package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;

import java.util.List;

/**
 * Most frequent stringified value wins. Confidence is the mean confidence of the
 * predictions that voted for the winner.
 */
public class MajorityVoteStrategy implements ConsensusStrategy {

    public static final String NAME = "majority_vote";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }
        String winner = BasicStrategies.majorityVote(predictions);
        return new Prediction(NAME, winner, BasicStrategies.meanConfidenceOf(predictions, winner));
    }
}
