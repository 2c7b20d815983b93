package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.exception.EmptyPredictionsException;
import com.consensusplatform.common.model.Prediction;

import java.util.List;

/**
 * Input checks shared by every strategy entry point.
 *
 * <p>Pure utility: no state, no logging.
 */
public final class PredictionGuard {

    private PredictionGuard() {}

    /**
     * @throws EmptyPredictionsException when {@code predictions} is {@code null} or empty
     */
    public static void requireNonEmpty(List<Prediction> predictions, String strategyName) {
        if (predictions == null || predictions.isEmpty()) {
            throw new EmptyPredictionsException(strategyName);
        }
    }

    /**
     * Guards the input and reports whether it holds exactly one prediction, which every
     * strategy returns unchanged.
     */
    public static boolean isPassThrough(List<Prediction> predictions, String strategyName) {
        requireNonEmpty(predictions, strategyName);
        return predictions.size() == 1;
    }

    /** True when every value is a number or a numeric string. */
    public static boolean allNumeric(List<Prediction> predictions) {
        for (Prediction p : predictions) {
            if (!p.isNumeric()) return false;
        }
        return true;
    }
}
