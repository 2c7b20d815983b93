package com.consensusplatform.common.exception;

/**
 * Raised synchronously when a strategy receives a {@code null} or empty prediction list.
 */
public class EmptyPredictionsException extends ConsensusException {

    public EmptyPredictionsException(String strategyName) {
        super(strategyName, "No predictions to aggregate");
    }
}
