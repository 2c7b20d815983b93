package com.consensusplatform.common.exception;

public class EmbeddingException extends ConsensusException {

    public EmbeddingException(String strategyName, String message) {
        super(strategyName, message);
    }

    public EmbeddingException(String strategyName, String message, Throwable cause) {
        super(strategyName, message, cause);
    }
}
