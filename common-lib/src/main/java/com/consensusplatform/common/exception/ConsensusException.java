package com.consensusplatform.common.exception;

public class ConsensusException extends RuntimeException {
    private final String strategyName;

    public ConsensusException(String strategyName, String message) {
        super("[" + strategyName + "] " + message);
        this.strategyName = strategyName;
    }

    public ConsensusException(String strategyName, String message, Throwable cause) {
        super("[" + strategyName + "] " + message, cause);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
