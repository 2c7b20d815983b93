package com.consensusplatform.common.exception;

import java.util.Collection;
import java.util.List;

/**
 * Raised by a strategy registry lookup for a name that was never registered.
 * The message lists every valid name.
 */
public class UnknownStrategyException extends ConsensusException {
    private final List<String> availableStrategies;

    public UnknownStrategyException(String requestedName, Collection<String> availableStrategies) {
        super("registry", "Unknown strategy '" + requestedName + "'. Available: "
            + String.join(", ", availableStrategies));
        this.availableStrategies = List.copyOf(availableStrategies);
    }

    public List<String> getAvailableStrategies() {
        return availableStrategies;
    }
}
