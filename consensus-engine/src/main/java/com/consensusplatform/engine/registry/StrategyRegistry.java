package com.consensusplatform.engine.registry;

import com.consensusplatform.common.exception.UnknownStrategyException;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Name → strategy lookup, built once at start-up and passed by reference.
 *
 * <p>Names keep registration order. Registering a name twice is rejected.
 */
public class StrategyRegistry {

    private static final Logger log = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, ConsensusStrategy> strategies = new LinkedHashMap<>();

    public synchronized StrategyRegistry register(ConsensusStrategy strategy) {
        String name = strategy.name();
        if (strategies.containsKey(name)) {
            throw new IllegalArgumentException("Strategy '" + name + "' is already registered");
        }
        strategies.put(name, strategy);
        log.debug("[StrategyRegistry] registered strategy={}", name);
        return this;
    }

    /**
     * @throws UnknownStrategyException when nothing is registered under {@code name};
     *                                  the message lists the valid names
     */
    public synchronized ConsensusStrategy get(String name) {
        ConsensusStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new UnknownStrategyException(name, strategies.keySet());
        }
        return strategy;
    }

    public synchronized boolean contains(String name) {
        return strategies.containsKey(name);
    }

    /** Registered names in registration order. */
    public synchronized List<String> names() {
        return List.copyOf(strategies.keySet());
    }
}
