package com.consensusplatform.engine.registry;

import com.consensusplatform.common.exception.UnknownStrategyException;
import com.consensusplatform.engine.strategy.MajorityVoteStrategy;
import com.consensusplatform.engine.strategy.TopConfidenceStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StrategyRegistryTest {

    private final StrategyRegistry registry = new StrategyRegistry()
        .register(new TopConfidenceStrategy())
        .register(new MajorityVoteStrategy());

    @Test
    @DisplayName("looks strategies up by name")
    void lookup() {
        assertInstanceOf(MajorityVoteStrategy.class, registry.get(MajorityVoteStrategy.NAME));
        assertTrue(registry.contains(TopConfidenceStrategy.NAME));
        assertFalse(registry.contains("nope"));
    }

    @Test
    @DisplayName("keeps registration order")
    void order() {
        assertEquals(List.of(TopConfidenceStrategy.NAME, MajorityVoteStrategy.NAME), registry.names());
    }

    @Test
    @DisplayName("unknown name lists every valid name")
    void unknown() {
        UnknownStrategyException ex = assertThrows(UnknownStrategyException.class, () -> registry.get("median"));
        assertTrue(ex.getMessage().contains("median"));
        assertTrue(ex.getMessage().contains(TopConfidenceStrategy.NAME));
        assertTrue(ex.getMessage().contains(MajorityVoteStrategy.NAME));
        assertEquals(registry.names(), ex.getAvailableStrategies());
    }

    @Test
    @DisplayName("registering a name twice is rejected")
    void duplicate() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(new MajorityVoteStrategy()));
        assertEquals(2, registry.names().size());
    }
}
