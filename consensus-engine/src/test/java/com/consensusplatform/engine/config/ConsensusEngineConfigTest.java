package com.consensusplatform.engine.config;

import com.consensusplatform.common.exception.UnknownStrategyException;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.aggregator.ConsensusAggregator;
import com.consensusplatform.engine.registry.StrategyRegistry;
import com.consensusplatform.engine.similarity.RobustConsensusStrategy;
import com.consensusplatform.engine.similarity.ShapleyValueStrategy;
import com.consensusplatform.engine.similarity.SimilarityStrategyType;
import com.consensusplatform.engine.tournament.TournamentEliminationAggregator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConsensusEngineConfigTest {

    private static AnnotationConfigApplicationContext context(Map<String, Object> overrides) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test-overrides", overrides));
        ctx.register(ConsensusEngineConfig.class);
        ctx.refresh();
        return ctx;
    }

    private static final List<Prediction> ANSWERS = List.of(
        new Prediction("a", "Paris", 0.9),
        new Prediction("b", "Paris", 0.7),
        new Prediction("c", "London", 0.6));

    // ── defaults ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Default wiring")
    class Defaults {

        @Test
        @DisplayName("registers all ten strategies in a fixed order")
        void registry() {
            try (AnnotationConfigApplicationContext ctx = context(Map.of())) {
                StrategyRegistry registry = ctx.getBean(StrategyRegistry.class);
                assertEquals(List.of(
                    "top_confidence", "majority_vote", "weighted_average", "adaptive_consensus",
                    "semantic_clustering", "semantic_clustering_strict", "shapley_value", "entropy_based",
                    "robust_consensus", "tournament_elimination"), registry.names());
                assertSame(ctx.getBean(TournamentEliminationAggregator.class),
                    registry.get(TournamentEliminationAggregator.NAME));
            }
        }

        @Test
        @DisplayName("default aggregator wraps adaptive consensus")
        void defaultAggregator() {
            try (AnnotationConfigApplicationContext ctx = context(Map.of())) {
                ConsensusAggregator aggregator = ctx.getBean(ConsensusAggregator.class);
                assertEquals("adaptive_consensus", aggregator.name());
                assertEquals("Paris", aggregator.aggregate(ANSWERS).block().value());
            }
        }

        @Test
        @DisplayName("every registered strategy answers the same question")
        void everyStrategyRuns() {
            try (AnnotationConfigApplicationContext ctx = context(Map.of("consensus.random-seed", "7"))) {
                StrategyRegistry registry = ctx.getBean(StrategyRegistry.class);
                for (String name : registry.names()) {
                    Prediction r = registry.get(name).aggregate(ANSWERS);
                    assertNotNull(r, name);
                    assertTrue(r.confidence() >= 0.0 && r.confidence() <= 1.0, name);
                }
                assertEquals("Paris", registry.get("semantic_clustering").aggregate(ANSWERS).value());
                assertEquals("Paris", registry.get("robust_consensus").aggregate(ANSWERS).value());
            }
        }
    }

    // ── overrides ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Property overrides")
    class Overrides {

        @Test
        @DisplayName("default strategy and robust members follow properties")
        void overrides() {
            try (AnnotationConfigApplicationContext ctx = context(Map.of(
                    "consensus.default-strategy", "majority_vote",
                    "consensus.robust.strategies", "shapley"))) {
                assertEquals("majority_vote", ctx.getBean(ConsensusAggregator.class).name());
                RobustConsensusStrategy robust = (RobustConsensusStrategy) ctx.getBean(StrategyRegistry.class)
                    .get(RobustConsensusStrategy.NAME);
                assertEquals(List.of(ShapleyValueStrategy.NAME), robust.strategyNames());
            }
        }

        @Test
        @DisplayName("a fixed seed makes sampled weights reproducible across contexts")
        void seeded() {
            Map<String, Object> seed = Map.of("consensus.random-seed", "42");
            double[] first;
            double[] second;
            try (AnnotationConfigApplicationContext ctx = context(seed)) {
                first = ((ShapleyValueStrategy) ctx.getBean(StrategyRegistry.class).get(ShapleyValueStrategy.NAME))
                    .computeWeights(ANSWERS);
            }
            try (AnnotationConfigApplicationContext ctx = context(seed)) {
                second = ((ShapleyValueStrategy) ctx.getBean(StrategyRegistry.class).get(ShapleyValueStrategy.NAME))
                    .computeWeights(ANSWERS);
            }
            assertArrayEquals(first, second, 0.0);
        }

        @Test
        @DisplayName("unknown default strategy fails start-up with the valid names")
        void unknownDefault() {
            BeanCreationException ex = assertThrows(BeanCreationException.class,
                () -> context(Map.of("consensus.default-strategy", "median")));
            Throwable root = ex;
            while (root.getCause() != null) root = root.getCause();
            assertInstanceOf(UnknownStrategyException.class, root);
            assertTrue(root.getMessage().contains("adaptive_consensus"));
        }
    }

    @Test
    @DisplayName("robust member list parses names and defaults to all types")
    void parseRobustTypes() {
        assertEquals(Set.of(SimilarityStrategyType.SEMANTIC, SimilarityStrategyType.ENTROPY),
            ConsensusEngineConfig.parseRobustTypes("semantic, entropy"));
        assertEquals(Set.of(SimilarityStrategyType.values()), ConsensusEngineConfig.parseRobustTypes(" "));
        assertThrows(IllegalArgumentException.class, () -> ConsensusEngineConfig.parseRobustTypes("median"));
    }
}
