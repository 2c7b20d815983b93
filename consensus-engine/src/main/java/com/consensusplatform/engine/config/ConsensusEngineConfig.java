package com.consensusplatform.engine.config;

import com.consensusplatform.common.embedding.EmbeddingProvider;
import com.consensusplatform.common.embedding.TermFrequencyEmbeddingProvider;
import com.consensusplatform.engine.aggregator.ConsensusAggregator;
import com.consensusplatform.engine.instrument.InstrumentedAggregator;
import com.consensusplatform.engine.instrument.MetricsSettings;
import com.consensusplatform.engine.logger.ConsensusFlowLogger;
import com.consensusplatform.engine.registry.StrategyRegistry;
import com.consensusplatform.engine.similarity.ClusteringMethod;
import com.consensusplatform.engine.similarity.ClusteringSettings;
import com.consensusplatform.engine.similarity.EmbeddingScaling;
import com.consensusplatform.engine.similarity.EntropyBasedStrategy;
import com.consensusplatform.engine.similarity.RobustConsensusStrategy;
import com.consensusplatform.engine.similarity.SemanticClusteringStrategy;
import com.consensusplatform.engine.similarity.ShapleyValueStrategy;
import com.consensusplatform.engine.similarity.SimilarityStrategyType;
import com.consensusplatform.engine.strategy.AdaptiveConsensusStrategy;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import com.consensusplatform.engine.strategy.MajorityVoteStrategy;
import com.consensusplatform.engine.strategy.TopConfidenceStrategy;
import com.consensusplatform.engine.strategy.WeightedAverageStrategy;
import com.consensusplatform.engine.tournament.HeuristicArbiter;
import com.consensusplatform.engine.tournament.TournamentArbiter;
import com.consensusplatform.engine.tournament.TournamentEliminationAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

/**
 * Spring wiring for the consensus engine.
 *
 * <p>Every tunable comes from a {@code consensus.*} property with an inline default;
 * {@code consensus-engine.properties} on the classpath documents them. An
 * {@link EmbeddingProvider} bean is optional; without one the term-frequency provider is
 * used. When {@code consensus.random-seed} is set every randomised component gets its
 * own {@link Random} seeded from it, so runs are reproducible.
 */
@Configuration
@PropertySource("classpath:consensus-engine.properties")
public class ConsensusEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(ConsensusEngineConfig.class);

    @Value("${consensus.default-strategy:adaptive_consensus}")
    private String defaultStrategy;

    @Value("${consensus.random-seed:}")
    private String randomSeed;

    // ── semantic clustering ─────────────────────────────────────────────────

    @Value("${consensus.semantic.similarity-threshold:0.7}")
    private double similarityThreshold;

    @Value("${consensus.semantic.min-cluster-size:2}")
    private int minClusterSize;

    @Value("${consensus.semantic.method:density}")
    private String clusteringMethod;

    @Value("${consensus.semantic.k:0}")
    private int clusterCount;

    @Value("${consensus.semantic.noise-eligible:false}")
    private boolean noiseEligible;

    // ── shapley / entropy / robust ──────────────────────────────────────────

    @Value("${consensus.shapley.permutations:100}")
    private int shapleyPermutations;

    @Value("${consensus.entropy.threshold:0.5}")
    private double entropyThreshold;

    @Value("${consensus.robust.strategies:semantic,shapley,entropy}")
    private String robustStrategies;

    // ── tournament ──────────────────────────────────────────────────────────

    @Value("${consensus.tournament.consistency-penalty:0.1}")
    private double consistencyPenalty;

    @Value("${consensus.tournament.winner-boost:0.05}")
    private double winnerBoost;

    @Value("${consensus.tournament.arbitration-timeout-ms:30000}")
    private long arbitrationTimeoutMs;

    // ── instrumentation ─────────────────────────────────────────────────────

    @Value("${consensus.metrics.enabled:true}")
    private boolean metricsEnabled;

    @Value("${consensus.metrics.perturbation-enabled:false}")
    private boolean perturbationEnabled;

    @Value("${consensus.metrics.perturbation-trials:5}")
    private int perturbationTrials;

    @Value("${consensus.metrics.perturbation-sigma:0.1}")
    private double perturbationSigma;

    @Bean
    public static PropertySourcesPlaceholderConfigurer consensusPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    public ConsensusFlowLogger consensusFlowLogger() {
        return new ConsensusFlowLogger();
    }

    @Bean
    public TournamentArbiter tournamentArbiter() {
        return new HeuristicArbiter(newRandom(1));
    }

    @Bean
    public TournamentEliminationAggregator tournamentEliminationAggregator(TournamentArbiter arbiter,
                                                                           ConsensusFlowLogger flowLogger) {
        return new TournamentEliminationAggregator(arbiter, consistencyPenalty, winnerBoost,
            Duration.ofMillis(arbitrationTimeoutMs), newRandom(2), flowLogger);
    }

    @Bean
    public StrategyRegistry strategyRegistry(ObjectProvider<EmbeddingProvider> embeddingProviders,
                                             TournamentEliminationAggregator tournament) {
        EmbeddingProvider embeddings = embeddingProviders.getIfAvailable(TermFrequencyEmbeddingProvider::new);

        ClusteringSettings clustering = new ClusteringSettings(similarityThreshold, minClusterSize,
            ClusteringMethod.fromName(clusteringMethod), clusterCount, noiseEligible,
            EmbeddingScaling.UNIT_LENGTH, true);

        SemanticClusteringStrategy semantic = new SemanticClusteringStrategy(
            SemanticClusteringStrategy.NAME, embeddings, clustering, newRandom(3));
        SemanticClusteringStrategy strict = new SemanticClusteringStrategy(
            SemanticClusteringStrategy.STRICT_NAME, embeddings, ClusteringSettings.strict(), newRandom(4));
        ShapleyValueStrategy shapley = new ShapleyValueStrategy(embeddings, shapleyPermutations, newRandom(5));
        EntropyBasedStrategy entropy = new EntropyBasedStrategy(embeddings, entropyThreshold);

        List<ConsensusStrategy> robustMembers = new ArrayList<>();
        for (SimilarityStrategyType type : parseRobustTypes(robustStrategies)) {
            switch (type) {
                case SEMANTIC -> robustMembers.add(semantic);
                case SHAPLEY -> robustMembers.add(shapley);
                case ENTROPY -> robustMembers.add(entropy);
            }
        }

        StrategyRegistry registry = new StrategyRegistry()
            .register(new TopConfidenceStrategy())
            .register(new MajorityVoteStrategy())
            .register(new WeightedAverageStrategy())
            .register(new AdaptiveConsensusStrategy())
            .register(semantic)
            .register(strict)
            .register(shapley)
            .register(entropy)
            .register(new RobustConsensusStrategy(robustMembers))
            .register(tournament);

        log.info("[ConsensusEngineConfig] strategies={} embeddingProvider={}",
            registry.names(), embeddings.getClass().getSimpleName());
        return registry;
    }

    @Bean
    public ConsensusAggregator consensusAggregator(StrategyRegistry registry, ConsensusFlowLogger flowLogger) {
        MetricsSettings metrics = new MetricsSettings(metricsEnabled, perturbationEnabled,
            perturbationTrials, perturbationSigma);
        log.info("[ConsensusEngineConfig] defaultStrategy={} metricsEnabled={} perturbationEnabled={}",
            defaultStrategy, metricsEnabled, perturbationEnabled);
        return new InstrumentedAggregator(registry.get(defaultStrategy), metrics, newRandom(6), flowLogger);
    }

    static Set<SimilarityStrategyType> parseRobustTypes(String csv) {
        Set<SimilarityStrategyType> types = new LinkedHashSet<>();
        for (String part : csv.split(",")) {
            if (!part.isBlank()) types.add(SimilarityStrategyType.fromName(part));
        }
        if (types.isEmpty()) {
            types.addAll(List.of(SimilarityStrategyType.values()));
        }
        return types;
    }

    private Random newRandom(int salt) {
        if (randomSeed == null || randomSeed.isBlank()) {
            return new Random();
        }
        return new Random(Long.parseLong(randomSeed.trim()) + salt);
    }
}
