package com.consensusplatform.engine.aggregator;

import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.logger.ConsensusFlowLogger;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Adapts a synchronous {@link ConsensusStrategy} to {@link ConsensusAggregator}.
 *
 * <p>The strategy runs on the subscribing thread. Strategy bodies are CPU-bound and never
 * block, so no scheduler hop is made.
 */
public class StrategyAggregator implements ConsensusAggregator {

    private final ConsensusStrategy strategy;
    private final ConsensusFlowLogger flowLogger;

    public StrategyAggregator(ConsensusStrategy strategy) {
        this(strategy, new ConsensusFlowLogger());
    }

    public StrategyAggregator(ConsensusStrategy strategy, ConsensusFlowLogger flowLogger) {
        this.strategy = strategy;
        this.flowLogger = flowLogger;
    }

    @Override
    public String name() {
        return strategy.name();
    }

    public ConsensusStrategy strategy() {
        return strategy;
    }

    @Override
    public Mono<Prediction> aggregate(List<Prediction> predictions) {
        return Mono.fromCallable(() -> strategy.aggregate(predictions))
            .doOnEach(flowLogger.stage(ConsensusFlowLogger.STRATEGY_COMPLETED,
                result -> "strategy=" + strategy.name() + " resultId=" + result.contributorId()));
    }
}
