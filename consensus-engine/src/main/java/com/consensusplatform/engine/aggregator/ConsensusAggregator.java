package com.consensusplatform.engine.aggregator;

import com.consensusplatform.common.model.Prediction;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Asynchronous aggregation contract consumed by orchestrators.
 *
 * <p>The returned {@link Mono} emits exactly one consensus prediction, or errors with a
 * {@link com.consensusplatform.common.exception.ConsensusException} for invalid input.
 * Nothing runs until subscription.
 */
public interface ConsensusAggregator {

    String name();

    Mono<Prediction> aggregate(List<Prediction> predictions);
}
