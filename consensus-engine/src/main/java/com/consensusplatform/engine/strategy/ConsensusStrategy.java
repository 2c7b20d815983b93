package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;

import java.util.List;

/**
 * Strategy contract for reducing a set of independently produced predictions to one
 * consensus {@link Prediction}.
 *
 * <p>Implementations must:
 * <ul>
 *   <li><b>Reject empty input</b>: throw {@code EmptyPredictionsException} for a
 *       {@code null} or empty list</li>
 *   <li><b>Pass singletons through</b>: a one-element list returns that element unchanged,
 *       so re-aggregating a consensus output is idempotent</li>
 *   <li><b>Never mutate inputs</b>: synthesise a new {@link Prediction} whose confidence is
 *       in [0, 1] and whose contributor id is distinct from every input contributor</li>
 * </ul>
 *
 * <p>Strategy bodies are synchronous, CPU-bound computations. The asynchronous contract
 * lives in {@link com.consensusplatform.engine.aggregator.ConsensusAggregator}.
 * Instances that keep history are single-writer: one aggregation in flight at a time.
 */
public interface ConsensusStrategy {

    /** Registry name, e.g. {@code majority_vote}. */
    String name();

    /**
     * @param predictions non-null, non-empty list of predictions
     * @return the consensus prediction, never {@code null}
     */
    Prediction aggregate(List<Prediction> predictions);

    /**
     * Computes the same answer as {@link #aggregate} but leaves any history or
     * diagnostics the strategy keeps untouched. Used for what-if reruns such as
     * perturbation trials. Stateless strategies need not override it.
     */
    default Prediction evaluate(List<Prediction> predictions) {
        return aggregate(predictions);
    }
}
