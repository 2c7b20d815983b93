package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.model.Prediction;

/**
 * Decides which of two predictions better answers a task.
 *
 * <p>Implementations may block (a remote model call, for instance); the tournament runs
 * each call on a bounded-elastic worker under a timeout. Exceptions and timeouts are
 * resolved by the tournament's confidence-comparison fallback.
 */
@FunctionalInterface
public interface TournamentArbiter {

    ArbitrationVerdict arbitrate(Prediction a, Prediction b, String task);
}
