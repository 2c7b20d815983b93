package com.consensusplatform.engine.strategy;

/**
 * Optional capability for strategies that track per-contributor contributions or cluster
 * diagnostics. Instrumentation checks for this interface and falls back to heuristics
 * when a strategy does not implement it.
 */
public interface StrategyWithDiagnostics extends ConsensusStrategy {

    /**
     * Diagnostics of the most recent {@link #aggregate} call, or
     * {@link StrategyDiagnostics#empty()} before the first call. Every call replaces
     * them, including single-prediction pass-through calls, which leave them empty.
     */
    StrategyDiagnostics lastDiagnostics();
}
