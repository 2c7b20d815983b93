package com.consensusplatform.engine.instrument;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of rerunning a strategy on confidence-perturbed copies of its input.
 * {@code stability} is the mean per-trial stability, {@code stabilityStd} its population
 * standard deviation.
 */
public record PerturbationReport(
    @JsonProperty("stability")    double stability,
    @JsonProperty("stabilityStd") double stabilityStd,
    @JsonProperty("trials")       int trials
) {
    /** Report for input too small to perturb. */
    public static PerturbationReport trivial() {
        return new PerturbationReport(1.0, 0.0, 0);
    }
}
