package com.consensusplatform.engine.instrument;

/**
 * Switches and knobs for {@link InstrumentedAggregator}.
 *
 * <p>{@code perturbationSigma} is the standard deviation of the Gaussian noise added to
 * each confidence; {@code perturbationTrials} the number of reruns.
 */
public record MetricsSettings(
    boolean enabled,
    boolean perturbationEnabled,
    int perturbationTrials,
    double perturbationSigma
) {
    public static final int    DEFAULT_TRIALS = 5;
    public static final double DEFAULT_SIGMA  = 0.1;

    public MetricsSettings {
        if (perturbationTrials < 1) {
            throw new IllegalArgumentException("perturbationTrials must be at least 1, got " + perturbationTrials);
        }
        if (perturbationSigma < 0.0) {
            throw new IllegalArgumentException("perturbationSigma must not be negative, got " + perturbationSigma);
        }
    }

    public static MetricsSettings defaults() {
        return new MetricsSettings(true, false, DEFAULT_TRIALS, DEFAULT_SIGMA);
    }

    public MetricsSettings withPerturbation(int trials, double sigma) {
        return new MetricsSettings(enabled, true, trials, sigma);
    }
}
