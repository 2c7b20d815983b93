package com.consensusplatform.engine.instrument;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of one instrumented aggregation.
 *
 * <p>{@code perturbation} is {@code null} when robustness testing is disabled or failed.
 */
public record PerformanceMetrics(
    @JsonProperty("recordedAt")        Instant recordedAt,
    @JsonProperty("strategy")          String strategy,
    @JsonProperty("predictionCount")   int predictionCount,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("agreementScore")    double agreementScore,
    @JsonProperty("predictionEntropy") double predictionEntropy,
    @JsonProperty("aggregationMillis") double aggregationMillis,
    @JsonProperty("contributions")     Map<String, Double> contributions,
    @JsonProperty("outlierRate")       double outlierRate,
    @JsonProperty("clusterInfo")       Map<String, Object> clusterInfo,
    @JsonProperty("perturbation")      PerturbationReport perturbation
) {
    public PerformanceMetrics {
        contributions = contributions == null ? Map.of() : Map.copyOf(contributions);
        clusterInfo = clusterInfo == null ? Map.of() : Map.copyOf(clusterInfo);
    }
}
