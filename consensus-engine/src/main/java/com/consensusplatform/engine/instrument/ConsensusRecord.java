package com.consensusplatform.engine.instrument;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Compact audit line for one aggregation, kept longer than full metrics snapshots.
 */
public record ConsensusRecord(
    @JsonProperty("completedAt")       Instant completedAt,
    @JsonProperty("predictionCount")   int predictionCount,
    @JsonProperty("resultValue")       String resultValue,
    @JsonProperty("resultConfidence")  double resultConfidence,
    @JsonProperty("aggregationMillis") double aggregationMillis,
    @JsonProperty("agreementScore")    double agreementScore,
    @JsonProperty("predictionEntropy") double predictionEntropy,
    @JsonProperty("perturbation")      PerturbationReport perturbation
) {}
