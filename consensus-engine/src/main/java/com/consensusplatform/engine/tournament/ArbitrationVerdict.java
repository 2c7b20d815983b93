package com.consensusplatform.engine.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An arbiter's decision for one match.
 *
 * <p>{@code confidenceDelta} is clamped to
 * {@code [-MAX_ADJUSTMENT, MAX_ADJUSTMENT]}; a NaN delta becomes 0.
 */
public record ArbitrationVerdict(
    @JsonProperty("winner")          Choice winner,
    @JsonProperty("rationale")       String rationale,
    @JsonProperty("confidenceDelta") double confidenceDelta
) {
    public static final double MAX_ADJUSTMENT = 0.2;

    public enum Choice { A, B }

    public ArbitrationVerdict {
        if (winner == null) {
            throw new IllegalArgumentException("winner must be A or B");
        }
        if (rationale == null) rationale = "";
        if (Double.isNaN(confidenceDelta)) confidenceDelta = 0.0;
        confidenceDelta = Math.max(-MAX_ADJUSTMENT, Math.min(MAX_ADJUSTMENT, confidenceDelta));
    }

    public static ArbitrationVerdict first(String rationale, double confidenceDelta) {
        return new ArbitrationVerdict(Choice.A, rationale, confidenceDelta);
    }

    public static ArbitrationVerdict second(String rationale, double confidenceDelta) {
        return new ArbitrationVerdict(Choice.B, rationale, confidenceDelta);
    }
}
