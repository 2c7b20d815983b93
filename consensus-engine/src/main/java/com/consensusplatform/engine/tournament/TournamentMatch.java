package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.tournament.ArbitrationVerdict.Choice;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One pairing. {@code side}, {@code winner} and {@code rationale} stay {@code null} until
 * resolved.
 *
 * <p>The winner carries the contributor id and value of the chosen side with its
 * confidence shifted by {@code confidenceDelta} and clamped to [0, 1].
 */
public record TournamentMatch(
    @JsonProperty("first")           Prediction first,
    @JsonProperty("second")          Prediction second,
    @JsonProperty("side")            Choice side,
    @JsonProperty("winner")          Prediction winner,
    @JsonProperty("rationale")       String rationale,
    @JsonProperty("confidenceDelta") double confidenceDelta,
    @JsonProperty("fallback")        boolean fallback
) {
    static final String FALLBACK_PREFIX = "Fallback decision due to arbitration error: ";

    public static TournamentMatch pending(Prediction first, Prediction second) {
        return new TournamentMatch(first, second, null, null, null, 0.0, false);
    }

    /** Applies an arbiter's verdict. */
    public TournamentMatch resolve(ArbitrationVerdict verdict) {
        Prediction chosen = verdict.winner() == Choice.A ? first : second;
        Prediction adjusted = chosen.withConfidence(chosen.confidence() + verdict.confidenceDelta());
        return new TournamentMatch(first, second, verdict.winner(), adjusted,
            verdict.rationale(), verdict.confidenceDelta(), false);
    }

    /** Resolves by confidence alone, {@code first} on ties, with no adjustment. */
    public TournamentMatch resolveByConfidence(Throwable cause) {
        Choice chosen = first.confidence() >= second.confidence() ? Choice.A : Choice.B;
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TournamentMatch(first, second, chosen, chosen == Choice.A ? first : second,
            FALLBACK_PREFIX + reason, 0.0, true);
    }

    @JsonIgnore
    public boolean isResolved() {
        return side != null;
    }

    /** The side that did not advance; {@code null} while pending. */
    @JsonIgnore
    public Prediction loser() {
        if (side == null) return null;
        return side == Choice.A ? second : first;
    }
}
