package com.consensusplatform.engine.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Summary of one finished tournament.
 *
 * <p>{@code repetitionScores} maps each contributor with winning rationales to
 * {@code 1 − unique/total} over the long words of those rationales (0 for a single
 * rationale).
 */
public record TournamentRecord(
    @JsonProperty("completedAt")      Instant completedAt,
    @JsonProperty("participants")     int participants,
    @JsonProperty("championId")       String championId,
    @JsonProperty("repetitionScores") Map<String, Double> repetitionScores,
    @JsonProperty("rounds")           List<TournamentRound> rounds
) {
    public TournamentRecord {
        repetitionScores = Map.copyOf(repetitionScores);
        rounds = List.copyOf(rounds);
    }

    public int roundCount() {
        return rounds.size();
    }

    public int totalMatches() {
        return rounds.stream().mapToInt(r -> r.matches().size()).sum();
    }
}
