package com.consensusplatform.engine.tournament;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Win/loss record of one contributor across recent tournaments.
 *
 * <p>{@code trend} is {@code recentWinRate − overallWinRate}, where recent means the
 * last {@value #RECENT_WINDOW} matches.
 */
public record TournamentStats(
    @JsonProperty("totalMatches")   int totalMatches,
    @JsonProperty("overallWinRate") double overallWinRate,
    @JsonProperty("recentWinRate")  double recentWinRate,
    @JsonProperty("trend")          double trend,
    @JsonProperty("wins")           int wins,
    @JsonProperty("losses")         int losses
) {
    public static final int RECENT_WINDOW = 10;
}
