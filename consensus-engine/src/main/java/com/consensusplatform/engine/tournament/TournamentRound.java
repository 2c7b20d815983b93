package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.model.Prediction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A resolved round. {@code bye} is the contestant that advanced without playing
 * ({@code null} when the contestant count was even); {@code winners} lists the bye first,
 * then the match winners in match order.
 */
public record TournamentRound(
    @JsonProperty("roundNumber") int roundNumber,
    @JsonProperty("matches")     List<TournamentMatch> matches,
    @JsonProperty("bye")         Prediction bye,
    @JsonProperty("winners")     List<Prediction> winners
) {
    public TournamentRound {
        matches = List.copyOf(matches);
        winners = List.copyOf(winners);
    }
}
