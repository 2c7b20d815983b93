package com.consensusplatform.engine.instrument;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contribution record of one contributor.
 *
 * <ul>
 *   <li>{@code trend} – mean of the last 5 contributions minus the mean of the 5 before;
 *       0 with fewer than 10 entries</li>
 *   <li>{@code consistency} – {@code 1 − std/(mean + 1e-8)}</li>
 * </ul>
 */
public record ContributorPerformance(
    @JsonProperty("contributorId")       String contributorId,
    @JsonProperty("averageContribution") double averageContribution,
    @JsonProperty("trend")               double trend,
    @JsonProperty("consistency")         double consistency,
    @JsonProperty("participations")      int participations
) {}
