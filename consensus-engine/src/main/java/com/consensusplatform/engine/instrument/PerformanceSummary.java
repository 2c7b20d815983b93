package com.consensusplatform.engine.instrument;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Averages over the most recent snapshots plus the best recent contributors.
 */
public record PerformanceSummary(
    @JsonProperty("averageConfidence")        double averageConfidence,
    @JsonProperty("averageAgreement")         double averageAgreement,
    @JsonProperty("averageEntropy")           double averageEntropy,
    @JsonProperty("averageAggregationMillis") double averageAggregationMillis,
    @JsonProperty("averageOutlierRate")       double averageOutlierRate,
    @JsonProperty("topContributors")          List<ContributorScore> topContributors,
    @JsonProperty("totalAggregations")        int totalAggregations
) {
    public PerformanceSummary {
        topContributors = List.copyOf(topContributors);
    }

    public record ContributorScore(
        @JsonProperty("contributorId") String contributorId,
        @JsonProperty("score")         double score
    ) {}
}
