package com.consensusplatform.engine.strategy;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Snapshot of what a strategy learned while aggregating.
 *
 * <ul>
 *   <li>{@code contributions} – contributorId → contribution weight; empty when the
 *       strategy does not attribute credit</li>
 *   <li>{@code clusterInfo} – free-form cluster diagnostics (sizes, counts); empty when
 *       the strategy does not cluster</li>
 * </ul>
 */
public record StrategyDiagnostics(
    @JsonProperty("contributions") Map<String, Double> contributions,
    @JsonProperty("clusterInfo")   Map<String, Object> clusterInfo
) {
    private static final StrategyDiagnostics EMPTY = new StrategyDiagnostics(Map.of(), Map.of());

    public StrategyDiagnostics {
        contributions = contributions == null ? Map.of() : Map.copyOf(contributions);
        clusterInfo   = clusterInfo == null ? Map.of() : Map.copyOf(clusterInfo);
    }

    public static StrategyDiagnostics empty() {
        return EMPTY;
    }

    public static StrategyDiagnostics ofContributions(Map<String, Double> contributions) {
        return new StrategyDiagnostics(contributions, Map.of());
    }

    public static StrategyDiagnostics ofClusterInfo(Map<String, Object> clusterInfo) {
        return new StrategyDiagnostics(Map.of(), clusterInfo);
    }
}
