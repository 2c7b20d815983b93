package com.consensusplatform.engine.similarity;

import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.strategy.BasicStrategies;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import com.consensusplatform.engine.strategy.PredictionGuard;
import com.consensusplatform.engine.strategy.StrategyDiagnostics;
import com.consensusplatform.engine.strategy.StrategyWithDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs several similarity strategies on the same input and combines their answers.
 *
 * <h3>Combination</h3>
 * <ul>
 *   <li>every answer numeric – confidence-weighted average; confidence is the mean
 *       confidence of the answers</li>
 *   <li>otherwise – confidence-weighted vote; confidence is the summed confidence of the
 *       answers agreeing with the winner divided by the number of answers</li>
 * </ul>
 *
 * <p>A failing sub-strategy is logged and skipped. When every sub-strategy fails the
 * raw input is combined directly: plain mean for numeric values, majority vote
 * otherwise.
 */
public class RobustConsensusStrategy implements StrategyWithDiagnostics {

    private static final Logger log = LoggerFactory.getLogger(RobustConsensusStrategy.class);

    public static final String NAME      = "robust_consensus";
    public static final String RESULT_ID = "robust_consensus";

    private final List<ConsensusStrategy> strategies;

    private volatile StrategyDiagnostics lastDiagnostics = StrategyDiagnostics.empty();

    public RobustConsensusStrategy(List<ConsensusStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("RobustConsensusStrategy needs at least one sub-strategy");
        }
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StrategyDiagnostics lastDiagnostics() {
        return lastDiagnostics;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ConsensusStrategy::name).toList();
    }

    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        return run(predictions, true);
    }

    /** Reruns every sub-strategy through its own non-recording path. */
    @Override
    public Prediction evaluate(List<Prediction> predictions) {
        return run(predictions, false);
    }

    private Prediction run(List<Prediction> predictions, boolean record) {
        if (record) {
            lastDiagnostics = StrategyDiagnostics.empty();
        }
        if (PredictionGuard.isPassThrough(predictions, NAME)) {
            return predictions.get(0);
        }

        List<Prediction> answers = new ArrayList<>();
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (ConsensusStrategy strategy : strategies) {
            try {
                answers.add(record ? strategy.aggregate(predictions) : strategy.evaluate(predictions));
                succeeded.add(strategy.name());
                if (record && strategy instanceof StrategyWithDiagnostics withDiagnostics) {
                    withDiagnostics.lastDiagnostics().contributions()
                        .forEach((id, w) -> contributions.merge(id, w, Double::sum));
                }
            } catch (RuntimeException e) {
                failed.add(strategy.name());
                log.error("[Robust] sub-strategy={} failed, skipping it", strategy.name(), e);
            }
        }

        if (record) {
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("succeeded", List.copyOf(succeeded));
            info.put("failed", List.copyOf(failed));
            lastDiagnostics = new StrategyDiagnostics(contributions, info);
        }

        if (answers.isEmpty()) {
            log.warn("[Robust] all {} sub-strategies failed, combining raw input", strategies.size());
            return combineRaw(predictions);
        }

        Prediction result = combine(answers);
        log.info("[Robust] succeeded={} failed={} value={} confidence={}",
            succeeded, failed, result.value(), String.format("%.3f", result.confidence()));
        return result;
    }

    private static Prediction combine(List<Prediction> answers) {
        if (PredictionGuard.allNumeric(answers)) {
            return new Prediction(RESULT_ID,
                BasicStrategies.weightedAverage(answers),
                BasicStrategies.meanConfidence(answers));
        }
        double[] weights = new double[answers.size()];
        for (int i = 0; i < answers.size(); i++) weights[i] = answers.get(i).confidence();
        String winner = BasicStrategies.weightedVote(answers, weights);

        double agreeing = 0;
        for (Prediction a : answers) {
            if (a.text().equals(winner)) agreeing += a.confidence();
        }
        return new Prediction(RESULT_ID, winner, Math.min(1.0, agreeing / answers.size()));
    }

    private static Prediction combineRaw(List<Prediction> predictions) {
        if (PredictionGuard.allNumeric(predictions)) {
            double sum = 0;
            for (Prediction p : predictions) sum += p.numericValue();
            return new Prediction(RESULT_ID, sum / predictions.size(),
                BasicStrategies.meanConfidence(predictions));
        }
        String winner = BasicStrategies.majorityVote(predictions);
        return new Prediction(RESULT_ID, winner, BasicStrategies.meanConfidenceOf(predictions, winner));
    }
}
