package com.consensusplatform.engine.instrument;

import com.consensusplatform.common.history.BoundedHistory;
import com.consensusplatform.common.math.Statistics;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.common.trace.TraceContextUtil;
import com.consensusplatform.engine.aggregator.ConsensusAggregator;
import com.consensusplatform.engine.logger.ConsensusFlowLogger;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import com.consensusplatform.engine.strategy.PredictionGuard;
import com.consensusplatform.engine.strategy.StrategyDiagnostics;
import com.consensusplatform.engine.strategy.StrategyWithDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Wraps a {@link ConsensusStrategy} and measures every aggregation it performs.
 *
 * <h3>Per call</h3>
 * <ol>
 *   <li>run the strategy, timing it with {@link System#nanoTime()}</li>
 *   <li>agreement, entropy and outlier rate of the input ({@link AgreementMetrics})</li>
 *   <li>contributions: the strategy's own when it reports them through
 *       {@link StrategyWithDiagnostics}, the closeness heuristic otherwise</li>
 *   <li>optional perturbation test: rerun on copies whose confidences carry Gaussian
 *       noise through {@link ConsensusStrategy#evaluate}, so the wrapped strategy's own
 *       histories see only the real call, and compare the results</li>
 *   <li>append a {@link PerformanceMetrics} snapshot (last {@value #METRICS_CAPACITY}) and
 *       a {@link ConsensusRecord} (last {@value #CONSENSUS_CAPACITY}), and extend each
 *       contributor's contribution history (last {@value #CONTRIBUTOR_CAPACITY})</li>
 * </ol>
 *
 * <p>Calls made without a round id in the Reactor Context get a fresh one, so every
 * log line of one aggregation can be correlated.
 *
 * <p>History is owned by this instance. One aggregation in flight per instance is the
 * supported usage.
 */
public class InstrumentedAggregator implements ConsensusAggregator {

    private static final Logger log = LoggerFactory.getLogger(InstrumentedAggregator.class);

    static final int METRICS_CAPACITY     = 100;
    static final int CONSENSUS_CAPACITY   = 1000;
    static final int CONTRIBUTOR_CAPACITY = 100;
    static final int SUMMARY_WINDOW       = 10;
    static final int TOP_CONTRIBUTORS     = 5;
    static final int TREND_WINDOW         = 5;

    private final ConsensusStrategy strategy;
    private final MetricsSettings settings;
    private final Random random;
    private final ConsensusFlowLogger flowLogger;

    private final BoundedHistory<PerformanceMetrics> metricsHistory = new BoundedHistory<>(METRICS_CAPACITY);
    private final BoundedHistory<ConsensusRecord> consensusHistory = new BoundedHistory<>(CONSENSUS_CAPACITY);
    private final Map<String, BoundedHistory<Double>> contributorHistory = new ConcurrentHashMap<>();

    public InstrumentedAggregator(ConsensusStrategy strategy) {
        this(strategy, MetricsSettings.defaults(), new Random(), new ConsensusFlowLogger());
    }

    public InstrumentedAggregator(ConsensusStrategy strategy, MetricsSettings settings,
                                  Random random, ConsensusFlowLogger flowLogger) {
        this.strategy = strategy;
        this.settings = settings;
        this.random = random;
        this.flowLogger = flowLogger;
    }

    @Override
    public String name() {
        return strategy.name();
    }

    public ConsensusStrategy strategy() {
        return strategy;
    }

    @Override
    public Mono<Prediction> aggregate(List<Prediction> predictions) {
        return Mono.deferContextual(ctx -> {
            if (!ctx.hasKey(TraceContextUtil.ROUND_ID_KEY)) {
                return TraceContextUtil.withRoundId(aggregate(predictions), TraceContextUtil.newRoundId());
            }
            PredictionGuard.requireNonEmpty(predictions, strategy.name());
            String roundId = TraceContextUtil.getRoundId(ctx);
            flowLogger.logWithRoundId(ConsensusFlowLogger.AGGREGATION_STARTED, roundId,
                "strategy=" + strategy.name() + " n=" + predictions.size());

            long start = System.nanoTime();
            Prediction result = strategy.aggregate(predictions);
            double elapsedMillis = (System.nanoTime() - start) / 1_000_000.0;

            flowLogger.logWithRoundId(ConsensusFlowLogger.STRATEGY_COMPLETED, roundId,
                "strategy=" + strategy.name() + " resultId=" + result.contributorId()
                    + " elapsedMs=" + String.format("%.2f", elapsedMillis));

            if (settings.enabled()) {
                PerformanceMetrics metrics = measure(predictions, result, elapsedMillis);
                flowLogger.logWithRoundId(ConsensusFlowLogger.METRICS_RECORDED, roundId,
                    "agreement=" + String.format("%.3f", metrics.agreementScore())
                        + " entropy=" + String.format("%.3f", metrics.predictionEntropy())
                        + " outlierRate=" + String.format("%.3f", metrics.outlierRate()));
            }
            return Mono.just(result);
        });
    }

    // ── queries ──────────────────────────────────────────────────────────────

    public List<PerformanceMetrics> getMetricsHistory() {
        return metricsHistory.snapshot();
    }

    public List<ConsensusRecord> getConsensusHistory() {
        return consensusHistory.snapshot();
    }

    /**
     * Averages over the last {@value #SUMMARY_WINDOW} snapshots and the top
     * {@value #TOP_CONTRIBUTORS} contributors by mean of their last
     * {@value #SUMMARY_WINDOW} contributions. Empty before the first recorded aggregation.
     */
    public Optional<PerformanceSummary> getPerformanceSummary() {
        if (metricsHistory.isEmpty()) {
            return Optional.empty();
        }
        List<PerformanceMetrics> recent = metricsHistory.latest(SUMMARY_WINDOW);

        List<PerformanceSummary.ContributorScore> ranking = new ArrayList<>();
        contributorHistory.forEach((id, history) -> {
            List<Double> latest = history.latest(SUMMARY_WINDOW);
            if (!latest.isEmpty()) {
                ranking.add(new PerformanceSummary.ContributorScore(id, Statistics.mean(latest)));
            }
        });
        ranking.sort(Comparator.comparingDouble(PerformanceSummary.ContributorScore::score).reversed()
            .thenComparing(PerformanceSummary.ContributorScore::contributorId));

        return Optional.of(new PerformanceSummary(
            recent.stream().mapToDouble(PerformanceMetrics::confidence).average().orElse(0.0),
            recent.stream().mapToDouble(PerformanceMetrics::agreementScore).average().orElse(0.0),
            recent.stream().mapToDouble(PerformanceMetrics::predictionEntropy).average().orElse(0.0),
            recent.stream().mapToDouble(PerformanceMetrics::aggregationMillis).average().orElse(0.0),
            recent.stream().mapToDouble(PerformanceMetrics::outlierRate).average().orElse(0.0),
            ranking.subList(0, Math.min(TOP_CONTRIBUTORS, ranking.size())),
            metricsHistory.size()));
    }

    public Optional<ContributorPerformance> getAgentPerformance(String contributorId) {
        BoundedHistory<Double> history = contributorHistory.get(contributorId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        List<Double> contributions = history.snapshot();
        double mean = Statistics.mean(contributions);

        double trend = 0.0;
        int n = contributions.size();
        if (n >= 2 * TREND_WINDOW) {
            double last = Statistics.mean(contributions.subList(n - TREND_WINDOW, n));
            double previous = Statistics.mean(contributions.subList(n - 2 * TREND_WINDOW, n - TREND_WINDOW));
            trend = last - previous;
        }
        double consistency = 1.0 - Statistics.stdDev(contributions) / (mean + AgreementMetrics.EPSILON);

        return Optional.of(new ContributorPerformance(contributorId, mean, trend, consistency, n));
    }

    // ── measurement ──────────────────────────────────────────────────────────

    private PerformanceMetrics measure(List<Prediction> predictions, Prediction result, double elapsedMillis) {
        double agreement = AgreementMetrics.agreementScore(predictions);
        double entropy = AgreementMetrics.predictionEntropy(predictions);
        double outlierRate = AgreementMetrics.outlierRate(predictions);

        Map<String, Double> contributions;
        StrategyDiagnostics diagnostics = strategy instanceof StrategyWithDiagnostics withDiagnostics
            ? withDiagnostics.lastDiagnostics()
            : StrategyDiagnostics.empty();
        if (!diagnostics.contributions().isEmpty()) {
            contributions = diagnostics.contributions();
        } else {
            contributions = AgreementMetrics.heuristicContributions(predictions, result);
        }
        Map<String, Object> clusterInfo = diagnostics.clusterInfo();

        PerturbationReport perturbation = settings.perturbationEnabled()
            ? testPerturbation(predictions, result)
            : null;

        PerformanceMetrics metrics = new PerformanceMetrics(Instant.now(), strategy.name(),
            predictions.size(), result.confidence(), agreement, entropy, elapsedMillis,
            contributions, outlierRate, clusterInfo, perturbation);

        metricsHistory.add(metrics);
        consensusHistory.add(new ConsensusRecord(metrics.recordedAt(), predictions.size(),
            result.text(), result.confidence(), elapsedMillis, agreement, entropy, perturbation));
        contributions.forEach((id, value) -> contributorHistory
            .computeIfAbsent(id, k -> new BoundedHistory<>(CONTRIBUTOR_CAPACITY))
            .add(value));

        log.debug("[Instrumented] strategy={} contributions={}", strategy.name(), contributions);
        return metrics;
    }

    private PerturbationReport testPerturbation(List<Prediction> predictions, Prediction original) {
        if (predictions.size() < 2) {
            return PerturbationReport.trivial();
        }
        double[] scores = new double[settings.perturbationTrials()];
        try {
            for (int t = 0; t < scores.length; t++) {
                List<Prediction> perturbed = new ArrayList<>(predictions.size());
                for (Prediction p : predictions) {
                    double noise = random.nextGaussian() * settings.perturbationSigma();
                    perturbed.add(p.withConfidence(p.confidence() + noise));
                }
                scores[t] = AgreementMetrics.stability(original, strategy.evaluate(perturbed));
            }
        } catch (RuntimeException e) {
            log.warn("[Instrumented] perturbation test failed for strategy={}", strategy.name(), e);
            return null;
        }
        PerturbationReport report = new PerturbationReport(
            Statistics.mean(scores), Statistics.stdDev(scores), scores.length);
        log.info("[Instrumented] strategy={} stability={} stabilityStd={}",
            strategy.name(), String.format("%.3f", report.stability()), String.format("%.3f", report.stabilityStd()));
        return report;
    }
}
