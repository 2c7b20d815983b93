package com.consensusplatform.engine.logger;

import com.consensusplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Observability component for the lifecycle of one consensus round.
 *
 * <p>Logs each stage without touching pipeline behaviour. All methods are pure
 * side-effects.
 *
 * <p>Lifecycle stages (in order):
 * <ol>
 *   <li>{@link #AGGREGATION_STARTED}  – predictions handed to an aggregator</li>
 *   <li>{@link #STRATEGY_COMPLETED}   – wrapped strategy produced its result</li>
 *   <li>{@link #METRICS_RECORDED}     – instrumentation snapshot appended to history</li>
 *   <li>{@link #ROUND_COMPLETED}      – one tournament round resolved (tournament only)</li>
 *   <li>{@link #CHAMPION_SELECTED}    – tournament champion crowned (tournament only)</li>
 * </ol>
 *
 * <p>Usage with {@code doOnEach} (reads roundId from Reactor Context):
 * <pre>
 *     .doOnEach(flowLogger.stage(ConsensusFlowLogger.STRATEGY_COMPLETED))
 * </pre>
 */
public class ConsensusFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(ConsensusFlowLogger.class);

    public static final String AGGREGATION_STARTED = "AGGREGATION_STARTED";
    public static final String STRATEGY_COMPLETED  = "STRATEGY_COMPLETED";
    public static final String METRICS_RECORDED    = "METRICS_RECORDED";
    public static final String ROUND_COMPLETED     = "ROUND_COMPLETED";
    public static final String CHAMPION_SELECTED   = "CHAMPION_SELECTED";

    /**
     * Returns a {@code doOnEach} consumer that logs the lifecycle stage on {@code onNext}
     * only. The roundId comes from the Reactor Context, never from MDC.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return stage(stageName, value -> "");
    }

    /**
     * Same as {@link #stage(String)}, appending {@code detail} rendered from the emitted
     * value.
     */
    public <T> Consumer<Signal<T>> stage(String stageName, Function<? super T, String> detail) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String roundId = TraceContextUtil.getRoundId(signal.getContextView());
            String rendered = detail.apply(signal.get());
            TraceContextUtil.withMdc(roundId, () ->
                log.info("[ConsensusFlow] stage={} roundId={} {}", stageName, roundId, rendered)
            );
        };
    }

    /**
     * Logs a stage when the roundId is already known outside a reactive signal.
     */
    public void logWithRoundId(String stageName, String roundId, String detail) {
        TraceContextUtil.withMdc(roundId, () ->
            log.info("[ConsensusFlow] stage={} roundId={} {}", stageName, roundId, detail)
        );
    }
}
