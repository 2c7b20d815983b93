package com.consensusplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Lightweight reactive tracing for consensus rounds.
 *
 * <p>The Reactor Context carries the {@code roundId} of one aggregation through every
 * operator of the pipeline. MDC is written only as a temporary bridge around a log
 * statement and cleared immediately afterwards.
 *
 * <p>Usage pattern in reactive chains:
 * <pre>
 *     return TraceContextUtil.withRoundId(pipeline, roundId);
 * </pre>
 *
 * <p>Usage pattern inside doOnEach:
 * <pre>
 *     signal -> TraceContextUtil.getRoundId(signal.getContextView())
 * </pre>
 */
public final class TraceContextUtil {

    public static final String ROUND_ID_KEY = "roundId";
    public static final String UNKNOWN_ROUND = "unknown";

    private TraceContextUtil() {}

    /** A fresh random round identifier. */
    public static String newRoundId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Stores {@code roundId} in the Reactor Context of {@code mono}.
     * {@code contextWrite} propagates upstream during subscription, so apply it last.
     */
    public static <T> Mono<T> withRoundId(Mono<T> mono, String roundId) {
        return mono.contextWrite(ctx -> ctx.put(ROUND_ID_KEY, roundId));
    }

    /**
     * Reads the round id from a {@link ContextView}; {@value #UNKNOWN_ROUND} when absent,
     * never {@code null}.
     */
    public static String getRoundId(ContextView ctx) {
        return ctx.getOrDefault(ROUND_ID_KEY, UNKNOWN_ROUND);
    }

    /**
     * Bridges {@code roundId} into MDC for the duration of {@code logAction}, then
     * removes the entry. Only for logging side-effects.
     */
    public static void withMdc(String roundId, Runnable logAction) {
        MDC.put(ROUND_ID_KEY, roundId);
        try {
            logAction.run();
        } finally {
            MDC.remove(ROUND_ID_KEY);
        }
    }
}
