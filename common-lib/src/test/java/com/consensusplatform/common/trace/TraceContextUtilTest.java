package com.consensusplatform.common.trace;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TraceContextUtilTest {

    @Test
    @DisplayName("withRoundId() makes the id visible downstream of the context write")
    void roundIdInContext() {
        Mono<String> pipeline = Mono.deferContextual(ctx -> Mono.just(TraceContextUtil.getRoundId(ctx)));
        assertEquals("round-1", TraceContextUtil.withRoundId(pipeline, "round-1").block());
    }

    @Test
    @DisplayName("missing roundId reads as 'unknown'")
    void missingRoundId() {
        assertEquals(TraceContextUtil.UNKNOWN_ROUND, TraceContextUtil.getRoundId(Context.empty()));
    }

    @Test
    @DisplayName("withMdc() sets the MDC entry only for the duration of the action")
    void mdcBridge() {
        AtomicReference<String> seen = new AtomicReference<>();
        TraceContextUtil.withMdc("round-9", () -> seen.set(MDC.get(TraceContextUtil.ROUND_ID_KEY)));
        assertEquals("round-9", seen.get());
        assertNull(MDC.get(TraceContextUtil.ROUND_ID_KEY));
    }

    @Test
    @DisplayName("newRoundId() is unique")
    void newRoundId() {
        assertNotEquals(TraceContextUtil.newRoundId(), TraceContextUtil.newRoundId());
    }
}
