package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.exception.EmptyPredictionsException;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.common.trace.TraceContextUtil;
import com.consensusplatform.engine.logger.ConsensusFlowLogger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class TournamentEliminationAggregatorTest {

    /** Higher confidence wins, A on ties, no adjustment. */
    private static final TournamentArbiter BY_CONFIDENCE = (a, b, task) -> a.confidence() >= b.confidence()
        ? ArbitrationVerdict.first("Response A carries stronger supporting evidence", 0.0)
        : ArbitrationVerdict.second("Response B carries stronger supporting evidence", 0.0);

    private static TournamentArbiter preferringConfident(double delta) {
        return (a, b, task) -> a.confidence() >= b.confidence()
            ? ArbitrationVerdict.first("", delta)
            : ArbitrationVerdict.second("", delta);
    }

    private static List<Prediction> contestants(double... confidences) {
        List<Prediction> out = new ArrayList<>();
        for (int i = 0; i < confidences.length; i++) {
            out.add(new Prediction("c" + (i + 1), "answer " + (i + 1), confidences[i]));
        }
        return out;
    }

    private static TournamentEliminationAggregator tournament(TournamentArbiter arbiter) {
        return tournament(arbiter, Duration.ofSeconds(5));
    }

    private static TournamentEliminationAggregator tournament(TournamentArbiter arbiter, Duration timeout) {
        return new TournamentEliminationAggregator(arbiter, 0.1, 0.05, timeout, new Random(17),
            new ConsensusFlowLogger());
    }

    // ── bracket ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Bracket")
    class Bracket {

        @Test
        @DisplayName("five contestants: bye in round one, four matches over three rounds")
        void fiveContestants() {
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            List<Prediction> field = contestants(0.9, 0.8, 0.7, 0.6, 0.5);

            t.aggregate(field, "capital of France?").block();

            TournamentRecord record = t.getTournamentHistory().get(0);
            assertEquals(5, record.participants());
            assertEquals(3, record.roundCount());
            assertEquals(4, record.totalMatches());

            TournamentRound first = record.rounds().get(0);
            assertEquals(1, first.roundNumber());
            assertEquals(2, first.matches().size());
            assertEquals("c1", first.bye().contributorId());
            assertEquals("c1", first.winners().get(0).contributorId());
            assertEquals(3, first.winners().size());
        }

        @Test
        @DisplayName("even field has no bye")
        void evenField() {
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            t.aggregate(contestants(0.4, 0.3, 0.2, 0.1), "").block();

            TournamentRound first = t.getTournamentHistory().get(0).rounds().get(0);
            assertNull(first.bye());
            assertEquals(2, first.matches().size());
            assertEquals(3, t.getTournamentHistory().get(0).totalMatches());
        }

        @Test
        @DisplayName("N contestants always take N - 1 matches")
        void matchCount() {
            for (int n = 2; n <= 9; n++) {
                double[] conf = new double[n];
                for (int i = 0; i < n; i++) conf[i] = 0.1 + 0.8 * i / n;
                TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
                t.aggregate(contestants(conf), "").block();
                assertEquals(n - 1, t.getTournamentHistory().get(0).totalMatches(), "n=" + n);
            }
        }

        @Test
        @DisplayName("every match is sent to the arbiter with the task")
        void arbiterSeesTask() {
            AtomicInteger calls = new AtomicInteger();
            List<String> tasks = new CopyOnWriteArrayList<>();
            TournamentEliminationAggregator t = tournament((a, b, task) -> {
                calls.incrementAndGet();
                tasks.add(task);
                return BY_CONFIDENCE.arbitrate(a, b, task);
            });
            t.aggregate(contestants(0.9, 0.8, 0.7, 0.6, 0.5), "which city?").block();

            assertEquals(4, calls.get());
            assertTrue(tasks.stream().allMatch("which city?"::equals));
        }
    }

    // ── champion ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Champion")
    class Champion {

        @Test
        @DisplayName("champion id carries the prefix and confidence gets the winner boost")
        void championIdAndBoost() {
            Prediction champion = tournament(BY_CONFIDENCE)
                .aggregate(contestants(0.9, 0.8, 0.7, 0.6, 0.5), "").block();

            assertNotNull(champion);
            assertEquals(TournamentEliminationAggregator.CHAMPION_PREFIX + "c1", champion.contributorId());
            assertEquals("answer 1", champion.value());
            // one winning rationale: no repetition penalty
            assertEquals(0.95, champion.confidence(), 1e-9);
        }

        @Test
        @DisplayName("repeated rationales cost the champion confidence")
        void repetitionPenalty() {
            TournamentArbiter sameWords = (a, b, task) -> a.confidence() >= b.confidence()
                ? ArbitrationVerdict.first("Chosen answer demonstrates superior reasoning", 0.0)
                : ArbitrationVerdict.second("Chosen answer demonstrates superior reasoning", 0.0);
            TournamentEliminationAggregator t = tournament(sameWords);

            Prediction champion = t.aggregate(contestants(0.9, 0.2, 0.3, 0.4), "").block();

            // two identical rationales of five long words: repetition 0.5, penalty 0.05
            assertEquals(0.5, t.getTournamentHistory().get(0).repetitionScores().get("c1"), 1e-9);
            assertEquals(0.9 - 0.05 + 0.05, champion.confidence(), 1e-9);
        }

        @Test
        @DisplayName("confidence deltas from the arbiter carry into the champion")
        void arbiterDelta() {
            Prediction champion = tournament(preferringConfident(0.1)).aggregate(contestants(0.5, 0.4), "").block();
            assertEquals(0.5 + 0.1 + 0.05, champion.confidence(), 1e-9);
        }

        @Test
        @DisplayName("champion confidence never exceeds one")
        void capped() {
            Prediction champion = tournament(preferringConfident(0.2)).aggregate(contestants(0.98, 0.4), "").block();
            assertEquals(1.0, champion.confidence(), 1e-12);
        }

        @Test
        @DisplayName("synchronous aggregate runs the same tournament")
        void synchronous() {
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            Prediction champion = t.aggregate(contestants(0.2, 0.7, 0.4));
            assertEquals("tournament_winner_c2", champion.contributorId());
            assertEquals(TournamentEliminationAggregator.NAME, t.name());
        }

        @Test
        @DisplayName("round id in the Reactor context does not change the outcome")
        void withRoundId() {
            Prediction champion = TraceContextUtil.withRoundId(
                tournament(BY_CONFIDENCE).aggregate(contestants(0.3, 0.6), ""), "round-42").block();
            assertEquals("tournament_winner_c2", champion.contributorId());
        }
    }

    // ── failure handling ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("Arbitration failures")
    class Failures {

        @Test
        @DisplayName("a throwing arbiter falls back to confidence comparison")
        void arbiterThrows() {
            TournamentEliminationAggregator t = tournament((a, b, task) -> {
                throw new IllegalStateException("arbiter unavailable");
            });
            Prediction champion = t.aggregate(contestants(0.3, 0.9, 0.5, 0.7), "").block();

            assertEquals("tournament_winner_c2", champion.contributorId());
            TournamentRecord record = t.getTournamentHistory().get(0);
            for (TournamentRound round : record.rounds()) {
                for (TournamentMatch m : round.matches()) {
                    assertTrue(m.fallback());
                    assertTrue(m.rationale().startsWith(TournamentMatch.FALLBACK_PREFIX));
                    assertTrue(m.rationale().contains("arbiter unavailable"));
                }
            }
            // fallback outcomes are not counted as wins or losses
            assertTrue(t.getContributorStats("c2").isEmpty());
        }

        @Test
        @DisplayName("a slow arbiter times out and falls back")
        void arbiterTimesOut() {
            TournamentArbiter slow = (a, b, task) -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ArbitrationVerdict.second("too late", 0.0);
            };
            TournamentEliminationAggregator t = tournament(slow, Duration.ofMillis(50));

            Prediction champion = t.aggregate(contestants(0.8, 0.6), "").block();

            assertEquals("tournament_winner_c1", champion.contributorId());
            assertTrue(t.getTournamentHistory().get(0).rounds().get(0).matches().get(0).fallback());
        }

        @Test
        @DisplayName("a null verdict falls back")
        void nullVerdict() {
            TournamentEliminationAggregator t = tournament((a, b, task) -> null);
            Prediction champion = t.aggregate(contestants(0.6, 0.8), "").block();
            assertEquals("tournament_winner_c2", champion.contributorId());
        }

        @Test
        @DisplayName("non-positive timeout is rejected")
        void timeoutValidated() {
            assertThrows(IllegalArgumentException.class, () -> tournament(BY_CONFIDENCE, Duration.ZERO));
        }
    }

    // ── stats and edges ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("Stats and edge cases")
    class StatsAndEdges {

        @Test
        @DisplayName("win/loss record accumulates across tournaments")
        void stats() {
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            t.aggregate(contestants(0.9, 0.2, 0.3, 0.4), "").block();
            t.aggregate(contestants(0.9, 0.2, 0.3, 0.4), "").block();

            TournamentStats champion = t.getContributorStats("c1").orElseThrow();
            assertEquals(4, champion.totalMatches());
            assertEquals(4, champion.wins());
            assertEquals(0, champion.losses());
            assertEquals(1.0, champion.overallWinRate(), 1e-12);
            assertEquals(0.0, champion.trend(), 1e-12);

            TournamentStats weakest = t.getContributorStats("c2").orElseThrow();
            assertEquals(0, weakest.wins());
            assertEquals(2, weakest.losses());
            assertEquals(2, t.getTournamentHistory().size());
        }

        @Test
        @DisplayName("evaluate crowns the same champion without recording anything")
        void evaluateLeavesNoTrace() {
            TournamentEliminationAggregator t = tournament(preferringConfident(0.0));
            Prediction champion = t.evaluate(contestants(0.9, 0.2, 0.3, 0.4));

            assertEquals(TournamentEliminationAggregator.CHAMPION_PREFIX + "c1", champion.contributorId());
            assertEquals(0.95, champion.confidence(), 1e-12);
            assertTrue(t.getTournamentHistory().isEmpty());
            assertTrue(t.getContributorStats("c1").isEmpty());
        }

        @Test
        @DisplayName("unknown contributor has no stats")
        void unknownContributor() {
            assertTrue(tournament(BY_CONFIDENCE).getContributorStats("nobody").isEmpty());
        }

        @Test
        @DisplayName("single contestant is returned unchanged")
        void singleton() {
            Prediction only = new Prediction("solo", "x", 0.4);
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            assertEquals(only, t.aggregate(List.of(only), "").block());
            assertTrue(t.getTournamentHistory().isEmpty());
        }

        @Test
        @DisplayName("empty field raises EmptyPredictionsException")
        void empty() {
            TournamentEliminationAggregator t = tournament(BY_CONFIDENCE);
            assertThrows(EmptyPredictionsException.class, () -> t.aggregate(List.of(), "").block());
        }
    }

    // ── repetition scores ────────────────────────────────────────────────────

    @Test
    @DisplayName("repetition score counts repeated long words among winning rationales")
    void repetitionScores() {
        Prediction x = new Prediction("x", "1", 0.5);
        Prediction y = new Prediction("y", "2", 0.5);
        Prediction z = new Prediction("z", "3", 0.5);
        TournamentMatch m1 = TournamentMatch.pending(x, y).resolve(ArbitrationVerdict.first("clearer answer overall", 0));
        TournamentMatch m2 = TournamentMatch.pending(x, z).resolve(ArbitrationVerdict.first("clearer answer overall", 0));
        TournamentMatch m3 = TournamentMatch.pending(y, z).resolve(ArbitrationVerdict.second("short one", 0));
        List<TournamentRound> rounds = List.of(
            new TournamentRound(1, List.of(m1, m3), null, List.of(x, z)),
            new TournamentRound(2, List.of(m2), null, List.of(x)));

        Map<String, Double> scores = TournamentEliminationAggregator.repetitionScores(rounds);
        // "clearer", "answer", "overall" twice each: 1 - 3/6
        assertEquals(0.5, scores.get("x"), 1e-12);
        // single rationale
        assertEquals(0.0, scores.get("z"), 1e-12);
    }
}
