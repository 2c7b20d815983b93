package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.model.Prediction;

import java.util.Random;

/**
 * Reference arbiter that needs no model call.
 *
 * <pre>
 *   score = confidence × 0.7
 *         + 0.1 for the strictly longer answer text
 *         + uniform jitter in [−0.1, 0.1]
 * </pre>
 *
 * <p>The higher score wins (A on ties); the winner's confidence adjustment is drawn
 * uniformly from {@code [0, 0.1]}.
 */
public class HeuristicArbiter implements TournamentArbiter {

    static final double CONFIDENCE_WEIGHT = 0.7;
    static final double LENGTH_BONUS      = 0.1;
    static final double JITTER            = 0.1;
    static final double MAX_BOOST         = 0.1;

    private final Random random;

    public HeuristicArbiter() {
        this(new Random());
    }

    public HeuristicArbiter(Random random) {
        this.random = random;
    }

    @Override
    public ArbitrationVerdict arbitrate(Prediction a, Prediction b, String task) {
        double scoreA = a.confidence() * CONFIDENCE_WEIGHT;
        double scoreB = b.confidence() * CONFIDENCE_WEIGHT;

        int lenA = a.text().length();
        int lenB = b.text().length();
        if (lenA > lenB) {
            scoreA += LENGTH_BONUS;
        } else if (lenB > lenA) {
            scoreB += LENGTH_BONUS;
        }

        scoreA += jitter();
        scoreB += jitter();

        double adjustment = random.nextDouble() * MAX_BOOST;
        if (scoreA >= scoreB) {
            return ArbitrationVerdict.first(String.format(
                "Response A selected for higher confidence (%.2f) and overall quality.", a.confidence()),
                adjustment);
        }
        return ArbitrationVerdict.second(String.format(
            "Response B selected for higher confidence (%.2f) and overall quality.", b.confidence()),
            adjustment);
    }

    private double jitter() {
        return (random.nextDouble() * 2.0 - 1.0) * JITTER;
    }
}
