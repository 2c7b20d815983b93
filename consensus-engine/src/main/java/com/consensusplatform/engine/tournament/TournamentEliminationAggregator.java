package com.consensusplatform.engine.tournament;

import com.consensusplatform.common.history.BoundedHistory;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.logger.ConsensusFlowLogger;
import com.consensusplatform.engine.strategy.BasicStrategies;
import com.consensusplatform.engine.strategy.ConsensusStrategy;
import com.consensusplatform.engine.strategy.PredictionGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-elimination tournament: predictions meet in pairs, an arbiter picks each winner,
 * and the last one standing becomes the consensus.
 *
 * <h3>Bracket</h3>
 * <ul>
 *   <li>Odd field: the highest-confidence contestant (earliest on ties) gets a bye.</li>
 *   <li>Everyone else is shuffled and paired in order.</li>
 *   <li>N contestants need exactly N − 1 matches.</li>
 * </ul>
 *
 * <h3>Execution</h3>
 * Rounds run one after another; matches inside a round are arbitrated concurrently on
 * {@link Schedulers#boundedElastic()}, each under {@code arbitrationTimeout}. A failing or
 * timed-out arbitration is resolved by confidence comparison instead of aborting the
 * tournament.
 *
 * <h3>Champion confidence</h3>
 * <pre>
 *   repetition = 1 − unique/total over words longer than 5 chars in the champion's
 *                winning rationales (0 with fewer than two rationales or no such words)
 *   confidence = min(1, max(0, c − repetition × consistencyPenalty) + winnerBoost)
 * </pre>
 *
 * <p>Win/loss outcomes of arbitrated matches are kept per contributor (last
 * {@value #WIN_HISTORY_CAPACITY}); finished tournaments are kept as
 * {@link TournamentRecord}s (last {@value #TOURNAMENT_HISTORY_CAPACITY}).
 */
public class TournamentEliminationAggregator implements ConsensusStrategy {

    private static final Logger log = LoggerFactory.getLogger(TournamentEliminationAggregator.class);

    public static final String NAME             = "tournament_elimination";
    public static final String CHAMPION_PREFIX  = "tournament_winner_";

    public static final double   DEFAULT_CONSISTENCY_PENALTY = 0.1;
    public static final double   DEFAULT_WINNER_BOOST        = 0.05;
    public static final Duration DEFAULT_ARBITRATION_TIMEOUT = Duration.ofSeconds(30);

    static final int WIN_HISTORY_CAPACITY        = 100;
    static final int TOURNAMENT_HISTORY_CAPACITY = 50;
    static final int MIN_KEY_WORD_LENGTH         = 6;

    private final TournamentArbiter arbiter;
    private final double consistencyPenalty;
    private final double winnerBoost;
    private final Duration arbitrationTimeout;
    private final Random random;
    private final ConsensusFlowLogger flowLogger;

    private final Map<String, BoundedHistory<Boolean>> winHistory = new ConcurrentHashMap<>();
    private final BoundedHistory<TournamentRecord> tournaments = new BoundedHistory<>(TOURNAMENT_HISTORY_CAPACITY);

    public TournamentEliminationAggregator(TournamentArbiter arbiter) {
        this(arbiter, DEFAULT_CONSISTENCY_PENALTY, DEFAULT_WINNER_BOOST, DEFAULT_ARBITRATION_TIMEOUT,
            new Random(), new ConsensusFlowLogger());
    }

    public TournamentEliminationAggregator(TournamentArbiter arbiter,
                                           double consistencyPenalty,
                                           double winnerBoost,
                                           Duration arbitrationTimeout,
                                           Random random,
                                           ConsensusFlowLogger flowLogger) {
        if (arbitrationTimeout == null || arbitrationTimeout.isZero() || arbitrationTimeout.isNegative()) {
            throw new IllegalArgumentException("arbitrationTimeout must be positive");
        }
        this.arbiter = arbiter;
        this.consistencyPenalty = consistencyPenalty;
        this.winnerBoost = winnerBoost;
        this.arbitrationTimeout = arbitrationTimeout;
        this.random = random;
        this.flowLogger = flowLogger;
    }

    @Override
    public String name() {
        return NAME;
    }

    /** Blocking form with an empty task description. */
    @Override
    public Prediction aggregate(List<Prediction> predictions) {
        return aggregate(predictions, "").block();
    }

    /**
     * Runs a full tournament.
     *
     * @param task the question the predictions answer, passed to the arbiter
     */
    public Mono<Prediction> aggregate(List<Prediction> predictions, String task) {
        return run(predictions, task, true);
    }

    /**
     * Plays a full tournament without recording win/loss outcomes or a
     * {@link TournamentRecord}. The arbiter is still consulted for every match.
     */
    @Override
    public Prediction evaluate(List<Prediction> predictions) {
        return run(predictions, "", false).block();
    }

    private Mono<Prediction> run(List<Prediction> predictions, String task, boolean record) {
        return Mono.defer(() -> {
            if (PredictionGuard.isPassThrough(predictions, NAME)) {
                return Mono.just(predictions.get(0));
            }
            log.info("[Tournament] starting n={} task='{}'", predictions.size(), task);
            return playRounds(List.copyOf(predictions), task == null ? "" : task, 1, new ArrayList<>(), record)
                .map(rounds -> crown(predictions.size(), rounds, record))
                .doOnEach(flowLogger.stage(ConsensusFlowLogger.CHAMPION_SELECTED,
                    champion -> "champion=" + champion.contributorId()));
        });
    }

    public List<TournamentRecord> getTournamentHistory() {
        return tournaments.snapshot();
    }

    public Optional<TournamentStats> getContributorStats(String contributorId) {
        BoundedHistory<Boolean> history = winHistory.get(contributorId);
        if (history == null || history.isEmpty()) {
            return Optional.empty();
        }
        List<Boolean> all = history.snapshot();
        List<Boolean> recent = history.latest(TournamentStats.RECENT_WINDOW);
        int wins = (int) all.stream().filter(Boolean::booleanValue).count();
        double overall = (double) wins / all.size();
        double recentRate = (double) recent.stream().filter(Boolean::booleanValue).count() / recent.size();
        return Optional.of(new TournamentStats(all.size(), overall, recentRate, recentRate - overall,
            wins, all.size() - wins));
    }

    // ── rounds ───────────────────────────────────────────────────────────────

    private Mono<List<TournamentRound>> playRounds(List<Prediction> contestants, String task,
                                                   int roundNumber, List<TournamentRound> played,
                                                   boolean record) {
        if (contestants.size() <= 1) {
            return Mono.just(played);
        }

        List<Prediction> field = new ArrayList<>(contestants);
        Prediction bye = null;
        if (field.size() % 2 == 1) {
            bye = BasicStrategies.topConfidence(field);
            field.remove(field.indexOf(bye));
        }
        Collections.shuffle(field, random);

        List<TournamentMatch> pairings = new ArrayList<>(field.size() / 2);
        for (int i = 0; i + 1 < field.size(); i += 2) {
            pairings.add(TournamentMatch.pending(field.get(i), field.get(i + 1)));
        }

        Prediction advancing = bye;
        return Flux.fromIterable(pairings)
            .flatMapSequential(match -> arbitrate(match, task))
            .collectList()
            .map(resolved -> {
                List<Prediction> winners = new ArrayList<>();
                if (advancing != null) winners.add(advancing);
                for (TournamentMatch m : resolved) winners.add(m.winner());
                if (record) recordOutcomes(resolved);
                return new TournamentRound(roundNumber, resolved, advancing, winners);
            })
            .doOnEach(flowLogger.stage(ConsensusFlowLogger.ROUND_COMPLETED,
                round -> "round=" + round.roundNumber() + " matches=" + round.matches().size()
                    + " advancing=" + round.winners().size()))
            .flatMap(round -> {
                played.add(round);
                return playRounds(round.winners(), task, roundNumber + 1, played, record);
            });
    }

    private Mono<TournamentMatch> arbitrate(TournamentMatch match, String task) {
        return Mono.fromCallable(() -> arbiter.arbitrate(match.first(), match.second(), task))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(arbitrationTimeout)
            .switchIfEmpty(Mono.error(new IllegalStateException("arbiter returned no verdict")))
            .map(match::resolve)
            .onErrorResume(e -> {
                log.error("[Tournament] arbitration failed a={} b={}, resolving by confidence",
                    match.first().contributorId(), match.second().contributorId(), e);
                return Mono.just(match.resolveByConfidence(e));
            });
    }

    private void recordOutcomes(List<TournamentMatch> resolved) {
        for (TournamentMatch m : resolved) {
            if (m.fallback()) continue;
            history(m.winner().contributorId()).add(Boolean.TRUE);
            history(m.loser().contributorId()).add(Boolean.FALSE);
        }
    }

    private BoundedHistory<Boolean> history(String contributorId) {
        return winHistory.computeIfAbsent(contributorId, id -> new BoundedHistory<>(WIN_HISTORY_CAPACITY));
    }

    // ── champion ─────────────────────────────────────────────────────────────

    private Prediction crown(int participants, List<TournamentRound> rounds, boolean record) {
        TournamentRound last = rounds.get(rounds.size() - 1);
        Prediction champion = last.winners().get(0);

        Map<String, Double> repetition = repetitionScores(rounds);
        double penalty = repetition.getOrDefault(champion.contributorId(), 0.0) * consistencyPenalty;
        Prediction crowned = Prediction.clamped(CHAMPION_PREFIX + champion.contributorId(), champion.value(),
            Math.max(0.0, champion.confidence() - penalty) + winnerBoost);

        if (record) {
            tournaments.add(new TournamentRecord(Instant.now(), participants, champion.contributorId(),
                repetition, rounds));
        }

        log.info("[Tournament] champion={} rounds={} penalty={} confidence={}",
            champion.contributorId(), rounds.size(),
            String.format("%.3f", penalty), String.format("%.3f", crowned.confidence()));

        return crowned;
    }

    /**
     * Contributor → {@code 1 − unique/total} over long words of its winning rationales.
     */
    static Map<String, Double> repetitionScores(List<TournamentRound> rounds) {
        Map<String, List<String>> rationales = new LinkedHashMap<>();
        for (TournamentRound round : rounds) {
            for (TournamentMatch m : round.matches()) {
                if (m.winner() == null || m.rationale() == null || m.rationale().isEmpty()) continue;
                rationales.computeIfAbsent(m.winner().contributorId(), k -> new ArrayList<>()).add(m.rationale());
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        rationales.forEach((contributor, texts) -> {
            if (texts.size() < 2) {
                scores.put(contributor, 0.0);
                return;
            }
            List<String> words = new ArrayList<>();
            for (String text : texts) {
                for (String w : text.toLowerCase(Locale.ROOT).split("\\s+")) {
                    if (w.length() >= MIN_KEY_WORD_LENGTH) words.add(w);
                }
            }
            if (words.isEmpty()) {
                scores.put(contributor, 0.0);
                return;
            }
            Set<String> unique = new HashSet<>(words);
            scores.put(contributor, 1.0 - (double) unique.size() / words.size());
        });
        return scores;
    }
}
