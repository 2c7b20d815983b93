package com.consensusplatform.engine.instrument;

import com.consensusplatform.common.math.Statistics;
import com.consensusplatform.common.model.Prediction;
import com.consensusplatform.engine.strategy.PredictionGuard;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Pure measurements taken around one aggregation.
 *
 * <p>Numeric formulas apply only when every value is numeric; otherwise the categorical
 * formula is used.
 */
public final class AgreementMetrics {

    static final int    MAX_HISTOGRAM_BINS = 10;
    static final double EPSILON            = 1e-8;

    private AgreementMetrics() {}

    /**
     * <ul>
     *   <li>numeric – {@code max(0, 1 − CV)}, with {@code CV = std/|mean|} (std alone when
     *       the mean is 0)</li>
     *   <li>categorical – {@code 1 − (unique − 1)/N}</li>
     * </ul>
     * 1.0 for a single prediction.
     */
    public static double agreementScore(List<Prediction> predictions) {
        if (predictions.size() <= 1) return 1.0;
        if (PredictionGuard.allNumeric(predictions)) {
            double[] values = numericValues(predictions);
            double mean = Statistics.mean(values);
            double std = Statistics.stdDev(values);
            double cv = mean != 0.0 ? std / Math.abs(mean) : std;
            return Math.max(0.0, 1.0 - cv);
        }
        Set<String> unique = new HashSet<>();
        for (Prediction p : predictions) unique.add(p.text());
        return 1.0 - (double) (unique.size() - 1) / predictions.size();
    }

    /**
     * Entropy in bits: of a {@code min(N, 10)}-bin histogram for numeric values, of the
     * value frequencies otherwise.
     */
    public static double predictionEntropy(List<Prediction> predictions) {
        if (predictions.isEmpty()) return 0.0;
        if (PredictionGuard.allNumeric(predictions)) {
            double[] values = numericValues(predictions);
            int bins = Math.min(values.length, MAX_HISTOGRAM_BINS);
            return Statistics.shannonEntropyBits(Statistics.histogram(values, bins));
        }
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Prediction p : predictions) counts.merge(p.text(), 1, Integer::sum);
        double[] freq = counts.values().stream().mapToDouble(Integer::doubleValue).toArray();
        return Statistics.shannonEntropyBits(freq);
    }

    /** Fraction of predictions whose confidence is below {@code mean − 2·std}. */
    public static double outlierRate(List<Prediction> predictions) {
        if (predictions.isEmpty()) return 0.0;
        double[] confidences = predictions.stream().mapToDouble(Prediction::confidence).toArray();
        double threshold = Statistics.mean(confidences) - 2.0 * Statistics.stdDev(confidences);
        long outliers = 0;
        for (double c : confidences) {
            if (c < threshold) outliers++;
        }
        return (double) outliers / predictions.size();
    }

    /**
     * Credit per contributor when the strategy reports none: closeness to the result
     * times confidence. Closeness is {@code 1 − |v − r| / (|r| + ε)} for numbers and
     * exact match for anything else.
     */
    public static Map<String, Double> heuristicContributions(List<Prediction> predictions, Prediction result) {
        Map<String, Double> contributions = new LinkedHashMap<>();
        for (Prediction p : predictions) {
            contributions.put(p.contributorId(), closeness(p, result) * p.confidence());
        }
        return contributions;
    }

    /**
     * Stability of a perturbed result against the original, clamped to [0, 1].
     */
    public static double stability(Prediction original, Prediction perturbed) {
        return Statistics.clamp01(closeness(perturbed, original));
    }

    private static double closeness(Prediction p, Prediction reference) {
        if (p.isNumeric() && reference.isNumeric()) {
            double v = p.numericValue();
            double r = reference.numericValue();
            return 1.0 - Math.abs(v - r) / (Math.abs(r) + EPSILON);
        }
        return p.text().equals(reference.text()) ? 1.0 : 0.0;
    }

    private static double[] numericValues(List<Prediction> predictions) {
        double[] values = new double[predictions.size()];
        for (int i = 0; i < values.length; i++) values[i] = predictions.get(i).numericValue();
        return values;
    }
}
