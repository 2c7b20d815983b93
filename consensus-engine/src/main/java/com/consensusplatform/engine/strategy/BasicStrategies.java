package com.consensusplatform.engine.strategy;

import com.consensusplatform.common.model.Prediction;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Value-level building blocks for the basic strategies.
 *
 * <p>Tie-breaking is first-encountered order for both {@link #topConfidence} and
 * {@link #majorityVote}. Inputs are assumed non-empty; callers guard first.
 */
public final class BasicStrategies {

    private BasicStrategies() {}

    /** Prediction with the highest confidence; the earliest one wins ties. */
    public static Prediction topConfidence(List<Prediction> predictions) {
        Prediction best = predictions.get(0);
        for (Prediction p : predictions) {
            if (p.confidence() > best.confidence()) best = p;
        }
        return best;
    }

    /** Most frequent stringified value; the value seen first wins ties. */
    public static String majorityVote(List<Prediction> predictions) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Prediction p : predictions) {
            counts.merge(p.text(), 1, Integer::sum);
        }
        String winner = null;
        int best = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > best) {
                winner = e.getKey();
                best = e.getValue();
            }
        }
        return winner;
    }

    /**
     * {@code Σ(value × confidence) / Σ(confidence)}, or the unweighted mean when the
     * confidences sum to zero.
     *
     * @throws NumberFormatException when a value is not numeric
     */
    public static double weightedAverage(List<Prediction> predictions) {
        double totalWeight = 0;
        double weightedSum = 0;
        double plainSum = 0;
        for (Prediction p : predictions) {
            double v = p.numericValue();
            totalWeight += p.confidence();
            weightedSum += v * p.confidence();
            plainSum    += v;
        }
        if (totalWeight == 0.0) {
            return plainSum / predictions.size();
        }
        return weightedSum / totalWeight;
    }

    /**
     * Value whose summed weight is largest; the value seen first wins ties.
     * {@code weights} is parallel to {@code predictions}.
     */
    public static String weightedVote(List<Prediction> predictions, double[] weights) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (int i = 0; i < predictions.size(); i++) {
            totals.merge(predictions.get(i).text(), weights[i], Double::sum);
        }
        String winner = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : totals.entrySet()) {
            if (e.getValue() > best) {
                winner = e.getKey();
                best = e.getValue();
            }
        }
        return winner;
    }

    /**
     * {@code Σ(value × weight) / Σ(weight)}, or the unweighted mean when the weights sum
     * to zero.
     *
     * @throws NumberFormatException when a value is not numeric
     */
    public static double weightedMean(List<Prediction> predictions, double[] weights) {
        double totalWeight = 0;
        double weightedSum = 0;
        double plainSum = 0;
        for (int i = 0; i < predictions.size(); i++) {
            double v = predictions.get(i).numericValue();
            totalWeight += weights[i];
            weightedSum += v * weights[i];
            plainSum    += v;
        }
        if (totalWeight == 0.0) {
            return plainSum / predictions.size();
        }
        return weightedSum / totalWeight;
    }

    public static double meanConfidence(List<Prediction> predictions) {
        return predictions.stream().mapToDouble(Prediction::confidence).average().orElse(0.0);
    }

    /** Mean confidence of the predictions whose text equals {@code text}. */
    public static double meanConfidenceOf(List<Prediction> predictions, String text) {
        return predictions.stream()
            .filter(p -> p.text().equals(text))
            .mapToDouble(Prediction::confidence)
            .average()
            .orElse(0.0);
    }

    /** Population variance of the confidences; 0.0 for fewer than two predictions. */
    public static double confidenceVariance(List<Prediction> predictions) {
        if (predictions.size() <= 1) return 0.0;
        double mean = meanConfidence(predictions);
        double sum = 0;
        for (Prediction p : predictions) {
            double d = p.confidence() - mean;
            sum += d * d;
        }
        return sum / predictions.size();
    }

    /**
     * {@code (unique − 1) / (N − 1)}: 0.0 when every value is the same, 1.0 when all differ.
     */
    public static double predictionDiversity(List<Prediction> predictions) {
        if (predictions.size() <= 1) return 0.0;
        Set<String> unique = new HashSet<>();
        for (Prediction p : predictions) unique.add(p.text());
        return (double) (unique.size() - 1) / (predictions.size() - 1);
    }
}
