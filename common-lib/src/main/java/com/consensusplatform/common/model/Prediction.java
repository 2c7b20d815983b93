package com.consensusplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One contributor's answer to a question, together with its self-reported confidence.
 *
 * <ul>
 *   <li>{@code contributorId} – identifier of the model instance or agent that produced the
 *       answer. Consensus outputs use a synthetic id (e.g. {@code semantic_consensus}) that
 *       never collides with an input contributor.</li>
 *   <li>{@code value} – the answer, either a {@link String} or a {@link Number}.</li>
 *   <li>{@code confidence} – self-reported confidence in [0.0, 1.0].</li>
 * </ul>
 *
 * Immutable; strategies derive new instances instead of mutating inputs.
 */
public record Prediction(
    @JsonProperty("contributorId") String contributorId,
    @JsonProperty("value")         Object value,
    @JsonProperty("confidence")    double confidence
) {

    public Prediction {
        Objects.requireNonNull(contributorId, "contributorId");
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String) && !(value instanceof Number)) {
            throw new IllegalArgumentException(
                "Prediction value must be a String or a Number, got " + value.getClass().getName());
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                "Prediction confidence must be within [0, 1], got " + confidence);
        }
    }

    public static Prediction of(String contributorId, Object value, double confidence) {
        return new Prediction(contributorId, value, confidence);
    }

    /**
     * Builds a prediction with the confidence clamped into [0, 1]; NaN becomes 0.
     * Strategies use it for synthesised consensus outputs.
     */
    public static Prediction clamped(String contributorId, Object value, double confidence) {
        return new Prediction(contributorId, value, clamp(confidence));
    }

    /** Same contributor and value, new confidence (clamped into [0, 1]). */
    public Prediction withConfidence(double newConfidence) {
        return new Prediction(contributorId, value, clamp(newConfidence));
    }

    /**
     * Textual form of the value. Whole-number doubles keep their trailing {@code .0}
     * so that {@code 10.0} and {@code 10} stay distinct categories.
     */
    @JsonIgnore
    public String text() {
        return String.valueOf(value);
    }

    /** True when the value is a number or a string that parses as one. */
    @JsonIgnore
    public boolean isNumeric() {
        if (value instanceof Number n) {
            return !Double.isNaN(n.doubleValue());
        }
        try {
            double parsed = Double.parseDouble(((String) value).trim());
            return !Double.isNaN(parsed);
        } catch (NumberFormatException e) {
            return false;
        }
    }

    /**
     * Numeric form of the value.
     *
     * @throws NumberFormatException when the value is a non-numeric string
     */
    @JsonIgnore
    public double numericValue() {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(((String) value).trim());
    }

    private static double clamp(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }
}
