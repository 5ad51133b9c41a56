package com.procureagent.common.evaluation;

import com.procureagent.common.exception.InvalidConfigurationException;

/**
 * Everything a scoring call depends on.
 *
 * <p>{@code referencePrice} and {@code referenceDeliveryDays} are fixed normalisation
 * constants, not batch-derived, so scores from different calls are comparable.
 * {@code scoreScale} is the maximum of the reliability/past-performance scale (5 or 10).
 */
public record EvaluationSettings(
    EvaluationWeights weights,
    double referencePrice,
    double referenceDeliveryDays,
    double scoreScale
) {
    public static final double DEFAULT_REFERENCE_PRICE         = 10_000.0;
    public static final double DEFAULT_REFERENCE_DELIVERY_DAYS = 30.0;
    public static final double DEFAULT_SCORE_SCALE             = 5.0;

    public static EvaluationSettings defaults() {
        return withWeights(EvaluationWeights.DEFAULT);
    }

    public static EvaluationSettings withWeights(EvaluationWeights weights) {
        return new EvaluationSettings(weights, DEFAULT_REFERENCE_PRICE,
                                      DEFAULT_REFERENCE_DELIVERY_DAYS, DEFAULT_SCORE_SCALE);
    }

    public EvaluationSettings validate() {
        if (weights == null) {
            throw new InvalidConfigurationException("Weights are required");
        }
        weights.validate();
        if (!(referencePrice > 0.0) || !(referenceDeliveryDays > 0.0) || !(scoreScale > 0.0)) {
            throw new InvalidConfigurationException(String.format(
                "Reference constants must be positive. referencePrice=%s referenceDeliveryDays=%s scoreScale=%s",
                referencePrice, referenceDeliveryDays, scoreScale));
        }
        return this;
    }
}
