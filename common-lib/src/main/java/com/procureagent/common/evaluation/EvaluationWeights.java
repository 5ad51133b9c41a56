package com.procureagent.common.evaluation;

import com.procureagent.common.exception.InvalidConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Criterion weights for offer scoring. A valid set is four finite, non-negative
 * numbers whose sum is 1.0 within {@value #SUM_TOLERANCE}.
 */
public record EvaluationWeights(
    double price,
    double delivery,
    double reliability,
    double pastPerformance
) {
    static final double SUM_TOLERANCE = 1e-6;

    public static final EvaluationWeights DEFAULT = new EvaluationWeights(0.4, 0.25, 0.2, 0.15);

    public double sum() {
        return price + delivery + reliability + pastPerformance;
    }

    /**
     * @throws InvalidConfigurationException when any weight is negative or non-finite,
     *                                       or the set does not sum to 1.0
     */
    public EvaluationWeights validate() {
        for (Map.Entry<String, Double> e : asMap().entrySet()) {
            double w = e.getValue();
            if (!Double.isFinite(w) || w < 0.0) {
                throw new InvalidConfigurationException(
                    "Weight '" + e.getKey() + "' must be a finite non-negative number, was " + w);
            }
        }
        if (Math.abs(sum() - 1.0) > SUM_TOLERANCE) {
            throw new InvalidConfigurationException("Weights must sum to 1.0, was " + sum());
        }
        return this;
    }

    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("price", price);
        map.put("delivery", delivery);
        map.put("reliability", reliability);
        map.put("pastPerformance", pastPerformance);
        return map;
    }
}
