package com.procureagent.common.evaluation;

import com.procureagent.common.model.Offer;

/**
 * One scored offer. {@code rank} is 1-based in descending score order;
 * {@code weights} is the snapshot the score was computed with.
 */
public record EvaluationResult(
    Offer offer,
    double score,
    int rank,
    EvaluationWeights weights
) {}
