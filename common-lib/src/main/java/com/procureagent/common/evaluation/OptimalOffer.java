package com.procureagent.common.evaluation;

public record OptimalOffer(
    EvaluationResult result,
    int rank,
    int totalOffers,
    EvaluationWeights weights
) {}
