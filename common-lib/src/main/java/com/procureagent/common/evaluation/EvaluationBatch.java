package com.procureagent.common.evaluation;

import java.util.List;

/**
 * Ranked survivors of an evaluation call together with the offers that were excluded.
 */
public record EvaluationBatch(
    List<EvaluationResult> ranked,
    List<RejectedOffer> rejected
) {
    public EvaluationBatch {
        ranked   = List.copyOf(ranked);
        rejected = List.copyOf(rejected);
    }
}
