package com.procureagent.negotiation.dto;

import com.procureagent.common.evaluation.EvaluationWeights;
import com.procureagent.common.model.Offer;

import java.util.List;

/**
 * Request body for the /api/v1/offers endpoints.
 *
 * @param weights    null for the configured weights
 * @param scoreScale maximum of the rating scale; null for the configured scale
 * @param topN       offers to merge for /hybrid; ignored elsewhere
 */
public record EvaluateOffersRequest(
    List<Offer> offers,
    EvaluationWeights weights,
    Double scoreScale,
    Integer topN
) {}
