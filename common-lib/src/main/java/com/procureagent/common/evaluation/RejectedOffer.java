package com.procureagent.common.evaluation;

import com.procureagent.common.model.Offer;

public record RejectedOffer(Offer offer, String reason) {}
