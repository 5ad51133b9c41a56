package com.procureagent.common.model;

public enum OfferStatus {
    PENDING,
    COUNTERED,
    ACCEPTED,
    REJECTED,
    EXPIRED
}
