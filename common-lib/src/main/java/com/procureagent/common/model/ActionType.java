package com.procureagent.common.model;

public enum ActionType {
    RESTOCK,
    HOLD,
    REDUCE_INVENTORY,
    ALERT,
    OPTIMIZE_STOCK,
    FORECAST_DEMAND
}
