package com.procureagent.orchestrator.model;

import com.procureagent.common.model.Priority;

/** An inventory item tagged with its restock urgency. */
public record ItemPriority(
    String sku,
    String name,
    int currentStock,
    int minThreshold,
    int leadTimeDays,
    Priority priority
) {}
