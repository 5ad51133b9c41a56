package com.procureagent.common.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validated recommendation produced by the decision validator.
 *
 * <p>Immutable: approval and execution happen downstream and never mutate the record.
 * {@code recommendedQuantity}, {@code estimatedCost} and {@code deadline} are nullable.
 */
public record Decision(
    AgentRole role,
    String itemSku,
    ActionType actionType,
    Priority priority,
    double confidence,
    String reasoning,
    Integer recommendedQuantity,
    Double estimatedCost,
    Instant deadline,
    Map<String, Object> metadata
) {
    public Decision {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public Decision withRecommendedQuantity(int quantity) {
        return new Decision(role, itemSku, actionType, priority, confidence, reasoning,
                            quantity, estimatedCost, deadline, metadata);
    }
}
