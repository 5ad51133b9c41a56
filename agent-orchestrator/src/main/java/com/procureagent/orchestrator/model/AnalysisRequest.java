package com.procureagent.orchestrator.model;

import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.SalesRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Input of one analysis run.
 *
 * @param role    persona to ask for recommendations; null means SUPPLY_CHAIN_MANAGER
 * @param sales   sales history for any of the items; may be null
 * @param context free-form market context (seasonality, budget, trends); may be null
 */
public record AnalysisRequest(
    AgentRole role,
    List<InventoryItem> items,
    List<SalesRecord> sales,
    Map<String, Object> context
) {
    public AnalysisRequest {
        sales   = sales == null ? List.of() : List.copyOf(sales);
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
