package com.procureagent.orchestrator.model;

import com.procureagent.common.inventory.InventorySnapshot;
import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.Decision;

import java.time.Instant;
import java.util.List;

/**
 * Result of one analysis run. {@code priorities} is ordered most urgent first;
 * {@code decisions} is never empty.
 */
public record AnalysisReport(
    String runId,
    AgentRole role,
    List<ItemPriority> priorities,
    InventorySnapshot snapshot,
    List<Decision> decisions,
    Instant generatedAt
) {}
