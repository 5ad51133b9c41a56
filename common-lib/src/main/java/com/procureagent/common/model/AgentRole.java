package com.procureagent.common.model;

/**
 * Closed set of recommendation personas. Prompt construction switches on this tag;
 * there is exactly one prompt variant per role.
 */
public enum AgentRole {
    SUPPLY_CHAIN_MANAGER,
    INVENTORY_ANALYST,
    DEMAND_FORECASTER,
    PROCUREMENT_SPECIALIST
}
