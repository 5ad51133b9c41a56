package com.procureagent.orchestrator.prompt;

import com.procureagent.common.model.AgentRole;
import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.SalesRecord;
import com.procureagent.orchestrator.model.ItemPriority;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the system instruction and the analysis prompt for each {@link AgentRole}.
 * One prompt variant per role; every variant asks for the same JSON decision format.
 */
@Component
public class RecommendationPromptBuilder {

    private static final String RESPONSE_FORMAT = """

        Respond ONLY with a JSON object in this exact format:
        {
          "decisions": [
            {
              "item_sku": "<sku>",
              "action_type": "restock|hold|reduce_inventory|alert|optimize_stock|forecast_demand",
              "priority": "low|medium|high|critical",
              "confidence_score": 0.0-1.0,
              "reasoning": "<clear explanation>",
              "recommended_quantity": <units, for restock actions>,
              "estimated_cost": <estimated cost of the action>,
              "deadline": "<ISO-8601 timestamp>"
            }
          ],
          "summary": "<one sentence overview>"
        }""";

    public String systemInstruction(AgentRole role) {
        String persona = switch (role) {
            case SUPPLY_CHAIN_MANAGER -> """
                You are an expert Supply Chain Manager for a stationery and office-supplies business.
                Identify stock issues, recommend restock quantities from sales velocity and lead times,
                and prioritise actions by business impact and urgency.""";
            case INVENTORY_ANALYST -> """
                You are an Inventory Analyst for a stationery and office-supplies business.
                Focus on stock health: out-of-stock and low-stock items, overstock that ties up capital,
                and the carrying cost of each item.""";
            case DEMAND_FORECASTER -> """
                You are a Demand Forecaster for a stationery and office-supplies business.
                Estimate near-term demand from the sales history, flag items whose demand is shifting,
                and recommend forecast_demand or restock actions accordingly.""";
            case PROCUREMENT_SPECIALIST -> """
                You are a Procurement Specialist for a stationery and office-supplies business.
                Turn stock needs into purchase actions, weighing order cost, lead time and budget,
                and batch orders where it lowers total cost.""";
        };
        return persona + RESPONSE_FORMAT;
    }

    /**
     * @param priorities items tagged with urgency, most urgent first
     * @param context    market context; printed as key/value lines
     */
    public String prompt(AgentRole role, List<ItemPriority> priorities, List<InventoryItem> items,
                         List<SalesRecord> sales, Map<String, Object> context) {
        StringBuilder inventory = new StringBuilder();
        for (ItemPriority p : priorities) {
            inventory.append(String.format(Locale.ROOT,
                "  - %-14s %-28s stock=%-5d min=%-5d leadTime=%-3dd urgency=%s%n",
                p.sku(), p.name(), p.currentStock(), p.minThreshold(), p.leadTimeDays(), p.priority()));
        }

        StringBuilder costs = new StringBuilder();
        for (InventoryItem item : items) {
            costs.append(String.format(Locale.ROOT, "  - %-14s unitCost=%.2f maxCapacity=%d category=%s%n",
                item.sku(), item.unitCost(), item.maxCapacity(), item.category()));
        }

        Map<String, Integer> unitsBySku = new TreeMap<>();
        for (SalesRecord record : sales) {
            unitsBySku.merge(record.sku(), record.quantitySold(), Integer::sum);
        }
        StringBuilder salesSummary = new StringBuilder();
        if (unitsBySku.isEmpty()) {
            salesSummary.append("  (no sales history provided)\n");
        } else {
            unitsBySku.forEach((sku, units) ->
                salesSummary.append(String.format(Locale.ROOT, "  - %-14s unitsSold=%d%n", sku, units)));
        }

        StringBuilder contextSection = new StringBuilder();
        if (!context.isEmpty()) {
            contextSection.append("\nMarket context:\n");
            context.forEach((key, value) -> contextSection.append("  ").append(key).append(": ").append(value).append('\n'));
        }

        return """
            %s

            Inventory (classified by restock urgency, most urgent first):
            %s
            Item economics:
            %s
            Sales over the reporting window:
            %s%s
            %s
            Provide specific, actionable recommendations in the JSON format described.
            """.formatted(header(role), inventory, costs, salesSummary, contextSection, focus(role));
    }

    private static String header(AgentRole role) {
        return switch (role) {
            case SUPPLY_CHAIN_MANAGER   -> "SUPPLY CHAIN ANALYSIS REQUEST";
            case INVENTORY_ANALYST      -> "INVENTORY HEALTH REVIEW";
            case DEMAND_FORECASTER      -> "DEMAND FORECAST REQUEST";
            case PROCUREMENT_SPECIALIST -> "PROCUREMENT PLANNING REQUEST";
        };
    }

    private static String focus(AgentRole role) {
        return switch (role) {
            case SUPPLY_CHAIN_MANAGER ->
                "Address CRITICAL and HIGH items first, then calculate restock quantities for low-stock items.";
            case INVENTORY_ANALYST ->
                "Flag out-of-stock, low-stock and overstocked items and say what each costs the business.";
            case DEMAND_FORECASTER ->
                "Project demand for the next lead-time window and call out items whose sales are accelerating.";
            case PROCUREMENT_SPECIALIST ->
                "Propose purchase orders with quantities and estimated cost, staying within any budget given.";
        };
    }
}
