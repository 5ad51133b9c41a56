package com.procureagent.common.inventory;

/**
 * Suggested purchase quantity for one sku. {@code confidence} grows with the length of
 * the sales history, capped at 0.9.
 */
public record ReorderSuggestion(
    String sku,
    int quantity,
    double confidence,
    double averageDailySales,
    double safetyStock
) {}
