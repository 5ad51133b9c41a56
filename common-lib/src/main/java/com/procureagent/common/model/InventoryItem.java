package com.procureagent.common.model;

/**
 * Stock position of one item. Stock above {@code maxCapacity} is allowed and reported as overstock.
 */
public record InventoryItem(
    String sku,
    String name,
    String category,
    int currentStock,
    int minThreshold,
    int maxCapacity,
    double unitCost,
    int leadTimeDays
) {
    public InventoryItem {
        if (sku == null || sku.isBlank()) {
            throw new IllegalArgumentException("Inventory item needs a sku");
        }
        if (currentStock < 0 || minThreshold < 0 || leadTimeDays < 0) {
            throw new IllegalArgumentException("Negative stock, threshold or lead time for sku " + sku);
        }
        if (maxCapacity < minThreshold) {
            throw new IllegalArgumentException("Max capacity below min threshold for sku " + sku);
        }
        if (!(unitCost >= 0)) {
            throw new IllegalArgumentException("Unit cost must be non-negative for sku " + sku);
        }
    }
}
