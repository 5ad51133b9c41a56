package com.procureagent.common.inventory;

import java.util.List;

/**
 * Aggregate view of an inventory list at analysis time.
 *
 * @param lowStockCount items with {@code 0 < stock <= minThreshold}
 * @param overstockCount items with {@code stock > maxCapacity}
 * @param criticalSkus   skus that are out of stock
 */
public record InventorySnapshot(
    int totalItems,
    int outOfStockCount,
    int lowStockCount,
    int overstockCount,
    double totalStockValue,
    List<String> criticalSkus
) {
    public InventorySnapshot {
        criticalSkus = List.copyOf(criticalSkus);
    }
}
