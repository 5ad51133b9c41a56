package com.procureagent.common.inventory;

import com.procureagent.common.model.InventoryItem;

import java.util.ArrayList;
import java.util.List;

/** Quick counts over an inventory list. */
public final class InventoryInsights {

    private InventoryInsights() {}

    public static InventorySnapshot snapshot(List<InventoryItem> items) {
        if (items == null || items.isEmpty()) {
            return new InventorySnapshot(0, 0, 0, 0, 0.0, List.of());
        }
        int outOfStock = 0;
        int lowStock   = 0;
        int overstock  = 0;
        double value   = 0.0;
        List<String> critical = new ArrayList<>();

        for (InventoryItem item : items) {
            int stock = item.currentStock();
            if (stock == 0) {
                outOfStock++;
                critical.add(item.sku());
            } else if (stock <= item.minThreshold()) {
                lowStock++;
            }
            if (stock > item.maxCapacity()) {
                overstock++;
            }
            value += stock * item.unitCost();
        }
        return new InventorySnapshot(items.size(), outOfStock, lowStock, overstock, value, critical);
    }
}
