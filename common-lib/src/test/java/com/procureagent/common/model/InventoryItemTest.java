package com.procureagent.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InventoryItemTest {

    @Test
    @DisplayName("valid item, including overstock above capacity, is accepted")
    void valid() {
        assertDoesNotThrow(() -> new InventoryItem("PEN-001", "Pen", "Writing", 0, 0, 0, 0.0, 0));
        assertDoesNotThrow(() -> new InventoryItem("PEN-001", "Pen", "Writing", 150, 10, 100, 10.0, 3));
    }

    @Test
    @DisplayName("missing sku is rejected")
    void missingSku() {
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem(null, "Pen", "Writing", 5, 10, 100, 10.0, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem(" ", "Pen", "Writing", 5, 10, 100, 10.0, 3));
    }

    @Test
    @DisplayName("negative stock, threshold, lead time or cost is rejected")
    void negatives() {
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", -1, 10, 100, 10.0, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", 5, -1, 100, 10.0, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", 5, 10, 100, 10.0, -2));
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", 5, 10, 100, -0.5, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", 5, 10, 100, Double.NaN, 3));
    }

    @Test
    @DisplayName("capacity below threshold is rejected")
    void capacityBelowThreshold() {
        assertThrows(IllegalArgumentException.class,
            () -> new InventoryItem("PEN-001", "Pen", "Writing", 5, 20, 10, 10.0, 3));
    }
}
