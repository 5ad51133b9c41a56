package com.procureagent.common.inventory;

import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.Priority;
import com.procureagent.common.model.SalesRecord;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Pure stateless classifier that maps an {@link InventoryItem} and its sales history
 * to a restock {@link Priority}.
 *
 * <p>Classification rules (evaluated in priority order):
 * <ol>
 *   <li>stock == 0                              → {@link Priority#CRITICAL}</li>
 *   <li>no sales, stock &le; threshold           → {@link Priority#HIGH}</li>
 *   <li>no sales                                → {@link Priority#LOW}</li>
 *   <li>daily rate == 0                         → {@link Priority#MEDIUM}</li>
 *   <li>days of stock &le; 1.0 × lead time       → {@link Priority#CRITICAL}</li>
 *   <li>days of stock &le; 1.5 × lead time       → {@link Priority#HIGH}</li>
 *   <li>days of stock &le; 2.0 × lead time       → {@link Priority#MEDIUM}</li>
 *   <li>otherwise                               → {@link Priority#LOW}</li>
 * </ol>
 *
 * <p>No reactive types. No logging. No side-effects.
 */
public final class UrgencyClassifier {

    static final double CRITICAL_COVERAGE = 1.0;
    static final double HIGH_COVERAGE     = 1.5;
    static final double MEDIUM_COVERAGE   = 2.0;

    private UrgencyClassifier() {}

    /**
     * @param item  item to classify
     * @param sales sales history; records for other skus are ignored, null means none
     */
    public static Priority classify(InventoryItem item, List<SalesRecord> sales) {
        if (item.currentStock() == 0) {
            return Priority.CRITICAL;
        }

        List<SalesRecord> own = salesFor(item.sku(), sales);
        if (own.isEmpty()) {
            return item.currentStock() <= item.minThreshold() ? Priority.HIGH : Priority.LOW;
        }

        double dailyRate = dailyRate(own);
        if (dailyRate == 0.0) {
            return Priority.MEDIUM;
        }

        double daysOfStock = item.currentStock() / dailyRate;
        int    leadTime    = item.leadTimeDays();
        if (daysOfStock <= CRITICAL_COVERAGE * leadTime) return Priority.CRITICAL;
        if (daysOfStock <= HIGH_COVERAGE * leadTime)     return Priority.HIGH;
        if (daysOfStock <= MEDIUM_COVERAGE * leadTime)   return Priority.MEDIUM;
        return Priority.LOW;
    }

    /**
     * Units sold per day over the span between the first and last sale date, with a
     * minimum span of one day.
     */
    public static double dailyRate(List<SalesRecord> sales) {
        if (sales == null || sales.isEmpty()) {
            return 0.0;
        }
        long totalSold = 0;
        LocalDate min = null;
        LocalDate max = null;
        for (SalesRecord s : sales) {
            totalSold += s.quantitySold();
            if (min == null || s.date().isBefore(min)) min = s.date();
            if (max == null || s.date().isAfter(max))  max = s.date();
        }
        long daySpan = Math.max(1, ChronoUnit.DAYS.between(min, max));
        return (double) totalSold / daySpan;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    static List<SalesRecord> salesFor(String sku, List<SalesRecord> sales) {
        if (sales == null || sales.isEmpty()) {
            return List.of();
        }
        return sales.stream()
            .filter(s -> s != null && sku.equals(s.sku()) && s.date() != null)
            .toList();
    }
}
