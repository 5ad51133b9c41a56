package com.procureagent.common.inventory;

import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.SalesRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lead-time demand plus safety stock, capped at the remaining shelf capacity.
 *
 * <pre>
 *   avgDaily    = mean of per-day sales totals
 *   sd          = sample std-dev of per-day totals (0.2 × avgDaily for a single day)
 *   safetyStock = max(2 × sd, 0.5 × avgDaily)
 *   quantity    = clamp(ceil(avgDaily × leadTime + safetyStock), 1, maxCapacity − currentStock)
 *   confidence  = min(0.9, 0.5 + days / 30)
 * </pre>
 *
 * <p>Without sales history the suggestion falls back to {@code 2 × minThreshold}, still
 * capped at the remaining capacity, with confidence 0.5. When there is no remaining
 * capacity the quantity is 0.
 */
public final class ReorderQuantityCalculator {

    static final double MAX_CONFIDENCE      = 0.9;
    static final double BASE_CONFIDENCE     = 0.5;
    static final double HISTORY_DAYS_FOR_MAX = 30.0;

    private ReorderQuantityCalculator() {}

    public static ReorderSuggestion suggest(InventoryItem item, List<SalesRecord> sales) {
        int remaining = Math.max(0, item.maxCapacity() - item.currentStock());
        List<SalesRecord> own = UrgencyClassifier.salesFor(item.sku(), sales);

        if (own.isEmpty()) {
            int qty = Math.min(remaining, 2 * item.minThreshold());
            return new ReorderSuggestion(item.sku(), Math.max(0, qty), BASE_CONFIDENCE, 0.0, 0.0);
        }

        Map<LocalDate, Integer> daily = new TreeMap<>();
        own.forEach(s -> daily.merge(s.date(), s.quantitySold(), Integer::sum));

        int    days     = daily.size();
        double avgDaily = daily.values().stream().mapToInt(Integer::intValue).average().orElse(0.0);
        double sd       = days > 1 ? sampleStdDev(daily.values().stream().mapToDouble(Integer::doubleValue).toArray(), avgDaily)
                                   : 0.2 * avgDaily;
        double safety   = Math.max(2.0 * sd, 0.5 * avgDaily);
        double demand   = avgDaily * item.leadTimeDays() + safety;

        int qty = remaining == 0 ? 0 : (int) Math.min(remaining, Math.max(1L, (long) Math.ceil(demand)));
        double confidence = Math.min(MAX_CONFIDENCE, BASE_CONFIDENCE + days / HISTORY_DAYS_FOR_MAX);

        return new ReorderSuggestion(item.sku(), qty, confidence, avgDaily, safety);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double sampleStdDev(double[] values, double mean) {
        double sumSq = 0.0;
        for (double v : values) {
            sumSq += (v - mean) * (v - mean);
        }
        return Math.sqrt(sumSq / (values.length - 1));
    }
}
