package com.procureagent.common.inventory;

import com.procureagent.common.model.InventoryItem;
import com.procureagent.common.model.Priority;
import com.procureagent.common.model.SalesRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class UrgencyClassifierTest {

    private static final LocalDate DAY_0 = LocalDate.of(2025, 3, 1);

    private static InventoryItem item(int stock, int threshold, int leadTime) {
        return new InventoryItem("PEN-001", "Blue ballpoint pen", "Writing", stock, threshold, 1_000, 12.5, leadTime);
    }

    /** 100 units over a 10 day span → 10 units/day. */
    private static List<SalesRecord> tenPerDay() {
        return List.of(
            new SalesRecord("PEN-001", DAY_0, 40),
            new SalesRecord("PEN-001", DAY_0.plusDays(5), 30),
            new SalesRecord("PEN-001", DAY_0.plusDays(10), 30),
            new SalesRecord("NOTE-002", DAY_0.plusDays(3), 500));
    }

    @Nested
    @DisplayName("without sales history")
    class NoSalesTests {

        @Test
        @DisplayName("stock 0 → CRITICAL")
        void outOfStock() {
            assertEquals(Priority.CRITICAL, UrgencyClassifier.classify(item(0, 10, 7), List.of()));
            assertEquals(Priority.CRITICAL, UrgencyClassifier.classify(item(0, 10, 7), null));
        }

        @Test
        @DisplayName("stock at threshold → HIGH")
        void atThreshold() {
            assertEquals(Priority.HIGH, UrgencyClassifier.classify(item(10, 10, 7), List.of()));
        }

        @Test
        @DisplayName("stock above threshold → LOW")
        void aboveThreshold() {
            assertEquals(Priority.LOW, UrgencyClassifier.classify(item(11, 10, 7), List.of()));
        }

        @Test
        @DisplayName("sales of other skus are ignored")
        void otherSkusIgnored() {
            List<SalesRecord> others = List.of(new SalesRecord("NOTE-002", DAY_0, 300));
            assertEquals(Priority.LOW, UrgencyClassifier.classify(item(50, 10, 7), others));
        }
    }

    @Nested
    @DisplayName("with sales history")
    class CoverageTests {

        @Test
        @DisplayName("stock 0 → CRITICAL regardless of sales")
        void outOfStockWithSales() {
            assertEquals(Priority.CRITICAL, UrgencyClassifier.classify(item(0, 0, 1), tenPerDay()));
        }

        @Test
        @DisplayName("coverage equal to lead time → CRITICAL")
        void coverageAtLeadTime() {
            assertEquals(Priority.CRITICAL, UrgencyClassifier.classify(item(70, 5, 7), tenPerDay()));
        }

        @Test
        @DisplayName("coverage at 1.5 × lead time → HIGH")
        void coverageAtOneAndHalf() {
            assertEquals(Priority.HIGH, UrgencyClassifier.classify(item(105, 5, 7), tenPerDay()));
        }

        @Test
        @DisplayName("coverage at 2 × lead time → MEDIUM")
        void coverageAtDouble() {
            assertEquals(Priority.MEDIUM, UrgencyClassifier.classify(item(140, 5, 7), tenPerDay()));
        }

        @Test
        @DisplayName("coverage beyond 2 × lead time → LOW")
        void coverageBeyond() {
            assertEquals(Priority.LOW, UrgencyClassifier.classify(item(141, 5, 7), tenPerDay()));
        }

        @Test
        @DisplayName("sales records with zero quantity → MEDIUM")
        void noMovement() {
            List<SalesRecord> stale = List.of(
                new SalesRecord("PEN-001", DAY_0, 0),
                new SalesRecord("PEN-001", DAY_0.plusDays(4), 0));
            assertEquals(Priority.MEDIUM, UrgencyClassifier.classify(item(5, 10, 7), stale));
        }

        @Test
        @DisplayName("same-day sales use a one-day span")
        void singleDaySpan() {
            List<SalesRecord> sameDay = List.of(
                new SalesRecord("PEN-001", DAY_0, 6),
                new SalesRecord("PEN-001", DAY_0, 4));
            assertEquals(10.0, UrgencyClassifier.dailyRate(sameDay), 1e-9);
            assertEquals(Priority.CRITICAL, UrgencyClassifier.classify(item(20, 5, 2), sameDay));
        }

        @Test
        @DisplayName("Deterministic: same input always produces same output")
        void deterministic() {
            InventoryItem item = item(105, 5, 7);
            Priority first = UrgencyClassifier.classify(item, tenPerDay());
            for (int i = 0; i < 50; i++) {
                assertEquals(first, UrgencyClassifier.classify(item, tenPerDay()));
            }
        }
    }
}
