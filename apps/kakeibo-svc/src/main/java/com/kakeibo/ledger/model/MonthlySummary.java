package com.kakeibo.ledger.model;

import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Per-month, per-category totals. Derived from a snapshot on demand and never stored.
 */
public record MonthlySummary(List<MonthTotals> months) {

    public MonthlySummary {
        months = months == null ? List.of() : List.copyOf(months);
    }

    public boolean isEmpty() {
        return months.isEmpty();
    }

    /**
     * @param categories totals keyed by category, iteration ordered by category name
     * @param total      sum across all categories of the month
     */
    public record MonthTotals(YearMonth month, Map<String, Long> categories, long total) {
    }
}
