package com.kakeibo.ledger.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

public record MonthBreakdown(
        YearMonth month,
        int totalEntries,
        long totalAmount,
        List<CategoryShare> categories
) {
    public record CategoryShare(String category, long amount, BigDecimal percentage) {
    }
}
