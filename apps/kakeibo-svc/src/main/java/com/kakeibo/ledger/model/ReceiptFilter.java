package com.kakeibo.ledger.model;

import java.time.LocalDate;

/**
 * Inclusive date bounds and an exact category match. A {@code null} part matches all receipts;
 * a blank category is treated as absent.
 */
public record ReceiptFilter(LocalDate dateFrom, LocalDate dateTo, String category) {

    private static final ReceiptFilter NONE = new ReceiptFilter(null, null, null);

    public ReceiptFilter {
        if (category != null) {
            category = category.trim();
            if (category.isEmpty()) {
                category = null;
            }
        }
    }

    public static ReceiptFilter none() {
        return NONE;
    }

    public static ReceiptFilter of(LocalDate dateFrom, LocalDate dateTo, String category) {
        return new ReceiptFilter(dateFrom, dateTo, category);
    }

    public boolean matches(Receipt receipt) {
        if (dateFrom != null && receipt.date().isBefore(dateFrom)) {
            return false;
        }
        if (dateTo != null && receipt.date().isAfter(dateTo)) {
            return false;
        }
        return category == null || category.equals(receipt.category());
    }
}
