package com.kakeibo.ledger.model;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * A single household-ledger entry. Instances are created only by the ledger store
 * and never change once stored.
 */
public record Receipt(
        long id,
        LocalDate date,
        String category,
        String description,
        long amount
) {
    public YearMonth yearMonth() {
        return YearMonth.from(date);
    }
}
