package com.kakeibo.ledger.model;

import java.time.LocalDate;

/**
 * Normalized receipt fields that passed validation but have no id yet.
 */
public record ValidatedReceipt(LocalDate date, String category, String description, long amount) {

    public Receipt withId(long id) {
        return new Receipt(id, date, category, description, amount);
    }
}
