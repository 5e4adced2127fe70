package com.kakeibo.ledger.model;

/**
 * Unvalidated receipt fields as they arrive from a JSON body or a CSV row. Values keep
 * their decoded type; {@code amount} may be a JSON number or a numeral string and a
 * non-text {@code date} or {@code category} is rejected by validation.
 */
public record RawReceipt(
        Object date,
        Object category,
        String description,
        Object amount
) {
}
