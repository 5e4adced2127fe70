package com.kakeibo.ledger.model;

import java.util.Map;

/**
 * A filtered snapshot together with the statistics the list view shows.
 */
public record ReceiptListing(
        LedgerSnapshot receipts,
        int total,
        long totalAmount,
        Map<String, Long> categories
) {
}
