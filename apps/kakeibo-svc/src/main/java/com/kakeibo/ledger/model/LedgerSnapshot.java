package com.kakeibo.ledger.model;

import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Point-in-time, read-only copy of the ledger in insertion order.
 */
public record LedgerSnapshot(List<Receipt> receipts) {

    private static final LedgerSnapshot EMPTY = new LedgerSnapshot(List.of());

    public LedgerSnapshot {
        receipts = receipts == null ? List.of() : List.copyOf(receipts);
    }

    public static LedgerSnapshot empty() {
        return EMPTY;
    }

    public LedgerSnapshot filter(Predicate<Receipt> predicate) {
        return new LedgerSnapshot(receipts.stream().filter(predicate).toList());
    }

    public Stream<Receipt> stream() {
        return receipts.stream();
    }

    public int size() {
        return receipts.size();
    }

    public boolean isEmpty() {
        return receipts.isEmpty();
    }
}
