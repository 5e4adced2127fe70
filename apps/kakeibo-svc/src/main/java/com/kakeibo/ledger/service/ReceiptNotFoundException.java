package com.kakeibo.ledger.service;

public class ReceiptNotFoundException extends RuntimeException {

    private final long receiptId;

    public ReceiptNotFoundException(long receiptId) {
        super("Receipt not found: " + receiptId);
        this.receiptId = receiptId;
    }

    public long receiptId() {
        return receiptId;
    }
}
