package com.kakeibo.ledger.service;

import com.kakeibo.ledger.model.ValidationError;

public class ReceiptValidationException extends IllegalArgumentException {

    private final ValidationError error;

    public ReceiptValidationException(ValidationError error) {
        super(error.message());
        this.error = error;
    }

    public ValidationError error() {
        return error;
    }
}
