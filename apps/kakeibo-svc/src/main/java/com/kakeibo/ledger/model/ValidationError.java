package com.kakeibo.ledger.model;

public record ValidationError(Code code, String field, String rawValue, String message) {

    public enum Code {
        INVALID_DATE,
        EMPTY_CATEGORY,
        INVALID_AMOUNT
    }
}
