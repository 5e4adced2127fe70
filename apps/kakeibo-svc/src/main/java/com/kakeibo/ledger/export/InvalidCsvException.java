package com.kakeibo.ledger.export;

public class InvalidCsvException extends IllegalArgumentException {

    public InvalidCsvException(String message) {
        super(message);
    }

    public InvalidCsvException(String message, Throwable cause) {
        super(message, cause);
    }
}
