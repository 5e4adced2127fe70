package com.kakeibo.ledger.service;

/**
 * Raised when a destructive operation is invoked without explicit confirmation.
 * Nothing has been changed when this is thrown.
 */
public class ConfirmationRequiredException extends IllegalStateException {

    public ConfirmationRequiredException(String message) {
        super(message);
    }
}
