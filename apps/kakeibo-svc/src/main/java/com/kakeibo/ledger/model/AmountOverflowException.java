package com.kakeibo.ledger.model;

/**
 * Raised when a total of stored amounts does not fit in a {@code long}.
 */
public class AmountOverflowException extends ArithmeticException {

    public AmountOverflowException(long left, long right) {
        super("amount total overflows: " + left + " + " + right);
    }

    public static long add(long left, long right) {
        try {
            return Math.addExact(left, right);
        } catch (ArithmeticException ex) {
            throw new AmountOverflowException(left, right);
        }
    }
}
