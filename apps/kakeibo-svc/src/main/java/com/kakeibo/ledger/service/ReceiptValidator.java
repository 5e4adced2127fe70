package com.kakeibo.ledger.service;

import com.kakeibo.ledger.model.RawReceipt;
import com.kakeibo.ledger.model.ValidatedReceipt;
import com.kakeibo.ledger.model.ValidationError;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns raw receipt fields into normalized values. Fields are checked in the order
 * date, category, amount and the first failure is reported.
 */
@Component
public class ReceiptValidator {

    /** {@code YYYY-MM-DD} with exactly four year digits and no sign. */
    public static final DateTimeFormatter ISO_DATE = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .appendLiteral('-')
            .appendValue(ChronoField.DAY_OF_MONTH, 2)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?[0-9]+");

    public ValidatedReceipt validate(RawReceipt raw) {
        if (raw == null) {
            throw invalid(ValidationError.Code.INVALID_DATE, "date", null, "receipt must be a JSON object");
        }
        LocalDate date = parseDate(raw.date());
        String category = normalizeCategory(raw.category());
        long amount = parseAmount(raw.amount());
        String description = raw.description() == null ? "" : raw.description();
        return new ValidatedReceipt(date, category, description, amount);
    }

    private LocalDate parseDate(Object value) {
        if (!(value instanceof String text) || text.isBlank()) {
            throw invalid(ValidationError.Code.INVALID_DATE, "date", rawText(value), "date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(text, ISO_DATE);
        } catch (DateTimeParseException ex) {
            throw invalid(ValidationError.Code.INVALID_DATE, "date", text, "date must be a valid YYYY-MM-DD date");
        }
    }

    private String normalizeCategory(Object value) {
        if (value != null && !(value instanceof String)) {
            throw invalid(ValidationError.Code.EMPTY_CATEGORY, "category", rawText(value), "category must be text");
        }
        String trimmed = value == null ? "" : ((String) value).trim();
        if (trimmed.isEmpty()) {
            throw invalid(ValidationError.Code.EMPTY_CATEGORY, "category", (String) value, "category must not be empty");
        }
        return trimmed;
    }

    private long parseAmount(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return toLong(new BigDecimal(big), value);
        }
        if (value instanceof BigDecimal decimal) {
            return toLong(decimal, value);
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw invalidAmount(value);
            }
            return toLong(BigDecimal.valueOf(d), value);
        }
        if (value instanceof String text) {
            if (!INTEGER_TEXT.matcher(text).matches()) {
                throw invalidAmount(value);
            }
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException ex) {
                throw invalidAmount(value);
            }
        }
        throw invalidAmount(value);
    }

    private long toLong(BigDecimal decimal, Object raw) {
        try {
            return decimal.stripTrailingZeros().longValueExact();
        } catch (ArithmeticException ex) {
            throw invalidAmount(raw);
        }
    }

    private ReceiptValidationException invalidAmount(Object value) {
        return invalid(ValidationError.Code.INVALID_AMOUNT, "amount", rawText(value), "amount must be an integer");
    }

    private static String rawText(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private ReceiptValidationException invalid(ValidationError.Code code, String field, String rawValue, String message) {
        return new ReceiptValidationException(new ValidationError(code, field, rawValue, message));
    }
}
