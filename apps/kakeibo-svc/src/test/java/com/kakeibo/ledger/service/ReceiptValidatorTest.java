package com.kakeibo.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.kakeibo.ledger.model.RawReceipt;
import com.kakeibo.ledger.model.ValidatedReceipt;
import com.kakeibo.ledger.model.ValidationError;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReceiptValidatorTest {

    private final ReceiptValidator validator = new ReceiptValidator();

    @Test
    void normalizesTextAmountAndTrimsCategory() {
        ValidatedReceipt receipt = validator.validate(new RawReceipt("2023-04-01", "  食費 ", "スーパー", "2500"));

        assertThat(receipt.date()).isEqualTo(LocalDate.of(2023, 4, 1));
        assertThat(receipt.category()).isEqualTo("食費");
        assertThat(receipt.description()).isEqualTo("スーパー");
        assertThat(receipt.amount()).isEqualTo(2500L);
    }

    @Test
    void acceptsNumericAndSignedAmounts() {
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, 1200)).amount()).isEqualTo(1200L);
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, 30000000000L)).amount()).isEqualTo(30000000000L);
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, "-300")).amount()).isEqualTo(-300L);
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, "+15")).amount()).isEqualTo(15L);
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, 100.0)).amount()).isEqualTo(100L);
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, new BigDecimal("1E+3"))).amount()).isEqualTo(1000L);
    }

    @Test
    void missingDescriptionDefaultsToEmpty() {
        assertThat(validator.validate(new RawReceipt("2023-01-01", "food", null, "1")).description()).isEmpty();
    }

    @Test
    void rejectsInvalidCalendarDate() {
        assertThatThrownBy(() -> validator.validate(new RawReceipt("2023-02-30", "food", "", "100")))
                .isInstanceOf(ReceiptValidationException.class)
                .satisfies(ex -> {
                    ValidationError error = ((ReceiptValidationException) ex).error();
                    assertThat(error.code()).isEqualTo(ValidationError.Code.INVALID_DATE);
                    assertThat(error.field()).isEqualTo("date");
                    assertThat(error.rawValue()).isEqualTo("2023-02-30");
                });
        assertThat(codeOf(new RawReceipt("2023/01/05", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt(null, "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
    }

    @Test
    void rejectsDatesWithoutExactlyFourYearDigits() {
        assertThat(codeOf(new RawReceipt("+12023-04-01", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("-0001-01-01", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("+2023-04-01", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("12023-04-01", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("2023-4-01", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("2023-04-1", "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(validator.validate(new RawReceipt("0999-12-31", "food", "", "100")).date())
                .isEqualTo(LocalDate.of(999, 12, 31));
    }

    @Test
    void rejectsNonTextDateAndCategory() {
        assertThat(codeOf(new RawReceipt(20230401, "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt(List.of("2023-04-01"), "food", "", "100"))).isEqualTo(ValidationError.Code.INVALID_DATE);
        assertThat(codeOf(new RawReceipt("2023-04-01", Map.of("x", 1), "", "100"))).isEqualTo(ValidationError.Code.EMPTY_CATEGORY);
        assertThat(codeOf(new RawReceipt("2023-04-01", 42, "", "100"))).isEqualTo(ValidationError.Code.EMPTY_CATEGORY);
    }

    @Test
    void rejectsBlankCategory() {
        assertThat(codeOf(new RawReceipt("2023-01-01", "   ", "", "100"))).isEqualTo(ValidationError.Code.EMPTY_CATEGORY);
        assertThat(codeOf(new RawReceipt("2023-01-01", null, "", "100"))).isEqualTo(ValidationError.Code.EMPTY_CATEGORY);
    }

    @Test
    void rejectsNonIntegerAmounts() {
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", "12a"))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", "1,000"))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", "12.5"))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", ""))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", null))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", 12.5))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", true))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
        assertThat(codeOf(new RawReceipt("2023-01-01", "food", "", "99999999999999999999"))).isEqualTo(ValidationError.Code.INVALID_AMOUNT);
    }

    @Test
    void reportsDateBeforeOtherFields() {
        assertThat(codeOf(new RawReceipt("bad", "", "", "x"))).isEqualTo(ValidationError.Code.INVALID_DATE);
    }

    private ValidationError.Code codeOf(RawReceipt raw) {
        try {
            validator.validate(raw);
        } catch (ReceiptValidationException ex) {
            return ex.error().code();
        }
        return null;
    }
}
