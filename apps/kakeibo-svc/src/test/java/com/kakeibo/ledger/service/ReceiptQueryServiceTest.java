package com.kakeibo.ledger.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import com.kakeibo.ledger.model.AmountOverflowException;
import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.Receipt;
import com.kakeibo.ledger.model.ReceiptFilter;
import com.kakeibo.ledger.model.ReceiptListing;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReceiptQueryServiceTest {

    private final ReceiptQueryService queryService = new ReceiptQueryService();

    private final LedgerSnapshot snapshot = new LedgerSnapshot(List.of(
            receipt(1, "2023-01-15", "食費", 3500),
            receipt(2, "2023-01-20", "交通費", 1200),
            receipt(3, "2023-02-01", "食費", 800),
            receipt(4, "2023-02-28", "Food", 400),
            receipt(5, "2023-03-01", "食費", 4200)
    ));

    @Test
    void noPredicatesReturnsWholeSnapshotInOrder() {
        assertThat(queryService.filter(snapshot, ReceiptFilter.none())).isEqualTo(snapshot);
    }

    @Test
    void dateBoundsAreInclusive() {
        LedgerSnapshot result = queryService.filter(snapshot,
                ReceiptFilter.of(LocalDate.of(2023, 1, 20), LocalDate.of(2023, 2, 28), null));

        assertThat(result.receipts()).extracting(Receipt::id).containsExactly(2L, 3L, 4L);
    }

    @Test
    void openEndedBounds() {
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(LocalDate.of(2023, 2, 28), null, null)).receipts())
                .extracting(Receipt::id).containsExactly(4L, 5L);
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(null, LocalDate.of(2023, 1, 15), null)).receipts())
                .extracting(Receipt::id).containsExactly(1L);
    }

    @Test
    void categoryMatchIsExactAndCaseSensitive() {
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(null, null, "食費")).receipts())
                .extracting(Receipt::id).containsExactly(1L, 3L, 5L);
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(null, null, "food")).isEmpty()).isTrue();
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(null, null, "食")).isEmpty()).isTrue();
        assertThat(queryService.filter(snapshot, ReceiptFilter.of(null, null, " Food ")).receipts())
                .extracting(Receipt::id).containsExactly(4L);
    }

    @Test
    void predicatesCombineWithAnd() {
        LedgerSnapshot result = queryService.filter(snapshot,
                ReceiptFilter.of(LocalDate.of(2023, 2, 1), LocalDate.of(2023, 3, 31), "食費"));

        assertThat(result.receipts()).extracting(Receipt::id).containsExactly(3L, 5L);
    }

    @Test
    void invertedRangeYieldsEmptyResult() {
        LedgerSnapshot result = queryService.filter(snapshot,
                ReceiptFilter.of(LocalDate.of(2023, 2, 1), LocalDate.of(2023, 1, 1), null));

        assertThat(result.isEmpty()).isTrue();
    }

    @Test
    void listingCarriesTotalsAndCategoryBreakdown() {
        ReceiptListing listing = queryService.list(snapshot, ReceiptFilter.of(null, LocalDate.of(2023, 2, 1), null));

        assertThat(listing.total()).isEqualTo(3);
        assertThat(listing.totalAmount()).isEqualTo(5500L);
        assertThat(listing.categories()).containsExactly(
                entry("食費", 4300L),
                entry("交通費", 1200L)
        );
    }

    @Test
    void listingTotalOverflowIsReported() {
        LedgerSnapshot huge = new LedgerSnapshot(List.of(
                receipt(1, "2023-01-15", "food", Long.MAX_VALUE),
                receipt(2, "2023-01-16", "food", 1)
        ));

        assertThatThrownBy(() -> queryService.list(huge, ReceiptFilter.none()))
                .isInstanceOf(AmountOverflowException.class);
    }

    @Test
    void blankCategoryMeansNoCategoryFilter() {
        ReceiptFilter filter = ReceiptFilter.of(null, null, "   ");

        assertThat(filter.category()).isNull();
        assertThat(queryService.filter(snapshot, filter)).isEqualTo(snapshot);
    }

    private static Receipt receipt(long id, String date, String category, long amount) {
        return new Receipt(id, LocalDate.parse(date), category, "", amount);
    }
}
