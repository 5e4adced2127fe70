package com.kakeibo.ledger.analytics;

import com.kakeibo.ledger.model.AmountOverflowException;
import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.MonthBreakdown;
import com.kakeibo.ledger.model.MonthlySummary;
import com.kakeibo.ledger.model.Receipt;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Service;

@Service
public class SummaryService {

    /**
     * Groups receipts by the month of their own date and by category. When {@code month} is
     * present only that month is considered. Totals that leave the {@code long} range raise
     * {@link AmountOverflowException}.
     */
    public MonthlySummary summarize(LedgerSnapshot snapshot, Optional<YearMonth> month) {
        Map<YearMonth, Map<String, Long>> buckets = new TreeMap<>();
        for (Receipt receipt : snapshot.receipts()) {
            YearMonth key = receipt.yearMonth();
            if (month.isPresent() && !month.get().equals(key)) {
                continue;
            }
            buckets.computeIfAbsent(key, ignored -> new TreeMap<>())
                    .merge(receipt.category(), receipt.amount(), AmountOverflowException::add);
        }
        List<MonthlySummary.MonthTotals> months = buckets.entrySet().stream()
                .map(entry -> new MonthlySummary.MonthTotals(
                        entry.getKey(),
                        Collections.unmodifiableMap(entry.getValue()),
                        entry.getValue().values().stream().reduce(0L, AmountOverflowException::add)))
                .toList();
        return new MonthlySummary(months);
    }

    public MonthBreakdown breakdown(LedgerSnapshot snapshot, YearMonth month) {
        List<Receipt> monthly = snapshot.stream()
                .filter(receipt -> receipt.yearMonth().equals(month))
                .toList();
        long total = monthly.stream().map(Receipt::amount).reduce(0L, AmountOverflowException::add);
        Map<String, Long> byCategory = new TreeMap<>();
        monthly.forEach(receipt -> byCategory.merge(receipt.category(), receipt.amount(), AmountOverflowException::add));

        List<MonthBreakdown.CategoryShare> categories = byCategory.entrySet().stream()
                .map(entry -> new MonthBreakdown.CategoryShare(entry.getKey(), entry.getValue(), percentage(entry.getValue(), total)))
                .sorted(Comparator.comparingLong(MonthBreakdown.CategoryShare::amount).reversed())
                .toList();
        return new MonthBreakdown(month, monthly.size(), total, categories);
    }

    private BigDecimal percentage(long amount, long total) {
        if (total == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(amount)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
