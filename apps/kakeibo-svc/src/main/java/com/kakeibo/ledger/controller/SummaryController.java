package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.analytics.SummaryService;
import com.kakeibo.ledger.controller.dto.MonthBreakdownResponseDto;
import com.kakeibo.ledger.controller.dto.MonthlySummaryResponseDto;
import com.kakeibo.ledger.model.MonthBreakdown;
import com.kakeibo.ledger.model.MonthlySummary;
import com.kakeibo.ledger.service.ReceiptService;
import com.kakeibo.ledger.web.RequestContextHolder;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/summary")
public class SummaryController {

    private static final DateTimeFormatter YEAR_MONTH = new DateTimeFormatterBuilder()
            .appendValue(ChronoField.YEAR, 4)
            .appendLiteral('-')
            .appendValue(ChronoField.MONTH_OF_YEAR, 2)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private final ReceiptService receiptService;
    private final SummaryService summaryService;

    public SummaryController(ReceiptService receiptService, SummaryService summaryService) {
        this.receiptService = receiptService;
        this.summaryService = summaryService;
    }

    @GetMapping
    public ResponseEntity<MonthlySummaryResponseDto> getSummary(
            @RequestParam(value = "year_month", required = false) String yearMonth
    ) {
        Optional<YearMonth> month = Optional.ofNullable(yearMonth)
                .filter(value -> !value.isBlank())
                .map(value -> parseMonth(value, "year_month"));
        MonthlySummary summary = summaryService.summarize(receiptService.snapshot(), month);
        Map<String, MonthlySummaryResponseDto.MonthDto> months = new LinkedHashMap<>();
        for (MonthlySummary.MonthTotals totals : summary.months()) {
            months.put(totals.month().toString(), new MonthlySummaryResponseDto.MonthDto(totals.categories(), totals.total()));
        }
        return ResponseEntity.ok(new MonthlySummaryResponseDto(months, traceId()));
    }

    @GetMapping("/{yearMonth}")
    public ResponseEntity<MonthBreakdownResponseDto> getMonthBreakdown(@PathVariable("yearMonth") String yearMonth) {
        MonthBreakdown breakdown = summaryService.breakdown(receiptService.snapshot(), parseMonth(yearMonth, "year_month"));
        var response = new MonthBreakdownResponseDto(
                breakdown.month().toString(),
                breakdown.totalEntries(),
                breakdown.totalAmount(),
                breakdown.categories().stream()
                        .map(share -> new MonthBreakdownResponseDto.CategoryDto(share.category(), share.amount(), share.percentage()))
                        .toList(),
                traceId()
        );
        return ResponseEntity.ok(response);
    }

    private static YearMonth parseMonth(String value, String param) {
        try {
            return YearMonth.parse(value, YEAR_MONTH);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException(param + " must be in YYYY-MM format");
        }
    }

    private static String traceId() {
        return RequestContextHolder.traceId().orElse(null);
    }
}
