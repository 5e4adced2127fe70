package com.kakeibo.ledger.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record MonthBreakdownResponseDto(
        String yearMonth,
        int totalEntries,
        long totalAmount,
        List<CategoryDto> categories,
        String traceId
) {
    public record CategoryDto(String category, long amount, BigDecimal percentage) {
    }
}
