package com.kakeibo.ledger.controller.dto;

import java.util.Map;

public record MonthlySummaryResponseDto(Map<String, MonthDto> months, String traceId) {

    public record MonthDto(Map<String, Long> categories, long total) {
    }
}
