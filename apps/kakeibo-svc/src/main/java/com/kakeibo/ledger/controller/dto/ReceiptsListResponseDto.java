package com.kakeibo.ledger.controller.dto;

import java.util.List;
import java.util.Map;

public record ReceiptsListResponseDto(
        int total,
        long totalAmount,
        Map<String, Long> categories,
        List<ReceiptResponseDto> entries,
        String traceId
) {
}
