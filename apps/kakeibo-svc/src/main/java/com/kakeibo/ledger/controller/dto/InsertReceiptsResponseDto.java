package com.kakeibo.ledger.controller.dto;

import java.util.List;

public record InsertReceiptsResponseDto(
        String status,
        int created,
        List<ReceiptResponseDto> entries,
        List<RejectionDto> rejected,
        String traceId
) {
    public record RejectionDto(int index, String code, String field, String value, String message) {
    }
}
