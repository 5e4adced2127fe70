package com.kakeibo.ledger.controller.dto;

import com.kakeibo.ledger.model.Receipt;

public record ReceiptResponseDto(long id, String date, String category, String description, long amount) {

    public static ReceiptResponseDto from(Receipt receipt) {
        return new ReceiptResponseDto(
                receipt.id(),
                receipt.date().toString(),
                receipt.category(),
                receipt.description(),
                receipt.amount()
        );
    }
}
