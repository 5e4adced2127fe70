package com.kakeibo.ledger.controller.dto;

public record ClearResponseDto(String status, int cleared, String message) {
}
