package com.kakeibo.ledger.controller.dto;

public record SampleSeedResponseDto(String status, int added, int total) {
}
