package com.kakeibo.ledger.controller;

import com.kakeibo.ledger.controller.dto.ClearResponseDto;
import com.kakeibo.ledger.controller.dto.SampleSeedResponseDto;
import com.kakeibo.ledger.service.ReceiptService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MaintenanceController {

    private final ReceiptService receiptService;

    public MaintenanceController(ReceiptService receiptService) {
        this.receiptService = receiptService;
    }

    @PostMapping("/sample")
    public ResponseEntity<SampleSeedResponseDto> seedSample() {
        var result = receiptService.seedSamples();
        return ResponseEntity.ok(new SampleSeedResponseDto("success", result.inserted().size(), receiptService.count()));
    }

    @PostMapping("/clear_data")
    public ResponseEntity<ClearResponseDto> clearData(
            @RequestParam(value = "confirm", required = false, defaultValue = "false") boolean confirm
    ) {
        int cleared = receiptService.clear(confirm);
        return ResponseEntity.ok(new ClearResponseDto("success", cleared, cleared + " receipts removed"));
    }
}
