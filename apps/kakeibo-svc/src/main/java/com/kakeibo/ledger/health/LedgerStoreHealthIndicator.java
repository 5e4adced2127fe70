package com.kakeibo.ledger.health;

import com.kakeibo.ledger.service.ReceiptService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("ledgerStore")
public class LedgerStoreHealthIndicator implements HealthIndicator {

    private final ReceiptService receiptService;

    public LedgerStoreHealthIndicator(ReceiptService receiptService) {
        this.receiptService = receiptService;
    }

    @Override
    public Health health() {
        return Health.up()
                .withDetail("receipts", receiptService.count())
                .build();
    }
}
