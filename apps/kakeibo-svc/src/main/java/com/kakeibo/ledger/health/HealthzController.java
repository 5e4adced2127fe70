package com.kakeibo.ledger.health;

import com.kakeibo.ledger.service.ReceiptService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight liveness endpoint. Actuator's /actuator/health carries the same store detail
 * through {@link LedgerStoreHealthIndicator}.
 */
@RestController
public class HealthzController {

    private final ReceiptService receiptService;

    public HealthzController(ReceiptService receiptService) {
        this.receiptService = receiptService;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> healthz() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("dataCount", receiptService.count());
        return body;
    }
}
