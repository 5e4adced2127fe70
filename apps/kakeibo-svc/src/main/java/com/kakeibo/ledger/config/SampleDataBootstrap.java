package com.kakeibo.ledger.config;

import com.kakeibo.ledger.service.ReceiptService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Optionally fills the ledger with the demo receipts at startup.
 * Enable with kakeibo.sample.seed-on-startup=true (env KAKEIBO_SAMPLE_SEED_ON_STARTUP).
 */
@Component
public class SampleDataBootstrap {
    private static final Logger log = LoggerFactory.getLogger(SampleDataBootstrap.class);

    private final ReceiptService receiptService;
    private final boolean enabled;

    public SampleDataBootstrap(ReceiptService receiptService, KakeiboProperties props) {
        this.receiptService = receiptService;
        this.enabled = props.sample().seedOnStartupFlag();
    }

    @PostConstruct
    void maybeSeed() {
        if (!enabled) {
            log.info("Sample seed disabled (kakeibo.sample.seed-on-startup=false)");
            return;
        }
        var result = receiptService.seedSamples();
        log.info("Sample seed applied: inserted={}", result.inserted().size());
    }
}
