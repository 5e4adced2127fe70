package com.kakeibo.ledger.health;

import com.kakeibo.ledger.model.RawReceipt;
import com.kakeibo.ledger.service.ReceiptService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class HealthzControllerTest {

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ReceiptService receiptService;

    @BeforeEach
    void resetLedger() {
        receiptService.clear(true);
    }

    @Test
    void healthzReturnsUpWithDataCount() throws Exception {
        receiptService.insertOne(new RawReceipt("2023-01-01", "food", "", "100"));

        mockMvc.perform(get("/healthz").header("X-Request-Trace", "trace-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Trace", "trace-1"))
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.dataCount").value(1));
    }

    @Test
    void actuatorHealthIncludesLedgerStore() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.ledgerStore.status").value("UP"))
                .andExpect(jsonPath("$.components.ledgerStore.details.receipts").value(0));
    }
}
