package com.kakeibo.ledger.service;

import com.kakeibo.ledger.model.AmountOverflowException;
import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.Receipt;
import com.kakeibo.ledger.model.ReceiptFilter;
import com.kakeibo.ledger.model.ReceiptListing;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Service;

@Service
public class ReceiptQueryService {

    /**
     * Keeps the receipts matching every supplied predicate, in snapshot order. An inverted
     * date range simply matches nothing.
     */
    public LedgerSnapshot filter(LedgerSnapshot snapshot, ReceiptFilter filter) {
        if (filter.dateFrom() != null && filter.dateTo() != null && filter.dateFrom().isAfter(filter.dateTo())) {
            return LedgerSnapshot.empty();
        }
        return snapshot.filter(filter::matches);
    }

    public ReceiptListing list(LedgerSnapshot snapshot, ReceiptFilter filter) {
        LedgerSnapshot matched = filter(snapshot, filter);
        long totalAmount = 0;
        Map<String, Long> categories = new LinkedHashMap<>();
        for (Receipt receipt : matched.receipts()) {
            totalAmount = AmountOverflowException.add(totalAmount, receipt.amount());
            categories.merge(receipt.category(), receipt.amount(), AmountOverflowException::add);
        }
        return new ReceiptListing(matched, matched.size(), totalAmount, categories);
    }
}
