package com.kakeibo.ledger.repository;

import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.Receipt;
import com.kakeibo.ledger.model.ValidatedReceipt;
import java.util.List;
import java.util.Optional;

public interface ReceiptRepository {

    Receipt save(ValidatedReceipt receipt);

    /**
     * Stores all receipts as one atomic step; a concurrent snapshot sees either all of them or none.
     */
    List<Receipt> saveAll(List<ValidatedReceipt> receipts);

    LedgerSnapshot snapshot();

    Optional<Receipt> findById(long id);

    int count();

    /**
     * @return the number of receipts removed
     */
    int deleteAll();
}
