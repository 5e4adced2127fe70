package com.kakeibo.ledger.service;

import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.RawReceipt;
import com.kakeibo.ledger.model.Receipt;
import com.kakeibo.ledger.model.ValidatedReceipt;
import com.kakeibo.ledger.model.ValidationError;
import com.kakeibo.ledger.repository.ReceiptRepository;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the ledger: validation on the way in, id assignment through the repository,
 * snapshots on the way out, and the guarded clear.
 */
@Service
public class ReceiptService {

    private static final Logger log = LoggerFactory.getLogger(ReceiptService.class);

    public record Rejection(int index, ValidationError error) {
    }

    public record InsertResult(List<Receipt> inserted, List<Rejection> rejected) {
        public boolean hasRejections() {
            return !rejected.isEmpty();
        }
    }

    private final ReceiptRepository receiptRepository;
    private final ReceiptValidator receiptValidator;

    public ReceiptService(ReceiptRepository receiptRepository, ReceiptValidator receiptValidator) {
        this.receiptRepository = receiptRepository;
        this.receiptValidator = receiptValidator;
    }

    /**
     * @throws ReceiptValidationException if the fields do not validate; nothing is stored
     */
    public Receipt insertOne(RawReceipt raw) {
        ValidatedReceipt validated = receiptValidator.validate(raw);
        Receipt stored = receiptRepository.save(validated);
        log.info("Receipt stored: id={}, date={}", stored.id(), stored.date());
        return stored;
    }

    /**
     * Validates every item independently and stores the valid ones in a single step.
     * Invalid items are reported by their position in the input and never abort the batch.
     */
    public InsertResult insertMany(List<RawReceipt> raws) {
        List<ValidatedReceipt> accepted = new ArrayList<>();
        List<Rejection> rejected = new ArrayList<>();
        for (int i = 0; i < raws.size(); i++) {
            try {
                accepted.add(receiptValidator.validate(raws.get(i)));
            } catch (ReceiptValidationException ex) {
                log.debug("Receipt rejected: index={}, code={}, field={}", i, ex.error().code(), ex.error().field());
                rejected.add(new Rejection(i, ex.error()));
            }
        }
        List<Receipt> inserted = receiptRepository.saveAll(accepted);
        log.info("Bulk insert finished: inserted={}, rejected={}", inserted.size(), rejected.size());
        return new InsertResult(inserted, List.copyOf(rejected));
    }

    public LedgerSnapshot snapshot() {
        return receiptRepository.snapshot();
    }

    public Receipt findById(long id) {
        return receiptRepository.findById(id)
                .orElseThrow(() -> new ReceiptNotFoundException(id));
    }

    public int count() {
        return receiptRepository.count();
    }

    /**
     * @return the number of receipts removed
     * @throws ConfirmationRequiredException if {@code confirm} is false; the ledger is left untouched
     */
    public int clear(boolean confirm) {
        if (!confirm) {
            log.warn("Clear refused: confirmation flag not set");
            throw new ConfirmationRequiredException("Confirmation required: add ?confirm=true to clear all receipts");
        }
        int removed = receiptRepository.deleteAll();
        log.info("Ledger cleared: removed={}", removed);
        return removed;
    }

    public InsertResult seedSamples() {
        return insertMany(SampleReceipts.all());
    }
}
