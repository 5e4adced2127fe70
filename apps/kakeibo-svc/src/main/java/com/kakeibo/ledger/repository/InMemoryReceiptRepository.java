package com.kakeibo.ledger.repository;

import com.kakeibo.ledger.model.LedgerSnapshot;
import com.kakeibo.ledger.model.Receipt;
import com.kakeibo.ledger.model.ValidatedReceipt;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Repository;

/**
 * Process-lifetime receipt storage. Writers and snapshot readers are serialized by a
 * read/write lock; callers only ever receive copies of the backing list.
 */
@Repository
public class InMemoryReceiptRepository implements ReceiptRepository {

    private final List<Receipt> storage = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    // ids survive deleteAll so they are never reused
    private long lastId;

    @Override
    public Receipt save(ValidatedReceipt receipt) {
        lock.writeLock().lock();
        try {
            Receipt stored = receipt.withId(++lastId);
            storage.add(stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Receipt> saveAll(List<ValidatedReceipt> receipts) {
        if (receipts.isEmpty()) {
            return List.of();
        }
        List<Receipt> stored = new ArrayList<>(receipts.size());
        lock.writeLock().lock();
        try {
            for (ValidatedReceipt receipt : receipts) {
                stored.add(receipt.withId(++lastId));
            }
            storage.addAll(stored);
        } finally {
            lock.writeLock().unlock();
        }
        return List.copyOf(stored);
    }

    @Override
    public LedgerSnapshot snapshot() {
        lock.readLock().lock();
        try {
            return new LedgerSnapshot(storage);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Receipt> findById(long id) {
        lock.readLock().lock();
        try {
            return storage.stream()
                    .filter(receipt -> receipt.id() == id)
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int count() {
        lock.readLock().lock();
        try {
            return storage.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int deleteAll() {
        lock.writeLock().lock();
        try {
            int removed = storage.size();
            storage.clear();
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
