package com.kestrel.wallet.store;

import com.kestrel.vault.error.NotFoundException;
import com.kestrel.vault.error.ValidationException;
import com.kestrel.vault.record.WalletRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Name-indexed wallet records with write-through to {@link WalletStorage}.
 *
 * Lookups take the read lock; insert, remove and replace take the write lock. The lock covers
 * the storage write so the map and storage never disagree, and is never held across network I/O.
 */
public class WalletStore {

    private static final Logger log = LoggerFactory.getLogger(WalletStore.class);

    private final Map<String, WalletRecord> wallets = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final WalletStorage storage;

    public WalletStore(WalletStorage storage) {
        if (storage == null) {
            throw new IllegalArgumentException("Wallet storage cannot be null");
        }
        this.storage = storage;
    }

    /**
     * Replaces the in-memory view with everything in storage.
     *
     * @return number of wallets loaded
     */
    public int loadAll() {
        List<WalletRecord> records = storage.loadAll();
        lock.writeLock().lock();
        try {
            wallets.clear();
            records.forEach(record -> wallets.put(record.name(), record));
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Loaded {} wallets from storage", records.size());
        return records.size();
    }

    public void insert(WalletRecord record) {
        lock.writeLock().lock();
        try {
            if (wallets.containsKey(record.name())) {
                throw new ValidationException("Wallet already exists: " + record.name());
            }
            storage.insert(record);
            wallets.put(record.name(), record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public WalletRecord remove(String name) {
        lock.writeLock().lock();
        try {
            WalletRecord existing = wallets.get(name);
            if (existing == null) {
                throw new NotFoundException("Wallet not found: " + name);
            }
            storage.delete(name);
            wallets.remove(name);
            return existing;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Swaps in a re-encrypted record for an existing wallet.
     */
    public void replace(WalletRecord record) {
        lock.writeLock().lock();
        try {
            if (!wallets.containsKey(record.name())) {
                throw new NotFoundException("Wallet not found: " + record.name());
            }
            storage.update(record);
            wallets.put(record.name(), record);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public WalletRecord get(String name) {
        lock.readLock().lock();
        try {
            WalletRecord record = wallets.get(name);
            if (record == null) {
                throw new NotFoundException("Wallet not found: " + name);
            }
            return record;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return wallets.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot ordered by name.
     */
    public List<WalletRecord> list() {
        lock.readLock().lock();
        try {
            List<WalletRecord> snapshot = new ArrayList<>(wallets.values());
            snapshot.sort(Comparator.comparing(WalletRecord::name));
            return snapshot;
        } finally {
            lock.readLock().unlock();
        }
    }
}
