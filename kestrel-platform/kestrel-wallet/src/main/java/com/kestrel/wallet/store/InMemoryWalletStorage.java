package com.kestrel.wallet.store;

import com.kestrel.vault.record.WalletRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable {@link WalletStorage} for development and tests.
 */
public class InMemoryWalletStorage implements WalletStorage {

    private final Map<String, WalletRecord> records = new ConcurrentHashMap<>();

    @Override
    public void insert(WalletRecord record) {
        if (records.putIfAbsent(record.name(), record) != null) {
            throw new IllegalStateException("Wallet already stored: " + record.name());
        }
    }

    @Override
    public void update(WalletRecord record) {
        if (records.replace(record.name(), record) == null) {
            throw new IllegalStateException("Wallet not stored: " + record.name());
        }
    }

    @Override
    public boolean delete(String name) {
        return records.remove(name) != null;
    }

    @Override
    public List<WalletRecord> loadAll() {
        return new ArrayList<>(records.values());
    }
}
