package com.kestrel.wallet.store;

import com.kestrel.vault.record.WalletRecord;

import java.util.List;

/**
 * Durable home of wallet records. Implementations see ciphertext only.
 */
public interface WalletStorage {

    void insert(WalletRecord record);

    void update(WalletRecord record);

    /**
     * @return true if a record with this name existed
     */
    boolean delete(String name);

    List<WalletRecord> loadAll();
}
