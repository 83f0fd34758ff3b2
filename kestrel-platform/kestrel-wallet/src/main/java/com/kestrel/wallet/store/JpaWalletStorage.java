package com.kestrel.wallet.store;

import com.kestrel.core.domain.WalletEntity;
import com.kestrel.core.repository.WalletRepository;
import com.kestrel.vault.record.WalletRecord;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * {@link WalletStorage} over the {@code wallets} table.
 */
public class JpaWalletStorage implements WalletStorage {

    private final WalletRepository repository;
    private final WalletDocumentCodec codec;

    public JpaWalletStorage(WalletRepository repository, WalletDocumentCodec codec) {
        this.repository = repository;
        this.codec = codec;
    }

    @Override
    @Transactional
    public void insert(WalletRecord record) {
        repository.save(WalletEntity.create(record.id(), record.name(), codec.encode(record),
                record.quantumSafe(), record.createdAt()));
    }

    @Override
    @Transactional
    public void update(WalletRecord record) {
        WalletEntity entity = repository.findByName(record.name())
                .orElseThrow(() -> new IllegalStateException("Wallet not stored: " + record.name()));
        entity.replaceEncryptedData(codec.encode(record), record.updatedAt());
    }

    @Override
    @Transactional
    public boolean delete(String name) {
        return repository.deleteByName(name) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public List<WalletRecord> loadAll() {
        return repository.findAll().stream()
                .map(entity -> codec.decode(entity.getId(), entity.getName(), entity.isQuantumSafe(),
                        entity.getCreatedAt(), entity.getUpdatedAt(), entity.getEncryptedData()))
                .toList();
    }
}
