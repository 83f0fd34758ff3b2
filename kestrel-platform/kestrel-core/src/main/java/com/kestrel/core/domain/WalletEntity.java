package com.kestrel.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted wallet row.
 *
 * {@code encryptedData} is a JSON document holding ciphertext, salt, nonce, schema version,
 * KEK id, password verifier, networks and multisig threshold. It never contains plaintext
 * key material.
 */
@Entity
@Table(name = "wallets", indexes = {
    @Index(name = "idx_wallets_name", columnList = "name", unique = true)
})
public class WalletEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @NotNull
    @Column(name = "name", nullable = false, unique = true, updatable = false, length = 64)
    private String name;

    @NotNull
    @Column(name = "encrypted_data", nullable = false, columnDefinition = "TEXT")
    private String encryptedData;

    @Column(name = "quantum_safe", nullable = false)
    private boolean quantumSafe;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected WalletEntity() {}

    public static WalletEntity create(UUID id, String name, String encryptedData,
                                      boolean quantumSafe, Instant createdAt) {
        if (id == null) {
            throw new IllegalArgumentException("Wallet ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Wallet name cannot be null or blank");
        }
        if (encryptedData == null || encryptedData.isBlank()) {
            throw new IllegalArgumentException("Encrypted data cannot be null or blank");
        }
        WalletEntity entity = new WalletEntity();
        entity.id = id;
        entity.name = name;
        entity.encryptedData = encryptedData;
        entity.quantumSafe = quantumSafe;
        entity.createdAt = createdAt != null ? createdAt : Instant.now();
        entity.updatedAt = entity.createdAt;
        return entity;
    }

    /**
     * Replaces the encrypted document after re-encryption.
     */
    public void replaceEncryptedData(String encryptedData, Instant updatedAt) {
        if (encryptedData == null || encryptedData.isBlank()) {
            throw new IllegalArgumentException("Encrypted data cannot be null or blank");
        }
        this.encryptedData = encryptedData;
        this.updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getEncryptedData() { return encryptedData; }
    public boolean isQuantumSafe() { return quantumSafe; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
