package com.kestrel.vault.record;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.crypto.EncryptedEnvelope;
import com.kestrel.vault.crypto.WalletIdentity;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Identity and encrypted secret container of one wallet.
 *
 * Immutable; re-encryption produces a new record through {@link #withEnvelope}.
 * Holds ciphertext only, so the record can be cached, persisted and logged by name.
 * {@code addresses} are the public addresses derived at creation, kept so that deletion can
 * clean up per-address state without a password.
 */
public record WalletRecord(
        UUID id,
        String name,
        Instant createdAt,
        Instant updatedAt,
        boolean quantumSafe,
        int multisigThreshold,
        Set<Network> supportedNetworks,
        EncryptedEnvelope envelope,
        String passwordVerifier,
        Set<String> addresses
) {

    public WalletRecord {
        if (id == null) {
            throw new IllegalArgumentException("Wallet ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Wallet name cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Creation time cannot be null");
        }
        if (envelope == null) {
            throw new IllegalArgumentException("Envelope cannot be null");
        }
        if (multisigThreshold < 1) {
            throw new IllegalArgumentException("Multisig threshold must be at least 1");
        }
        updatedAt = updatedAt != null ? updatedAt : createdAt;
        supportedNetworks = supportedNetworks == null || supportedNetworks.isEmpty()
                ? Set.copyOf(EnumSet.allOf(Network.class))
                : Set.copyOf(supportedNetworks);
        addresses = addresses == null ? Set.of() : Set.copyOf(addresses);
    }

    public static WalletRecord create(UUID id, String name, boolean quantumSafe,
                                      EncryptedEnvelope envelope, String passwordVerifier) {
        Instant now = Instant.now();
        return new WalletRecord(id, name, now, now, quantumSafe, 1,
                EnumSet.allOf(Network.class), envelope, passwordVerifier, Set.of());
    }

    public WalletIdentity identity() {
        return new WalletIdentity(id, name);
    }

    public WalletRecord withEnvelope(EncryptedEnvelope newEnvelope) {
        return new WalletRecord(id, name, createdAt, Instant.now(), quantumSafe, multisigThreshold,
                supportedNetworks, newEnvelope, passwordVerifier, addresses);
    }

    public WalletRecord withAddresses(Set<String> derived) {
        return new WalletRecord(id, name, createdAt, updatedAt, quantumSafe, multisigThreshold,
                supportedNetworks, envelope, passwordVerifier, derived);
    }

    public boolean supports(Network network) {
        return supportedNetworks.contains(network);
    }

    public boolean hasPasswordVerifier() {
        return passwordVerifier != null && !passwordVerifier.isBlank();
    }

    @Override
    public String toString() {
        return "WalletRecord[id=" + id + ", name=" + name + ", schemaVersion=" + envelope.schemaVersion() + "]";
    }
}
