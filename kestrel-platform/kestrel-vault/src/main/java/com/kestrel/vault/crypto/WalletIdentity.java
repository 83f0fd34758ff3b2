package com.kestrel.vault.crypto;

import java.util.UUID;

/**
 * The wallet attributes an envelope is bound to through its associated data.
 */
public record WalletIdentity(UUID id, String name) {

    public WalletIdentity {
        if (id == null) {
            throw new IllegalArgumentException("Wallet ID cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Wallet name cannot be null or blank");
        }
    }
}
