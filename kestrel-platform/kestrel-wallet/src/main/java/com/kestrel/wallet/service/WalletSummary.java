package com.kestrel.wallet.service;

import com.kestrel.vault.address.Network;

import java.time.Instant;
import java.util.Set;
import java.util.UUID;

/**
 * Non-secret view of a wallet for listings.
 */
public record WalletSummary(
        UUID id,
        String name,
        Instant createdAt,
        Instant updatedAt,
        boolean quantumSafe,
        Set<Network> supportedNetworks
) {}
