package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;

import java.util.Collection;
import java.util.OptionalLong;

/**
 * Persisted, cross-process sequence counters. The stored next value never decreases.
 */
public interface NonceStore {

    /**
     * Atomically reserves the next value for the pair. The first reservation returns {@code seed}.
     */
    long reserve(Network network, String address, long seed);

    /**
     * Raises the stored next value to {@code max(stored, used + 1)}.
     */
    void markUsed(Network network, String address, long used);

    OptionalLong peek(Network network, String address);

    int purge(Collection<String> addresses);
}
