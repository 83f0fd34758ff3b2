package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.OptionalLong;

/**
 * Both sequence tiers behind one facade.
 *
 * {@link #reserve} goes to the persisted store, which is authoritative across processes; the
 * local tracker follows it so {@link #nextLocal} never hands out a value the store already issued.
 */
public class NonceLedger {

    private static final Logger log = LoggerFactory.getLogger(NonceLedger.class);

    private final LocalNonceTracker localTracker;
    private final NonceStore store;

    public NonceLedger(LocalNonceTracker localTracker, NonceStore store) {
        if (localTracker == null || store == null) {
            throw new IllegalArgumentException("Local tracker and nonce store cannot be null");
        }
        this.localTracker = localTracker;
        this.store = store;
    }

    public long reserve(Network network, String address) {
        return reserve(network, address, 0L);
    }

    /**
     * Reserves a value no lower than {@code floor}, such as the chain's pending transaction count.
     * The stored counter is first raised to {@code floor}, then incremented atomically, so concurrent
     * callers with the same floor still receive distinct values.
     */
    public long reserve(Network network, String address, long floor) {
        if (floor < 0) {
            throw new IllegalArgumentException("Sequence floor cannot be negative");
        }
        if (floor > 0) {
            store.markUsed(network, address, floor - 1);
        }
        long reserved = store.reserve(network, address, floor);
        localTracker.markUsed(network, address, reserved);
        log.debug("Reserved sequence {} for {} on {}", reserved, address, network.tag());
        return reserved;
    }

    /**
     * Process-local advisory value; no cross-process guarantee.
     */
    public long nextLocal(Network network, String address) {
        return localTracker.next(network, address);
    }

    public void markUsed(Network network, String address, long used) {
        store.markUsed(network, address, used);
        localTracker.markUsed(network, address, used);
    }

    public OptionalLong peekPersisted(Network network, String address) {
        return store.peek(network, address);
    }

    /**
     * Removes both tiers' entries for a deleted wallet's addresses.
     */
    public void purge(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return;
        }
        int local = localTracker.purge(addresses);
        int persisted = store.purge(addresses);
        log.info("Purged {} local and {} persisted nonce entries", local, persisted);
    }
}
