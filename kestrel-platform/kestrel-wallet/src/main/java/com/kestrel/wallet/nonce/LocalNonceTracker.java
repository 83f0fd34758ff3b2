package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.NonceOverflowException;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-process advisory sequence counters keyed by (address, network).
 *
 * Fast and lock-guarded but with no cross-process guarantee; {@link NonceStore} is the authority
 * when several processes share storage.
 */
public class LocalNonceTracker {

    private final Map<Key, Long> next = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Returns the current value and advances it by one.
     *
     * @throws NonceOverflowException when the counter would wrap
     */
    public long next(Network network, String address) {
        Key key = new Key(address, network);
        lock.writeLock().lock();
        try {
            long current = next.getOrDefault(key, 0L);
            long advanced;
            try {
                advanced = Math.addExact(current, 1L);
            } catch (ArithmeticException e) {
                throw new NonceOverflowException("Nonce counter exhausted for " + network.tag(), e);
            }
            next.put(key, advanced);
            return current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Next value that {@link #next} would return, without advancing.
     */
    public long peek(Network network, String address) {
        lock.readLock().lock();
        try {
            return next.getOrDefault(new Key(address, network), 0L);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Raises the counter to {@code used + 1}; never lowers it.
     */
    public void markUsed(Network network, String address, long used) {
        long candidate;
        try {
            candidate = Math.addExact(used, 1L);
        } catch (ArithmeticException e) {
            throw new NonceOverflowException("Nonce counter exhausted for " + network.tag(), e);
        }
        lock.writeLock().lock();
        try {
            next.merge(new Key(address, network), candidate, Math::max);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void reset(Network network, String address) {
        lock.writeLock().lock();
        try {
            next.remove(new Key(address, network));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops every entry for the given addresses on all networks.
     *
     * @return number of entries removed
     */
    public int purge(Collection<String> addresses) {
        lock.writeLock().lock();
        try {
            int before = next.size();
            next.keySet().removeIf(key -> addresses.contains(key.address()));
            return before - next.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return next.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private record Key(String address, Network network) {}
}
