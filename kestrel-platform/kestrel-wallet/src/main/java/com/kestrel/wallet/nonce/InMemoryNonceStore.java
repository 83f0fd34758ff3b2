package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.NonceOverflowException;

import java.util.Collection;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link NonceStore} for single-process deployments and tests.
 */
public class InMemoryNonceStore implements NonceStore {

    private final Map<String, Long> next = new ConcurrentHashMap<>();

    @Override
    public long reserve(Network network, String address, long seed) {
        long stored = next.compute(key(network, address),
                (k, current) -> increment(current == null ? seed : current, network));
        return stored - 1;
    }

    @Override
    public void markUsed(Network network, String address, long used) {
        long candidate = increment(used, network);
        next.merge(key(network, address), candidate, Math::max);
    }

    @Override
    public OptionalLong peek(Network network, String address) {
        Long value = next.get(key(network, address));
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }

    @Override
    public int purge(Collection<String> addresses) {
        int before = next.size();
        next.keySet().removeIf(key -> addresses.contains(key.substring(key.indexOf('|') + 1)));
        return before - next.size();
    }

    private static String key(Network network, String address) {
        return network.tag() + "|" + address;
    }

    private static long increment(long value, Network network) {
        try {
            return Math.addExact(value, 1L);
        } catch (ArithmeticException e) {
            throw new NonceOverflowException("Nonce counter exhausted for " + network.tag(), e);
        }
    }
}
