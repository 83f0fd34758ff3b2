package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

class InMemoryNonceStoreTest {

    private static final String ADDRESS = "0xabc";

    @Test
    void firstReservationReturnsSeed() {
        InMemoryNonceStore store = new InMemoryNonceStore();

        assertThat(store.reserve(Network.ETH, ADDRESS, 5)).isEqualTo(5);
        assertThat(store.reserve(Network.ETH, ADDRESS, 5)).isEqualTo(6);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(7);
    }

    @Test
    void concurrentReservationsAreDistinctAndGapless() throws Exception {
        InMemoryNonceStore store = new InMemoryNonceStore();
        ConcurrentLinkedQueue<Long> issued = new ConcurrentLinkedQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 500; i++) {
                futures.add(pool.submit(() -> issued.add(store.reserve(Network.ETH, ADDRESS, 0))));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).containsExactlyInAnyOrderElementsOf(LongStream.range(0, 500).boxed().toList());
    }

    @Test
    void markUsedRaisesButNeverLowers() {
        InMemoryNonceStore store = new InMemoryNonceStore();
        store.markUsed(Network.ETH, ADDRESS, 41);
        store.markUsed(Network.ETH, ADDRESS, 3);

        assertThat(store.reserve(Network.ETH, ADDRESS, 0)).isEqualTo(42);
    }

    @Test
    void purgeRemovesEveryNetworkForAddress() {
        InMemoryNonceStore store = new InMemoryNonceStore();
        store.reserve(Network.ETH, ADDRESS, 0);
        store.reserve(Network.POLYGON, ADDRESS, 0);
        store.reserve(Network.ETH, "0xdef", 0);

        assertThat(store.purge(Set.of(ADDRESS))).isEqualTo(2);
        assertThat(store.peek(Network.ETH, ADDRESS)).isEmpty();
        assertThat(store.peek(Network.ETH, "0xdef")).isPresent();
    }
}
