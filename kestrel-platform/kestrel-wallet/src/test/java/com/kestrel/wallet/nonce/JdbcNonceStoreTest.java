package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.NonceOverflowException;
import org.flywaydb.core.Flyway;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs the nonce upsert against H2 with the production migration applied.
 */
class JdbcNonceStoreTest {

    private static final String ADDRESS = "0x7E5F4552091A69125d5DfCb7b8C2659029395Bdf";

    private JdbcNonceStore store;
    private NamedParameterJdbcTemplate jdbc;

    @BeforeEach
    void setUp() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:nonces-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        Flyway.configure().dataSource(dataSource).locations("classpath:db/migration").load().migrate();

        jdbc = new NamedParameterJdbcTemplate(dataSource);
        store = new JdbcNonceStore(jdbc, new TransactionTemplate(new DataSourceTransactionManager(dataSource)));
    }

    @Test
    void reservationsAreMonotonicFromSeed() {
        assertThat(store.reserve(Network.ETH, ADDRESS, 0)).isZero();
        assertThat(store.reserve(Network.ETH, ADDRESS, 0)).isEqualTo(1);
        assertThat(store.reserve(Network.ETH, ADDRESS, 0)).isEqualTo(2);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(3);
    }

    @Test
    void concurrentReservationsAreDistinctAndGapless() throws Exception {
        int threads = 8;
        int perThread = 25;
        ConcurrentLinkedQueue<Long> issued = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        issued.add(store.reserve(Network.ETH, ADDRESS, 0));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(issued).containsExactlyInAnyOrderElementsOf(
                LongStream.range(0, threads * perThread).boxed().toList());
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(threads * perThread);
    }

    @Test
    void incrementPastBigintRangeIsNonceOverflow() {
        store.markUsed(Network.ETH, ADDRESS, Long.MAX_VALUE - 1);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(Long.MAX_VALUE);

        assertThatThrownBy(() -> store.reserve(Network.ETH, ADDRESS, 0))
                .isInstanceOf(NonceOverflowException.class);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(Long.MAX_VALUE);
    }

    @Test
    void seedOnlyAppliesToFirstReservation() {
        assertThat(store.reserve(Network.SEPOLIA, ADDRESS, 10)).isEqualTo(10);
        assertThat(store.reserve(Network.SEPOLIA, ADDRESS, 0)).isEqualTo(11);
    }

    @Test
    void pairsAreIndependent() {
        store.reserve(Network.ETH, ADDRESS, 0);
        store.reserve(Network.ETH, ADDRESS, 0);

        assertThat(store.reserve(Network.POLYGON, ADDRESS, 0)).isZero();
        assertThat(store.reserve(Network.ETH, "0x0000000000000000000000000000000000000001", 0)).isZero();
    }

    @Test
    void markUsedRaisesButNeverLowers() {
        store.markUsed(Network.ETH, ADDRESS, 20);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(21);

        store.markUsed(Network.ETH, ADDRESS, 5);
        assertThat(store.peek(Network.ETH, ADDRESS)).hasValue(21);

        assertThat(store.reserve(Network.ETH, ADDRESS, 0)).isEqualTo(21);
    }

    @Test
    void purgeDeletesRowsForAddresses() {
        store.reserve(Network.ETH, ADDRESS, 0);
        store.reserve(Network.BSC, ADDRESS, 0);
        store.reserve(Network.BTC, "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH", 0);

        assertThat(store.purge(Set.of(ADDRESS))).isEqualTo(2);
        assertThat(store.peek(Network.ETH, ADDRESS)).isEmpty();
        assertThat(store.peek(Network.BTC, "1BgGZ9tcN4rm9KBzDn7KprQz87SZ26SAMH")).hasValue(1);
        assertThat(store.purge(Set.of())).isZero();
    }

    @Test
    void ledgerKeepsLocalTierAheadOfPersistedReservations() {
        NonceLedger ledger = new NonceLedger(new LocalNonceTracker(), store);

        assertThat(ledger.reserve(Network.ETH, ADDRESS)).isZero();
        assertThat(ledger.reserve(Network.ETH, ADDRESS)).isEqualTo(1);
        assertThat(ledger.nextLocal(Network.ETH, ADDRESS)).isEqualTo(2);

        ledger.purge(Set.of(ADDRESS));
        assertThat(ledger.peekPersisted(Network.ETH, ADDRESS)).isEmpty();
        assertThat(ledger.nextLocal(Network.ETH, ADDRESS)).isZero();
    }

    @Test
    void ledgerReservationRespectsFloorWithoutLoweringTheCounter() {
        NonceLedger ledger = new NonceLedger(new LocalNonceTracker(), store);

        assertThat(ledger.reserve(Network.ETH, ADDRESS, 7)).isEqualTo(7);
        assertThat(ledger.reserve(Network.ETH, ADDRESS, 7)).isEqualTo(8);
        assertThat(ledger.reserve(Network.ETH, ADDRESS, 3)).isEqualTo(9);
        assertThat(ledger.reserve(Network.ETH, ADDRESS, 20)).isEqualTo(20);
        assertThat(ledger.peekPersisted(Network.ETH, ADDRESS)).hasValue(21);
    }
}
