package com.kestrel.wallet.nonce;

import com.kestrel.vault.address.Network;
import com.kestrel.vault.error.NonceOverflowException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.OptionalLong;

/**
 * {@link NonceStore} backed by the {@code nonces} table.
 *
 * A reservation is one {@code MERGE} (insert {@code seed + 1}, or increment) followed by a read of
 * {@code next_nonce - 1} in the same transaction, so concurrent callers in any process receive
 * distinct, ordered values. Two first-time inserts racing on a fresh pair surface as a unique-key
 * violation and the loser retries once against the now-existing row. An increment past the
 * {@code BIGINT} range is reported by the database as SQLSTATE 22003 and surfaces as
 * {@link NonceOverflowException}.
 */
public class JdbcNonceStore implements NonceStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcNonceStore.class);

    private static final String SOURCE =
            "USING (SELECT CAST(:network AS VARCHAR(32)) AS network, CAST(:address AS VARCHAR(128)) AS address) s "
                    + "ON t.network = s.network AND t.address = s.address ";

    private static final String RESERVE_SQL = "MERGE INTO nonces t " + SOURCE
            + "WHEN MATCHED THEN UPDATE SET next_nonce = t.next_nonce + 1, updated_at = :now "
            + "WHEN NOT MATCHED THEN INSERT (network, address, next_nonce, updated_at) "
            + "VALUES (s.network, s.address, :initial, :now)";

    private static final String MARK_USED_SQL = "MERGE INTO nonces t " + SOURCE
            + "WHEN MATCHED THEN UPDATE SET next_nonce = GREATEST(t.next_nonce, :candidate), updated_at = :now "
            + "WHEN NOT MATCHED THEN INSERT (network, address, next_nonce, updated_at) "
            + "VALUES (s.network, s.address, :candidate, :now)";

    private static final String SELECT_SQL =
            "SELECT next_nonce FROM nonces WHERE network = :network AND address = :address";

    private static final String PURGE_SQL = "DELETE FROM nonces WHERE address IN (:addresses)";

    private static final String NUMERIC_OUT_OF_RANGE = "22003";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;

    public JdbcNonceStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactions) {
        if (jdbc == null || transactions == null) {
            throw new IllegalArgumentException("JDBC template and transaction template cannot be null");
        }
        this.jdbc = jdbc;
        this.transactions = transactions;
    }

    @Override
    public long reserve(Network network, String address, long seed) {
        long initial = increment(seed, network);
        try {
            try {
                return reserveOnce(network, address, initial);
            } catch (DuplicateKeyException e) {
                log.debug("Concurrent first reservation for {} on {}, retrying", address, network.tag());
                return reserveOnce(network, address, initial);
            }
        } catch (DataAccessException e) {
            if (isNumericOverflow(e)) {
                throw new NonceOverflowException("Nonce counter exhausted for " + network.tag(), e);
            }
            throw e;
        }
    }

    @Override
    public void markUsed(Network network, String address, long used) {
        MapSqlParameterSource params = params(network, address)
                .addValue("candidate", increment(used, network))
                .addValue("now", Timestamp.from(Instant.now()));
        try {
            jdbc.update(MARK_USED_SQL, params);
        } catch (DuplicateKeyException e) {
            jdbc.update(MARK_USED_SQL, params);
        }
    }

    @Override
    public OptionalLong peek(Network network, String address) {
        List<Long> values = jdbc.queryForList(SELECT_SQL, params(network, address), Long.class);
        return values.isEmpty() ? OptionalLong.empty() : OptionalLong.of(values.get(0));
    }

    @Override
    public int purge(Collection<String> addresses) {
        if (addresses == null || addresses.isEmpty()) {
            return 0;
        }
        return jdbc.update(PURGE_SQL, new MapSqlParameterSource("addresses", List.copyOf(addresses)));
    }

    // ==================== Private Helper Methods ====================

    private long reserveOnce(Network network, String address, long initial) {
        Long reserved = transactions.execute(status -> {
            MapSqlParameterSource params = params(network, address)
                    .addValue("initial", initial)
                    .addValue("now", Timestamp.from(Instant.now()));
            jdbc.update(RESERVE_SQL, params);
            return jdbc.queryForObject(SELECT_SQL, params, Long.class) - 1;
        });
        if (reserved == null) {
            throw new IllegalStateException("Nonce reservation returned no value");
        }
        return reserved;
    }

    private static boolean isNumericOverflow(DataAccessException e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && NUMERIC_OUT_OF_RANGE.equals(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private static MapSqlParameterSource params(Network network, String address) {
        return new MapSqlParameterSource()
                .addValue("network", network.tag())
                .addValue("address", address);
    }

    private static long increment(long value, Network network) {
        try {
            return Math.addExact(value, 1L);
        } catch (ArithmeticException e) {
            throw new NonceOverflowException("Nonce counter exhausted for " + network.tag(), e);
        }
    }
}
