package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Postgres advisory lock service.
 *
 * <p>Row locks only work once a row exists and only for the statements that take them. Advisory locks
 * serialize by (scope, key) regardless, so completion of one payment id and writes to one credential are
 * each strictly one-at-a-time across all instances.</p>
 *
 * <p>Locks are transaction-scoped and released when the transaction ends; calling this outside a transaction
 * is a bug.</p>
 */
@Component
public class PostgresAdvisoryLockService {

    /** Scope for the pending-to-paid transition of one payment id. */
    public static final String LEDGER_COMPLETE_SCOPE = "ledger:complete";

    /** Scope for writes to one credential (extend, reconciliation delete). */
    public static final String CREDENTIAL_SCOPE = "credential";

    /** Scope for debiting the stored balance for one order. */
    public static final String BALANCE_PAYMENT_SCOPE = "balance:pay";

    private final JdbcTemplate jdbcTemplate;

    public PostgresAdvisoryLockService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Acquires a transaction-scoped advisory lock for the given scope and key, waiting if another transaction
     * holds it.
     *
     * @param scope lock scope
     * @param key   key within the scope
     */
    public void lock(String scope, String key) {
        long lockId = toLongHash(scope + "|" + key);
        // the function returns void; nothing to map
        jdbcTemplate.query("select pg_advisory_xact_lock(?)", rs -> null, lockId);
    }

    /**
     * Like {@link #lock(String, String)}, but gives up after {@code timeout}.
     *
     * <p>Sets {@code lock_timeout} for the rest of the current transaction, so row locks taken afterwards are
     * bounded too. Postgres reports an expired wait as SQLSTATE 55P03, which Spring translates to
     * {@link org.springframework.dao.CannotAcquireLockException}; the transaction is then unusable and must
     * be rolled back by the caller.</p>
     *
     * @param scope   lock scope
     * @param key     key within the scope
     * @param timeout longest wait
     */
    public void lock(String scope, String key, Duration timeout) {
        jdbcTemplate.queryForObject("select set_config('lock_timeout', ?, true)", String.class,
                Math.max(1L, timeout.toMillis()) + "ms");
        lock(scope, key);
    }

    static long toLongHash(String s) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(s.getBytes(StandardCharsets.UTF_8));
            return ByteBuffer.wrap(hash, 0, 8).getLong();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
