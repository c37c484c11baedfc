package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Component;

/**
 * Re-runs a ledger transaction that lost a lock race.
 *
 * <p>Only lock failures ({@link PessimisticLockingFailureException} and its subclasses
 * {@code CannotAcquireLockException} and {@code DeadlockLoserDataAccessException}) are retried. The delay is
 * {@code baseBackoff * 2^(attempt-1)}. Every other exception propagates on the first attempt.</p>
 */
@Component
public class ContentionRetry {

    private static final Logger log = LoggerFactory.getLogger(ContentionRetry.class);

    /**
     * Pause between attempts.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration baseBackoff;
    private final Sleeper sleeper;
    private final Counter retryCounter;
    private final Counter exhaustedCounter;

    public ContentionRetry(AppProperties properties, MeterRegistry meterRegistry) {
        this(properties.getLedger().getMaxAttempts(), properties.getLedger().getBaseBackoff(),
                d -> Thread.sleep(d.toMillis()), meterRegistry);
    }

    ContentionRetry(int maxAttempts, Duration baseBackoff, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseBackoff = baseBackoff;
        this.sleeper = sleeper;
        this.retryCounter = Counter.builder("keyshop.ledger.contention.retry").register(meterRegistry);
        this.exhaustedCounter = Counter.builder("keyshop.ledger.contention.exhausted").register(meterRegistry);
    }

    /**
     * Runs {@code action}, retrying on lock contention.
     *
     * @param operation name used in logs and in the final exception
     * @param action    transactional unit of work
     * @param <T>       result type
     * @return result of the first successful attempt
     * @throws LedgerContentionException when all attempts lost a lock race
     */
    public <T> T execute(String operation, Supplier<T> action) {
        PessimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (PessimisticLockingFailureException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration backoff = backoff(attempt);
                retryCounter.increment();
                log.warn("Lock contention on {} attempt={}/{} retryIn={}ms error={}",
                        operation, attempt, maxAttempts, backoff.toMillis(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LedgerContentionException(operation, attempt, ie);
                }
            }
        }
        exhaustedCounter.increment();
        log.error("Lock contention on {} not resolved after {} attempts", operation, maxAttempts);
        throw new LedgerContentionException(operation, maxAttempts, last);
    }

    Duration backoff(int attempt) {
        return baseBackoff.multipliedBy(1L << Math.min(attempt - 1, 20));
    }
}
