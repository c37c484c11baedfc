package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataIntegrityViolationException;

class ContentionRetryTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final ContentionRetry retry = new ContentionRetry(4, Duration.ofMillis(50), sleeps::add, registry);

    @Test
    void retriesLockFailuresWithExponentialBackoff() {
        AtomicInteger calls = new AtomicInteger();

        String result = retry.execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new CannotAcquireLockException("lock not available");
            }
            return "ok";
        });

        Assertions.assertEquals("ok", result);
        Assertions.assertEquals(3, calls.get());
        Assertions.assertEquals(List.of(Duration.ofMillis(50), Duration.ofMillis(100)), sleeps);
        Assertions.assertEquals(2.0, registry.counter("keyshop.ledger.contention.retry").count());
    }

    @Test
    void exhaustionSurfacesAsContention() {
        AtomicInteger calls = new AtomicInteger();

        LedgerContentionException e = Assertions.assertThrows(LedgerContentionException.class,
                () -> retry.execute("ledger:complete", () -> {
                    calls.incrementAndGet();
                    throw new CannotAcquireLockException("deadlock");
                }));

        Assertions.assertEquals(4, calls.get());
        Assertions.assertInstanceOf(CannotAcquireLockException.class, e.getCause());
        Assertions.assertEquals(1.0, registry.counter("keyshop.ledger.contention.exhausted").count());
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        Assertions.assertThrows(DataIntegrityViolationException.class, () -> retry.execute("test", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));
        Assertions.assertEquals(1, calls.get());
        Assertions.assertTrue(sleeps.isEmpty());
    }
}
