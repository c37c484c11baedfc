package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.config.CacheConfig.LEDGER_STATUS_CACHE;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.LedgerStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PendingTransactionRepository;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

/**
 * Redis-backed lookup of ledger statuses.
 *
 * <p>Only {@code PAID} is cached: it is terminal, so a cached value can never go stale. Postgres remains the
 * source of truth.</p>
 */
@Service
public class LedgerStatusCache {

    private final PendingTransactionRepository repository;

    public LedgerStatusCache(PendingTransactionRepository repository) {
        this.repository = repository;
    }

    /**
     * Status name of a payment id.
     *
     * @param paymentId payment id
     * @return status name, or null if unknown
     */
    @Cacheable(cacheNames = LEDGER_STATUS_CACHE, key = "#paymentId", unless = "#result == null || #result != 'PAID'")
    public String lookup(String paymentId) {
        return repository.findStatus(paymentId).map(LedgerStatus::name).orElse(null);
    }
}
