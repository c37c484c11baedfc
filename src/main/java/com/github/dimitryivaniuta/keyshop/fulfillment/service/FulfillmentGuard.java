package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.repo.ProcessedPaymentRepository;
import java.time.Clock;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Second line of defence: at most one fulfillment per payment id, including payments that never went through
 * the ledger (stored-balance purchases).
 */
@Service
public class FulfillmentGuard {

    private final ProcessedPaymentRepository repository;
    private final Clock clock;

    public FulfillmentGuard(ProcessedPaymentRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Claims a payment id for fulfillment.
     *
     * @param paymentId payment id
     * @return true for the first claim ever; false for repeats and blank ids
     */
    @Transactional
    public boolean claim(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            return false;
        }
        return repository.insertIfAbsent(paymentId, clock.instant()) == 1;
    }
}
