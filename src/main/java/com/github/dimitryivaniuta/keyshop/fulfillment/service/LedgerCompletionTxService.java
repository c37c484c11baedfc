package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.service.PostgresAdvisoryLockService.LEDGER_COMPLETE_SCOPE;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingTransaction;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PendingTransactionRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.LedgerCompletion;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.interceptor.TransactionAspectSupport;

/**
 * Transactional half of {@link CompletionCoordinator}.
 *
 * <p>Lives in its own bean so the {@code @Transactional} proxy is always in play; a self-invoked method would
 * run without a transaction and the advisory lock would fail.</p>
 */
@Service
public class LedgerCompletionTxService {

    private final PendingTransactionRepository repository;
    private final PostgresAdvisoryLockService advisoryLockService;
    private final MetadataCodec codec;
    private final Clock clock;
    private final Duration lockTimeout;

    public LedgerCompletionTxService(
            PendingTransactionRepository repository,
            PostgresAdvisoryLockService advisoryLockService,
            MetadataCodec codec,
            AppProperties properties,
            Clock clock
    ) {
        this.repository = repository;
        this.advisoryLockService = advisoryLockService;
        this.codec = codec;
        this.lockTimeout = properties.getLedger().getLockTimeout();
        this.clock = clock;
    }

    /**
     * Advisory lock, row lock, amount check, conditional update, all in one transaction.
     *
     * <p>The amount check runs on the row as locked here, so an intent refreshed after the provider was paid
     * can never be completed with the refreshed order.</p>
     *
     * @param paymentId    payment id
     * @param paidAmount   amount confirmed by the provider, {@code null} to skip the check
     * @param paidCurrency currency confirmed by the provider, {@code null} to skip the check
     * @return completion; {@code COMPLETED} carries the metadata read before the update
     * @throws org.springframework.dao.CannotAcquireLockException when the lock is not granted in time
     */
    @Transactional
    public LedgerCompletion completeLocked(String paymentId, BigDecimal paidAmount, String paidCurrency) {
        advisoryLockService.lock(LEDGER_COMPLETE_SCOPE, paymentId, lockTimeout);

        Optional<PendingTransaction> pending = repository.findPendingForUpdate(paymentId);
        if (pending.isEmpty()) {
            return LedgerCompletion.notPending();
        }

        OrderMetadata metadata = codec.decode(pending.get().getMetadata()).withPaymentId(paymentId);
        if (!LedgerCompletion.matches(metadata, paidAmount, paidCurrency)) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return LedgerCompletion.mismatch(metadata);
        }

        int updated = repository.markPaid(paymentId, clock.instant());
        if (updated != 1) {
            TransactionAspectSupport.currentTransactionStatus().setRollbackOnly();
            return LedgerCompletion.notPending();
        }
        return LedgerCompletion.completed(metadata);
    }
}
