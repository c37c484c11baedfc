package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import static com.github.dimitryivaniuta.keyshop.fulfillment.service.PostgresAdvisoryLockService.LEDGER_COMPLETE_SCOPE;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.LedgerCompletion;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Flips a pending intent to paid exactly once, however many webhooks, retries and manual checks race for it.
 *
 * <p>Exactly one caller per payment id ever receives the metadata; every other caller gets empty. The
 * transaction commits before the metadata is returned, so fulfillment never runs under a ledger lock.</p>
 */
@Service
public class CompletionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(CompletionCoordinator.class);

    private final LedgerCompletionTxService txService;
    private final ContentionRetry contentionRetry;

    private final Counter completedCounter;
    private final Counter noopCounter;
    private final Counter mismatchCounter;

    public CompletionCoordinator(
            LedgerCompletionTxService txService,
            ContentionRetry contentionRetry,
            MeterRegistry meterRegistry
    ) {
        this.txService = txService;
        this.contentionRetry = contentionRetry;

        this.completedCounter = Counter.builder("keyshop.ledger.completed").register(meterRegistry);
        this.noopCounter = Counter.builder("keyshop.ledger.complete.noop").register(meterRegistry);
        this.mismatchCounter = Counter.builder("keyshop.ledger.complete.mismatch").register(meterRegistry);
    }

    /**
     * Completes a pending intent.
     *
     * @param paymentId payment id
     * @return metadata for the single winning caller; empty for unknown, already paid, or lost races
     * @throws LedgerContentionException when lock contention outlasts all retries
     */
    public Optional<OrderMetadata> completeIfPending(String paymentId) {
        return completeIfMatching(paymentId, null, null).completedMetadata();
    }

    /**
     * Completes a pending intent only if the confirmed payment matches it as it stands under the lock.
     *
     * @param paymentId    payment id
     * @param paidAmount   amount the provider confirmed, {@code null} to accept any
     * @param paidCurrency currency the provider confirmed, {@code null} to accept any
     * @return completion; only one caller per payment id ever sees {@code COMPLETED}
     * @throws LedgerContentionException when lock contention outlasts all retries
     */
    public LedgerCompletion completeIfMatching(String paymentId, BigDecimal paidAmount, String paidCurrency) {
        if (paymentId == null || paymentId.isBlank()) {
            return LedgerCompletion.notPending();
        }
        LedgerCompletion result = contentionRetry.execute(LEDGER_COMPLETE_SCOPE,
                () -> txService.completeLocked(paymentId, paidAmount, paidCurrency));

        switch (result.outcome()) {
            case COMPLETED -> {
                completedCounter.increment();
                log.info("Ledger completed paymentId={} owner={} action={}",
                        paymentId, result.metadata().ownerId(), result.metadata().action());
            }
            case MISMATCH -> {
                mismatchCounter.increment();
                log.warn("Ledger completion refused, amount mismatch paymentId={} expected={} {} paid={} {}",
                        paymentId, result.metadata().amount(), result.metadata().currency(), paidAmount, paidCurrency);
            }
            case NOT_PENDING -> {
                noopCounter.increment();
                log.info("Ledger completion no-op paymentId={} (unknown or already paid)", paymentId);
            }
        }
        return result;
    }
}
