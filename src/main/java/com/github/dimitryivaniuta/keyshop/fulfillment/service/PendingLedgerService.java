package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.LedgerStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PendingTransactionRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.InvalidOrderMetadataException;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Durable record of payment intents, written before the payer is sent to a provider.
 *
 * <p>A row is {@code PENDING} until {@link CompletionCoordinator} flips it to {@code PAID}; nothing here can
 * move it back. Recording an intent is best effort: a storage failure is logged and reported as
 * {@code false}, never thrown, so a broken ledger does not block checkout.</p>
 */
@Service
public class PendingLedgerService {

    private static final Logger log = LoggerFactory.getLogger(PendingLedgerService.class);

    private final PendingTransactionRepository repository;
    private final MetadataCodec codec;
    private final LedgerStatusCache statusCache;
    private final TransactionTemplate tx;
    private final Clock clock;

    private final Counter recordedCounter;
    private final Counter rejectedCounter;

    public PendingLedgerService(
            PendingTransactionRepository repository,
            MetadataCodec codec,
            LedgerStatusCache statusCache,
            PlatformTransactionManager transactionManager,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.repository = repository;
        this.codec = codec;
        this.statusCache = statusCache;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;

        this.recordedCounter = Counter.builder("keyshop.ledger.intent.recorded").register(meterRegistry);
        this.rejectedCounter = Counter.builder("keyshop.ledger.intent.rejected").register(meterRegistry);
    }

    /**
     * Inserts a pending intent or refreshes a still-pending one.
     *
     * @param paymentId payment id generated by the caller
     * @param ownerId   paying party; must match {@code metadata.ownerId}
     * @param amount    expected amount
     * @param currency  expected currency
     * @param metadata  order metadata; its payment id is overwritten with {@code paymentId}
     * @return true when stored; false for a blank id, a row that is already paid, or a storage failure
     * @throws InvalidOrderMetadataException when the metadata is incomplete for its action
     */
    public boolean createOrRefreshIntent(String paymentId, long ownerId, BigDecimal amount, String currency,
                                         OrderMetadata metadata) {
        if (paymentId == null || paymentId.isBlank()) {
            log.warn("Refusing to record intent with blank payment id owner={}", ownerId);
            return false;
        }
        Objects.requireNonNull(metadata, "metadata");
        OrderMetadata md = metadata.withPaymentId(paymentId).validate();
        if (md.ownerId() != ownerId) {
            throw new InvalidOrderMetadataException("metadata ownerId " + md.ownerId() + " does not match " + ownerId);
        }
        String json = codec.encode(md);

        try {
            Integer rows = tx.execute(status ->
                    repository.upsertPending(paymentId, ownerId, amount, currency, json, clock.instant()));
            if (rows != null && rows == 1) {
                recordedCounter.increment();
                log.info("Pending intent recorded paymentId={} owner={} action={} amount={} {}",
                        paymentId, ownerId, md.action(), amount, currency);
                return true;
            }
            rejectedCounter.increment();
            log.info("Pending intent not refreshed, already paid paymentId={}", paymentId);
            return false;
        } catch (DataAccessException | TransactionException e) {
            rejectedCounter.increment();
            log.error("Failed to record pending intent paymentId={} owner={} error={}", paymentId, ownerId, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Metadata of a still-pending intent, without changing anything.
     *
     * @param paymentId payment id
     * @return metadata, empty when unknown or already paid
     */
    @Transactional(readOnly = true)
    public Optional<OrderMetadata> peekMetadata(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            return Optional.empty();
        }
        return repository.findByPaymentIdAndStatus(paymentId, LedgerStatus.PENDING)
                .map(t -> codec.decode(t.getMetadata()));
    }

    /**
     * Current status of a payment id. {@code PAID} answers may come from the cache.
     *
     * @param paymentId payment id
     * @return status, empty when unknown
     */
    public Optional<LedgerStatus> getStatus(String paymentId) {
        if (paymentId == null || paymentId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(statusCache.lookup(paymentId)).map(LedgerStatus::valueOf);
    }

    /**
     * Latest pending intent of an owner, by last refresh.
     *
     * @param ownerId owner
     * @return metadata of the most recently refreshed pending intent
     */
    @Transactional(readOnly = true)
    public Optional<OrderMetadata> mostRecentPendingFor(long ownerId) {
        return repository.findFirstByOwnerIdAndStatusOrderByUpdatedAtDescCreatedAtDesc(ownerId, LedgerStatus.PENDING)
                .map(t -> codec.decode(t.getMetadata()));
    }
}
