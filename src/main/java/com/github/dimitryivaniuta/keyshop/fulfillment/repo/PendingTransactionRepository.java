package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.LedgerStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingTransaction;
import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link PendingTransaction}.
 *
 * <p>Every write carries a {@code status = 'PENDING'} predicate: a paid row can be neither revived nor
 * rewritten.</p>
 */
public interface PendingTransactionRepository extends JpaRepository<PendingTransaction, String> {

    /**
     * Inserts a pending intent, or refreshes an existing one that is still pending.
     *
     * @return 1 when a row was inserted or refreshed, 0 when the existing row is already paid
     */
    @Modifying
    @Query(value = """
            insert into pending_transactions (payment_id, owner_id, amount, currency, metadata, status, created_at, updated_at)
            values (:paymentId, :ownerId, :amount, :currency, :metadata, 'PENDING', :now, :now)
            on conflict (payment_id) do update set
                owner_id = excluded.owner_id,
                amount = excluded.amount,
                currency = excluded.currency,
                metadata = excluded.metadata,
                updated_at = excluded.updated_at
            where pending_transactions.status = 'PENDING'
            """, nativeQuery = true)
    int upsertPending(
            @Param("paymentId") String paymentId,
            @Param("ownerId") long ownerId,
            @Param("amount") BigDecimal amount,
            @Param("currency") String currency,
            @Param("metadata") String metadata,
            @Param("now") Instant now
    );

    /**
     * Finds a pending row and locks it for the rest of the transaction.
     *
     * @param paymentId payment id
     * @return pending row, empty if unknown or already paid
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select t from PendingTransaction t where t.paymentId = :paymentId and t.status = com.github.dimitryivaniuta.keyshop.fulfillment.domain.LedgerStatus.PENDING")
    Optional<PendingTransaction> findPendingForUpdate(@Param("paymentId") String paymentId);

    /**
     * Flips a row to PAID, re-asserting that it is still pending.
     *
     * @return number of rows changed (0 when another caller won)
     */
    @Modifying
    @Query(value = """
            update pending_transactions
            set status = 'PAID', updated_at = :now
            where payment_id = :paymentId and status = 'PENDING'
            """, nativeQuery = true)
    int markPaid(@Param("paymentId") String paymentId, @Param("now") Instant now);

    Optional<PendingTransaction> findByPaymentIdAndStatus(String paymentId, LedgerStatus status);

    @Query("select t.status from PendingTransaction t where t.paymentId = :paymentId")
    Optional<LedgerStatus> findStatus(@Param("paymentId") String paymentId);

    Optional<PendingTransaction> findFirstByOwnerIdAndStatusOrderByUpdatedAtDescCreatedAtDesc(Long ownerId, LedgerStatus status);
}
