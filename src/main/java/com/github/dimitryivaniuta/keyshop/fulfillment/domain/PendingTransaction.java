package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A payment intent recorded before the payer is redirected to a provider.
 *
 * <p>Rows are never deleted; they double as the audit trail of every attempted purchase. All writes go through
 * native statements in {@code PendingTransactionRepository} so that the {@code PENDING -> PAID} transition is
 * always guarded by a status predicate. The entity is therefore read-only from JPA's point of view.</p>
 */
@Entity
@Table(
        name = "pending_transactions",
        indexes = @Index(name = "idx_pending_owner_status_updated", columnList = "owner_id,status,updated_at")
)
@Getter
@NoArgsConstructor
public class PendingTransaction {

    @Id
    @Column(name = "payment_id", nullable = false, updatable = false, length = 128)
    private String paymentId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "amount", precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 8)
    private String currency;

    @Column(name = "metadata", nullable = false, columnDefinition = "text")
    private String metadata;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private LedgerStatus status;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public boolean isPending() {
        return status == LedgerStatus.PENDING;
    }
}
