package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only claim record. Its existence proves that fulfillment for {@code paymentId} has started.
 *
 * <p>Rows are inserted by {@code ProcessedPaymentRepository#insertIfAbsent} only; they are never updated or
 * deleted.</p>
 */
@Entity
@Table(name = "processed_payments")
@Getter
@NoArgsConstructor
public class ProcessedPayment {

    @Id
    @Column(name = "payment_id", nullable = false, updatable = false, length = 128)
    private String paymentId;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private Instant claimedAt;
}
