package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Append-only log of money movements caused by fulfillment.
 */
@Entity
@Table(name = "payment_log", indexes = @Index(name = "idx_payment_log_payment", columnList = "payment_id"))
@Getter
@NoArgsConstructor
public class PaymentLogEntry {

    /**
     * Kind of money movement.
     */
    public enum Kind {
        PURCHASE,
        /** Price taken from the stored balance for a balance-paid order. */
        BALANCE_DEBIT,
        TOP_UP,
        REFUND,
        REFERRAL_REWARD
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "payment_id", nullable = false, length = 128)
    private String paymentId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private Kind kind;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", length = 8)
    private String currency;

    @Column(name = "payment_method", length = 64)
    private String paymentMethod;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /**
     * Creates a log entry.
     *
     * @param paymentId     payment id the movement belongs to
     * @param ownerId       affected owner
     * @param kind          movement kind
     * @param amount        amount
     * @param currency      currency
     * @param paymentMethod payment method
     * @param now           time
     * @return entry
     */
    public static PaymentLogEntry of(String paymentId, Long ownerId, Kind kind, BigDecimal amount, String currency,
                                     String paymentMethod, Instant now) {
        PaymentLogEntry e = new PaymentLogEntry();
        e.paymentId = paymentId;
        e.ownerId = ownerId;
        e.kind = kind;
        e.amount = amount;
        e.currency = currency;
        e.paymentMethod = paymentMethod;
        e.createdAt = now;
        return e;
    }
}
