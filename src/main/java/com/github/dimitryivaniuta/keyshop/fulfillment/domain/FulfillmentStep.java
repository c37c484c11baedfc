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
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Recorded outcome of one fulfillment side effect.
 *
 * <p>Every side effect of a run leaves a row here, including failed or skipped ones, so that e.g. a lost
 * referral payout is a queryable fact. A run is terminal once it has a {@link StepType#COMPLETED} or
 * {@link StepType#ABORTED} row.</p>
 */
@Entity
@Table(name = "fulfillment_steps", indexes = @Index(name = "idx_fulfillment_steps_payment", columnList = "payment_id"))
@Getter
@NoArgsConstructor
public class FulfillmentStep {

    /**
     * Side effect the row describes.
     */
    public enum StepType {
        PROVISION,
        GIFT_HOLD,
        BALANCE_CREDIT,
        REFUND,
        REFERRAL,
        PROMO,
        COMMISSION,
        NOTIFY,
        COMPLETED,
        ABORTED,
        ALERTED
    }

    /**
     * How the side effect ended.
     */
    public enum Outcome {
        APPLIED,
        SKIPPED,
        FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "payment_id", nullable = false, length = 128)
    private String paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "step", nullable = false, length = 32)
    private StepType step;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 16)
    private Outcome outcome;

    @Column(name = "detail", length = 2000)
    private String detail;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    /**
     * Creates a step row.
     *
     * @param paymentId payment id
     * @param step      side effect
     * @param outcome   outcome
     * @param detail    free-form detail, truncated to 2000 chars
     * @param now       time
     * @return row
     */
    public static FulfillmentStep of(String paymentId, StepType step, Outcome outcome, String detail, Instant now) {
        FulfillmentStep s = new FulfillmentStep();
        s.paymentId = paymentId;
        s.step = step;
        s.outcome = outcome;
        s.detail = detail != null && detail.length() > 2000 ? detail.substring(0, 2000) : detail;
        s.createdAt = now;
        return s;
    }
}
