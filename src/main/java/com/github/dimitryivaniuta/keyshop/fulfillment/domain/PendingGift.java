package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A paid gift waiting for the payer to name a recipient.
 *
 * <p>Survives restarts, so a gift paid while the bot was down can still be delivered later.</p>
 */
@Entity
@Table(name = "pending_gifts")
@Getter
@NoArgsConstructor
public class PendingGift {

    @Id
    @Column(name = "payment_id", nullable = false, updatable = false, length = 128)
    private String paymentId;

    @Column(name = "payer_id", nullable = false)
    private Long payerId;

    @Column(name = "host_name", nullable = false, length = 128)
    private String hostName;

    @Column(name = "plan_id")
    private Long planId;

    @Column(name = "plan_name", length = 128)
    private String planName;

    @Column(name = "days", nullable = false)
    private int days;

    @Column(name = "payment_method", length = 64)
    private String paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PendingGiftStatus status;

    @Column(name = "credential_id")
    private Long credentialId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Creates a gift awaiting its recipient.
     *
     * @param paymentId     payment that bought the gift
     * @param payerId       payer
     * @param hostName      host to provision on
     * @param planId        plan id, if any
     * @param planName      plan name at purchase time
     * @param days          days to grant
     * @param paymentMethod payment method
     * @param now           time
     * @return new gift
     */
    public static PendingGift awaiting(String paymentId, Long payerId, String hostName, Long planId, String planName,
                                       int days, String paymentMethod, Instant now) {
        PendingGift g = new PendingGift();
        g.paymentId = paymentId;
        g.payerId = payerId;
        g.hostName = hostName;
        g.planId = planId;
        g.planName = planName;
        g.days = days;
        g.paymentMethod = paymentMethod;
        g.status = PendingGiftStatus.AWAITING_RECIPIENT;
        g.createdAt = now;
        g.updatedAt = now;
        return g;
    }

    public void markDelivered(Long credentialId, Instant now) {
        this.status = PendingGiftStatus.DELIVERED;
        this.credentialId = credentialId;
        this.updatedAt = now;
    }
}
