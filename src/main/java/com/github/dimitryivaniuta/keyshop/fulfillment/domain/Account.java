package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Stored balance and referral bookkeeping of a payer.
 *
 * <p>Money columns are only changed through the conditional updates in {@code AccountRepository}.</p>
 */
@Entity
@Table(name = "accounts")
@Getter
@NoArgsConstructor
public class Account {

    @Id
    @Column(name = "owner_id", nullable = false, updatable = false)
    private Long ownerId;

    @Column(name = "balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal balance;

    @Column(name = "referrer_id")
    private Long referrerId;

    @Column(name = "referral_balance", nullable = false, precision = 12, scale = 2)
    private BigDecimal referralBalance;

    @Column(name = "total_spent", nullable = false, precision = 12, scale = 2)
    private BigDecimal totalSpent;

    /**
     * Set once the owner has claimed the free trial.
     */
    @Column(name = "trial_used", nullable = false)
    private boolean trialUsed;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
