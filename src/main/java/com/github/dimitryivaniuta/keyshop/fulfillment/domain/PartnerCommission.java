package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Commission owed to the operator of a managed sub-instance ("franchise"). Unique per (instance, payment).
 */
@Entity
@Table(
        name = "partner_commissions",
        uniqueConstraints = @UniqueConstraint(name = "uq_partner_commission", columnNames = {"instance_id", "payment_id"})
)
@Getter
@NoArgsConstructor
public class PartnerCommission {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "instance_id", nullable = false)
    private Long instanceId;

    @Column(name = "payment_id", nullable = false, length = 128)
    private String paymentId;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    @Column(name = "amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amount;

    @Column(name = "commission_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal commissionPercent;

    @Column(name = "commission_amount", nullable = false, precision = 12, scale = 2)
    private BigDecimal commissionAmount;

    @Column(name = "payment_method", length = 64)
    private String paymentMethod;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
