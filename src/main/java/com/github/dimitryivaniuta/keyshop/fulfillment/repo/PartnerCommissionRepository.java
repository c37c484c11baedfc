package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PartnerCommission;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link PartnerCommission}.
 */
public interface PartnerCommissionRepository extends JpaRepository<PartnerCommission, Long> {

    /**
     * Accrues a commission once per (instance, payment).
     *
     * @return 1 when accrued, 0 when the pair already exists
     */
    @Modifying
    @Query(value = """
            insert into partner_commissions
                (instance_id, payment_id, owner_id, amount, commission_percent, commission_amount, payment_method, created_at)
            values (:instanceId, :paymentId, :ownerId, :amount, :percent, :commission, :paymentMethod, :now)
            on conflict (instance_id, payment_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("instanceId") long instanceId,
            @Param("paymentId") String paymentId,
            @Param("ownerId") long ownerId,
            @Param("amount") BigDecimal amount,
            @Param("percent") BigDecimal percent,
            @Param("commission") BigDecimal commission,
            @Param("paymentMethod") String paymentMethod,
            @Param("now") Instant now
    );

    List<PartnerCommission> findByInstanceIdAndPaymentId(Long instanceId, String paymentId);
}
