package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PromoCode;
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
 * Repository for {@link PromoCode} and its usage log.
 */
public interface PromoCodeRepository extends JpaRepository<PromoCode, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from PromoCode p where upper(p.code) = upper(:code)")
    Optional<PromoCode> findForUpdate(@Param("code") String code);

    /**
     * Records one usage per order.
     *
     * @return 1 when recorded, 0 when the order already used a code
     */
    @Modifying
    @Query(value = """
            insert into promo_code_usages (code, owner_id, applied_amount, order_id, used_at)
            values (:code, :ownerId, :appliedAmount, :orderId, :now)
            on conflict (order_id) do nothing
            """, nativeQuery = true)
    int insertUsage(
            @Param("code") String code,
            @Param("ownerId") long ownerId,
            @Param("appliedAmount") BigDecimal appliedAmount,
            @Param("orderId") String orderId,
            @Param("now") Instant now
    );
}
