package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingGift;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingGiftStatus;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link PendingGift}.
 */
public interface PendingGiftRepository extends JpaRepository<PendingGift, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select g from PendingGift g where g.paymentId = :paymentId")
    Optional<PendingGift> findForUpdate(@Param("paymentId") String paymentId);

    List<PendingGift> findByPayerIdAndStatusOrderByCreatedAt(Long payerId, PendingGiftStatus status);
}
