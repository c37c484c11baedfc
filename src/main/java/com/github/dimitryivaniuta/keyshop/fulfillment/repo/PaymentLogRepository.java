package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PaymentLogEntry;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link PaymentLogEntry}.
 */
public interface PaymentLogRepository extends JpaRepository<PaymentLogEntry, Long> {

    List<PaymentLogEntry> findByPaymentIdOrderById(String paymentId);

    boolean existsByPaymentIdAndKind(String paymentId, PaymentLogEntry.Kind kind);
}
