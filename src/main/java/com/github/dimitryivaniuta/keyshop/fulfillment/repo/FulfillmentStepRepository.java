package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link FulfillmentStep}.
 */
public interface FulfillmentStepRepository extends JpaRepository<FulfillmentStep, Long> {

    List<FulfillmentStep> findByPaymentIdOrderById(String paymentId);
}
