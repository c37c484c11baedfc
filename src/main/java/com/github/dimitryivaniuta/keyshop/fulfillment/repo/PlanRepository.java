package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Plan;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Repository for {@link Plan}.
 */
public interface PlanRepository extends JpaRepository<Plan, Long> {
}
