package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.ProcessedPayment;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Repository for {@link ProcessedPayment}.
 */
public interface ProcessedPaymentRepository extends JpaRepository<ProcessedPayment, String> {

    /**
     * Atomic claim: inserts the id unless it is already present.
     *
     * @return 1 for the first claim ever, 0 otherwise
     */
    @Modifying
    @Query(value = """
            insert into processed_payments (payment_id, claimed_at)
            values (:paymentId, :now)
            on conflict (payment_id) do nothing
            """, nativeQuery = true)
    int insertIfAbsent(@Param("paymentId") String paymentId, @Param("now") Instant now);

    /**
     * Claims older than {@code before} that never reached a terminal step and were not reported yet.
     *
     * @param before cutoff
     * @param limit  max rows
     * @return payment ids
     */
    @Query(value = """
            select p.payment_id
            from processed_payments p
            where p.claimed_at < :before
              and not exists (
                  select 1 from fulfillment_steps s
                  where s.payment_id = p.payment_id
                    and s.step in ('COMPLETED', 'ABORTED', 'ALERTED')
              )
            order by p.claimed_at
            limit :limit
            """, nativeQuery = true)
    List<String> findUnfinishedClaims(@Param("before") Instant before, @Param("limit") int limit);
}
