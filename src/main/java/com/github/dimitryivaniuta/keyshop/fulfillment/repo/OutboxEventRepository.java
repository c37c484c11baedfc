package com.github.dimitryivaniuta.keyshop.fulfillment.repo;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxEvent;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

/**
 * Notification outbox. Rows are written in the transaction of the step that produced them and only ever
 * change status afterwards.
 */
public interface OutboxEventRepository extends JpaRepository<OutboxEvent, String> {

    /**
     * Oldest notifications whose next attempt is due, row-locked for the caller's transaction.
     *
     * <p>A lock timeout of {@code -2} is Hibernate's SKIP LOCKED: rows another dispatcher already holds are
     * left out instead of waited for.</p>
     *
     * @param statuses statuses still to be sent
     * @param now      current time
     * @param batch    batch size, as the page size of the first page
     * @return locked notifications, oldest first
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            select e from OutboxEvent e
            where e.status in :statuses
              and (e.nextAttemptAt is null or e.nextAttemptAt <= :now)
            order by e.createdAt
            """)
    List<OutboxEvent> lockDueNotifications(
            @Param("statuses") Collection<OutboxStatus> statuses,
            @Param("now") Instant now,
            Pageable batch
    );

    List<OutboxEvent> findByEventKeyOrderByCreatedAt(String eventKey);
}
