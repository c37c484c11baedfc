package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Notification waiting to be published to the chat-bot front end.
 *
 * <p>Fulfillment only writes rows here; {@code OutboxDispatcher} publishes them to Kafka with retries, so a
 * broker outage never blocks or fails a fulfillment run.</p>
 */
@Entity
@Table(
        name = "outbox_events",
        indexes = @Index(name = "idx_outbox_status_next_created", columnList = "status,next_attempt_at,created_at")
)
@Getter
@NoArgsConstructor
public class OutboxEvent {

    /**
     * Partition key of messages addressed to operators rather than one payer.
     */
    public static final String OPERATORS_KEY = "operators";

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "event_type", nullable = false, length = 64)
    private String eventType;

    /**
     * Kafka key: the owner id for payer messages, {@code operators} otherwise.
     */
    @Column(name = "event_key", nullable = false, length = 128)
    private String eventKey;

    @Column(name = "payload", nullable = false, columnDefinition = "text")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private OutboxStatus status;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", columnDefinition = "text")
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    /**
     * Creates a notification row ready to publish.
     *
     * @param eventType notification kind
     * @param eventKey  partition key
     * @param payload   JSON payload
     * @param now       creation time
     * @return event in status NEW
     */
    public static OutboxEvent newEvent(String eventType, String eventKey, String payload, Instant now) {
        OutboxEvent e = new OutboxEvent();
        e.id = UUID.randomUUID().toString();
        e.eventType = eventType;
        e.eventKey = eventKey;
        e.payload = payload;
        e.status = OutboxStatus.NEW;
        e.createdAt = now;
        e.updatedAt = now;
        return e;
    }

    public boolean isOperatorMessage() {
        return OPERATORS_KEY.equals(eventKey);
    }

    public void markSent(Instant now) {
        status = OutboxStatus.SENT;
        sentAt = now;
        updatedAt = now;
        nextAttemptAt = null;
        lastError = null;
    }

    /**
     * Counts a failed attempt and schedules the next one.
     *
     * @param error   broker error, already truncated
     * @param now     time of the failed attempt
     * @param backoff delay before the next attempt
     */
    public void markRetry(String error, Instant now, Duration backoff) {
        status = OutboxStatus.RETRY;
        attemptCount++;
        lastError = error;
        nextAttemptAt = now.plus(backoff);
        updatedAt = now;
    }

    /**
     * Gives up on the notification; it stays in the table for operators to inspect.
     */
    public void markDead(String error, Instant now) {
        status = OutboxStatus.DEAD;
        attemptCount++;
        lastError = error;
        nextAttemptAt = null;
        updatedAt = now;
    }
}
