package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

/**
 * Notification delivery status. Stored as VARCHAR; values are enforced in code.
 */
public enum OutboxStatus {
    /** Newly written by fulfillment, never attempted. */
    NEW,
    /** Failed before; retried after {@code nextAttemptAt}. */
    RETRY,
    /** Acknowledged by Kafka. */
    SENT,
    /** Gave up after max attempts. */
    DEAD
}
