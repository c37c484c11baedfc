package com.github.dimitryivaniuta.keyshop.fulfillment.service.events;

import java.time.Instant;

/**
 * Message for the chat-bot front end.
 *
 * <p>Stored in the outbox and later published to Kafka.</p>
 */
public record NotificationEvent(
        String schemaVersion,
        String eventId,
        Instant occurredAt,
        Kind kind,
        Long ownerId,
        Long messageId,
        String text
) {

    /**
     * What the front end should do with the event.
     */
    public enum Kind {
        PAYER_MESSAGE,
        OPERATOR_MESSAGE,
        RETRACT_MESSAGE
    }
}
