package com.github.dimitryivaniuta.keyshop.fulfillment.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxEvent;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.events.NotificationEvent;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link NotificationSink} that writes outbox rows; {@code OutboxDispatcher} publishes them to Kafka.
 *
 * <p>Each message is written in its own transaction, so it survives a rollback of the caller and a failed
 * write never reaches the caller.</p>
 */
@Slf4j
@Component
public class OutboxNotificationSink implements NotificationSink {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public OutboxNotificationSink(
            OutboxEventRepository outboxEventRepository,
            ObjectMapper objectMapper,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.objectMapper = objectMapper;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    @Override
    public void notifyPayer(long ownerId, String message) {
        write(NotificationEvent.Kind.PAYER_MESSAGE, String.valueOf(ownerId), ownerId, null, message);
    }

    @Override
    public void notifyOperators(String message) {
        write(NotificationEvent.Kind.OPERATOR_MESSAGE, OutboxEvent.OPERATORS_KEY, null, null, message);
    }

    @Override
    public void retractMessage(long ownerId, long messageId) {
        write(NotificationEvent.Kind.RETRACT_MESSAGE, String.valueOf(ownerId), ownerId, messageId, null);
    }

    private void write(NotificationEvent.Kind kind, String key, Long ownerId, Long messageId, String text) {
        Instant now = clock.instant();
        NotificationEvent event = new NotificationEvent(
                "1",
                UUID.randomUUID().toString(),
                now,
                kind,
                ownerId,
                messageId,
                text
        );
        try {
            String payload = objectMapper.writeValueAsString(event);
            requiresNew.executeWithoutResult(status ->
                    outboxEventRepository.save(OutboxEvent.newEvent(kind.name(), key, payload, now)));
        } catch (JsonProcessingException | DataAccessException | TransactionException e) {
            log.error("Notification dropped kind={} key={} error={}", kind, key, e.getMessage(), e);
        }
    }
}
