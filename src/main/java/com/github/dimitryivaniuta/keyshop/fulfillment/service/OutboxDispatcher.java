package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.config.AppProperties;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxEvent;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes notification outbox rows to Kafka.
 *
 * <ul>
 *   <li>{@code FOR UPDATE SKIP LOCKED}: several instances may publish side by side without double-sending.</li>
 *   <li>An event is SENT only after Kafka acknowledged it within {@code sendTimeout}.</li>
 *   <li>Failures back off exponentially with jitter; after {@code maxAttempts} the event is DEAD.</li>
 * </ul>
 */
@Component
public class OutboxDispatcher {

    private static final Logger log = LoggerFactory.getLogger(OutboxDispatcher.class);

    private final OutboxEventRepository outboxEventRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final AppProperties properties;
    private final Clock clock;

    private final Counter sentCounter;
    private final Counter retryCounter;
    private final Counter deadCounter;
    private final Counter operatorDeadCounter;

    public OutboxDispatcher(
            OutboxEventRepository outboxEventRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            AppProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.outboxEventRepository = outboxEventRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.clock = clock;

        this.sentCounter = Counter.builder("keyshop.outbox.sent").register(meterRegistry);
        this.retryCounter = Counter.builder("keyshop.outbox.retry").register(meterRegistry);
        this.deadCounter = Counter.builder("keyshop.outbox.dead").register(meterRegistry);
        this.operatorDeadCounter = Counter.builder("keyshop.outbox.dead.operators").register(meterRegistry);
    }

    /**
     * Publishes the next batch of due notifications.
     *
     * @return number of events attempted
     */
    @Scheduled(fixedDelayString = "${app.outbox.publish-interval-ms:1000}")
    @Transactional
    public int publishBatch() {
        AppProperties.Outbox outbox = properties.getOutbox();

        List<OutboxEvent> batch = outboxEventRepository.lockDueNotifications(
                EnumSet.of(OutboxStatus.NEW, OutboxStatus.RETRY),
                clock.instant(),
                PageRequest.of(0, Math.max(1, outbox.getBatchSize()))
        );
        if (batch.isEmpty()) {
            return 0;
        }

        int sent = 0;
        int retry = 0;
        int dead = 0;

        for (OutboxEvent e : batch) {
            try {
                kafkaTemplate.send(outbox.getNotificationsTopic(), e.getEventKey(), e.getPayload())
                        .get(outbox.getSendTimeout().toMillis(), TimeUnit.MILLISECONDS);
                e.markSent(clock.instant());
                outboxEventRepository.save(e);
                sent++;
                sentCounter.increment();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                markFailed(e, ex, outbox);
                retry++;
                break;
            } catch (ExecutionException | TimeoutException | KafkaException ex) {
                if (markFailed(e, ex, outbox)) {
                    dead++;
                } else {
                    retry++;
                }
            }
        }

        log.info("Outbox publish batch done. sent={} retry={} dead={} topic={}", sent, retry, dead, outbox.getNotificationsTopic());
        return batch.size();
    }

    /**
     * @return true when the event went DEAD
     */
    private boolean markFailed(OutboxEvent e, Exception ex, AppProperties.Outbox outbox) {
        String err = safeError(ex);
        if (e.getAttemptCount() + 1 >= outbox.getMaxAttempts()) {
            e.markDead(err, clock.instant());
            deadCounter.increment();
            if (e.isOperatorMessage()) {
                operatorDeadCounter.increment();
            }
            log.error("Outbox event {} moved to DEAD after {} attempts. type={} error={}",
                    e.getId(), e.getAttemptCount(), e.getEventType(), err);
            outboxEventRepository.save(e);
            return true;
        }
        Duration backoff = computeBackoff(outbox.getBaseBackoff(), outbox.getMaxBackoff(), e.getAttemptCount() + 1);
        e.markRetry(err, clock.instant(), backoff);
        retryCounter.increment();
        log.warn("Outbox event {} failed. attempt={} nextAttemptAt={} error={}",
                e.getId(), e.getAttemptCount(), e.getNextAttemptAt(), err);
        outboxEventRepository.save(e);
        return false;
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at {@code max}, with jitter in [0.5, 1.5).
     */
    static Duration computeBackoff(Duration base, Duration max, int attempt) {
        double exp = Math.pow(2.0, Math.max(0, attempt - 1));
        long candidateMs = (long) (base.toMillis() * exp);
        long capped = Math.min(candidateMs, max.toMillis());

        double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
        long withJitter = (long) (capped * jitter);

        return Duration.ofMillis(Math.max(base.toMillis(), Math.min(withJitter, max.toMillis())));
    }

    private static String safeError(Exception ex) {
        Throwable root = ex instanceof ExecutionException && ex.getCause() != null ? ex.getCause() : ex;
        String msg = root.getMessage();
        if (msg == null) {
            msg = root.getClass().getSimpleName();
        }
        if (msg.length() > 2000) {
            msg = msg.substring(0, 2000);
        }
        return msg;
    }
}
