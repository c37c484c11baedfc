package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyshop.fulfillment.AbstractPostgresIntegrationTest;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxEvent;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OutboxStatus;
import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.OutboxEventRepository;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;
import org.springframework.kafka.support.SendResult;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Verifies that queued notifications are published to Kafka and marked SENT only on ack.
 */
class OutboxDispatcherTest extends AbstractPostgresIntegrationTest {

    @Autowired
    OutboxEventRepository repo;

    @Autowired
    OutboxDispatcher dispatcher;

    @Autowired
    NotificationSink notificationSink;

    @Autowired
    ObjectMapper objectMapper;

    @Autowired
    PlatformTransactionManager transactionManager;

    @Test
    void dispatcherMarksSent() throws Exception {
        notificationSink.notifyPayer(42L, "Your key is ready");

        // Kafka send must return an already-completed future (ack success).
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        Assertions.assertEquals(1, dispatcher.publishBatch());

        OutboxEvent updated = repo.findByEventKeyOrderByCreatedAt("42").get(0);
        Assertions.assertEquals(OutboxStatus.SENT, updated.getStatus());

        ArgumentCaptor<String> topic = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> key = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        Mockito.verify(kafkaTemplate).send(topic.capture(), key.capture(), payload.capture());

        Assertions.assertEquals("keyshop-notifications", topic.getValue());
        Assertions.assertEquals("42", key.getValue());
        JsonNode event = objectMapper.readTree(payload.getValue());
        Assertions.assertEquals("PAYER_MESSAGE", event.get("kind").asText());
        Assertions.assertEquals("Your key is ready", event.get("text").asText());
    }

    @Test
    void failedSendIsScheduledForRetry() {
        notificationSink.notifyOperators("Payment fulfilled payment=p1");

        CompletableFuture<SendResult<String, String>> failed = new CompletableFuture<>();
        failed.completeExceptionally(new IllegalStateException("broker down"));
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(failed);

        dispatcher.publishBatch();

        List<OutboxEvent> events = repo.findByEventKeyOrderByCreatedAt("operators");
        Assertions.assertEquals(1, events.size());
        OutboxEvent e = events.get(0);
        Assertions.assertEquals(OutboxStatus.RETRY, e.getStatus());
        Assertions.assertEquals(1, e.getAttemptCount());
        Assertions.assertNotNull(e.getLastError());
        Assertions.assertNotNull(e.getNextAttemptAt());
    }

    @Test
    void rowsHeldByAnotherDispatcherAreSkipped() throws Exception {
        notificationSink.notifyPayer(42L, "first");
        clock.set(T0.plusSeconds(1));
        notificationSink.notifyPayer(43L, "second");
        CompletableFuture<SendResult<String, String>> ok = CompletableFuture.completedFuture(null);
        Mockito.when(kafkaTemplate.send(Mockito.anyString(), Mockito.anyString(), Mockito.anyString())).thenReturn(ok);

        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService other = Executors.newSingleThreadExecutor();
        try {
            Future<List<OutboxEvent>> holding = other.submit(() -> new TransactionTemplate(transactionManager).execute(status -> {
                List<OutboxEvent> locked = repo.lockDueNotifications(EnumSet.of(OutboxStatus.NEW), clock.instant(),
                        PageRequest.of(0, 1));
                held.countDown();
                try {
                    release.await(30, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return locked;
            }));
            Assertions.assertTrue(held.await(10, TimeUnit.SECONDS));

            Assertions.assertEquals(1, dispatcher.publishBatch());
            Mockito.verify(kafkaTemplate).send(Mockito.anyString(), Mockito.eq("43"), Mockito.anyString());
            Mockito.verify(kafkaTemplate, Mockito.never()).send(Mockito.anyString(), Mockito.eq("42"), Mockito.anyString());

            release.countDown();
            Assertions.assertEquals("42", holding.get(10, TimeUnit.SECONDS).get(0).getEventKey());
        } finally {
            release.countDown();
            other.shutdownNow();
        }
        Assertions.assertEquals(OutboxStatus.NEW, repo.findByEventKeyOrderByCreatedAt("42").get(0).getStatus());
    }

    @Test
    void backoffIsCappedAndJittered() {
        Duration base = Duration.ofSeconds(1);
        Duration max = Duration.ofMinutes(2);

        Duration first = OutboxDispatcher.computeBackoff(base, max, 1);
        Duration late = OutboxDispatcher.computeBackoff(base, max, 30);

        Assertions.assertTrue(first.toMillis() >= 1000 && first.toMillis() < 1500);
        Assertions.assertTrue(late.compareTo(max) <= 0);
    }
}
