package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyshop.fulfillment.AbstractPostgresIntegrationTest;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.Credential;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.CredentialOrigin;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.FulfillmentStep.StepType;
import com.github.dimitryivaniuta.keyshop.fulfillment.domain.OriginSource;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisionedCredential;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningException;
import com.github.dimitryivaniuta.keyshop.fulfillment.provisioning.ProvisioningRequest;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.AccountRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.CredentialRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.FulfillmentStepRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.OutboxEventRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.repo.PartnerCommissionRepository;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentAction;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.GiftDelivery;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.WebhookResult;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.HmacPaymentVerifier;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.RawWebhook;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;

import static org.mockito.ArgumentMatchers.any;

/**
 * End-to-end: signed webhook, ledger completion, guard, orchestrator side effects and outbox, with only the
 * panel and Kafka mocked.
 */
class FulfillmentFlowTest extends AbstractPostgresIntegrationTest {

    @Autowired
    PendingLedgerService ledger;

    @Autowired
    WebhookIntakeService webhookIntake;

    @Autowired
    FulfillmentOrchestrator orchestrator;

    @Autowired
    BalancePaymentService balancePayments;

    @Autowired
    GiftService giftService;

    @Autowired
    CredentialRepository credentialRepository;

    @Autowired
    AccountRepository accountRepository;

    @Autowired
    PartnerCommissionRepository commissionRepository;

    @Autowired
    FulfillmentStepRepository stepRepository;

    @Autowired
    OutboxEventRepository outboxRepository;

    @Autowired
    ObjectMapper objectMapper;

    @BeforeEach
    void seedAccounts() {
        jdbc.update("insert into accounts (owner_id, balance, referrer_id, referral_balance, total_spent, updated_at) "
                + "values (7, 0, null, 0, 0, now()), (42, 0, 7, 0, 0, now())");
    }

    @Test
    void signedWebhookFulfillsOnceWithAllSideEffects() throws Exception {
        panelIssues("u42-abc");
        OrderMetadata order = new OrderMetadata(null, 42L, FulfillmentAction.NEW, new BigDecimal("300.00"), "RUB",
                null, null, "nl-1", null, 30, null, null, null, 3L, null);
        Assertions.assertTrue(ledger.createOrRefreshIntent("w1", 42L, new BigDecimal("300.00"), "RUB", order));

        RawWebhook webhook = signed("w1", "300.00");
        WebhookResult first = webhookIntake.handle(webhook);
        WebhookResult redelivered = webhookIntake.handle(webhook);

        Assertions.assertEquals(WebhookResult.Outcome.FULFILLED, first.outcome());
        Assertions.assertEquals(FulfillmentReport.Status.FULFILLED, first.report().status());
        Assertions.assertEquals(WebhookResult.Outcome.NOT_PENDING, redelivered.outcome());
        Mockito.verify(provisioningClient, Mockito.times(1)).createOrExtend(any());

        Assertions.assertEquals(1, credentialRepository.findByOwnerIdOrderById(42L).size());
        Assertions.assertEquals(0, new BigDecimal("30.00")
                .compareTo(accountRepository.findById(7L).orElseThrow().getReferralBalance()));
        Assertions.assertEquals(0, new BigDecimal("300.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getTotalSpent()));
        Assertions.assertEquals(1, commissionRepository.findByInstanceIdAndPaymentId(3L, "w1").size());
        Assertions.assertFalse(outboxRepository.findByEventKeyOrderByCreatedAt("42").isEmpty());

        List<FulfillmentStep> steps = stepRepository.findByPaymentIdOrderById("w1");
        Assertions.assertEquals(StepType.COMPLETED, steps.get(steps.size() - 1).getStep());
    }

    @Test
    void mismatchedAmountLeavesIntentPending() {
        OrderMetadata order = new OrderMetadata(null, 42L, FulfillmentAction.TOP_UP, new BigDecimal("300.00"), "RUB",
                null, null, null, null, null, null, null, null, null, null);
        ledger.createOrRefreshIntent("w2", 42L, new BigDecimal("300.00"), "RUB", order);

        WebhookResult result = webhookIntake.handle(signed("w2", "3.00"));

        Assertions.assertEquals(WebhookResult.Outcome.MISMATCH, result.outcome());
        Assertions.assertTrue(ledger.peekMetadata("w2").isPresent());
    }

    @Test
    void webhookForOldAmountCannotCompleteRefreshedIntent() throws Exception {
        panelIssues("u42-old");
        OrderMetadata cheap = new OrderMetadata(null, 42L, FulfillmentAction.NEW, new BigDecimal("100.00"), "RUB",
                null, null, "nl-1", null, 30, null, null, null, null, null);
        OrderMetadata expensive = new OrderMetadata(null, 42L, FulfillmentAction.NEW, new BigDecimal("5000.00"), "RUB",
                null, null, "nl-1", null, 365, null, null, null, null, null);
        ledger.createOrRefreshIntent("w3", 42L, new BigDecimal("100.00"), "RUB", cheap);
        ledger.createOrRefreshIntent("w3", 42L, new BigDecimal("5000.00"), "RUB", expensive);

        WebhookResult result = webhookIntake.handle(signed("w3", "100.00"));

        Assertions.assertEquals(WebhookResult.Outcome.MISMATCH, result.outcome());
        Assertions.assertEquals(0, new BigDecimal("5000")
                .compareTo(ledger.peekMetadata("w3").orElseThrow().amount()));
        Mockito.verify(provisioningClient, Mockito.never()).createOrExtend(any());
        Assertions.assertTrue(credentialRepository.findByOwnerIdOrderById(42L).isEmpty());
    }

    @Test
    void provisioningTimeoutRefundsAndRetryIsSilentNoOp() throws Exception {
        Mockito.when(provisioningClient.createOrExtend(any()))
                .thenThrow(ProvisioningException.timedOut("read timed out", null));
        OrderMetadata order = new OrderMetadata("p2", 42L, FulfillmentAction.NEW, new BigDecimal("300.00"), "RUB",
                "yookassa", null, "nl-1", null, 30, null, null, null, null, null);

        FulfillmentReport report = orchestrator.runFulfillment(order);
        FulfillmentReport retried = orchestrator.runFulfillment(order);

        Assertions.assertEquals(FulfillmentReport.Status.FAILED, report.status());
        Assertions.assertEquals("TIMEOUT", report.errorCode());
        Assertions.assertEquals(FulfillmentReport.Status.DUPLICATE, retried.status());
        Assertions.assertTrue(credentialRepository.findByOwnerIdOrderById(42L).isEmpty());
        Assertions.assertEquals(0, new BigDecimal("300.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getBalance()));
        Mockito.verify(provisioningClient, Mockito.times(1)).createOrExtend(any());

        List<FulfillmentStep> steps = stepRepository.findByPaymentIdOrderById("p2");
        Assertions.assertEquals(StepType.ABORTED, steps.get(steps.size() - 1).getStep());
    }

    @Test
    void balancePaymentDebitsOnce() throws Exception {
        panelIssues("u42-bal");
        jdbc.update("update accounts set balance = 500 where owner_id = 42");
        OrderMetadata order = new OrderMetadata("b1", 42L, FulfillmentAction.NEW, new BigDecimal("200.00"), "RUB",
                null, null, "nl-1", 1, null, null, null, null, 3L, null);

        FulfillmentReport first = balancePayments.pay(order);
        FulfillmentReport second = balancePayments.pay(order);

        Assertions.assertEquals(FulfillmentReport.Status.FULFILLED, first.status());
        Assertions.assertEquals(FulfillmentReport.Status.DUPLICATE, second.status());
        Assertions.assertEquals(0, new BigDecimal("300.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getBalance()));
        Assertions.assertEquals(0, new BigDecimal("0.00")
                .compareTo(accountRepository.findById(7L).orElseThrow().getReferralBalance()));
        Assertions.assertTrue(commissionRepository.findByInstanceIdAndPaymentId(3L, "b1").isEmpty());

        OrderMetadata tooExpensive = new OrderMetadata("b2", 42L, FulfillmentAction.NEW, new BigDecimal("1000.00"),
                "RUB", null, null, "nl-1", 1, null, null, null, null, null, null);
        Assertions.assertThrows(InsufficientBalanceException.class, () -> balancePayments.pay(tooExpensive));
        Assertions.assertEquals(0, new BigDecimal("300.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getBalance()));
    }

    @Test
    void giftWaitsForRecipientThenDeliversOnce() throws Exception {
        panelIssues("friend");
        OrderMetadata gift = new OrderMetadata("g1", 42L, FulfillmentAction.GIFT, new BigDecimal("300.00"), "RUB",
                "yookassa", null, "nl-1", null, 30, null, null, null, null, null);

        FulfillmentReport report = orchestrator.runFulfillment(gift);
        Assertions.assertEquals(FulfillmentReport.Status.AWAITING_RECIPIENT, report.status());
        Assertions.assertEquals(1, giftService.awaitingFor(42L).size());

        clock.advance(Duration.ofMinutes(10));
        GiftDelivery delivered = giftService.deliver("g1", "Friend");
        GiftDelivery again = giftService.deliver("g1", "someone-else");

        Assertions.assertEquals(GiftDelivery.Status.DELIVERED, delivered.status());
        Assertions.assertEquals(GiftDelivery.Status.ALREADY_DELIVERED, again.status());
        Assertions.assertEquals(delivered.credentialId(), again.credentialId());
        Assertions.assertTrue(giftService.awaitingFor(42L).isEmpty());
        Assertions.assertEquals(GiftDelivery.Status.NOT_FOUND, giftService.deliver("nope", "x").status());
    }

    @Test
    void concurrentRunsOfOnePaymentApplyEverySideEffectOnce() throws Exception {
        panelIssues("u42-race");
        OrderMetadata order = new OrderMetadata("r1", 42L, FulfillmentAction.NEW, new BigDecimal("300.00"), "RUB",
                "yookassa", null, "nl-1", null, 30, null, null, null, 3L, null);
        OrderMetadata topUp = new OrderMetadata("r2", 42L, FulfillmentAction.TOP_UP, new BigDecimal("150.00"), "RUB",
                "yookassa", null, null, null, null, null, null, null, null, null);

        List<FulfillmentReport> reports = race(8, () -> orchestrator.runFulfillment(order));
        List<FulfillmentReport> topUps = race(8, () -> orchestrator.runFulfillment(topUp));

        Assertions.assertEquals(1, reports.stream().filter(r -> r.status() == FulfillmentReport.Status.FULFILLED).count());
        Assertions.assertEquals(7, reports.stream().filter(r -> r.status() == FulfillmentReport.Status.DUPLICATE).count());
        Assertions.assertEquals(1, topUps.stream().filter(r -> r.status() == FulfillmentReport.Status.FULFILLED).count());
        Mockito.verify(provisioningClient, Mockito.times(1)).createOrExtend(any());

        Assertions.assertEquals(1, credentialRepository.findByOwnerIdOrderById(42L).size());
        Assertions.assertEquals(1, commissionRepository.findByInstanceIdAndPaymentId(3L, "r1").size());
        Assertions.assertEquals(0, new BigDecimal("150.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getBalance()));
        Assertions.assertEquals(0, new BigDecimal("45.00")
                .compareTo(accountRepository.findById(7L).orElseThrow().getReferralBalance()));
        Assertions.assertEquals(0, new BigDecimal("300.00")
                .compareTo(accountRepository.findById(42L).orElseThrow().getTotalSpent()));
    }

    @Test
    void extensionCountsFromNowForLapsedKeyAndClearsMissingMark() throws Exception {
        Credential lapsed = credentialRepository.save(Credential.provisioned(42L, "nl-1", "uuid-x", "u42-ext",
                T0.minus(Duration.ofDays(5)), CredentialOrigin.of(OriginSource.PURCHASE, null, "Month", 30),
                T0.minus(Duration.ofDays(35))));
        jdbc.update("update credentials set missing_since = ? where id = ?",
                Timestamp.from(T0.minus(Duration.ofHours(2))), lapsed.getId());
        Mockito.when(provisioningClient.createOrExtend(any())).thenAnswer(inv -> {
            ProvisioningRequest req = inv.getArgument(0, ProvisioningRequest.class);
            // written while the panel call is in flight; must survive the local update
            jdbc.update("update credentials set device_limit = 5 where id = ?", lapsed.getId());
            return new ProvisionedCredential(req.host(), req.identity(), req.remoteUuid(), req.expiresAt(), null);
        });
        OrderMetadata order = new OrderMetadata("e1", 42L, FulfillmentAction.EXTEND, new BigDecimal("300.00"), "RUB",
                "yookassa", null, null, null, 30, lapsed.getId(), null, null, null, null);

        FulfillmentReport report = orchestrator.runFulfillment(order);

        Assertions.assertEquals(FulfillmentReport.Status.FULFILLED, report.status());
        Assertions.assertEquals(lapsed.getId(), report.credentialId());
        ArgumentCaptor<ProvisioningRequest> sent = ArgumentCaptor.forClass(ProvisioningRequest.class);
        Mockito.verify(provisioningClient).createOrExtend(sent.capture());
        Assertions.assertEquals("uuid-x", sent.getValue().remoteUuid());
        Assertions.assertEquals(T0.plus(Duration.ofDays(30)), sent.getValue().expiresAt());

        Credential stored = credentialRepository.findById(lapsed.getId()).orElseThrow();
        Assertions.assertEquals(T0.plus(Duration.ofDays(30)), stored.getExpiresAt());
        Assertions.assertNull(stored.getMissingSince());
        Assertions.assertEquals(5, stored.getDeviceLimit());
        Assertions.assertEquals(OriginSource.EXTEND, stored.getOrigin().getSource());
        Assertions.assertEquals(1, credentialRepository.findByOwnerIdOrderById(42L).size());
    }

    @Test
    void extensionOfLiveKeyCountsFromItsExpiry() throws Exception {
        Credential live = credentialRepository.save(Credential.provisioned(42L, "nl-1", "uuid-y", "u42-live",
                T0.plus(Duration.ofDays(10)), CredentialOrigin.of(OriginSource.PURCHASE, null, "Month", 30), T0));
        Mockito.when(provisioningClient.createOrExtend(any())).thenAnswer(inv -> {
            ProvisioningRequest req = inv.getArgument(0, ProvisioningRequest.class);
            return new ProvisionedCredential(req.host(), req.identity(), req.remoteUuid(), req.expiresAt(), null);
        });
        OrderMetadata order = new OrderMetadata("e2", 42L, FulfillmentAction.EXTEND, new BigDecimal("300.00"), "RUB",
                "yookassa", null, null, null, 30, live.getId(), null, null, null, null);

        Assertions.assertEquals(FulfillmentReport.Status.FULFILLED, orchestrator.runFulfillment(order).status());

        Assertions.assertEquals(T0.plus(Duration.ofDays(40)),
                credentialRepository.findById(live.getId()).orElseThrow().getExpiresAt());
    }

    private List<FulfillmentReport> race(int threads, Callable<FulfillmentReport> run) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<FulfillmentReport>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return run.call();
                }));
            }
            start.countDown();
            List<FulfillmentReport> reports = new ArrayList<>();
            for (Future<FulfillmentReport> f : futures) {
                reports.add(f.get(60, TimeUnit.SECONDS));
            }
            return reports;
        } finally {
            pool.shutdownNow();
        }
    }

    private void panelIssues(String identity) throws ProvisioningException {
        Mockito.when(provisioningClient.createOrExtend(any())).thenAnswer(inv -> {
            ProvisioningRequest req = inv.getArgument(0, ProvisioningRequest.class);
            return new ProvisionedCredential(req.host(), identity, "uuid-" + identity, req.expiresAt(), "vless://" + identity);
        });
    }

    private RawWebhook signed(String paymentId, String amount) {
        String body = "{\"id\":\"yk-" + paymentId + "\",\"status\":\"succeeded\",\"amount\":\"" + amount
                + "\",\"currency\":\"RUB\",\"metadata\":{\"payment_id\":\"" + paymentId + "\"}}";
        String signature = new HmacPaymentVerifier("yookassa", WEBHOOK_SECRET, "X-Signature", objectMapper).signHex(body);
        return new RawWebhook("yookassa", Map.of("X-Signature", signature), body);
    }
}
