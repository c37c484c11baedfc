package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentAction;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.LedgerCompletion;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.WebhookResult;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerificationException;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerifier;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerifierRegistry;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.RawWebhook;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.VerifiedPayment;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;

class WebhookIntakeServiceTest {

    private final PaymentVerifierRegistry registry = Mockito.mock(PaymentVerifierRegistry.class);
    private final PaymentVerifier verifier = Mockito.mock(PaymentVerifier.class);
    private final PaymentCompletionService completion = Mockito.mock(PaymentCompletionService.class);
    private final NotificationSink sink = Mockito.mock(NotificationSink.class);

    private WebhookIntakeService service;
    private final RawWebhook webhook = new RawWebhook("yookassa", Map.of(), "{}");

    @BeforeEach
    void setUp() {
        service = new WebhookIntakeService(registry, completion, sink, new SimpleMeterRegistry());
        Mockito.when(registry.find("yookassa")).thenReturn(Optional.of(verifier));
    }

    @Test
    void unknownProviderIsRejected() {
        Mockito.when(registry.find("acme")).thenReturn(Optional.empty());

        Assertions.assertThrows(PaymentVerificationException.class,
                () -> service.handle(new RawWebhook("acme", Map.of(), "{}")));
        Mockito.verifyNoInteractions(completion);
    }

    @Test
    void forgedNotificationNeverTouchesLedger() {
        Mockito.when(verifier.verify(any())).thenThrow(new PaymentVerificationException("Signature mismatch"));

        Assertions.assertThrows(PaymentVerificationException.class, () -> service.handle(webhook));
        Mockito.verifyNoInteractions(completion);
    }

    @Test
    void matchingNotificationCompletesAndFulfills() {
        Mockito.when(verifier.verify(webhook)).thenReturn(paid(new BigDecimal("300.00"), "rub"));
        FulfillmentReport report = new FulfillmentReport("ord-1", FulfillmentReport.Status.FULFILLED, 5L, null, List.of());
        Mockito.when(completion.completeVerifiedAndFulfill("ord-1", "yookassa", new BigDecimal("300.00"), "rub"))
                .thenReturn(new PaymentCompletionService.VerifiedCompletion(LedgerCompletion.completed(order()), report));

        WebhookResult result = service.handle(webhook);

        Assertions.assertEquals(WebhookResult.Outcome.FULFILLED, result.outcome());
        Assertions.assertSame(report, result.report());
    }

    @Test
    void amountMismatchIsAcknowledgedButNotFulfilled() {
        Mockito.when(verifier.verify(webhook)).thenReturn(paid(new BigDecimal("3.00"), "RUB"));
        Mockito.when(completion.completeVerifiedAndFulfill(anyString(), anyString(), any(), anyString()))
                .thenReturn(new PaymentCompletionService.VerifiedCompletion(LedgerCompletion.mismatch(order()), null));

        WebhookResult result = service.handle(webhook);

        Assertions.assertEquals(WebhookResult.Outcome.MISMATCH, result.outcome());
        Assertions.assertNull(result.report());
        Mockito.verify(sink).notifyOperators(Mockito.contains("expected=300 RUB got=3.00 RUB"));
    }

    @Test
    void redeliveryAfterCompletionIsNotPending() {
        Mockito.when(verifier.verify(webhook)).thenReturn(paid(new BigDecimal("300"), "RUB"));
        Mockito.when(completion.completeVerifiedAndFulfill(anyString(), anyString(), any(), anyString()))
                .thenReturn(new PaymentCompletionService.VerifiedCompletion(LedgerCompletion.notPending(), null));

        WebhookResult result = service.handle(webhook);

        Assertions.assertEquals(WebhookResult.Outcome.NOT_PENDING, result.outcome());
        Mockito.verifyNoInteractions(sink);
    }

    @Test
    void amountsCompareByValueAndCurrencyIgnoresCase() {
        Assertions.assertTrue(LedgerCompletion.matches(order(), new BigDecimal("300.00"), "rub"));
        Assertions.assertTrue(LedgerCompletion.matches(order(), null, null));
        Assertions.assertFalse(LedgerCompletion.matches(order(), new BigDecimal("300.01"), "RUB"));
        Assertions.assertFalse(LedgerCompletion.matches(order(), new BigDecimal("300"), "USD"));
    }

    @Test
    void nonFinalStatusIsIgnored() {
        Mockito.when(verifier.verify(webhook))
                .thenReturn(new VerifiedPayment("yk-1", new BigDecimal("300"), "RUB", "ord-1", false));

        Assertions.assertEquals(WebhookResult.Outcome.IGNORED, service.handle(webhook).outcome());
        Mockito.verifyNoInteractions(completion);
    }

    private static VerifiedPayment paid(BigDecimal amount, String currency) {
        return new VerifiedPayment("yk-1", amount, currency, "ord-1", true);
    }

    private static OrderMetadata order() {
        return new OrderMetadata("ord-1", 7L, FulfillmentAction.NEW, new BigDecimal("300"), "RUB", null, null,
                "nl-1", null, 30, null, null, null, null, null);
    }
}
