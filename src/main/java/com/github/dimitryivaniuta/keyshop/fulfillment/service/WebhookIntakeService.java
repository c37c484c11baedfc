package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.github.dimitryivaniuta.keyshop.fulfillment.notification.NotificationSink;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.WebhookResult;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerificationException;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerifier;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.PaymentVerifierRegistry;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.RawWebhook;
import com.github.dimitryivaniuta.keyshop.fulfillment.verification.VerifiedPayment;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for provider notifications.
 *
 * <p>Only authenticated notifications reach the ledger. The confirmed amount is compared with the intent inside
 * the completion transaction; a notification that does not match is acknowledged but not completed, since
 * redelivery would not fix it.</p>
 */
@Service
public class WebhookIntakeService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIntakeService.class);

    private final PaymentVerifierRegistry verifierRegistry;
    private final PaymentCompletionService completionService;
    private final NotificationSink notificationSink;

    private final Counter mismatchCounter;
    private final Counter rejectedCounter;

    public WebhookIntakeService(
            PaymentVerifierRegistry verifierRegistry,
            PaymentCompletionService completionService,
            NotificationSink notificationSink,
            MeterRegistry meterRegistry
    ) {
        this.verifierRegistry = verifierRegistry;
        this.completionService = completionService;
        this.notificationSink = notificationSink;

        this.mismatchCounter = Counter.builder("keyshop.webhook.mismatch").register(meterRegistry);
        this.rejectedCounter = Counter.builder("keyshop.webhook.rejected").register(meterRegistry);
    }

    /**
     * Verifies and processes one notification.
     *
     * @param webhook raw notification
     * @return result
     * @throws PaymentVerificationException when the provider is unknown or the notification is not authentic
     */
    public WebhookResult handle(RawWebhook webhook) {
        PaymentVerifier verifier = verifierRegistry.find(webhook.provider())
                .orElseThrow(() -> {
                    rejectedCounter.increment();
                    return new PaymentVerificationException("Unknown provider " + webhook.provider());
                });

        VerifiedPayment payment;
        try {
            payment = verifier.verify(webhook);
        } catch (PaymentVerificationException e) {
            rejectedCounter.increment();
            log.warn("Webhook rejected provider={} reason={}", webhook.provider(), e.getMessage());
            throw e;
        }

        String paymentId = payment.internalPaymentId();
        if (!payment.succeeded()) {
            log.info("Webhook ignored, payment not final provider={} paymentId={}", webhook.provider(), paymentId);
            return new WebhookResult(WebhookResult.Outcome.IGNORED, paymentId, null);
        }

        PaymentCompletionService.VerifiedCompletion completion = completionService.completeVerifiedAndFulfill(
                paymentId, webhook.provider(), payment.amount(), payment.currency());
        switch (completion.ledger().outcome()) {
            case COMPLETED:
                return new WebhookResult(WebhookResult.Outcome.FULFILLED, paymentId, completion.report());
            case MISMATCH:
                OrderMetadata pending = completion.ledger().metadata();
                mismatchCounter.increment();
                log.warn("Webhook amount mismatch paymentId={} expected={} {} got={} {}", paymentId,
                        pending.amount(), pending.currency(), payment.amount(), payment.currency());
                notificationSink.notifyOperators("Amount mismatch payment=" + paymentId + " provider=" + webhook.provider()
                        + " expected=" + pending.amount() + " " + pending.currency()
                        + " got=" + payment.amount() + " " + payment.currency());
                return new WebhookResult(WebhookResult.Outcome.MISMATCH, paymentId, null);
            default:
                log.info("Webhook for non-pending payment provider={} paymentId={}", webhook.provider(), paymentId);
                return new WebhookResult(WebhookResult.Outcome.NOT_PENDING, paymentId, null);
        }
    }
}
