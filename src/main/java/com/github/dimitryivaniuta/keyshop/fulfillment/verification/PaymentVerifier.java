package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

/**
 * Authenticates notifications from one payment provider.
 */
public interface PaymentVerifier {

    /**
     * Provider name as used in {@code /webhooks/{provider}}.
     *
     * @return lower-case provider name
     */
    String provider();

    /**
     * Verifies a raw notification.
     *
     * @param webhook raw notification
     * @return verified payment
     * @throws PaymentVerificationException when the notification is not authentic or malformed
     */
    VerifiedPayment verify(RawWebhook webhook);
}
