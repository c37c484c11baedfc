package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

import java.math.BigDecimal;

/**
 * Notification whose authenticity has been proven.
 *
 * @param providerPaymentId provider's own payment id
 * @param amount            paid amount
 * @param currency          currency
 * @param internalPaymentId our payment id, echoed back by the provider
 * @param succeeded         whether the provider reports the payment as captured
 */
public record VerifiedPayment(
        String providerPaymentId,
        BigDecimal amount,
        String currency,
        String internalPaymentId,
        boolean succeeded
) {
}
