package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * What a verified provider notification led to.
 *
 * @param outcome   outcome
 * @param paymentId internal payment id
 * @param report    fulfillment report when {@code outcome == FULFILLED}
 */
public record WebhookResult(Outcome outcome, String paymentId, FulfillmentReport report) {

    /**
     * Webhook outcome. All of them are acknowledged to the provider.
     */
    public enum Outcome {
        /** This notification completed the intent and ran fulfillment. */
        FULFILLED,
        /** The intent is unknown or was already paid. */
        NOT_PENDING,
        /** The provider reports a non-final status. */
        IGNORED,
        /** Amount or currency differs from the pending intent. */
        MISMATCH
    }
}
