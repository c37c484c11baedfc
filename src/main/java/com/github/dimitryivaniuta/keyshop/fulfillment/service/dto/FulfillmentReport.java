package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

import java.util.List;

/**
 * Aggregated result of a fulfillment run.
 *
 * @param paymentId    payment id
 * @param status       overall status
 * @param credentialId credential issued or extended, if any
 * @param errorCode    short provisioning error code when {@code status == FAILED}
 * @param steps        per side-effect outcomes, in execution order
 */
public record FulfillmentReport(
        String paymentId,
        Status status,
        Long credentialId,
        String errorCode,
        List<StepOutcome> steps
) {

    /**
     * Overall run status.
     */
    public enum Status {
        /** All mandatory steps ran; optional steps may still have failed (see {@link #steps()}). */
        FULFILLED,
        /** Gift paid; waiting for a recipient. */
        AWAITING_RECIPIENT,
        /** Provisioning failed; payer refunded or notified. */
        FAILED,
        /** Another caller already claimed this payment. */
        DUPLICATE
    }

    public static FulfillmentReport duplicate(String paymentId) {
        return new FulfillmentReport(paymentId, Status.DUPLICATE, null, null, List.of());
    }

    public boolean hasFailedSteps() {
        return steps.stream().anyMatch(StepOutcome::isFailed);
    }
}
