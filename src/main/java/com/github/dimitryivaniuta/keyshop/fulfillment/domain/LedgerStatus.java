package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

/**
 * Status of a payment intent. Transitions only from {@link #PENDING} to {@link #PAID}.
 */
public enum LedgerStatus {
    /** Waiting for the provider to confirm. */
    PENDING,

    /** Confirmed and handed to fulfillment. Terminal. */
    PAID
}
