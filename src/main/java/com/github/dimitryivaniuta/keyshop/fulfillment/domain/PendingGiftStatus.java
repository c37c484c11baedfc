package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

/**
 * Lifecycle of a pending gift.
 */
public enum PendingGiftStatus {
    /** Paid; the payer has not named a recipient yet. */
    AWAITING_RECIPIENT,

    /** Credential issued. Terminal. */
    DELIVERED
}
