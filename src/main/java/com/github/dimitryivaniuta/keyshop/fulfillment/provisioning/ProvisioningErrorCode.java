package com.github.dimitryivaniuta.keyshop.fulfillment.provisioning;

/**
 * Short, payer-safe code for a failed provisioning attempt.
 */
public enum ProvisioningErrorCode {
    /** The requested handle is already used by another credential. */
    IDENTITY_TAKEN,
    /** The panel does not know the requested host. */
    HOST_NOT_FOUND,
    /** The panel did not answer in time. */
    TIMEOUT,
    /** Anything else the panel or the network did wrong. */
    UPSTREAM_ERROR,
    /** The order itself could not be turned into a request (no duration, unknown credential). */
    INVALID_ORDER
}
