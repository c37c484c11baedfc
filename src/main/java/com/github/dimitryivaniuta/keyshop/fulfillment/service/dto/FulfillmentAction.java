package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * What a paid order asks fulfillment to do.
 */
public enum FulfillmentAction {
    /** Issue a new credential to the payer. */
    NEW,
    /** Add time to one of the payer's credentials. */
    EXTEND,
    /** Issue a credential once the payer names a recipient. */
    GIFT,
    /** Credit the stored balance. */
    TOP_UP
}
