package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * Result of redeeming a promo code after a sale.
 */
public enum PromoOutcome {
    /** Usage recorded within the limit. When it was the last allowed usage the code is now switched off. */
    REDEEMED,
    /** The limit was already used up before this sale; the usage is recorded anyway. */
    EXHAUSTED,
    /** The code is past its validity; it was switched off. */
    EXPIRED,
    /** No such code. */
    UNKNOWN
}
