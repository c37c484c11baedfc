package com.github.dimitryivaniuta.keyshop.fulfillment.domain;

/**
 * How a credential came to exist.
 */
public enum OriginSource {
    TRIAL,
    PURCHASE,
    EXTEND,
    GIFT
}
