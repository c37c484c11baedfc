package com.github.dimitryivaniuta.keyshop.fulfillment.service;

/**
 * The stored balance does not cover a balance-paid order.
 */
public class InsufficientBalanceException extends RuntimeException {

    public InsufficientBalanceException(long ownerId, String paymentId) {
        super("Balance of owner " + ownerId + " does not cover payment " + paymentId);
    }
}
