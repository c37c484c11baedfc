package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import lombok.Getter;

/**
 * A ledger transaction kept losing lock races and gave up.
 *
 * <p>Answered with 503 so the payment provider redelivers the notification later.</p>
 */
@Getter
public class LedgerContentionException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public LedgerContentionException(String operation, int attempts, Throwable cause) {
        super("Ledger operation '" + operation + "' failed after " + attempts + " attempts", cause);
        this.operation = operation;
        this.attempts = attempts;
    }
}
