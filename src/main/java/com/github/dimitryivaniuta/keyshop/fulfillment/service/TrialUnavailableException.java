package com.github.dimitryivaniuta.keyshop.fulfillment.service;

/**
 * The owner already used the free trial, or trials are switched off.
 */
public class TrialUnavailableException extends RuntimeException {

    public TrialUnavailableException(long ownerId, String reason) {
        super("Trial unavailable for owner " + ownerId + ": " + reason);
    }
}
