package com.github.dimitryivaniuta.keyshop.fulfillment.verification;

/**
 * A provider notification could not be authenticated or parsed.
 */
public class PaymentVerificationException extends RuntimeException {

    public PaymentVerificationException(String message) {
        super(message);
    }

    public PaymentVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
