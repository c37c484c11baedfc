package com.github.dimitryivaniuta.keyshop.fulfillment.notification;

/**
 * Fire-and-forget messages to payers and operators.
 *
 * <p>Implementations never throw: a lost message must not fail a fulfillment run.</p>
 */
public interface NotificationSink {

    void notifyPayer(long ownerId, String message);

    void notifyOperators(String message);

    /**
     * Asks the front end to delete a message it sent earlier, e.g. the "please pay" prompt.
     *
     * @param ownerId   chat owner
     * @param messageId message to delete
     */
    void retractMessage(long ownerId, long messageId);
}
