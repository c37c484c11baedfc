package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Result of one attempt to flip a pending intent to paid.
 *
 * @param outcome  outcome
 * @param metadata for {@code COMPLETED} the order to fulfill; for {@code MISMATCH} the pending order the payment
 *                 was compared with; {@code null} otherwise
 */
public record LedgerCompletion(Outcome outcome, OrderMetadata metadata) {

    public enum Outcome {
        /** This caller flipped the intent; it alone fulfills it. */
        COMPLETED,
        /** Unknown payment id, already paid, or lost the race. */
        NOT_PENDING,
        /** The paid amount or currency differs from the intent as it stood under the lock; nothing changed. */
        MISMATCH
    }

    public static LedgerCompletion completed(OrderMetadata metadata) {
        return new LedgerCompletion(Outcome.COMPLETED, metadata);
    }

    public static LedgerCompletion notPending() {
        return new LedgerCompletion(Outcome.NOT_PENDING, null);
    }

    public static LedgerCompletion mismatch(OrderMetadata pending) {
        return new LedgerCompletion(Outcome.MISMATCH, pending);
    }

    public boolean isCompleted() {
        return outcome == Outcome.COMPLETED;
    }

    /**
     * @return the order to fulfill, present only for {@code COMPLETED}
     */
    public Optional<OrderMetadata> completedMetadata() {
        return isCompleted() ? Optional.of(metadata) : Optional.empty();
    }

    /**
     * Whether a provider-confirmed payment matches the pending order. A side that does not state an amount
     * or a currency does not constrain it.
     *
     * @param pending  order as stored in the ledger
     * @param paid     amount confirmed by the provider, may be {@code null}
     * @param currency currency confirmed by the provider, may be {@code null}
     * @return true when they agree
     */
    public static boolean matches(OrderMetadata pending, BigDecimal paid, String currency) {
        if (pending.amount() != null && paid != null && pending.amount().compareTo(paid) != 0) {
            return false;
        }
        return pending.currency() == null || currency == null || pending.currency().equalsIgnoreCase(currency);
    }
}
