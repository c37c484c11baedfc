package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.math.BigDecimal;

/**
 * Everything fulfillment needs to know about a paid order.
 *
 * <p>Stored as JSON in the ledger and validated per {@link FulfillmentAction} before it is accepted, so the
 * orchestrator never has to guess which fields an action carries.</p>
 *
 * @param paymentId       internal payment id
 * @param ownerId         paying party
 * @param action          what to fulfill
 * @param amount          charged amount
 * @param currency        ISO currency
 * @param paymentMethod   provider name or the stored-balance method
 * @param planId          chosen plan, if any
 * @param hostName        panel host for NEW and GIFT
 * @param months          duration in months when no plan is given
 * @param days            duration in days when no plan is given
 * @param credentialId    target credential for EXTEND
 * @param promoCode       discount code applied at checkout
 * @param promoDiscount   discount amount granted by the code
 * @param instanceId      managed sub-instance the sale went through
 * @param promptMessageId "please pay" message to retract after payment
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderMetadata(
        String paymentId,
        Long ownerId,
        FulfillmentAction action,
        BigDecimal amount,
        String currency,
        String paymentMethod,
        Long planId,
        String hostName,
        Integer months,
        Integer days,
        Long credentialId,
        String promoCode,
        BigDecimal promoDiscount,
        Long instanceId,
        Long promptMessageId
) {

    /**
     * Copy with the given payment id.
     *
     * @param id payment id
     * @return copy
     */
    public OrderMetadata withPaymentId(String id) {
        return new OrderMetadata(id, ownerId, action, amount, currency, paymentMethod, planId, hostName, months, days,
                credentialId, promoCode, promoDiscount, instanceId, promptMessageId);
    }

    /**
     * Copy with the given payment method, used when the provider is only known at notification time.
     *
     * @param method payment method
     * @return copy
     */
    public OrderMetadata withPaymentMethod(String method) {
        return new OrderMetadata(paymentId, ownerId, action, amount, currency, method, planId, hostName, months, days,
                credentialId, promoCode, promoDiscount, instanceId, promptMessageId);
    }

    /**
     * Checks that the fields required by {@link #action()} are present.
     *
     * @return this
     * @throws InvalidOrderMetadataException when a required field is missing
     */
    public OrderMetadata validate() {
        if (paymentId == null || paymentId.isBlank()) {
            throw new InvalidOrderMetadataException("paymentId is required");
        }
        if (ownerId == null || ownerId <= 0) {
            throw new InvalidOrderMetadataException("ownerId must be positive");
        }
        if (action == null) {
            throw new InvalidOrderMetadataException("action is required");
        }
        switch (action) {
            case TOP_UP -> {
                if (amount == null || amount.signum() <= 0) {
                    throw new InvalidOrderMetadataException("TOP_UP requires a positive amount");
                }
            }
            case NEW, GIFT -> {
                if (hostName == null || hostName.isBlank()) {
                    throw new InvalidOrderMetadataException(action + " requires hostName");
                }
                requireDuration();
            }
            case EXTEND -> {
                if (credentialId == null) {
                    throw new InvalidOrderMetadataException("EXTEND requires credentialId");
                }
                requireDuration();
            }
        }
        return this;
    }

    /**
     * True when the order was paid from the stored balance instead of real money.
     *
     * @param balanceMethod configured name of the balance payment method
     * @return whether this is a balance payment
     */
    @JsonIgnore
    public boolean isPaidFromBalance(String balanceMethod) {
        return paymentMethod != null && paymentMethod.trim().equalsIgnoreCase(balanceMethod);
    }

    private void requireDuration() {
        boolean hasDuration = planId != null
                || (days != null && days > 0)
                || (months != null && months > 0);
        if (!hasDuration) {
            throw new InvalidOrderMetadataException(action + " requires planId, days or months");
        }
    }
}
