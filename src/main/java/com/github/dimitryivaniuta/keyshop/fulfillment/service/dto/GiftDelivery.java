package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * Result of delivering a pending gift.
 *
 * @param paymentId    gift payment id
 * @param status       result
 * @param credentialId issued credential, when delivered
 * @param errorCode    provisioning error code, when failed
 */
public record GiftDelivery(String paymentId, Status status, Long credentialId, String errorCode) {

    /**
     * Delivery result.
     */
    public enum Status {
        DELIVERED,
        ALREADY_DELIVERED,
        NOT_FOUND,
        FAILED
    }
}
