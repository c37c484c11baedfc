package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

/**
 * @param paymentId payment id
 * @param recorded  false when the intent is already paid or could not be stored
 */
public record IntentResponse(String paymentId, boolean recorded) {}
