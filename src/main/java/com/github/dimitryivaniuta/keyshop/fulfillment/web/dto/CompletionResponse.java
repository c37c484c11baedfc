package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.FulfillmentReport;

/**
 * Result of a manual payment check.
 *
 * @param paymentId payment id
 * @param completed true when this call completed the intent
 * @param report    fulfillment report, {@code null} when nothing was completed
 */
public record CompletionResponse(String paymentId, boolean completed, FulfillmentReport report) {}
