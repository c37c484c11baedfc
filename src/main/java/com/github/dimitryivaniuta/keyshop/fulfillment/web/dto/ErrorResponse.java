package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import java.time.Instant;

/**
 * Error body of every non-2xx answer.
 *
 * @param code      machine-readable code
 * @param message   human readable message
 * @param timestamp event time
 */
public record ErrorResponse(String code, String message, Instant timestamp) {}
