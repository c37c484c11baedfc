package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.LedgerStatus;

public record IntentStatusResponse(String paymentId, LedgerStatus status) {}
