package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.domain.PendingGift;
import java.time.Instant;

public record PendingGiftResponse(
        String paymentId,
        String hostName,
        String planName,
        int days,
        Instant createdAt
) {

    public static PendingGiftResponse from(PendingGift g) {
        return new PendingGiftResponse(g.getPaymentId(), g.getHostName(), g.getPlanName(), g.getDays(), g.getCreatedAt());
    }
}
