package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

/**
 * Payment intent recorded before the payer is redirected to a provider.
 */
public record CreateIntentRequest(
        @NotBlank @Size(max = 128) @Pattern(regexp = "^[A-Za-z0-9._:-]+$") String paymentId,
        @NotNull @Positive Long ownerId,
        @Positive BigDecimal amount,
        @Size(min = 3, max = 8) String currency,
        @NotNull OrderMetadata metadata
) {}
