package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param recipient handle the gift credential is issued under
 */
public record GiftRecipientRequest(
        @NotBlank @Size(max = 255) @Pattern(regexp = "^[A-Za-z0-9._@+-]+$") String recipient
) {}
