package com.github.dimitryivaniuta.keyshop.fulfillment.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * @param host panel host name
 */
public record HostRequest(@NotBlank @Size(max = 128) String host) {}
