package com.github.dimitryivaniuta.keyshop.fulfillment.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.keyshop.fulfillment.service.dto.OrderMetadata;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the JSON stored in {@code pending_transactions.metadata}.
 */
@Component
public class MetadataCodec {

    private final ObjectMapper objectMapper;

    public MetadataCodec(@Qualifier("canonicalObjectMapper") ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(OrderMetadata metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize order metadata", e);
        }
    }

    public OrderMetadata decode(String json) {
        try {
            return objectMapper.readValue(json, OrderMetadata.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored order metadata is not readable", e);
        }
    }
}
