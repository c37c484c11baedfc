package com.github.dimitryivaniuta.keyshop.fulfillment.service.dto;

/**
 * Order metadata is missing a field its action requires.
 */
public class InvalidOrderMetadataException extends IllegalArgumentException {

    public InvalidOrderMetadataException(String message) {
        super(message);
    }
}
