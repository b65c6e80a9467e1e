package com.listing.reconciliation.codec;

/**
 * A stored change payload does not conform to the schema of its change type.
 */
public class InvalidPayloadException extends RuntimeException {

    public InvalidPayloadException(String message) {
        super(message);
    }

    public InvalidPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
