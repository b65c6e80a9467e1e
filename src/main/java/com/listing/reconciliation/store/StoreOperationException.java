package com.listing.reconciliation.store;

/**
 * A single read or write against the backing store failed.
 */
public class StoreOperationException extends RuntimeException {

    public StoreOperationException(String message) {
        super(message);
    }

    public StoreOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
