package com.switchboard.core.store;

/**
 * Raised when the backing store cannot be read or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
