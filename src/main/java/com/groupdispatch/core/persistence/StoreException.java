package com.groupdispatch.core.persistence;

/**
 * Raised when the dispatch store cannot read or persist state.
 * Cursor advances and session updates must not proceed past this failure.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
