package com.fintech.metals.storage;

/**
 * Thrown when the price store cannot complete a read or write.
 * A failed write leaves no partial rows behind.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
