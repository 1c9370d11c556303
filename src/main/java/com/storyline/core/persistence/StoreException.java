package com.storyline.core.persistence;

/**
 * Thrown when a persisted structure cannot be read or written.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
