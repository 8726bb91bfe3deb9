package com.kotsin.hotspot.store;

/**
 * A merged event set could not be written. The scan that produced it is
 * reported as failed and nothing is published.
 */
public class StorePersistenceException extends RuntimeException {

    public StorePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
