package com.manifold.core.store;

/**
 * Thrown when a run artifact cannot be persisted or read back. Fatal for the run.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
