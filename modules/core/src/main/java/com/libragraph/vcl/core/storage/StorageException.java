package com.libragraph.vcl.core.storage;

/**
 * Wraps checked I/O exceptions from blob storage operations.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
