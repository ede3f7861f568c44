package com.chronicle.exceptions;

/**
 * Raised by a storage backend when a read or write cannot complete.
 * The persistence manager catches it and decides whether to fail over.
 */
public class StorageException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String backend;

    public StorageException(String backend, String message) {
        super(message);
        this.backend = backend;
    }

    public StorageException(String backend, String message, Throwable cause) {
        super(message, cause);
        this.backend = backend;
    }

    public String getBackend() {
        return backend;
    }
}
