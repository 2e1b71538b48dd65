package com.example.trackscribe.exception;

/** Local artifact or transcript cache I/O failed. */
public class StorageException extends RuntimeException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
