package com.example.trackscribe.exception;

/** A discovered entry lacks the locators needed to process it. */
public class MetadataException extends RuntimeException {
    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
