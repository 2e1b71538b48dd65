package com.example.trackscribe.exception;

/** The transcription or alignment capability failed. */
public class AsrException extends RuntimeException {
    public AsrException(String message) {
        super(message);
    }

    public AsrException(String message, Throwable cause) {
        super(message, cause);
    }
}
