package com.example.trackscribe.exception;

/** The audio source could not produce the local artifact for a track. */
public class FetchException extends RuntimeException {
    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
