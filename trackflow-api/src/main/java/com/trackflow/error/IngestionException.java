package com.trackflow.error;

/**
 * Infrastructure failure while ingesting. Safe to retry.
 */
public class IngestionException extends RuntimeException {

    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
