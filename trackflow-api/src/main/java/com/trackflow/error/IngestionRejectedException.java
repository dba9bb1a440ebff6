package com.trackflow.error;

/**
 * Upload refused for its content or size. Retrying the same object cannot succeed.
 */
public class IngestionRejectedException extends RuntimeException {

    private final String key;

    public IngestionRejectedException(String key, String message) {
        super(message);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
