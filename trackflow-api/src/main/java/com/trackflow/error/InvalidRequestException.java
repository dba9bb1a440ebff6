package com.trackflow.error;

/**
 * Malformed or incomplete request. Never retried.
 */
public class InvalidRequestException extends RuntimeException {

    private final String code;

    public InvalidRequestException(String message, String code) {
        super(message);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
