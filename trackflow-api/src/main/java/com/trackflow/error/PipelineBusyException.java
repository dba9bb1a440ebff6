package com.trackflow.error;

/**
 * A concurrency limit was reached before the caller's wait expired.
 */
public class PipelineBusyException extends RuntimeException {

    public PipelineBusyException(String message) {
        super(message);
    }
}
