package com.trackflow.dto;

/**
 * Status plus body of a manual invocation, independent of the transport that
 * carried it.
 */
public record InvocationResponse(int statusCode, Object body) {

    public static InvocationResponse ok(Object body) {
        return new InvocationResponse(200, body);
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
