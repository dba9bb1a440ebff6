package com.trackflow.event;

/**
 * Why a promotion attempt failed. Only {@link #TRANSIENT} is worth retrying.
 */
public enum FailureKind {
    NOT_FOUND,
    VALIDATION,
    TRANSIENT,
    CONFIGURATION
}
