package com.trackflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a track record inside one environment.
 * PROMOTED and REJECTED are terminal.
 */
public enum TrackStatus {
    PROCESSED("processed"),
    ENHANCED("enhanced"),
    PROMOTED("promoted"),
    REJECTED("rejected");

    /** Statuses a track may be promoted from. */
    public static final Set<TrackStatus> PROMOTABLE = EnumSet.of(PROCESSED, ENHANCED);

    private final String value;

    TrackStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == PROMOTED || this == REJECTED;
    }

    @JsonCreator
    public static TrackStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown track status: " + value));
    }
}
