package com.trackflow.error;

public class TrackNotFoundException extends RuntimeException {

    private final String trackId;

    public TrackNotFoundException(String trackId) {
        super("Track " + trackId + " not found");
        this.trackId = trackId;
    }

    public String trackId() {
        return trackId;
    }
}
