package com.trackflow.event;

/**
 * Published in-process once a track record has been written.
 */
public record TrackIngestedEvent(String trackId, String blobKey) {
}
