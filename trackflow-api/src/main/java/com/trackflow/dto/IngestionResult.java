package com.trackflow.dto;

import com.trackflow.model.TrackRecord;

public record IngestionResult(Status status, String key, String trackId, String message, TrackRecord record) {

    public enum Status {
        INGESTED,
        SKIPPED,
        REJECTED
    }

    public static IngestionResult ingested(String key, TrackRecord record) {
        return new IngestionResult(Status.INGESTED, key, record.getId(), "Ingested " + record.getFilename(), record);
    }

    public static IngestionResult skipped(String key, String reason) {
        return new IngestionResult(Status.SKIPPED, key, null, reason, null);
    }

    public static IngestionResult rejected(String key, String reason) {
        return new IngestionResult(Status.REJECTED, key, null, reason, null);
    }
}
