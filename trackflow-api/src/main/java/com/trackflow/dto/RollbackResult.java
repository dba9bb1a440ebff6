package com.trackflow.dto;

public record RollbackResult(String trackId, String targetEnvironment, boolean recordDeleted, int blobsDeleted) {
}
