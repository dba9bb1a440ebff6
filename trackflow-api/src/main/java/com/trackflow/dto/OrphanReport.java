package com.trackflow.dto;

import java.time.Instant;
import java.util.List;

public record OrphanReport(Instant checkedAt, int prefixesScanned, List<String> orphanTrackIds, int blobsDeleted) {
}
