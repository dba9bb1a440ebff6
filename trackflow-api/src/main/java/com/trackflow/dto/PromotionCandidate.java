package com.trackflow.dto;

import com.trackflow.model.TrackRecord;

import java.time.Duration;
import java.time.Instant;

public record PromotionCandidate(String trackId, String title, Instant createdDate, long ageHours,
                                 Long fileSize, Integer duration) {

    public static PromotionCandidate of(TrackRecord record, Instant now) {
        long age = Duration.between(record.getCreatedDate(), now).toHours();
        return new PromotionCandidate(record.getId(), record.getTitle(), record.getCreatedDate(), age,
                record.getFileSize(), record.getDuration());
    }
}
