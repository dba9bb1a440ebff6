package com.trackflow.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tracks")
@IdClass(TrackKey.class)
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackRecord {

    public static final String UNKNOWN_GENRE = "unknown";

    @Id
    @Column(length = 64)
    private String id;

    @Id
    @Column(name = "created_date")
    private Instant createdDate;

    @Column(length = 500)
    private String title;

    @Column(length = 500)
    private String artist;

    @Column(length = 500)
    private String album;

    @Column(nullable = false, length = 100)
    private String genre;

    @Column(length = 4000)
    private String description;

    @Convert(converter = TagListConverter.class)
    @Column(length = 2000)
    private List<String> tags;

    @Column(nullable = false, length = 500)
    private String filename;

    @Column(name = "file_url", nullable = false, length = 1000)
    private String fileUrl;

    @Column(name = "file_size", nullable = false)
    private Long fileSize;

    @Column(name = "file_hash", length = 64)
    private String fileHash;

    @Column(length = 16)
    private String format;

    @Column(nullable = false)
    private Integer duration;

    private Integer bitrate;

    @Column(name = "sample_rate")
    private Integer sampleRate;

    private Integer channels;

    @Column(nullable = false, length = 20)
    private TrackStatus status;

    @Column(name = "thumbnail_url", length = 1000)
    private String thumbnailUrl;

    @Column(name = "enriched_date")
    private Instant enrichedDate;

    @Column(name = "promotion_date")
    private Instant promotionDate;

    @Column(name = "promoted_from", length = 32)
    private String promotedFrom;

    @PrePersist
    protected void onCreate() {
        if (createdDate == null) {
            createdDate = Instant.now();
        }
        if (genre == null || genre.isBlank()) {
            genre = UNKNOWN_GENRE;
        }
        if (duration == null) {
            duration = 0;
        }
        if (tags == null) {
            tags = new ArrayList<>();
        }
    }

    public int durationOrZero() {
        return duration == null ? 0 : duration;
    }

    public long fileSizeOrZero() {
        return fileSize == null ? 0L : fileSize;
    }
}
