package com.trackflow.service;

import com.trackflow.config.StorageConfig;
import com.trackflow.error.EnrichmentException;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the audio of a {@code processed} track and fills in duration, technical
 * properties and embedded tags. A track whose audio cannot be decoded is left
 * exactly as it was.
 */
@Service
@Slf4j
public class EnrichmentService {

    private final TrackStore trackStore;
    private final BlobStore mediaStore;
    private final AudioMetadataReader metadataReader;
    private final MediaUrls mediaUrls;
    private final Clock clock;

    public EnrichmentService(TrackStore trackStore,
                             @Qualifier(StorageConfig.MEDIA_STORE) BlobStore mediaStore,
                             AudioMetadataReader metadataReader,
                             MediaUrls mediaUrls,
                             Clock clock) {
        this.trackStore = trackStore;
        this.mediaStore = mediaStore;
        this.metadataReader = metadataReader;
        this.mediaUrls = mediaUrls;
        this.clock = clock;
    }

    /**
     * Enriches using the media key the record's file URL points at.
     */
    public TrackRecord enrich(String trackId) {
        TrackRecord record = trackStore.findById(trackId).orElseThrow(() -> new TrackNotFoundException(trackId));
        String blobKey = mediaUrls.keyOf(record.getFileUrl())
                .orElseThrow(() -> new EnrichmentException("Track " + trackId + " has no media in this environment"));
        return enrich(record, blobKey);
    }

    public TrackRecord enrich(String trackId, String blobKey) {
        TrackRecord record = trackStore.findById(trackId).orElseThrow(() -> new TrackNotFoundException(trackId));
        return enrich(record, blobKey);
    }

    private TrackRecord enrich(TrackRecord record, String blobKey) {
        String trackId = record.getId();
        if (record.getStatus() != null && record.getStatus().isTerminal()) {
            log.info("Not enriching track {}: status is {}", trackId, record.getStatus().value());
            return record;
        }

        AudioMetadata metadata = readMetadata(trackId, blobKey);
        if (metadata.durationSeconds() <= 0) {
            throw new EnrichmentException("No playable audio in " + blobKey + " for track " + trackId);
        }

        TrackRecord enriched = record.toBuilder()
                .tags(record.getTags() == null ? new ArrayList<>() : new ArrayList<>(record.getTags()))
                .build();
        apply(enriched, metadata);
        if (metadata.artwork() != null) {
            storeArtwork(enriched, metadata.artwork());
        }
        enriched.setStatus(TrackStatus.ENHANCED);
        enriched.setEnrichedDate(clock.instant().truncatedTo(ChronoUnit.MICROS));

        // Decoding takes a while; the track may have been promoted or rejected meanwhile
        if (!trackStore.saveIfStatusIn(enriched, TrackStatus.PROMOTABLE)) {
            TrackRecord current = trackStore.findById(trackId).orElseThrow(() -> new TrackNotFoundException(trackId));
            log.info("Discarding enrichment of track {}: status changed to {}", trackId, current.getStatus().value());
            return current;
        }
        log.info("Enriched track {}: {}s, {} kbps, {} Hz", trackId, enriched.getDuration(), enriched.getBitrate(),
                enriched.getSampleRate());
        return enriched;
    }

    private AudioMetadata readMetadata(String trackId, String blobKey) {
        Path temp = null;
        try {
            temp = Files.createTempFile("trackflow-enrich-", suffixOf(blobKey));
            try (InputStream in = mediaStore.open(blobKey)) {
                Files.copy(in, temp, StandardCopyOption.REPLACE_EXISTING);
            }
            return metadataReader.read(temp);
        } catch (IOException e) {
            throw new EnrichmentException("Could not read " + blobKey + " for track " + trackId, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not delete temp file {}", temp, e);
                }
            }
        }
    }

    static void apply(TrackRecord record, AudioMetadata metadata) {
        record.setDuration(metadata.durationSeconds());
        record.setBitrate(metadata.bitrate());
        record.setSampleRate(metadata.sampleRate());
        record.setChannels(metadata.channels());
        if (metadata.title() != null) {
            record.setTitle(metadata.title());
        }
        if (metadata.artist() != null) {
            record.setArtist(metadata.artist());
        }
        if (metadata.album() != null) {
            record.setAlbum(metadata.album());
        }
        if (metadata.genre() != null) {
            record.setGenre(metadata.genre());
        }
        if (metadata.comment() != null) {
            record.setDescription(metadata.comment());
        }
        if (metadata.year() != null) {
            List<String> tags = record.getTags();
            String yearTag = "year:" + metadata.year();
            if (!tags.contains(yearTag)) {
                tags.add(yearTag);
            }
        }
    }

    // Artwork is optional; a failed write leaves the thumbnail unset
    private void storeArtwork(TrackRecord record, AudioMetadata.Artwork artwork) {
        String key = MediaUrls.trackPrefix(record.getId()) + "artwork/cover." + artwork.extension();
        try {
            mediaStore.put(key, new ByteArrayInputStream(artwork.data()));
            record.setThumbnailUrl(mediaUrls.urlFor(key));
        } catch (IOException e) {
            log.warn("Could not store artwork for track {}", record.getId(), e);
        }
    }

    private static String suffixOf(String key) {
        String name = key.substring(key.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : ".audio";
    }
}
