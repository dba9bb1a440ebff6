package com.trackflow.service;

import com.trackflow.config.PipelineProperties;
import com.trackflow.config.StorageConfig;
import com.trackflow.dto.IngestionResult;
import com.trackflow.error.IngestionException;
import com.trackflow.error.PipelineBusyException;
import com.trackflow.event.TrackIngestedEvent;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Turns a newly uploaded object into a track record: screens it, copies it into
 * the media area under a fresh id and writes the initial {@code processed} record.
 */
@Service
@Slf4j
public class IngestionService {

    private final BlobStore uploadStore;
    private final BlobStore mediaStore;
    private final TrackStore trackStore;
    private final ContentScanner contentScanner;
    private final ApplicationEventPublisher eventPublisher;
    private final MediaUrls mediaUrls;
    private final Clock clock;
    private final PipelineProperties.Ingestion settings;
    private final Semaphore permits;

    public IngestionService(@Qualifier(StorageConfig.UPLOAD_STORE) BlobStore uploadStore,
                            @Qualifier(StorageConfig.MEDIA_STORE) BlobStore mediaStore,
                            TrackStore trackStore,
                            ContentScanner contentScanner,
                            ApplicationEventPublisher eventPublisher,
                            MediaUrls mediaUrls,
                            Clock clock,
                            PipelineProperties properties) {
        this.uploadStore = uploadStore;
        this.mediaStore = mediaStore;
        this.trackStore = trackStore;
        this.contentScanner = contentScanner;
        this.eventPublisher = eventPublisher;
        this.mediaUrls = mediaUrls;
        this.clock = clock;
        this.settings = properties.ingestion();
        this.permits = new Semaphore(Math.max(1, settings.maxConcurrency()), true);
    }

    /**
     * Object keys arrive form encoded in upload notifications.
     */
    public static String decodeKey(String rawKey) {
        return URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
    }

    /**
     * @param area name of the area the object was written to
     * @param key  decoded object key
     * @throws PipelineBusyException if no ingestion slot frees up in time
     * @throws IngestionException    on storage or metadata failures; nothing is left behind
     */
    public IngestionResult ingest(String area, String key) {
        if (!uploadStore.area().equals(area)) {
            log.warn("Ignoring upload in unknown area {}: {}", area, key);
            return IngestionResult.skipped(key, "Unknown area " + area);
        }
        if (!key.startsWith(settings.uploadPrefix())) {
            log.debug("Skipping {}: outside {}", key, settings.uploadPrefix());
            return IngestionResult.skipped(key, "Outside upload prefix");
        }
        String filename = key.substring(key.lastIndexOf('/') + 1);
        if (!isSupported(filename)) {
            log.debug("Skipping {}: unsupported extension", key);
            return IngestionResult.skipped(key, "Unsupported file type");
        }

        acquirePermit(key);
        try {
            return doIngest(key, filename);
        } finally {
            permits.release();
        }
    }

    public boolean isSupported(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return settings.supportedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .anyMatch(lower::endsWith);
    }

    private void acquirePermit(String key) {
        try {
            if (!permits.tryAcquire(settings.acquireTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                throw new PipelineBusyException("Ingestion busy, could not start " + key + " within "
                        + settings.acquireTimeout());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineBusyException("Interrupted while waiting to ingest " + key);
        }
    }

    private IngestionResult doIngest(String key, String filename) {
        Optional<BlobStore.BlobInfo> info;
        byte[] head;
        try {
            info = uploadStore.stat(key);
            if (info.isEmpty()) {
                log.warn("Upload {} no longer exists", key);
                return IngestionResult.rejected(key, "Object not found");
            }
            long size = info.get().size();
            if (size < settings.minSize().toBytes() || size > settings.maxSize().toBytes()) {
                log.warn("Rejecting {}: size {} outside [{}, {}]", key, size, settings.minSize(), settings.maxSize());
                return IngestionResult.rejected(key, "File size " + size + " bytes is outside the allowed range");
            }
            head = uploadStore.readHead(key, settings.scanBytes());
        } catch (IOException e) {
            throw new IngestionException("Could not read upload " + key, e);
        }

        Optional<String> marker = contentScanner.scan(head);
        if (marker.isPresent()) {
            log.error("SECURITY: rejecting {}, suspicious content '{}'", key, marker.get());
            return IngestionResult.rejected(key, "Suspicious content detected");
        }

        String trackId = UUID.randomUUID().toString();
        String mediaKey = MediaUrls.trackPrefix(trackId) + filename;
        String hash = copyToMedia(key, mediaKey);

        FilenameMetadata metadata = FilenameMetadata.of(filename);
        TrackRecord record = TrackRecord.builder()
                .id(trackId)
                .createdDate(clock.instant().truncatedTo(ChronoUnit.MICROS))
                .title(metadata.title())
                .artist(metadata.artist())
                .genre(TrackRecord.UNKNOWN_GENRE)
                .description("")
                .tags(new ArrayList<>())
                .filename(filename)
                .fileUrl(mediaUrls.urlFor(mediaKey))
                .fileSize(info.get().size())
                .fileHash(hash)
                .format(metadata.format())
                .duration(0)
                .status(TrackStatus.PROCESSED)
                .build();

        TrackRecord saved;
        try {
            saved = trackStore.save(record);
        } catch (RuntimeException e) {
            discard(mediaKey);
            throw new IngestionException("Could not save record for " + key, e);
        }

        log.info("Ingested {} as track {} ({} bytes, sha256 {})", key, trackId, saved.getFileSize(), hash);
        eventPublisher.publishEvent(new TrackIngestedEvent(trackId, mediaKey));
        return IngestionResult.ingested(key, saved);
    }

    private String copyToMedia(String key, String mediaKey) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(uploadStore.open(key), digest)) {
            mediaStore.put(mediaKey, in);
        } catch (IOException e) {
            discard(mediaKey);
            throw new IngestionException("Could not copy " + key + " to " + mediaStore.area(), e);
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    private void discard(String mediaKey) {
        try {
            mediaStore.delete(mediaKey);
        } catch (IOException e) {
            log.error("Could not remove {}:{} after a failed ingestion", mediaStore.area(), mediaKey, e);
        }
    }
}
