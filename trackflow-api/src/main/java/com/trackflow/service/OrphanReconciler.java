package com.trackflow.service;

import com.trackflow.config.PipelineProperties;
import com.trackflow.config.StorageConfig;
import com.trackflow.dto.OrphanReport;
import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Finds media left under {@code audio/{id}/} without a matching track record,
 * which happens when ingestion dies between the copy and the record write.
 * Blobs younger than the grace period are ignored, as their record may still
 * be on its way.
 */
@Component
@Slf4j
public class OrphanReconciler {

    private static final String MEDIA_PREFIX = "audio/";

    private final BlobStore mediaStore;
    private final TrackStore trackStore;
    private final Clock clock;
    private final PipelineProperties.Reconciliation settings;

    public OrphanReconciler(@Qualifier(StorageConfig.MEDIA_STORE) BlobStore mediaStore,
                            TrackStore trackStore,
                            Clock clock,
                            PipelineProperties properties) {
        this.mediaStore = mediaStore;
        this.trackStore = trackStore;
        this.clock = clock;
        this.settings = properties.reconciliation();
    }

    public OrphanReport findOrphans() {
        return reconcile(false);
    }

    @Scheduled(cron = "${pipeline.reconciliation.cron:0 30 * * * *}")
    public void scheduledReconcile() {
        try {
            OrphanReport report = reconcile(settings.deleteOrphans());
            if (!report.orphanTrackIds().isEmpty()) {
                log.warn("Found {} orphaned track folders, deleted {} blobs: {}", report.orphanTrackIds().size(),
                        report.blobsDeleted(), report.orphanTrackIds());
            }
        } catch (RuntimeException e) {
            log.error("Orphan reconciliation failed: {}", e.getMessage(), e);
        }
    }

    OrphanReport reconcile(boolean delete) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(settings.gracePeriod());
        Map<String, List<String>> byTrack = new LinkedHashMap<>();
        try {
            for (String key : mediaStore.list(MEDIA_PREFIX)) {
                String rest = key.substring(MEDIA_PREFIX.length());
                int slash = rest.indexOf('/');
                if (slash > 0) {
                    byTrack.computeIfAbsent(rest.substring(0, slash), id -> new ArrayList<>()).add(key);
                }
            }

            List<String> orphans = new ArrayList<>();
            int deleted = 0;
            for (Map.Entry<String, List<String>> entry : byTrack.entrySet()) {
                String trackId = entry.getKey();
                if (trackStore.findById(trackId).isPresent() || !olderThan(entry.getValue(), cutoff)) {
                    continue;
                }
                orphans.add(trackId);
                if (delete) {
                    for (String key : entry.getValue()) {
                        if (mediaStore.delete(key)) {
                            deleted++;
                        }
                    }
                }
            }
            return new OrphanReport(now, byTrack.size(), orphans, deleted);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not list " + mediaStore.area() + ":" + MEDIA_PREFIX, e);
        }
    }

    private boolean olderThan(List<String> keys, Instant cutoff) throws IOException {
        for (String key : keys) {
            Optional<BlobStore.BlobInfo> info = mediaStore.stat(key);
            if (info.isPresent() && info.get().lastModified().isAfter(cutoff)) {
                return false;
            }
        }
        return true;
    }
}
