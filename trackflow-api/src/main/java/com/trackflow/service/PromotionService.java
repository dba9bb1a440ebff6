package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.config.StorageConfig;
import com.trackflow.dto.RollbackResult;
import com.trackflow.dto.ValidationVerdict;
import com.trackflow.event.FailureKind;
import com.trackflow.event.PromotionOutcome;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;
import com.trackflow.storage.BlobStore;
import com.trackflow.storage.MediaUrls;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Promotes single tracks from this environment into the {@link TargetEnvironment}.
 *
 * <p>Safe to repeat: a track already present in the target is reported as a
 * success without copying anything, and every write replaces rather than
 * appends. The target record is written only after all blobs are copied and
 * the audio checksum matches, so a reader that finds it can rely on the media
 * being there. The source is marked {@code promoted} only if nobody rejected
 * it in the meantime.</p>
 */
@Service
@ConditionalOnPromotion
@Slf4j
public class PromotionService {

    private final TrackStore sourceStore;
    private final BlobStore sourceMedia;
    private final MediaUrls sourceUrls;
    private final TargetEnvironment target;
    private final TrackValidator validator;
    private final PromotionAuditService auditService;
    private final PromotionNotifier notifier;
    private final Clock clock;
    private final String sourceEnvironment;
    private final PipelineProperties.Promotion settings;
    private final Semaphore permits;

    public PromotionService(TrackStore sourceStore,
                            @Qualifier(StorageConfig.MEDIA_STORE) BlobStore sourceMedia,
                            MediaUrls sourceUrls,
                            TargetEnvironment target,
                            TrackValidator validator,
                            PromotionAuditService auditService,
                            PromotionNotifier notifier,
                            Clock clock,
                            PipelineProperties properties) {
        this.sourceStore = sourceStore;
        this.sourceMedia = sourceMedia;
        this.sourceUrls = sourceUrls;
        this.target = target;
        this.validator = validator;
        this.auditService = auditService;
        this.notifier = notifier;
        this.clock = clock;
        this.sourceEnvironment = properties.environment();
        this.settings = properties.promotion();
        this.permits = new Semaphore(Math.max(1, settings.maxConcurrency()), true);
    }

    public String sourceEnvironment() {
        return sourceEnvironment;
    }

    public String targetEnvironment() {
        return target.name();
    }

    /**
     * Promotes one track. Never throws for per-track problems: every failure is
     * reported in the returned outcome, which is also audited and published.
     */
    public PromotionOutcome promote(String trackId, AgeGate ageGate) {
        PromotionOutcome outcome;
        if (!acquirePermit()) {
            outcome = failure(trackId, FailureKind.TRANSIENT,
                    "No promotion slot free within " + settings.trackTimeout(), null);
        } else {
            try {
                outcome = attempt(trackId, ageGate);
            } catch (IOException e) {
                outcome = failure(trackId, classify(e), describe(e), null);
            } catch (RuntimeException e) {
                outcome = failure(trackId, classify(e), describe(e), null);
            } finally {
                permits.release();
            }
        }

        if (outcome.isSuccess()) {
            log.info("Promoted track {} {} -> {} (files={}, recordCreated={})", trackId, sourceEnvironment,
                    target.name(), outcome.getFilesCopied(), outcome.isRecordCreated());
        } else {
            log.warn("Promotion of track {} failed [{}]: {}", trackId, outcome.getFailureKind(), outcome.getError());
        }
        return report(outcome);
    }

    /**
     * Reports a track given up on before its promotion finished, as a
     * retriable failure.
     */
    public PromotionOutcome abandon(String trackId, String error) {
        log.warn("Promotion of track {} abandoned: {}", trackId, error);
        return report(failure(trackId, FailureKind.TRANSIENT, error, null));
    }

    private PromotionOutcome report(PromotionOutcome outcome) {
        auditService.record(outcome);
        notifier.publish(outcome);
        return outcome;
    }

    private PromotionOutcome attempt(String trackId, AgeGate ageGate) throws IOException {
        Optional<TrackRecord> found = sourceStore.findById(trackId);
        if (found.isEmpty()) {
            return failure(trackId, FailureKind.NOT_FOUND, "Track " + trackId + " not found in " + sourceEnvironment, null);
        }
        TrackRecord source = found.get();

        Optional<TrackRecord> existing = target.tracks().findById(trackId);
        if (existing.isPresent()) {
            Instant promotedAt = existing.get().getPromotionDate();
            // An earlier run wrote the target but stopped before marking the source
            if (TrackStatus.PROMOTABLE.contains(source.getStatus())
                    && !markPromoted(source, promotedAt != null ? promotedAt : now())) {
                log.warn("Track {} changed status while its promotion was being repaired", trackId);
            }
            log.info("Track {} already present in {}", trackId, target.name());
            return success(trackId, 0, false, promotedAt, null);
        }

        ValidationVerdict verdict = validator.validate(source, ageGate);
        if (!verdict.valid()) {
            return failure(trackId, FailureKind.VALIDATION, "Validation failed: " + verdict.failedChecks(), verdict);
        }

        int copied = copyBlobs(trackId);
        try {
            verifyCopy(source);
        } catch (IOException e) {
            withdraw(trackId);
            throw e;
        }

        // The copy takes a while; an operator may have rejected the track meanwhile
        Optional<TrackRecord> current = sourceStore.findById(trackId);
        if (current.isEmpty() || !TrackStatus.PROMOTABLE.contains(current.get().getStatus())) {
            withdraw(trackId);
            return failure(trackId, FailureKind.VALIDATION, "Track " + trackId + " is now "
                    + statusOf(current) + " and can no longer be promoted", verdict);
        }

        Instant promotionDate = now();
        target.tracks().save(toTargetRecord(current.get(), promotionDate));
        if (!markPromoted(current.get(), promotionDate)) {
            withdraw(trackId);
            return failure(trackId, FailureKind.VALIDATION, "Track " + trackId + " is now "
                    + statusOf(sourceStore.findById(trackId)) + " and can no longer be promoted", verdict);
        }
        return success(trackId, copied, true, promotionDate, verdict);
    }

    private static String statusOf(Optional<TrackRecord> record) {
        return record.map(r -> r.getStatus().value()).orElse("deleted");
    }

    private int copyBlobs(String trackId) throws IOException {
        List<String> keys = sourceMedia.list(MediaUrls.trackPrefix(trackId));
        if (keys.isEmpty()) {
            throw new NoSuchFileException(sourceMedia.area() + ":" + MediaUrls.trackPrefix(trackId));
        }
        for (String key : keys) {
            try (InputStream in = sourceMedia.open(key)) {
                long bytes = target.media().put(key, in);
                log.debug("Copied {} ({} bytes) to {}", key, bytes, target.media().area());
            }
        }
        return keys.size();
    }

    /**
     * Checks that the audio object arrived in the target intact, comparing its
     * SHA-256 with the hash taken at ingestion when there is one.
     */
    private void verifyCopy(TrackRecord source) throws IOException {
        String audioKey = sourceUrls.keyOf(source.getFileUrl())
                .orElseThrow(() -> new NoSuchFileException("No media key in " + source.getFileUrl()));
        if (target.media().stat(audioKey).isEmpty()) {
            throw new NoSuchFileException(target.media().area() + ":" + audioKey);
        }
        if (source.getFileHash() == null) {
            log.debug("Track {} has no content hash, skipping checksum of {}", source.getId(), audioKey);
            return;
        }
        String copied = sha256(target.media(), audioKey);
        if (!copied.equalsIgnoreCase(source.getFileHash())) {
            throw new IOException("Checksum mismatch for " + target.media().area() + ":" + audioKey
                    + ", expected " + source.getFileHash() + " but found " + copied);
        }
    }

    private static String sha256(BlobStore store, String key) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        try (InputStream in = new DigestInputStream(store.open(key), digest)) {
            in.transferTo(OutputStream.nullOutputStream());
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    // Takes back a half finished promotion; the failure being reported matters more than cleanup errors
    private void withdraw(String trackId) {
        try {
            rollback(trackId);
        } catch (RuntimeException e) {
            log.error("Could not withdraw partial promotion of track {} from {}", trackId, target.name(), e);
        }
    }

    private TrackRecord toTargetRecord(TrackRecord source, Instant promotionDate) {
        MediaUrls targetUrls = target.mediaUrls();
        return source.toBuilder()
                .tags(source.getTags() == null ? new ArrayList<>() : new ArrayList<>(source.getTags()))
                .fileUrl(sourceUrls.rebase(source.getFileUrl(), targetUrls))
                .thumbnailUrl(source.getThumbnailUrl() == null ? null
                        : sourceUrls.rebase(source.getThumbnailUrl(), targetUrls))
                .promotedFrom(sourceEnvironment)
                .promotionDate(promotionDate)
                .build();
    }

    /**
     * @return {@code false} if the source left the promotable statuses first
     */
    private boolean markPromoted(TrackRecord source, Instant promotionDate) {
        TrackRecord promoted = source.toBuilder()
                .status(TrackStatus.PROMOTED)
                .promotionDate(promotionDate)
                .build();
        return sourceStore.saveIfStatusIn(promoted, TrackStatus.PROMOTABLE);
    }

    /**
     * Removes a promoted track from the target. The source record keeps its
     * status; restoring it is an operator decision.
     */
    public RollbackResult rollback(String trackId) {
        boolean recordDeleted = target.tracks().deleteById(trackId);
        int blobsDeleted = 0;
        try {
            for (String key : target.media().list(MediaUrls.trackPrefix(trackId))) {
                if (target.media().delete(key)) {
                    blobsDeleted++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not remove media of track " + trackId + " from " + target.name(), e);
        }
        log.warn("Rolled back track {} from {}: recordDeleted={}, blobsDeleted={}", trackId, target.name(),
                recordDeleted, blobsDeleted);
        return new RollbackResult(trackId, target.name(), recordDeleted, blobsDeleted);
    }

    static FailureKind classify(Throwable e) {
        Throwable cause = e instanceof UncheckedIOException ? e.getCause() : e;
        if (cause instanceof AccessDeniedException) {
            return FailureKind.CONFIGURATION;
        }
        if (cause instanceof IOException
                || cause instanceof TransientDataAccessException
                || cause instanceof RecoverableDataAccessException
                || cause instanceof QueryTimeoutException
                || cause instanceof DataAccessResourceFailureException) {
            return FailureKind.TRANSIENT;
        }
        if (cause instanceof NonTransientDataAccessException || cause instanceof SecurityException) {
            return FailureKind.CONFIGURATION;
        }
        return FailureKind.TRANSIENT;
    }

    private boolean acquirePermit() {
        try {
            return permits.tryAcquire(settings.trackTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String describe(Throwable e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private PromotionOutcome success(String trackId, int filesCopied, boolean recordCreated, Instant promotionDate,
                                     ValidationVerdict verdict) {
        return PromotionOutcome.builder()
                .trackId(trackId)
                .sourceEnvironment(sourceEnvironment)
                .targetEnvironment(target.name())
                .success(true)
                .filesCopied(filesCopied)
                .recordCreated(recordCreated)
                .promotionDate(promotionDate)
                .validation(verdict)
                .build();
    }

    private PromotionOutcome failure(String trackId, FailureKind kind, String error, ValidationVerdict verdict) {
        return PromotionOutcome.builder()
                .trackId(trackId)
                .sourceEnvironment(sourceEnvironment)
                .targetEnvironment(target.name())
                .success(false)
                .failureKind(kind)
                .error(error)
                .validation(verdict)
                .build();
    }
}
