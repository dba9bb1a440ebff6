package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.dto.BatchSummary;
import com.trackflow.dto.PromotionCandidate;
import com.trackflow.dto.ValidationVerdict;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.event.PromotionOutcome;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.repository.TrackStore;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Selects and promotes tracks, either as a batch of the oldest eligible tracks
 * or one at a time on request.
 */
@Service
@ConditionalOnPromotion
@Slf4j
public class PromotionOrchestrator {

    private final TrackStore trackStore;
    private final TrackValidator validator;
    private final PromotionService promotionService;
    private final PromotionNotifier notifier;
    private final Clock clock;
    private final PipelineProperties.Promotion settings;
    private final ExecutorService executor;

    public PromotionOrchestrator(TrackStore trackStore,
                                 TrackValidator validator,
                                 PromotionService promotionService,
                                 PromotionNotifier notifier,
                                 Clock clock,
                                 PipelineProperties properties) {
        this.trackStore = trackStore;
        this.validator = validator;
        this.promotionService = promotionService;
        this.notifier = notifier;
        this.clock = clock;
        this.settings = properties.promotion();
        this.executor = Executors.newFixedThreadPool(Math.max(1, settings.maxConcurrency()));
    }

    /**
     * Promotes up to {@code maxPromotions} of the oldest tracks that pass every
     * check other than the soak time. Each is then promoted with the age gate
     * enforced. One track failing never affects the others.
     */
    public BatchSummary runBatch(int maxPromotions, String trigger) {
        String batchId = UUID.randomUUID().toString();
        Instant start = clock.instant();
        log.info("[Batch {}] Starting {} batch, max {} promotions", batchId, trigger, maxPromotions);

        BatchSummary summary = BatchSummary.builder()
                .batchId(batchId)
                .trigger(trigger)
                .sourceEnvironment(promotionService.sourceEnvironment())
                .targetEnvironment(promotionService.targetEnvironment())
                .startTime(start)
                .maxPromotions(maxPromotions)
                .build();

        List<TrackRecord> scanned;
        try {
            scanned = trackStore.findByStatusIn(TrackStatus.PROMOTABLE);
        } catch (RuntimeException e) {
            log.error("[Batch {}] Candidate scan failed: {}", batchId, e.getMessage(), e);
            summary.setStatus(BatchSummary.Status.FAILED);
            summary.setError("Candidate scan failed: " + e.getMessage());
            summary.setEndTime(clock.instant());
            notifier.publishBatch(summary);
            return summary;
        }

        List<TrackRecord> selected = scanned.stream()
                .sorted(Comparator.comparing(TrackRecord::getCreatedDate))
                .filter(this::isEligible)
                .limit(Math.max(0, maxPromotions))
                .toList();
        summary.setScanned(scanned.size());
        summary.setEligible(selected.size());
        log.info("[Batch {}] {} scanned, {} selected", batchId, scanned.size(), selected.size());

        AtomicInteger retryBudget = new AtomicInteger(Math.max(0, settings.retryBudget()));
        List<Future<PromotionOutcome>> futures = new ArrayList<>();
        for (TrackRecord record : selected) {
            futures.add(executor.submit(() -> promoteWithRetry(record.getId(), retryBudget)));
        }

        Instant deadline = start.plus(settings.batchTimeout());
        List<PromotionOutcome> outcomes = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            outcomes.add(await(batchId, selected.get(i).getId(), futures.get(i), deadline));
        }

        int promoted = 0;
        int alreadyPromoted = 0;
        int failed = 0;
        for (PromotionOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                failed++;
            } else if (outcome.isRecordCreated()) {
                promoted++;
            } else {
                alreadyPromoted++;
            }
        }
        summary.setOutcomes(outcomes);
        summary.setPromoted(promoted);
        summary.setAlreadyPromoted(alreadyPromoted);
        summary.setFailed(failed);
        summary.setRetriesUsed(Math.max(0, settings.retryBudget()) - retryBudget.get());
        summary.setStatus(BatchSummary.statusOf(promoted + alreadyPromoted, failed));
        summary.setEndTime(clock.instant());

        log.info("[Batch {}] Finished {}: promoted={}, alreadyPromoted={}, failed={}, took {} ms", batchId,
                summary.getStatus(), promoted, alreadyPromoted, failed,
                Duration.between(start, summary.getEndTime()).toMillis());
        notifier.publishBatch(summary);
        return summary;
    }

    private boolean isEligible(TrackRecord record) {
        try {
            return validator.passesNonBypassableChecks(record);
        } catch (UncheckedIOException e) {
            log.warn("Skipping track {} this round, media lookup failed: {}", record.getId(), e.getMessage());
            return false;
        }
    }

    private PromotionOutcome promoteWithRetry(String trackId, AtomicInteger retryBudget) {
        PromotionOutcome outcome = promotionService.promote(trackId, AgeGate.ENFORCED);
        while (outcome.isRetriable() && takeRetry(retryBudget)) {
            log.info("Retrying track {} after transient failure: {}", trackId, outcome.getError());
            outcome = promotionService.promote(trackId, AgeGate.ENFORCED);
        }
        return outcome;
    }

    private static boolean takeRetry(AtomicInteger budget) {
        return budget.getAndUpdate(b -> b > 0 ? b - 1 : 0) > 0;
    }

    private PromotionOutcome await(String batchId, String trackId, Future<PromotionOutcome> future, Instant deadline) {
        long remaining = Math.max(0, Duration.between(clock.instant(), deadline).toMillis());
        try {
            return future.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Batch {}] Abandoned track {} at batch timeout", batchId, trackId);
            return promotionService.abandon(trackId, "Not finished within batch timeout " + settings.batchTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Batch {}] Track {} failed unexpectedly", batchId, trackId, cause);
            return promotionService.abandon(trackId, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return promotionService.abandon(trackId, "Interrupted");
        }
    }

    public PromotionOutcome promoteTrack(String trackId, boolean bypassAgeGate) {
        return promotionService.promote(trackId, bypassAgeGate ? AgeGate.BYPASSED : AgeGate.ENFORCED);
    }

    /**
     * @throws TrackNotFoundException if the track does not exist here
     */
    public ValidationVerdict validateTrack(String trackId, boolean bypassAgeGate) {
        TrackRecord record = trackStore.findById(trackId).orElseThrow(() -> new TrackNotFoundException(trackId));
        return validator.validate(record, bypassAgeGate ? AgeGate.BYPASSED : AgeGate.ENFORCED);
    }

    /**
     * Tracks a batch could pick right now, oldest first, ignoring the batch size.
     */
    public List<PromotionCandidate> scanCandidates() {
        Instant now = clock.instant();
        return trackStore.findByStatusIn(TrackStatus.PROMOTABLE).stream()
                .sorted(Comparator.comparing(TrackRecord::getCreatedDate))
                .filter(this::isEligible)
                .map(record -> PromotionCandidate.of(record, now))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
    }
}
