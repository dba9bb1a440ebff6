package com.trackflow.service;

import com.trackflow.config.PipelineProperties;
import com.trackflow.event.TrackIngestedEvent;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs enrichment in the background for every ingested track, so the ingestion
 * path never waits on audio decoding.
 */
@Component
@ConditionalOnProperty(prefix = "pipeline.enrichment", name = "enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class EnrichmentDispatcher {

    private final EnrichmentService enrichmentService;
    private final ExecutorService executor;

    public EnrichmentDispatcher(EnrichmentService enrichmentService, PipelineProperties properties) {
        this.enrichmentService = enrichmentService;
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.enrichment().threads()));
    }

    @EventListener
    public void onTrackIngested(TrackIngestedEvent event) {
        executor.submit(() -> {
            try {
                enrichmentService.enrich(event.trackId(), event.blobKey());
            } catch (Exception e) {
                // The record stays processed and can be enriched again by hand
                log.error("[Enrichment] Failed for track {}: {}", event.trackId(), e.getMessage(), e);
            }
        });
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down enrichment executor");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
