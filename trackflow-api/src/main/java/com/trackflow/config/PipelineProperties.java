package com.trackflow.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.util.unit.DataSize;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Pipeline settings, bound once from {@code pipeline.*} at startup and handed to
 * components through their constructors.
 */
@ConfigurationProperties(prefix = "pipeline")
public record PipelineProperties(
        @DefaultValue("dev") String environment,
        @DefaultValue Storage storage,
        @DefaultValue Ingestion ingestion,
        @DefaultValue Enrichment enrichment,
        @DefaultValue Validation validation,
        @DefaultValue Promotion promotion,
        @DefaultValue Topics topics,
        @DefaultValue Reconciliation reconciliation,
        @DefaultValue RateLimit rateLimit) {

    public record Storage(
            @DefaultValue("uploads") String uploadArea,
            @DefaultValue("./data/uploads") Path uploadDir,
            @DefaultValue("media") String mediaArea,
            @DefaultValue("./data/media") Path mediaDir,
            @DefaultValue("http://localhost:8080/media") String mediaBaseUrl) {
    }

    public record Ingestion(
            @DefaultValue("audio/") String uploadPrefix,
            @DefaultValue({".mp3", ".wav", ".flac", ".m4a", ".aac", ".ogg"}) List<String> supportedExtensions,
            @DefaultValue("1KB") DataSize minSize,
            @DefaultValue("100MB") DataSize maxSize,
            @DefaultValue("1024") int scanBytes,
            @DefaultValue("2") int maxConcurrency,
            @DefaultValue("30s") Duration acquireTimeout) {
    }

    public record Enrichment(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("4") int threads) {
    }

    public record Validation(
            @DefaultValue("24h") Duration minSoak,
            @DefaultValue("true") boolean manualAgeGateBypass,
            @DefaultValue("1") int minDurationSeconds,
            @DefaultValue("600") int maxDurationSeconds,
            @DefaultValue("10KB") DataSize minFileSize,
            @DefaultValue("50MB") DataSize maxFileSize) {
    }

    public record Promotion(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("prod") String targetEnvironment,
            @DefaultValue("10") int maxPromotions,
            @DefaultValue("0 0 */6 * * *") String scheduleCron,
            @DefaultValue("2") int maxConcurrency,
            @DefaultValue("3") int retryBudget,
            @DefaultValue("15m") Duration trackTimeout,
            @DefaultValue("15m") Duration batchTimeout,
            @DefaultValue Target target) {
    }

    public record Target(
            @DefaultValue("prod-media") String mediaArea,
            @DefaultValue("./data/prod-media") Path mediaDir,
            @DefaultValue("http://localhost:8080/prod-media") String mediaBaseUrl,
            String jdbcUrl,
            String username,
            String password,
            @DefaultValue("5m") Duration queryTimeout) {
    }

    public record Topics(
            @DefaultValue("track-upload-events") String uploads,
            @DefaultValue("track-promotion-requests") String promotionRequests,
            @DefaultValue("track-promotion-events") String promotionEvents,
            @DefaultValue("track-promotion-batches") String promotionBatches) {
    }

    public record Reconciliation(
            @DefaultValue("1h") Duration gracePeriod,
            @DefaultValue("false") boolean deleteOrphans,
            @DefaultValue("0 30 * * * *") String cron) {
    }

    public record RateLimit(
            @DefaultValue("5") int requestsPerSecond,
            @DefaultValue("ip") String scope) {
    }
}
