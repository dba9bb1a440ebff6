package com.trackflow.config;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token buckets for the HTTP surface using Bucket4j.
 * Supports either per-IP buckets or a single global bucket, set through
 * {@code pipeline.rate-limit.*}.
 */
@Configuration
public class RateLimitConfig {

    private final int requestsPerSecond;
    private final boolean global;
    private final Bandwidth limit;
    private final Bucket globalBucket;

    // Per-IP buckets cache (used when scope is "ip")
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public RateLimitConfig(PipelineProperties properties) {
        PipelineProperties.RateLimit settings = properties.rateLimit();
        this.requestsPerSecond = settings.requestsPerSecond() > 0 ? settings.requestsPerSecond() : 5;
        this.global = "global".equals(settings.scope().toLowerCase(Locale.ROOT));
        this.limit = Bandwidth.builder()
                .capacity(requestsPerSecond)
                .refillGreedy(requestsPerSecond, Duration.ofSeconds(1))
                .build();
        this.globalBucket = Bucket.builder().addLimit(limit).build();
    }

    public Bucket resolveBucket(String clientIp) {
        if (global) {
            return globalBucket;
        }
        return buckets.computeIfAbsent(clientIp, ip -> Bucket.builder()
                .addLimit(limit)
                .build());
    }

    /**
     * Takes one token from the client's bucket. The probe tells whether it was
     * granted, how many are left and how long until the next refill.
     */
    public ConsumptionProbe consume(String clientIp) {
        return resolveBucket(clientIp).tryConsumeAndReturnRemaining(1);
    }

    public int getLimitCapacity() {
        return requestsPerSecond;
    }

    public String getWindowDescription() {
        return "1s";
    }
}
