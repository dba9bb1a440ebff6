package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.dto.BatchSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnPromotion
@Slf4j
public class PromotionScheduler {

    public static final String TRIGGER = "scheduled";

    private final PromotionOrchestrator orchestrator;
    private final int maxPromotions;

    public PromotionScheduler(PromotionOrchestrator orchestrator, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.maxPromotions = properties.promotion().maxPromotions();
    }

    @Scheduled(cron = "${pipeline.promotion.schedule-cron:0 0 */6 * * *}")
    public void runScheduledBatch() {
        try {
            BatchSummary summary = orchestrator.runBatch(maxPromotions, TRIGGER);
            log.info("Scheduled promotion batch {} finished with status {}", summary.getBatchId(), summary.getStatus());
        } catch (RuntimeException e) {
            log.error("Scheduled promotion batch failed: {}", e.getMessage(), e);
        }
    }
}
