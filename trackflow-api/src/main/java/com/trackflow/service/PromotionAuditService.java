package com.trackflow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.event.PromotionOutcome;
import com.trackflow.model.PromotionAuditEntry;
import com.trackflow.repository.PromotionAuditRepository;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Keeps a durable trail of promotion outcomes: one JSON line on the audit logger
 * and one row in {@code promotion_audit}. Audit failures are logged and never
 * fail the promotion.
 */
@Service
@ConditionalOnPromotion
@Slf4j
public class PromotionAuditService {

    private static final Logger AUDIT = LoggerFactory.getLogger("trackflow.promotion.audit");
    private static final int MAX_ERROR_LENGTH = 2000;

    private final PromotionAuditRepository auditRepository;
    private final ObjectMapper objectMapper;

    public PromotionAuditService(PromotionAuditRepository auditRepository, ObjectMapper kafkaObjectMapper) {
        this.auditRepository = auditRepository;
        this.objectMapper = kafkaObjectMapper;
    }

    public void record(PromotionOutcome outcome) {
        try {
            AUDIT.info(objectMapper.writeValueAsString(outcome));
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize audit line for track {}", outcome.getTrackId(), e);
            AUDIT.info("{}", outcome);
        }

        try {
            auditRepository.save(toEntry(outcome));
        } catch (RuntimeException e) {
            log.error("Could not store audit entry for track {}: {}", outcome.getTrackId(), e.getMessage(), e);
        }
    }

    public List<PromotionAuditEntry> history(String trackId) {
        return auditRepository.findByTrackIdOrderByRecordedAtDesc(trackId);
    }

    private static PromotionAuditEntry toEntry(PromotionOutcome outcome) {
        PromotionAuditEntry entry = new PromotionAuditEntry();
        entry.setTrackId(outcome.getTrackId());
        entry.setSourceEnvironment(outcome.getSourceEnvironment());
        entry.setTargetEnvironment(outcome.getTargetEnvironment());
        entry.setSuccess(outcome.isSuccess());
        entry.setFilesCopied(outcome.getFilesCopied());
        entry.setRecordCreated(outcome.isRecordCreated());
        entry.setFailureKind(outcome.getFailureKind() == null ? null : outcome.getFailureKind().name());
        String error = outcome.getError();
        entry.setError(error != null && error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error);
        entry.setPromotionDate(outcome.getPromotionDate());
        return entry;
    }
}
