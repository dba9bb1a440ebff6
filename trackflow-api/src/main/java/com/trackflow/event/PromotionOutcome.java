package com.trackflow.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trackflow.dto.ValidationVerdict;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Result of one promotion attempt, published to the promotion events topic.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromotionOutcome {

    private String trackId;
    private String sourceEnvironment;
    private String targetEnvironment;
    private boolean success;
    private int filesCopied;
    private boolean recordCreated;
    private Instant promotionDate;
    private FailureKind failureKind;
    private String error;
    private ValidationVerdict validation;

    public boolean isRetriable() {
        return !success && failureKind == FailureKind.TRANSIENT;
    }
}
