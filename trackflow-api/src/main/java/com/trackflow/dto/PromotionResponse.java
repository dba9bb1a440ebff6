package com.trackflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trackflow.event.FailureKind;
import com.trackflow.event.PromotionOutcome;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body returned to a caller of a single-track action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PromotionResponse {

    private String message;
    private String trackId;
    private ValidationVerdict validation;
    private Promotion promotion;
    private FailureKind failureKind;
    private String error;

    public record Promotion(int filesCopied, boolean recordCreated, Instant promotionDate) {
    }

    public static PromotionResponse from(String message, PromotionOutcome outcome) {
        Promotion promotion = outcome.isSuccess()
                ? new Promotion(outcome.getFilesCopied(), outcome.isRecordCreated(), outcome.getPromotionDate())
                : null;
        return new PromotionResponse(message, outcome.getTrackId(), outcome.getValidation(), promotion,
                outcome.getFailureKind(), outcome.getError());
    }
}
