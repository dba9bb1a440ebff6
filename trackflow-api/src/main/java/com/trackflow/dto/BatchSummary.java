package com.trackflow.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trackflow.event.PromotionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchSummary {

    public enum Status {
        SUCCESS,
        PARTIAL,
        FAILED,
        EMPTY
    }

    private String batchId;
    private String trigger;
    private String sourceEnvironment;
    private String targetEnvironment;
    private Instant startTime;
    private Instant endTime;
    private int maxPromotions;
    private int scanned;
    private int eligible;
    private int promoted;
    private int alreadyPromoted;
    private int failed;
    private int retriesUsed;
    private Status status;
    private String error;
    @Builder.Default
    private List<PromotionOutcome> outcomes = new ArrayList<>();

    public static Status statusOf(int succeeded, int failed) {
        if (succeeded == 0 && failed == 0) {
            return Status.EMPTY;
        }
        if (failed == 0) {
            return Status.SUCCESS;
        }
        return succeeded > 0 ? Status.PARTIAL : Status.FAILED;
    }
}
