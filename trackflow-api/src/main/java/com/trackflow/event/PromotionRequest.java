package com.trackflow.event;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual promotion request, received over HTTP or from the request topic.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromotionRequest {

    public static final String PROMOTE_TRACK = "promote_track";
    public static final String BATCH_PROMOTION = "batch_promotion";
    public static final String VALIDATE_TRACK = "validate_track";
    public static final String SCAN_CANDIDATES = "scan_candidates";

    @JsonProperty("action")
    private String action;

    @JsonProperty("trackId")
    private String trackId;

    @JsonProperty("maxPromotions")
    private Integer maxPromotions;

    @JsonProperty("bypassAgeGate")
    private Boolean bypassAgeGate;

    @JsonProperty("requestedBy")
    private String requestedBy;

    public boolean bypassAgeGateRequested() {
        return Boolean.TRUE.equals(bypassAgeGate);
    }

    public static PromotionRequest promoteTrack(String trackId, boolean bypassAgeGate) {
        return new PromotionRequest(PROMOTE_TRACK, trackId, null, bypassAgeGate, null);
    }

    public static PromotionRequest batch(int maxPromotions) {
        return new PromotionRequest(BATCH_PROMOTION, null, maxPromotions, false, null);
    }
}
