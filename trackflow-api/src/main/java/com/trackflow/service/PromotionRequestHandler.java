package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.dto.BatchSummary;
import com.trackflow.dto.InvocationResponse;
import com.trackflow.dto.PromotionCandidate;
import com.trackflow.dto.PromotionResponse;
import com.trackflow.dto.ValidationVerdict;
import com.trackflow.error.TrackNotFoundException;
import com.trackflow.event.PromotionOutcome;
import com.trackflow.event.PromotionRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes manual promotion requests and maps the result to a status code,
 * whichever transport the request came in on.
 */
@Component
@ConditionalOnPromotion
@Slf4j
public class PromotionRequestHandler {

    public static final List<String> SUPPORTED_ACTIONS = List.of(
            PromotionRequest.PROMOTE_TRACK,
            PromotionRequest.BATCH_PROMOTION,
            PromotionRequest.VALIDATE_TRACK,
            PromotionRequest.SCAN_CANDIDATES);

    static final String MANUAL_TRIGGER = "manual";

    private final PromotionOrchestrator orchestrator;
    private final int defaultMaxPromotions;

    public PromotionRequestHandler(PromotionOrchestrator orchestrator, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.defaultMaxPromotions = properties.promotion().maxPromotions();
    }

    public InvocationResponse handle(PromotionRequest request) {
        if (request == null || request.getAction() == null || request.getAction().isBlank()) {
            return badRequest("action is required");
        }
        log.info("Promotion request '{}' for track {} by {}", request.getAction(), request.getTrackId(),
                request.getRequestedBy() == null ? "anonymous" : request.getRequestedBy());

        return switch (request.getAction()) {
            case PromotionRequest.PROMOTE_TRACK -> promoteTrack(request);
            case PromotionRequest.BATCH_PROMOTION -> batch(request);
            case PromotionRequest.VALIDATE_TRACK -> validateTrack(request);
            case PromotionRequest.SCAN_CANDIDATES -> scanCandidates();
            default -> badRequest("Unknown action: " + request.getAction());
        };
    }

    private InvocationResponse promoteTrack(PromotionRequest request) {
        if (isBlank(request.getTrackId())) {
            return badRequest("trackId is required for " + PromotionRequest.PROMOTE_TRACK);
        }
        PromotionOutcome outcome = orchestrator.promoteTrack(request.getTrackId(), request.bypassAgeGateRequested());
        if (outcome.isSuccess()) {
            String message = outcome.isRecordCreated() ? "Track promoted successfully" : "Track already promoted";
            return InvocationResponse.ok(PromotionResponse.from(message, outcome));
        }
        int status = switch (outcome.getFailureKind()) {
            case NOT_FOUND -> 404;
            case VALIDATION -> 400;
            case TRANSIENT -> 503;
            case CONFIGURATION -> 500;
        };
        return new InvocationResponse(status, PromotionResponse.from("Promotion failed", outcome));
    }

    private InvocationResponse batch(PromotionRequest request) {
        int max = request.getMaxPromotions() != null && request.getMaxPromotions() > 0
                ? request.getMaxPromotions()
                : defaultMaxPromotions;
        BatchSummary summary = orchestrator.runBatch(max, MANUAL_TRIGGER);
        return InvocationResponse.ok(summary);
    }

    private InvocationResponse validateTrack(PromotionRequest request) {
        String trackId = request.getTrackId();
        if (isBlank(trackId)) {
            return badRequest("trackId is required for " + PromotionRequest.VALIDATE_TRACK);
        }
        ValidationVerdict verdict;
        try {
            verdict = orchestrator.validateTrack(trackId, request.bypassAgeGateRequested());
        } catch (TrackNotFoundException e) {
            return new InvocationResponse(404, error(e.getMessage()));
        } catch (UncheckedIOException e) {
            log.error("Validation of track {} could not reach media: {}", trackId, e.getMessage());
            return new InvocationResponse(503, error("Media temporarily unavailable"));
        }
        PromotionResponse body = new PromotionResponse();
        body.setTrackId(trackId);
        body.setValidation(verdict);
        if (verdict.valid()) {
            body.setMessage("Validation passed, ready for promotion");
            return InvocationResponse.ok(body);
        }
        body.setMessage("Validation failed");
        body.setError("Failed checks: " + verdict.failedChecks());
        return new InvocationResponse(400, body);
    }

    private InvocationResponse scanCandidates() {
        List<PromotionCandidate> candidates = orchestrator.scanCandidates();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", candidates.size());
        body.put("candidates", candidates);
        return InvocationResponse.ok(body);
    }

    private static InvocationResponse badRequest(String message) {
        Map<String, Object> body = error(message);
        body.put("supportedActions", SUPPORTED_ACTIONS);
        return new InvocationResponse(400, body);
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        return body;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
