package com.trackflow.controller;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.dto.InvocationResponse;
import com.trackflow.dto.RollbackResult;
import com.trackflow.event.PromotionRequest;
import com.trackflow.model.PromotionAuditEntry;
import com.trackflow.service.PromotionAuditService;
import com.trackflow.service.PromotionRequestHandler;
import com.trackflow.service.PromotionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Manual promotion surface. Exists only in environments that promote.
 */
@RestController
@RequestMapping("/api/promotion")
@ConditionalOnPromotion
@RequiredArgsConstructor
@CrossOrigin(origins = { "http://localhost:3000", "http://localhost:5173" })
@Slf4j
public class PromotionController {

    private final PromotionRequestHandler requestHandler;
    private final PromotionService promotionService;
    private final PromotionAuditService auditService;

    @PostMapping
    public ResponseEntity<Object> invoke(@RequestBody PromotionRequest request) {
        log.info("POST /api/promotion - action: {}, trackId: {}", request.getAction(), request.getTrackId());
        InvocationResponse response = requestHandler.handle(request);
        return ResponseEntity.status(response.statusCode()).body(response.body());
    }

    @DeleteMapping("/{trackId}")
    public ResponseEntity<RollbackResult> rollback(@PathVariable String trackId) {
        log.info("DELETE /api/promotion/{}", trackId);
        RollbackResult result = promotionService.rollback(trackId);
        if (!result.recordDeleted() && result.blobsDeleted() == 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{trackId}/history")
    public ResponseEntity<List<PromotionAuditEntry>> history(@PathVariable String trackId) {
        log.info("GET /api/promotion/{}/history", trackId);
        return ResponseEntity.ok(auditService.history(trackId));
    }
}
