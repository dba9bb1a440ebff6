package com.trackflow.controller;

import com.trackflow.config.PipelineProperties;
import com.trackflow.config.StorageConfig;
import com.trackflow.dto.IngestionResult;
import com.trackflow.dto.OrphanReport;
import com.trackflow.dto.TrackDTO;
import com.trackflow.dto.UploadResponse;
import com.trackflow.error.IngestionException;
import com.trackflow.error.IngestionRejectedException;
import com.trackflow.error.InvalidRequestException;
import com.trackflow.model.TrackRecord;
import com.trackflow.model.TrackStatus;
import com.trackflow.service.EnrichmentService;
import com.trackflow.service.IngestionService;
import com.trackflow.service.OrphanReconciler;
import com.trackflow.service.TrackService;
import com.trackflow.storage.BlobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/tracks")
@CrossOrigin(origins = { "http://localhost:3000", "http://localhost:5173" })
@Slf4j
public class TrackController {

    private final TrackService trackService;
    private final IngestionService ingestionService;
    private final EnrichmentService enrichmentService;
    private final OrphanReconciler orphanReconciler;
    private final BlobStore uploadStore;
    private final PipelineProperties properties;

    public TrackController(TrackService trackService,
                           IngestionService ingestionService,
                           EnrichmentService enrichmentService,
                           OrphanReconciler orphanReconciler,
                           @Qualifier(StorageConfig.UPLOAD_STORE) BlobStore uploadStore,
                           PipelineProperties properties) {
        this.trackService = trackService;
        this.ingestionService = ingestionService;
        this.enrichmentService = enrichmentService;
        this.orphanReconciler = orphanReconciler;
        this.uploadStore = uploadStore;
        this.properties = properties;
    }

    @GetMapping
    public ResponseEntity<Page<TrackDTO>> getTracks(
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String genre,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        log.info("GET /api/tracks - status: {}, genre: {}, page: {}, size: {}", status, genre, page, size);
        Pageable pageable = PageRequest.of(page, size);
        return ResponseEntity.ok(trackService.getTracks(parseStatus(status), genre, pageable));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TrackDTO> getTrack(@PathVariable String id) {
        log.info("GET /api/tracks/{}", id);
        return trackService.getTrack(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/upload")
    public ResponseEntity<UploadResponse> uploadTrack(@RequestParam("file") MultipartFile file) {
        String filename = StringUtils.getFilename(file.getOriginalFilename());
        log.info("POST /api/tracks/upload - file: {}, size: {}", filename, file.getSize());
        if (filename == null || filename.isBlank() || file.isEmpty()) {
            throw new InvalidRequestException("A non-empty file with a name is required", "FILE_REQUIRED");
        }
        if (!ingestionService.isSupported(filename)) {
            throw new InvalidRequestException("Unsupported file type: " + filename, "UNSUPPORTED_TYPE");
        }

        String key = properties.ingestion().uploadPrefix() + filename;
        try (InputStream in = file.getInputStream()) {
            uploadStore.put(key, in);
        } catch (IOException e) {
            throw new IngestionException("Could not store upload " + filename, e);
        }

        IngestionResult result = ingestionService.ingest(uploadStore.area(), key);
        if (result.status() != IngestionResult.Status.INGESTED) {
            throw new IngestionRejectedException(key, result.message());
        }
        TrackRecord record = result.record();
        UploadResponse response = new UploadResponse(record.getId(), record.getStatus().value(),
                "File uploaded and ingested", record.getFileUrl());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PostMapping("/{id}/enrich")
    public ResponseEntity<TrackDTO> enrichTrack(@PathVariable String id) {
        log.info("POST /api/tracks/{}/enrich", id);
        enrichmentService.enrich(id);
        return trackService.getTrack(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/reject")
    public ResponseEntity<TrackDTO> rejectTrack(@PathVariable String id,
                                                @RequestParam(required = false) String reason) {
        log.info("POST /api/tracks/{}/reject", id);
        return ResponseEntity.ok(trackService.reject(id, reason));
    }

    @GetMapping("/orphans")
    public ResponseEntity<OrphanReport> findOrphans() {
        log.info("GET /api/tracks/orphans");
        return ResponseEntity.ok(orphanReconciler.findOrphans());
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("environment", properties.environment());
        body.put("promotionEnabled", properties.promotion().enabled());
        body.put("enrichmentEnabled", properties.enrichment().enabled());
        return ResponseEntity.ok(body);
    }

    private static TrackStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return TrackStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(e.getMessage(), "INVALID_STATUS");
        }
    }
}
