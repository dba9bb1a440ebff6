package com.trackflow.service;

import com.trackflow.dto.IngestionResult;
import com.trackflow.event.UploadEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

/**
 * Feeds upload notifications to {@link IngestionService}. Storage failures are
 * rethrown so the container redelivers the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UploadEventConsumer {

    private final IngestionService ingestionService;

    @KafkaListener(topics = "${pipeline.topics.uploads:track-upload-events}",
            containerFactory = "uploadListenerContainerFactory")
    public void consume(UploadEvent event) {
        if (event == null || event.getKey() == null || event.getArea() == null) {
            log.warn("Received null or invalid upload event: {}", event);
            return;
        }
        String key = IngestionService.decodeKey(event.getKey());
        IngestionResult result = ingestionService.ingest(event.getArea(), key);
        switch (result.status()) {
            case INGESTED -> log.info("Upload {} became track {}", key, result.trackId());
            case REJECTED -> log.warn("Upload {} rejected: {}", key, result.message());
            case SKIPPED -> log.debug("Upload {} skipped: {}", key, result.message());
        }
    }
}
