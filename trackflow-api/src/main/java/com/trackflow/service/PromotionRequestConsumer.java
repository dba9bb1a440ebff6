package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.dto.InvocationResponse;
import com.trackflow.event.PromotionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnPromotion
@RequiredArgsConstructor
@Slf4j
public class PromotionRequestConsumer {

    private final PromotionRequestHandler requestHandler;

    @KafkaListener(topics = "${pipeline.topics.promotion-requests:track-promotion-requests}",
            containerFactory = "promotionRequestListenerContainerFactory")
    public void consume(PromotionRequest request) {
        if (request == null) {
            log.warn("Received null promotion request");
            return;
        }
        InvocationResponse response = requestHandler.handle(request);
        if (response.isSuccess()) {
            log.info("Promotion request '{}' completed with {}", request.getAction(), response.statusCode());
        } else {
            log.warn("Promotion request '{}' for track {} returned {}: {}", request.getAction(), request.getTrackId(),
                    response.statusCode(), response.body());
        }
    }
}
