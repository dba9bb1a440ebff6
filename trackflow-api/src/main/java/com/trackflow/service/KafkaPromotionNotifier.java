package com.trackflow.service;

import com.trackflow.config.ConditionalOnPromotion;
import com.trackflow.config.PipelineProperties;
import com.trackflow.dto.BatchSummary;
import com.trackflow.event.PromotionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnPromotion
@Slf4j
public class KafkaPromotionNotifier implements PromotionNotifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final PipelineProperties.Topics topics;

    public KafkaPromotionNotifier(KafkaTemplate<String, Object> kafkaTemplate, PipelineProperties properties) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = properties.topics();
    }

    /**
     * Publish a promotion outcome keyed by track id, asynchronously.
     */
    @Override
    public void publish(PromotionOutcome outcome) {
        send(topics.promotionEvents(), outcome.getTrackId(), outcome, "outcome for track " + outcome.getTrackId());
    }

    @Override
    public void publishBatch(BatchSummary summary) {
        send(topics.promotionBatches(), summary.getBatchId(), summary, "summary of batch " + summary.getBatchId());
    }

    private void send(String topic, String key, Object payload, String description) {
        try {
            Message<Object> message = MessageBuilder
                    .withPayload(payload)
                    .setHeader(KafkaHeaders.TOPIC, topic)
                    .setHeader(KafkaHeaders.KEY, key)
                    .build();

            kafkaTemplate.send(message).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish {}: {}", description, ex.getMessage());
                } else {
                    log.debug("Published {} with partition offset: {}", description,
                            result.getRecordMetadata().offset());
                }
            });
        } catch (Exception e) {
            log.error("Error publishing {}: {}", description, e.getMessage(), e);
        }
    }
}
