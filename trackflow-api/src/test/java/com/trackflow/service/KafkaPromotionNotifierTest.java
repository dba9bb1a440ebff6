package com.trackflow.service;

import com.trackflow.dto.BatchSummary;
import com.trackflow.event.PromotionOutcome;
import com.trackflow.support.PipelineFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.kafka.support.SendResult;
import org.springframework.messaging.Message;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

class KafkaPromotionNotifierTest {

    private KafkaTemplate<String, Object> kafkaTemplate;
    private KafkaPromotionNotifier notifier;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        notifier = new KafkaPromotionNotifier(kafkaTemplate,
                PipelineFixtures.defaults(Path.of("uploads"), Path.of("media")));
    }

    @Test
    @DisplayName("outcomes go to the promotion events topic keyed by track id")
    @SuppressWarnings("unchecked")
    void publishesOutcome() {
        when(kafkaTemplate.send(any(Message.class))).thenReturn(new CompletableFuture<SendResult<String, Object>>());
        PromotionOutcome outcome = PromotionOutcome.builder().trackId("t1").success(true).build();

        notifier.publish(outcome);

        ArgumentCaptor<Message<?>> captor = ArgumentCaptor.forClass(Message.class);
        verify(kafkaTemplate).send(captor.capture());
        Message<?> message = captor.getValue();
        assertThat(message.getPayload()).isSameAs(outcome);
        assertThat(message.getHeaders().get(KafkaHeaders.TOPIC)).isEqualTo("track-promotion-events");
        assertThat(message.getHeaders().get(KafkaHeaders.KEY)).isEqualTo("t1");
    }

    @Test
    @DisplayName("batch summaries go to the batch topic keyed by batch id")
    @SuppressWarnings("unchecked")
    void publishesBatch() {
        when(kafkaTemplate.send(any(Message.class))).thenReturn(new CompletableFuture<SendResult<String, Object>>());

        notifier.publishBatch(BatchSummary.builder().batchId("b1").build());

        ArgumentCaptor<Message<?>> captor = ArgumentCaptor.forClass(Message.class);
        verify(kafkaTemplate).send(captor.capture());
        assertThat(captor.getValue().getHeaders().get(KafkaHeaders.TOPIC)).isEqualTo("track-promotion-batches");
        assertThat(captor.getValue().getHeaders().get(KafkaHeaders.KEY)).isEqualTo("b1");
    }

    @Test
    @DisplayName("a broker failure is logged, never thrown")
    @SuppressWarnings("unchecked")
    void brokerFailureContained() {
        when(kafkaTemplate.send(any(Message.class))).thenThrow(new IllegalStateException("no broker"));

        assertThatCode(() -> notifier.publish(PromotionOutcome.builder().trackId("t1").build()))
                .doesNotThrowAnyException();
    }
}
