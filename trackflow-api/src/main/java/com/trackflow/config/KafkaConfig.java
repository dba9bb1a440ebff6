package com.trackflow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trackflow.error.IngestionRejectedException;
import com.trackflow.error.InvalidRequestException;
import com.trackflow.event.PromotionRequest;
import com.trackflow.event.UploadEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

@Configuration
@EnableKafka
@Slf4j
public class KafkaConfig {

    private static final long RETENTION_7_DAYS = 7L * 24 * 60 * 60 * 1000;

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:trackflow-api}")
    private String groupId;

    // Instants go over the wire as ISO-8601 strings
    @Bean
    public ObjectMapper kafkaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public KafkaAdmin kafkaAdmin() {
        Map<String, Object> props = new HashMap<>();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        return new KafkaAdmin(props);
    }

    @Bean
    public KafkaAdmin.NewTopics pipelineTopics(PipelineProperties properties) {
        PipelineProperties.Topics topics = properties.topics();
        return new KafkaAdmin.NewTopics(
                topic(topics.uploads(), 3),
                topic(topics.promotionRequests(), 1),
                topic(topics.promotionEvents(), 3),
                topic(topics.promotionBatches(), 1));
    }

    private static NewTopic topic(String name, int partitions) {
        return TopicBuilder.name(name)
                .partitions(partitions)
                .replicas(1)
                .config("retention.ms", String.valueOf(RETENTION_7_DAYS))
                .build();
    }

    // Producer configuration
    @Bean
    public ProducerFactory<String, Object> producerFactory(ObjectMapper kafkaObjectMapper) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        configProps.put(ProducerConfig.ACKS_CONFIG, "all");
        configProps.put(ProducerConfig.RETRIES_CONFIG, 3);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, 100);
        configProps.put(ProducerConfig.BATCH_SIZE_CONFIG, 32768);
        DefaultKafkaProducerFactory<String, Object> factory = new DefaultKafkaProducerFactory<>(configProps);
        JsonSerializer<Object> valueSerializer = new JsonSerializer<>(kafkaObjectMapper);
        valueSerializer.setAddTypeInfo(false);
        factory.setValueSerializer(valueSerializer);
        return factory;
    }

    @Bean
    public KafkaTemplate<String, Object> kafkaTemplate(ProducerFactory<String, Object> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    // Consumer configuration
    private <T> DefaultKafkaConsumerFactory<String, T> consumerFactory(Class<T> type, ObjectMapper kafkaObjectMapper) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, JsonDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        JsonDeserializer<T> valueDeserializer = new JsonDeserializer<>(type, kafkaObjectMapper);
        valueDeserializer.addTrustedPackages("*");
        valueDeserializer.setUseTypeHeaders(false);
        valueDeserializer.setRemoveTypeHeaders(false);
        valueDeserializer.setUseTypeMapperForKey(false);
        return new DefaultKafkaConsumerFactory<>(props, new StringDeserializer(), valueDeserializer);
    }

    /**
     * Redelivers failed upload events a few times before giving up. Rejected
     * uploads and malformed requests are never redelivered.
     */
    @Bean
    public DefaultErrorHandler pipelineErrorHandler() {
        DefaultErrorHandler handler = new DefaultErrorHandler(
                (record, e) -> log.error("Giving up on {} at offset {}: {}", record.topic(), record.offset(),
                        e.getMessage()),
                new FixedBackOff(2000L, 3));
        handler.addNotRetryableExceptions(IngestionRejectedException.class, InvalidRequestException.class);
        return handler;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, UploadEvent> uploadListenerContainerFactory(
            ObjectMapper kafkaObjectMapper, DefaultErrorHandler pipelineErrorHandler, PipelineProperties properties) {
        ConcurrentKafkaListenerContainerFactory<String, UploadEvent> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory(UploadEvent.class, kafkaObjectMapper));
        factory.setConcurrency(properties.ingestion().maxConcurrency());
        factory.setCommonErrorHandler(pipelineErrorHandler);
        return factory;
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, PromotionRequest> promotionRequestListenerContainerFactory(
            ObjectMapper kafkaObjectMapper, DefaultErrorHandler pipelineErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, PromotionRequest> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory(PromotionRequest.class, kafkaObjectMapper));
        factory.setConcurrency(1);
        factory.setCommonErrorHandler(pipelineErrorHandler);
        return factory;
    }
}
