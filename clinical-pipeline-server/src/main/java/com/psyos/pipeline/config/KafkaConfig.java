package com.psyos.pipeline.config;

import com.psyos.pipeline.exception.ConfigurationException;
import com.psyos.pipeline.exception.IntegrityException;
import com.psyos.pipeline.exception.TenantScopeViolationException;
import com.psyos.pipeline.infrastructure.JobTopics;
import com.psyos.pipeline.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.*;
import org.springframework.kafka.listener.ConsumerRecordRecoverer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for the three pipeline job topics.
 *
 * Features:
 * - Idempotent producer, String payloads (JSON written by KafkaJobQueue)
 * - Manual acknowledgment once the processor returns
 * - Exponential backoff with a bounded number of attempts per job
 */
@Configuration
@EnableKafka
@Slf4j
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.kafka.consumer.group-id:clinical-pipeline}")
    private String consumerGroupId;

    @Value("${pipeline.jobs.concurrency:3}")
    private int concurrency;

    @Value("${pipeline.jobs.max-attempts:5}")
    private int maxAttempts;

    @Value("${pipeline.jobs.initial-backoff-ms:1000}")
    private long initialBackoffMs;

    @Value("${pipeline.jobs.partitions:3}")
    private int partitions;

    // ============================================
    // Topics
    // ============================================

    @Bean
    public NewTopic inboundTopic() {
        return TopicBuilder.name(JobTopics.INBOUND).partitions(partitions).build();
    }

    @Bean
    public NewTopic aiReplyTopic() {
        return TopicBuilder.name(JobTopics.AI_REPLY).partitions(partitions).build();
    }

    @Bean
    public NewTopic outboundTopic() {
        return TopicBuilder.name(JobTopics.OUTBOUND).partitions(partitions).build();
    }

    // ============================================
    // Producer Configuration
    // ============================================

    @Bean
    public ProducerFactory<String, String> producerFactory() {
        Map<String, Object> config = new HashMap<>();
        config.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        config.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        config.put(ProducerConfig.ACKS_CONFIG, "all");
        config.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        config.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
        config.put(ProducerConfig.LINGER_MS_CONFIG, 5);
        config.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);
        config.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);

        return new DefaultKafkaProducerFactory<>(config);
    }

    @Bean
    public KafkaTemplate<String, String> kafkaTemplate(ProducerFactory<String, String> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }

    // ============================================
    // Consumer Configuration
    // ============================================

    @Bean
    public ConsumerFactory<String, String> consumerFactory() {
        Map<String, Object> config = new HashMap<>();
        config.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        config.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroupId);
        config.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        config.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);

        config.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        config.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        config.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 50);
        // model calls and backoff both run inside the poll loop
        config.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, 300000);
        config.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        config.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);

        return new DefaultKafkaConsumerFactory<>(config);
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, String> kafkaListenerContainerFactory(
            ConsumerFactory<String, String> consumerFactory,
            DefaultErrorHandler jobErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ConcurrentKafkaListenerContainerFactory<>();

        factory.setConsumerFactory(consumerFactory);
        factory.setConcurrency(concurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL);
        factory.setCommonErrorHandler(jobErrorHandler);

        return factory;
    }

    @Bean
    public DefaultErrorHandler jobErrorHandler(MetricsService metricsService) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(Math.max(0, maxAttempts - 1));
        backOff.setInitialInterval(initialBackoffMs);
        backOff.setMultiplier(2.0);
        backOff.setMaxInterval(60000);

        ConsumerRecordRecoverer recoverer = (record, ex) -> {
            Header jobIdHeader = record.headers().lastHeader(JobTopics.JOB_ID_HEADER);
            String jobId = jobIdHeader != null ? new String(jobIdHeader.value(), StandardCharsets.UTF_8) : null;
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            log.error("Job failed permanently: topic={}, jobId={}, key={}, error={}",
                    record.topic(), jobId, record.key(), cause.getMessage());
            metricsService.recordJobFailed(record.topic(), cause.getClass().getSimpleName());
        };

        DefaultErrorHandler handler = new DefaultErrorHandler(recoverer, backOff);
        handler.addNotRetryableExceptions(
                ConfigurationException.class,
                IntegrityException.class,
                TenantScopeViolationException.class,
                IllegalArgumentException.class
        );
        handler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Job attempt failed: topic={}, key={}, attempt={}, error={}",
                        record.topic(), record.key(), deliveryAttempt, ex.getMessage()));
        return handler;
    }
}
