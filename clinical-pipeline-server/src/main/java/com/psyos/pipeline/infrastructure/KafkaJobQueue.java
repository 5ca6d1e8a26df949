package com.psyos.pipeline.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.InboundJob;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.exception.JobEnqueueException;
import com.psyos.pipeline.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka-backed job queue.
 *
 * Records are keyed by conversation (or by tenant and sender for inbound jobs) so that
 * jobs of one conversation land on one partition. Each send waits for the broker
 * acknowledgment, bounded by {@code pipeline.jobs.enqueue-timeout-ms}, and a failure
 * surfaces as {@link JobEnqueueException} so that the job which produced it is retried.
 * Callers never wait for the enqueued job to be processed.
 */
@Component
@Slf4j
public class KafkaJobQueue implements JobQueue {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final long enqueueTimeoutMs;

    public KafkaJobQueue(KafkaTemplate<String, String> kafkaTemplate,
                         ObjectMapper objectMapper,
                         MetricsService metricsService,
                         @Value("${pipeline.jobs.enqueue-timeout-ms:5000}") long enqueueTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.enqueueTimeoutMs = enqueueTimeoutMs;
    }

    @Override
    public String enqueueInbound(InboundJob job) {
        return publish(JobTopics.INBOUND, job.getTenantId() + ":" + job.getFromPhone(), job);
    }

    @Override
    public String enqueueAiReply(AiReplyJob job) {
        return publish(JobTopics.AI_REPLY, job.getTenantId() + ":" + job.getConversationId(), job);
    }

    @Override
    public String enqueueOutbound(OutboundJob job) {
        return publish(JobTopics.OUTBOUND, job.getTenantId() + ":" + job.getConversationId(), job);
    }

    private String publish(String topic, String key, Object job) {
        String jobId = UUID.randomUUID().toString();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Job payload is not serializable for topic " + topic, e);
        }

        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, payload);
        record.headers().add(JobTopics.JOB_ID_HEADER, jobId.getBytes(StandardCharsets.UTF_8));

        SendResult<String, String> result;
        try {
            result = kafkaTemplate.send(record).get(enqueueTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw enqueueFailed(topic, jobId, e);
        } catch (ExecutionException e) {
            throw enqueueFailed(topic, jobId, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            throw enqueueFailed(topic, jobId, e);
        }

        log.debug("Job enqueued: topic={}, jobId={}, partition={}, offset={}",
                topic, jobId,
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
        metricsService.recordJobEnqueued(topic);
        return jobId;
    }

    private JobEnqueueException enqueueFailed(String topic, String jobId, Throwable cause) {
        log.error("Failed to enqueue job: topic={}, jobId={}, error={}", topic, jobId, cause.toString());
        metricsService.recordError("JOB_ENQUEUE_ERROR", topic);
        return new JobEnqueueException("Job was not acknowledged on topic " + topic, cause);
    }
}
