package com.psyos.pipeline.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.infrastructure.JobTopics;
import com.psyos.pipeline.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Shared handling for job listeners: decode, process, acknowledge.
 *
 * Exceptions from the processor are rethrown unchanged; the container's error handler
 * decides between retry and terminal failure from their type.
 */
@Slf4j
abstract class JobConsumerSupport<T> {

    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final Class<T> jobType;

    protected JobConsumerSupport(ObjectMapper objectMapper, MetricsService metricsService, Class<T> jobType) {
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.jobType = jobType;
    }

    protected void handle(ConsumerRecord<String, String> record, Acknowledgment acknowledgment, Consumer<T> processor) {
        String jobId = jobId(record);
        T job = decode(record);
        MetricsService.TimerSample timer = metricsService.startTimer();

        log.debug("Job started: topic={}, jobId={}, job={}", record.topic(), jobId, job);
        processor.accept(job);

        acknowledgment.acknowledge();
        metricsService.recordJobProcessed(record.topic(), timer.stop());
        log.debug("Job completed: topic={}, jobId={}", record.topic(), jobId);
    }

    private T decode(ConsumerRecord<String, String> record) {
        try {
            return objectMapper.readValue(record.value(), jobType);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed " + jobType.getSimpleName() + " on topic " + record.topic(), e);
        }
    }

    static String jobId(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(JobTopics.JOB_ID_HEADER);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
