package com.psyos.pipeline.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.domain.InboundJob;
import com.psyos.pipeline.infrastructure.JobTopics;
import com.psyos.pipeline.service.InboundProcessor;
import com.psyos.pipeline.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class InboundJobConsumer extends JobConsumerSupport<InboundJob> {

    private final InboundProcessor inboundProcessor;

    public InboundJobConsumer(ObjectMapper objectMapper, MetricsService metricsService,
                              InboundProcessor inboundProcessor) {
        super(objectMapper, metricsService, InboundJob.class);
        this.inboundProcessor = inboundProcessor;
        log.info("InboundJobConsumer initialized: topic={}", JobTopics.INBOUND);
    }

    @KafkaListener(
        topics = JobTopics.INBOUND,
        groupId = "${spring.kafka.consumer.group-id:clinical-pipeline}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        handle(record, acknowledgment, inboundProcessor::ingest);
    }
}
