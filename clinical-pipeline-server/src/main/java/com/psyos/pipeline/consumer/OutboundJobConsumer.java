package com.psyos.pipeline.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.infrastructure.JobTopics;
import com.psyos.pipeline.service.MetricsService;
import com.psyos.pipeline.service.OutboundDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class OutboundJobConsumer extends JobConsumerSupport<OutboundJob> {

    private final OutboundDispatcher outboundDispatcher;

    public OutboundJobConsumer(ObjectMapper objectMapper, MetricsService metricsService,
                               OutboundDispatcher outboundDispatcher) {
        super(objectMapper, metricsService, OutboundJob.class);
        this.outboundDispatcher = outboundDispatcher;
        log.info("OutboundJobConsumer initialized: topic={}", JobTopics.OUTBOUND);
    }

    @KafkaListener(
        topics = JobTopics.OUTBOUND,
        groupId = "${spring.kafka.consumer.group-id:clinical-pipeline}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        handle(record, acknowledgment, outboundDispatcher::dispatch);
    }
}
