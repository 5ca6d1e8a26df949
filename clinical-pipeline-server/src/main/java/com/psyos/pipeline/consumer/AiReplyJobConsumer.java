package com.psyos.pipeline.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.infrastructure.JobTopics;
import com.psyos.pipeline.service.AiReplyProcessor;
import com.psyos.pipeline.service.MetricsService;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

@Service
@Slf4j
public class AiReplyJobConsumer extends JobConsumerSupport<AiReplyJob> {

    private final AiReplyProcessor aiReplyProcessor;

    public AiReplyJobConsumer(ObjectMapper objectMapper, MetricsService metricsService,
                              AiReplyProcessor aiReplyProcessor) {
        super(objectMapper, metricsService, AiReplyJob.class);
        this.aiReplyProcessor = aiReplyProcessor;
        log.info("AiReplyJobConsumer initialized: topic={}", JobTopics.AI_REPLY);
    }

    @KafkaListener(
        topics = JobTopics.AI_REPLY,
        groupId = "${spring.kafka.consumer.group-id:clinical-pipeline}",
        containerFactory = "kafkaListenerContainerFactory"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment acknowledgment) {
        handle(record, acknowledgment, aiReplyProcessor::generateReply);
    }
}
