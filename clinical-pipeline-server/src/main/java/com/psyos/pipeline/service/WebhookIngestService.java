package com.psyos.pipeline.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.psyos.pipeline.domain.InboundJob;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageSource;
import com.psyos.pipeline.infrastructure.JobQueue;
import com.psyos.pipeline.infrastructure.WebhookPayloadAdapter;
import com.psyos.pipeline.infrastructure.WebhookPayloadAdapter.InboundWebhookMessage;
import com.psyos.pipeline.repository.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Turns an authenticated channel webhook into an inbound job.
 *
 * Payloads without text, id or sender are acknowledged and dropped. A message already
 * stored and answered under the same provider id is not enqueued again; one still
 * waiting for its AI reply goes back to the inbound stage, which queues the reply job.
 */
@Service
@Slf4j
public class WebhookIngestService {

    private final WebhookPayloadAdapter payloadAdapter;
    private final MessageStore messageStore;
    private final JobQueue jobQueue;
    private final RateLimiter rateLimiter;
    private final int limitPerMinute;

    public WebhookIngestService(WebhookPayloadAdapter payloadAdapter,
                                MessageStore messageStore,
                                JobQueue jobQueue,
                                RateLimiter rateLimiter,
                                @Value("${pipeline.rate-limit.webhook-per-minute:60}") int limitPerMinute) {
        this.payloadAdapter = payloadAdapter;
        this.messageStore = messageStore;
        this.jobQueue = jobQueue;
        this.rateLimiter = rateLimiter;
        this.limitPerMinute = limitPerMinute;
    }

    /**
     * @return the job id, or empty when nothing was enqueued
     */
    public Optional<String> accept(String tenantId, JsonNode payload) {
        Optional<InboundWebhookMessage> extracted = payloadAdapter.extract(payload);
        if (extracted.isEmpty()) {
            log.debug("Webhook payload without text, id or sender: tenantId={}", tenantId);
            return Optional.empty();
        }
        InboundWebhookMessage message = extracted.get();

        rateLimiter.enforce("webhook:" + tenantId + ":" + message.getFromPhone(), limitPerMinute, Duration.ofMinutes(1));

        Optional<MessageEntity> stored = messageStore.findByExternalId(tenantId, message.getExternalMessageId());
        if (stored.isPresent() && messageStore.findReplyTo(tenantId, stored.get().getId()).isPresent()) {
            log.debug("Webhook message already answered: tenantId={}, externalMessageId={}",
                    tenantId, message.getExternalMessageId());
            return Optional.empty();
        }

        String jobId = jobQueue.enqueueInbound(InboundJob.builder()
                .tenantId(tenantId)
                .externalMessageId(message.getExternalMessageId())
                .fromPhone(message.getFromPhone())
                .text(message.getText())
                .source(MessageSource.WHATSAPP)
                .build());
        log.info("Webhook accepted: tenantId={}, externalMessageId={}, jobId={}",
                tenantId, message.getExternalMessageId(), jobId);
        return Optional.of(jobId);
    }
}
