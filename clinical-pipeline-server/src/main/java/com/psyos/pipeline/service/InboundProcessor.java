package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.InboundJob;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.AuthorType;
import com.psyos.pipeline.domain.MessageEntity.Direction;
import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.exception.DuplicateDeliveryException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EncryptedPayload;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.infrastructure.JobQueue;
import com.psyos.pipeline.repository.ConversationStore;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Stores inbound patient messages encrypted and hands them to the AI path.
 *
 * Redelivery of the same channel message stores nothing: the unique external id makes the
 * second insert fail. The AI job is enqueued again only while the stored message has no
 * AI reply, which covers a first attempt that stored the message but could not enqueue.
 */
@Service
@Slf4j
public class InboundProcessor {

    public enum Outcome {
        STORED,
        PATIENT_NOT_FOUND,
        CONVERSATION_NOT_FOUND,
        DUPLICATE
    }

    private final UserDirectory userDirectory;
    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final EnvelopeCryptoService cryptoService;
    private final JobQueue jobQueue;
    private final AuditService auditService;
    private final MetricsService metricsService;

    public InboundProcessor(UserDirectory userDirectory,
                            ConversationStore conversationStore,
                            MessageStore messageStore,
                            EnvelopeCryptoService cryptoService,
                            JobQueue jobQueue,
                            AuditService auditService,
                            MetricsService metricsService) {
        this.userDirectory = userDirectory;
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.cryptoService = cryptoService;
        this.jobQueue = jobQueue;
        this.auditService = auditService;
        this.metricsService = metricsService;
    }

    public Outcome ingest(InboundJob job) {
        String tenantId = job.getTenantId();

        Optional<UserEntity> patient = userDirectory.findPatientByPhone(tenantId, job.getFromPhone());
        if (patient.isEmpty()) {
            log.info("Inbound ignored: tenantId={}, reason=patient_not_found", tenantId);
            metricsService.recordInboundIgnored("patient_not_found");
            auditService.record(tenantId, AuditService.INBOUND_IGNORED, "Patient", null,
                    Map.of("reason", "patient_not_found"));
            return Outcome.PATIENT_NOT_FOUND;
        }
        String patientId = patient.get().getId();

        Optional<ConversationEntity> found = conversationStore.findLatestOpenForPatient(tenantId, patientId);
        if (found.isEmpty()) {
            log.info("Inbound ignored: tenantId={}, patientId={}, reason=conversation_not_found", tenantId, patientId);
            metricsService.recordInboundIgnored("conversation_not_found");
            auditService.record(tenantId, patientId, AuditService.INBOUND_IGNORED, "Conversation", null,
                    Map.of("reason", "conversation_not_found"));
            return Outcome.CONVERSATION_NOT_FOUND;
        }
        ConversationEntity conversation = found.get();

        MessageEntity message;
        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.getEncryptedDek())) {
            EncryptedPayload encrypted = cryptoService.encryptText(job.getText(), dek);
            message = messageStore.create(tenantId, MessageEntity.builder()
                    .tenantId(tenantId)
                    .conversationId(conversation.getId())
                    .direction(Direction.IN)
                    .authorType(AuthorType.PATIENT)
                    .ciphertext(encrypted.ciphertextBase64())
                    .iv(encrypted.nonceBase64())
                    .authTag(encrypted.tagBase64())
                    .externalMessageId(job.getExternalMessageId())
                    .build());
        } catch (DuplicateDeliveryException e) {
            log.info("Inbound duplicate skipped: tenantId={}, externalMessageId={}",
                    tenantId, job.getExternalMessageId());
            if (conversation.isAiEnabled()) {
                resumeUnanswered(tenantId, job.getExternalMessageId());
            }
            return Outcome.DUPLICATE;
        }

        auditService.record(tenantId, patientId, AuditService.MESSAGE_INBOUND, "Message", message.getId(),
                Map.of("source", job.getSource() != null ? job.getSource().wireName() : "unknown"));

        if (conversation.isAiEnabled()) {
            enqueueAiReply(tenantId, conversation.getId(), message.getId());
        }
        log.info("Inbound stored: tenantId={}, conversationId={}, messageId={}, aiEnabled={}",
                tenantId, conversation.getId(), message.getId(), conversation.isAiEnabled());
        return Outcome.STORED;
    }

    private void resumeUnanswered(String tenantId, String externalMessageId) {
        messageStore.findByExternalId(tenantId, externalMessageId)
                .filter(stored -> messageStore.findReplyTo(tenantId, stored.getId()).isEmpty())
                .ifPresent(stored -> {
                    log.info("Inbound duplicate has no AI reply, re-enqueueing: tenantId={}, messageId={}",
                            tenantId, stored.getId());
                    enqueueAiReply(tenantId, stored.getConversationId(), stored.getId());
                });
    }

    private void enqueueAiReply(String tenantId, String conversationId, String messageId) {
        jobQueue.enqueueAiReply(AiReplyJob.builder()
                .tenantId(tenantId)
                .conversationId(conversationId)
                .triggerMessageId(messageId)
                .build());
    }
}
