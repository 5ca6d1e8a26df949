package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.DecryptedAttachment;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.AuthorType;
import com.psyos.pipeline.domain.MessageEntity.Direction;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.domain.SendMessageRequest;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.exception.NotFoundException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EncryptedPayload;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.infrastructure.JobQueue;
import com.psyos.pipeline.repository.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Base64;
import java.util.Map;

/**
 * Web-side message operations: send, soft delete and attachment download.
 */
@Service
@Slf4j
public class MessageService {

    static final String DEFAULT_ATTACHMENT_MIME = "application/octet-stream";

    private final MessageStore messageStore;
    private final ConversationAccessGuard accessGuard;
    private final EnvelopeCryptoService cryptoService;
    private final JobQueue jobQueue;
    private final AuditService auditService;
    private final RateLimiter rateLimiter;
    private final int maxAttachmentBytes;
    private final int sendLimitPerMinute;

    public MessageService(MessageStore messageStore,
                          ConversationAccessGuard accessGuard,
                          EnvelopeCryptoService cryptoService,
                          JobQueue jobQueue,
                          AuditService auditService,
                          RateLimiter rateLimiter,
                          @Value("${pipeline.attachments.max-bytes:10485760}") int maxAttachmentBytes,
                          @Value("${pipeline.rate-limit.send-per-minute:30}") int sendLimitPerMinute) {
        this.messageStore = messageStore;
        this.accessGuard = accessGuard;
        this.cryptoService = cryptoService;
        this.jobQueue = jobQueue;
        this.auditService = auditService;
        this.rateLimiter = rateLimiter;
        this.maxAttachmentBytes = maxAttachmentBytes;
        this.sendLimitPerMinute = sendLimitPerMinute;
    }

    /**
     * Stores a message written in the web client. Patient messages go to the AI path when
     * the conversation has AI enabled; psychologist messages are delivered to the patient.
     */
    public MessageEntity send(TenantUserContext context, SendMessageRequest request) {
        requireAuthor(context);
        String content = request.getContent() != null ? request.getContent() : "";
        SendMessageRequest.Attachment attachment = request.getAttachment();
        if (content.isBlank() && attachment == null) {
            throw new IllegalArgumentException("content or attachment is required");
        }

        ConversationEntity conversation = accessGuard.requireParticipant(context, request.getConversationId());
        rateLimiter.enforce("send:" + context.getTenantId() + ":" + context.getUserId(),
                sendLimitPerMinute, Duration.ofMinutes(1));

        boolean patient = context.hasRole(UserRole.PATIENT);
        MessageEntity.MessageEntityBuilder builder = MessageEntity.builder()
                .tenantId(context.getTenantId())
                .conversationId(conversation.getId())
                .direction(patient ? Direction.IN : Direction.OUT)
                .authorType(patient ? AuthorType.PATIENT : AuthorType.PSYCHOLOGIST);

        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.getEncryptedDek())) {
            EncryptedPayload body = cryptoService.encryptText(content, dek);
            builder.ciphertext(body.ciphertextBase64())
                    .iv(body.nonceBase64())
                    .authTag(body.tagBase64());

            if (attachment != null) {
                byte[] bytes = decodeAttachment(attachment);
                EncryptedPayload encryptedAttachment = cryptoService.encryptBytes(bytes, dek);
                builder.attachmentCiphertext(encryptedAttachment.ciphertextBase64())
                        .attachmentIv(encryptedAttachment.nonceBase64())
                        .attachmentAuthTag(encryptedAttachment.tagBase64())
                        .attachmentMime(attachment.getMime() != null && !attachment.getMime().isBlank()
                                ? attachment.getMime() : DEFAULT_ATTACHMENT_MIME)
                        .attachmentSize(bytes.length);
            }
        }

        MessageEntity message = messageStore.create(context.getTenantId(), builder.build());

        if (patient && conversation.isAiEnabled()) {
            jobQueue.enqueueAiReply(AiReplyJob.builder()
                    .tenantId(context.getTenantId())
                    .conversationId(conversation.getId())
                    .triggerMessageId(message.getId())
                    .build());
        } else if (!patient) {
            jobQueue.enqueueOutbound(OutboundJob.builder()
                    .tenantId(context.getTenantId())
                    .conversationId(conversation.getId())
                    .messageId(message.getId())
                    .build());
        }

        auditService.record(context.getTenantId(), context.getUserId(), AuditService.MESSAGE_SENT,
                "Message", message.getId(), Map.of("attachment", attachment != null));
        log.info("Web message stored: tenantId={}, conversationId={}, messageId={}, role={}",
                context.getTenantId(), conversation.getId(), message.getId(), context.getRole());
        return message;
    }

    /**
     * Soft-deletes a message. Patients may delete their own messages, psychologists any
     * human-authored message of their conversations. AI and system messages stay.
     *
     * @return false when the message does not exist
     */
    public boolean delete(TenantUserContext context, String messageId) {
        requireAuthor(context);
        MessageEntity message = messageStore.findById(context.getTenantId(), messageId).orElse(null);
        if (message == null) {
            return false;
        }
        accessGuard.requireParticipant(context, message.getConversationId());

        if (message.getAuthorType() == AuthorType.AI || message.getAuthorType() == AuthorType.SYSTEM) {
            throw new AccessDeniedException("AI and system messages cannot be deleted");
        }
        if (context.hasRole(UserRole.PATIENT) && message.getAuthorType() != AuthorType.PATIENT) {
            throw new AccessDeniedException("Patients can only delete their own messages");
        }

        boolean deleted = messageStore.markDeleted(context.getTenantId(), messageId, context.getUserId());
        auditService.record(context.getTenantId(), context.getUserId(), AuditService.MESSAGE_DELETE,
                "Message", messageId, null);
        log.info("Message deleted: tenantId={}, messageId={}, alreadyDeleted={}",
                context.getTenantId(), messageId, !deleted);
        return true;
    }

    public DecryptedAttachment readAttachment(TenantUserContext context, String messageId) {
        MessageEntity message = messageStore.findById(context.getTenantId(), messageId)
                .filter(MessageEntity::hasAttachment)
                .filter(found -> found.getDeletedAt() == null)
                .orElseThrow(() -> new NotFoundException("Attachment not found"));
        ConversationEntity conversation = accessGuard.requireParticipant(context, message.getConversationId());

        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.getEncryptedDek())) {
            byte[] bytes = cryptoService.decryptBytes(message.getAttachmentCiphertext(),
                    message.getAttachmentIv(), message.getAttachmentAuthTag(), dek);
            String mime = message.getAttachmentMime() != null ? message.getAttachmentMime() : DEFAULT_ATTACHMENT_MIME;
            return new DecryptedAttachment(mime, bytes);
        }
    }

    private byte[] decodeAttachment(SendMessageRequest.Attachment attachment) {
        if (attachment.getDataBase64() == null || attachment.getDataBase64().isEmpty()) {
            throw new IllegalArgumentException("attachment data is required");
        }
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(attachment.getDataBase64());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("attachment data is not valid base64", e);
        }
        if (bytes.length > maxAttachmentBytes) {
            throw new IllegalArgumentException("attachment too large");
        }
        return bytes;
    }

    private static void requireAuthor(TenantUserContext context) {
        if (!context.hasRole(UserRole.PSYCHOLOGIST, UserRole.PATIENT)) {
            throw new AccessDeniedException("Only patients and psychologists write messages");
        }
    }
}
