package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.Direction;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.infrastructure.ChannelClient;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.repository.ConversationStore;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Decrypts an outgoing message and delivers it to the patient's channel address.
 * Channel failures propagate so the job is retried. A message is handed to the channel
 * once; later jobs for a dispatched message are skipped.
 */
@Service
@Slf4j
public class OutboundDispatcher {

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final UserDirectory userDirectory;
    private final EnvelopeCryptoService cryptoService;
    private final ChannelClient channelClient;
    private final AuditService auditService;

    public OutboundDispatcher(ConversationStore conversationStore,
                              MessageStore messageStore,
                              UserDirectory userDirectory,
                              EnvelopeCryptoService cryptoService,
                              ChannelClient channelClient,
                              AuditService auditService) {
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.userDirectory = userDirectory;
        this.cryptoService = cryptoService;
        this.channelClient = channelClient;
        this.auditService = auditService;
    }

    /**
     * @return true when the message was handed to the channel
     */
    public boolean dispatch(OutboundJob job) {
        String tenantId = job.getTenantId();
        Optional<ConversationEntity> conversation = conversationStore.findById(tenantId, job.getConversationId());
        Optional<MessageEntity> message = messageStore.findById(tenantId, job.getMessageId());

        if (conversation.isEmpty() || message.isEmpty()) {
            log.info("Outbound skipped: tenantId={}, messageId={}, reason=not_found", tenantId, job.getMessageId());
            return false;
        }
        MessageEntity outgoing = message.get();
        if (outgoing.getDirection() != Direction.OUT) {
            log.info("Outbound skipped: tenantId={}, messageId={}, reason=not_outbound", tenantId, outgoing.getId());
            return false;
        }
        if (outgoing.getDeletedAt() != null) {
            log.info("Outbound skipped: tenantId={}, messageId={}, reason=deleted", tenantId, outgoing.getId());
            return false;
        }
        if (outgoing.getDispatchedAt() != null) {
            log.info("Outbound skipped: tenantId={}, messageId={}, reason=already_dispatched", tenantId, outgoing.getId());
            return false;
        }

        String phone = userDirectory.findById(tenantId, conversation.get().getPatientUserId())
                .map(UserEntity::getPhoneE164)
                .orElse(null);
        if (phone == null || phone.isBlank()) {
            log.info("Outbound skipped: tenantId={}, messageId={}, reason=patient_address_missing",
                    tenantId, outgoing.getId());
            return false;
        }

        String content;
        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.get().getEncryptedDek())) {
            content = cryptoService.decryptText(outgoing.getCiphertext(), outgoing.getIv(), outgoing.getAuthTag(), dek);
        }

        channelClient.sendText(phone, content);
        messageStore.markDispatched(tenantId, outgoing.getId());

        auditService.record(tenantId, AuditService.MESSAGE_OUTBOUND, "Message", outgoing.getId(), null);
        log.info("Outbound delivered: tenantId={}, conversationId={}, messageId={}",
                tenantId, job.getConversationId(), outgoing.getId());
        return true;
    }
}
