package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.ConversationEntity.ConversationStatus;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.exception.NotFoundException;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.repository.ConversationStore;
import com.psyos.pipeline.repository.UserDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@Slf4j
public class ConversationService {

    private final ConversationStore conversationStore;
    private final UserDirectory userDirectory;
    private final EnvelopeCryptoService cryptoService;
    private final ConversationAccessGuard accessGuard;
    private final AuditService auditService;

    public ConversationService(ConversationStore conversationStore,
                               UserDirectory userDirectory,
                               EnvelopeCryptoService cryptoService,
                               ConversationAccessGuard accessGuard,
                               AuditService auditService) {
        this.conversationStore = conversationStore;
        this.userDirectory = userDirectory;
        this.cryptoService = cryptoService;
        this.accessGuard = accessGuard;
        this.auditService = auditService;
    }

    /**
     * Opens a conversation between the calling psychologist and a patient of the same
     * tenant, with a freshly generated data key wrapped under the master key.
     */
    public ConversationEntity open(TenantUserContext context, String patientUserId, boolean aiEnabled) {
        if (!context.hasRole(UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Only psychologists open conversations");
        }
        UserEntity patient = userDirectory.findById(context.getTenantId(), patientUserId)
                .filter(user -> user.getRole() == UserRole.PATIENT)
                .orElseThrow(() -> new NotFoundException("Patient not found"));

        ConversationEntity conversation = conversationStore.create(context.getTenantId(), ConversationEntity.builder()
                .tenantId(context.getTenantId())
                .psychologistUserId(context.getUserId())
                .patientUserId(patient.getId())
                .status(ConversationStatus.OPEN)
                .aiEnabled(aiEnabled)
                .encryptedDek(cryptoService.newWrappedConversationKey())
                .build());

        auditService.record(context.getTenantId(), context.getUserId(), AuditService.CONVERSATION_OPEN,
                "Conversation", conversation.getId(), Map.of("aiEnabled", aiEnabled));
        log.info("Conversation opened: tenantId={}, conversationId={}, aiEnabled={}",
                context.getTenantId(), conversation.getId(), aiEnabled);
        return conversation;
    }

    public ConversationEntity close(TenantUserContext context, String conversationId) {
        if (!context.hasRole(UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Only psychologists close conversations");
        }
        accessGuard.requireParticipant(context, conversationId);
        return conversationStore.updateStatus(context.getTenantId(), conversationId, ConversationStatus.CLOSED)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));
    }
}
