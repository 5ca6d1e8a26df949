package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.exception.NotFoundException;
import com.psyos.pipeline.repository.ConversationStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Conversation-level access rules on top of tenant isolation.
 *
 * Patients reach their own conversations and psychologists the conversations they
 * lead. Admins are admitted only where the caller explicitly allows operator access.
 */
@Component
@Slf4j
public class ConversationAccessGuard {

    private final ConversationStore conversationStore;

    public ConversationAccessGuard(ConversationStore conversationStore) {
        this.conversationStore = conversationStore;
    }

    public ConversationEntity requireParticipant(TenantUserContext context, String conversationId) {
        return require(context, conversationId, false);
    }

    public ConversationEntity requireParticipantOrAdmin(TenantUserContext context, String conversationId) {
        return require(context, conversationId, true);
    }

    private ConversationEntity require(TenantUserContext context, String conversationId, boolean allowAdmin) {
        if (conversationId == null || conversationId.isBlank()) {
            throw new IllegalArgumentException("conversationId is required");
        }
        ConversationEntity conversation = conversationStore.findById(context.getTenantId(), conversationId)
                .orElseThrow(() -> new NotFoundException("Conversation not found"));

        boolean allowed = switch (context.getRole()) {
            case PSYCHOLOGIST -> context.getUserId().equals(conversation.getPsychologistUserId());
            case PATIENT -> context.getUserId().equals(conversation.getPatientUserId());
            case ADMIN -> allowAdmin;
        };
        if (!allowed) {
            log.warn("Conversation access denied: tenantId={}, userId={}, role={}, conversationId={}",
                    context.getTenantId(), context.getUserId(), context.getRole(), conversationId);
            throw new AccessDeniedException("Conversation access denied");
        }
        return conversation;
    }
}
