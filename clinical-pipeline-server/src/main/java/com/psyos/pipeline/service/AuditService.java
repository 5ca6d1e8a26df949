package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AuditLog;
import com.psyos.pipeline.repository.AuditLogStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Audit sink. Entries carry identifiers, flags and reasons; callers never pass content.
 */
@Service
@Slf4j
public class AuditService {

    public static final String INBOUND_IGNORED = "inbound.ignored";
    public static final String MESSAGE_INBOUND = "message.inbound";
    public static final String MESSAGE_OUTBOUND = "message.outbound";
    public static final String MESSAGE_SENT = "message.send";
    public static final String MESSAGE_DELETE = "message.delete";
    public static final String AI_REPLY = "ai.reply";
    public static final String POLICY_UPDATE = "policy.update";
    public static final String CONVERSATION_OPEN = "conversation.open";

    private final AuditLogStore auditLogStore;

    public AuditService(AuditLogStore auditLogStore) {
        this.auditLogStore = auditLogStore;
    }

    public AuditLog record(String tenantId, String actorUserId, String action,
                           String targetType, String targetId, Map<String, Object> meta) {
        AuditLog entry = auditLogStore.create(tenantId, AuditLog.builder()
                .tenantId(tenantId)
                .actorUserId(actorUserId)
                .action(action)
                .targetType(targetType)
                .targetId(targetId)
                .meta(meta)
                .build());
        log.debug("Audit recorded: tenantId={}, action={}, targetType={}, targetId={}",
                tenantId, action, targetType, targetId);
        return entry;
    }

    public AuditLog record(String tenantId, String action, String targetType, String targetId,
                           Map<String, Object> meta) {
        return record(tenantId, null, action, targetType, targetId, meta);
    }
}
