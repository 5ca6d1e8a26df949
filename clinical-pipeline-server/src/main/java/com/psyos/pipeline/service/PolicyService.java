package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.PolicyFlags;
import com.psyos.pipeline.domain.PolicyUpdateRequest;
import com.psyos.pipeline.domain.SignalOverrides;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.repository.PolicyStore;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Policy provider for the AI path and policy administration for clinicians.
 *
 * Two levels exist: the psychologist's own policy and an optional per-conversation
 * policy. Their texts are concatenated; tuning and signal overrides come from the
 * psychologist policy flags.
 */
@Service
@Slf4j
public class PolicyService {

    static final String SCOPE_TENANT = "tenant";
    static final String SCOPE_USER = "user";
    static final String SCOPE_CONVERSATION = "conversation";

    private final PolicyStore policyStore;
    private final ConversationAccessGuard accessGuard;
    private final AuditService auditService;

    public PolicyService(PolicyStore policyStore, ConversationAccessGuard accessGuard, AuditService auditService) {
        this.policyStore = policyStore;
        this.accessGuard = accessGuard;
        this.auditService = auditService;
    }

    public ResolvedPolicy resolve(String tenantId, ConversationEntity conversation) {
        Optional<AiPolicyEntity> psychologistPolicy =
                policyStore.findPsychologistPolicy(tenantId, conversation.getPsychologistUserId());
        Optional<AiPolicyEntity> conversationPolicy =
                policyStore.findConversationPolicy(tenantId, conversation.getId());

        PolicyFlags flags = psychologistPolicy.map(AiPolicyEntity::getFlags).orElse(null);
        return new ResolvedPolicy(
                mergePolicies(
                        psychologistPolicy.map(AiPolicyEntity::getPolicyText).orElse(null),
                        conversationPolicy.map(AiPolicyEntity::getPolicyText).orElse(null)),
                AiTuning.from(flags != null ? flags.getAiSettings() : null),
                flags != null ? flags.getSignalConfig() : null);
    }

    /**
     * Trimmed non-blank policy blocks joined by a blank line.
     */
    public static String mergePolicies(String psychologistPolicy, String conversationPolicy) {
        List<String> blocks = new ArrayList<>(2);
        for (String block : new String[]{psychologistPolicy, conversationPolicy}) {
            if (block != null && !block.isBlank()) {
                blocks.add(block.trim());
            }
        }
        return String.join("\n\n", blocks);
    }

    public Optional<AiPolicyEntity> getPolicy(TenantUserContext context, String scope,
                                              String ownerUserId, String conversationId) {
        if (!context.hasRole(UserRole.ADMIN, UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Policy read requires ADMIN or PSYCHOLOGIST");
        }
        switch (normalizeScope(scope)) {
            case SCOPE_USER: {
                String owner = ownerUserId != null ? ownerUserId : context.getUserId();
                if (!owner.equals(context.getUserId()) && !context.hasRole(UserRole.ADMIN)) {
                    throw new AccessDeniedException("Cannot read another psychologist's policy");
                }
                return policyStore.findPsychologistPolicy(context.getTenantId(), owner);
            }
            case SCOPE_CONVERSATION: {
                accessGuard.requireParticipantOrAdmin(context, conversationId);
                return policyStore.findConversationPolicy(context.getTenantId(), conversationId);
            }
            default:
                throw new IllegalArgumentException("Tenant policy disabled. Use psychologist policy.");
        }
    }

    public AiPolicyEntity upsertPolicy(TenantUserContext context, PolicyUpdateRequest request) {
        if (request.getTenantId() != null && !request.getTenantId().equals(context.getTenantId())) {
            throw new AccessDeniedException("Policy tenant does not match caller");
        }
        if (request.getPolicyText() == null || request.getPolicyText().isBlank()) {
            throw new IllegalArgumentException("policyText is required");
        }

        String scope = normalizeScope(request.getScope());
        if (SCOPE_TENANT.equals(scope)) {
            throw new IllegalArgumentException("Tenant policy disabled. Use psychologist policy.");
        }
        if (!context.hasRole(UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Policy update requires PSYCHOLOGIST");
        }

        AiPolicyEntity policy;
        if (SCOPE_USER.equals(scope)) {
            if (request.getOwnerUserId() != null && !request.getOwnerUserId().equals(context.getUserId())) {
                throw new AccessDeniedException("Cannot update another psychologist's policy");
            }
            policy = policyStore.upsertPsychologistPolicy(context.getTenantId(), context.getUserId(),
                    request.getPolicyText(), request.getFlags());
        } else {
            if (request.getConversationId() == null || request.getConversationId().isBlank()) {
                throw new IllegalArgumentException("conversationId required");
            }
            accessGuard.requireParticipant(context, request.getConversationId());
            policy = policyStore.upsertConversationPolicy(context.getTenantId(), request.getConversationId(),
                    request.getPolicyText(), request.getFlags());
        }

        auditService.record(context.getTenantId(), context.getUserId(), AuditService.POLICY_UPDATE,
                "AiPolicy", policy.getId(), Map.of("scope", scope));
        log.info("Policy updated: tenantId={}, scope={}, policyId={}", context.getTenantId(), scope, policy.getId());
        return policy;
    }

    private static String normalizeScope(String scope) {
        String normalized = scope == null ? "" : scope.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case SCOPE_TENANT:
            case SCOPE_USER:
            case SCOPE_CONVERSATION:
                return normalized;
            default:
                throw new IllegalArgumentException("Unknown policy scope: " + scope);
        }
    }

    @Value
    public static class ResolvedPolicy {
        String promptText;
        AiTuning tuning;
        SignalOverrides signalOverrides;
    }
}
