package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.PolicyFlags;
import com.psyos.pipeline.repository.scope.ScopeFilter;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.isNull;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

@Component
public class PolicyStore {

    private final TenantScopedStore<AiPolicyEntity> store;

    public PolicyStore(AiPolicyRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(AiPolicyEntity.class, repository, guard);
    }

    public Optional<AiPolicyEntity> findPsychologistPolicy(String tenantId, String psychologistUserId) {
        return store.findUnique(tenantId, psychologistScope(tenantId, psychologistUserId));
    }

    public Optional<AiPolicyEntity> findConversationPolicy(String tenantId, String conversationId) {
        return store.findUnique(tenantId, conversationScope(tenantId, conversationId));
    }

    public AiPolicyEntity upsertPsychologistPolicy(String tenantId, String psychologistUserId,
                                                   String policyText, PolicyFlags flags) {
        return store.upsert(tenantId, psychologistScope(tenantId, psychologistUserId),
                () -> AiPolicyEntity.builder()
                        .tenantId(tenantId)
                        .ownerUserId(psychologistUserId)
                        .policyText(policyText)
                        .flags(flags)
                        .build(),
                policy -> {
                    policy.setPolicyText(policyText);
                    policy.setFlags(flags);
                });
    }

    public AiPolicyEntity upsertConversationPolicy(String tenantId, String conversationId,
                                                   String policyText, PolicyFlags flags) {
        return store.upsert(tenantId, conversationScope(tenantId, conversationId),
                () -> AiPolicyEntity.builder()
                        .tenantId(tenantId)
                        .conversationId(conversationId)
                        .policyText(policyText)
                        .flags(flags)
                        .build(),
                policy -> {
                    policy.setPolicyText(policyText);
                    policy.setFlags(flags);
                });
    }

    private ScopeFilter psychologistScope(String tenantId, String psychologistUserId) {
        return tenantAnd(tenantId, eq("ownerUserId", psychologistUserId), isNull("conversationId"));
    }

    private ScopeFilter conversationScope(String tenantId, String conversationId) {
        return tenantAnd(tenantId, eq("conversationId", conversationId));
    }
}
