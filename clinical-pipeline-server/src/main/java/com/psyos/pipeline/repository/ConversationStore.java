package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.ConversationEntity.ConversationStatus;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

@Component
public class ConversationStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");

    private final TenantScopedStore<ConversationEntity> store;

    public ConversationStore(ConversationRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(ConversationEntity.class, repository, guard);
    }

    public ConversationEntity create(String tenantId, ConversationEntity conversation) {
        return store.create(tenantId, conversation);
    }

    public Optional<ConversationEntity> findById(String tenantId, String conversationId) {
        return store.findUnique(tenantId, tenantAnd(tenantId, eq("id", conversationId)));
    }

    /**
     * Most recently created OPEN conversation of a patient.
     */
    public Optional<ConversationEntity> findLatestOpenForPatient(String tenantId, String patientUserId) {
        return store.findFirst(tenantId,
                tenantAnd(tenantId, eq("patientUserId", patientUserId), eq("status", ConversationStatus.OPEN)),
                NEWEST_FIRST);
    }

    public Optional<ConversationEntity> updateStatus(String tenantId, String conversationId, ConversationStatus status) {
        return store.update(tenantId, tenantAnd(tenantId, eq("id", conversationId)),
                conversation -> conversation.setStatus(status));
    }
}
