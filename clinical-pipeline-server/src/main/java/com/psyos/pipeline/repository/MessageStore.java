package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.exception.DuplicateDeliveryException;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.isNull;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;
import static com.psyos.pipeline.repository.scope.ScopeFilter.within;

@Component
@Slf4j
public class MessageStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");
    private static final Sort OLDEST_FIRST = Sort.by(Sort.Direction.ASC, "createdAt");

    private final TenantScopedStore<MessageEntity> store;

    public MessageStore(MessageRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(MessageEntity.class, repository, guard);
    }

    /**
     * Persists a message. A collision on (tenantId, externalMessageId) means the channel
     * delivered the same message again and surfaces as {@link DuplicateDeliveryException}.
     */
    public MessageEntity create(String tenantId, MessageEntity message) {
        try {
            return store.create(tenantId, message);
        } catch (DataIntegrityViolationException e) {
            if (message.getExternalMessageId() != null) {
                throw new DuplicateDeliveryException(tenantId, message.getExternalMessageId(), e);
            }
            throw e;
        }
    }

    public Optional<MessageEntity> findById(String tenantId, String messageId) {
        return store.findUnique(tenantId, tenantAnd(tenantId, eq("id", messageId)));
    }

    public Optional<MessageEntity> findByExternalId(String tenantId, String externalMessageId) {
        return store.findUnique(tenantId, tenantAnd(tenantId, eq("externalMessageId", externalMessageId)));
    }

    public Optional<MessageEntity> findReplyTo(String tenantId, String triggerMessageId) {
        return store.findUnique(tenantId, tenantAnd(tenantId, eq("replyToMessageId", triggerMessageId)));
    }

    /**
     * Latest non-deleted messages of a conversation, newest first.
     */
    public List<MessageEntity> findRecent(String tenantId, String conversationId, int limit) {
        return store.findMany(tenantId,
                tenantAnd(tenantId, eq("conversationId", conversationId), isNull("deletedAt")),
                NEWEST_FIRST, limit);
    }

    /**
     * Non-deleted messages created in {@code [from, to)}, oldest first.
     */
    public List<MessageEntity> findWindow(String tenantId, String conversationId, Instant from, Instant to, int limit) {
        return store.findMany(tenantId,
                tenantAnd(tenantId, eq("conversationId", conversationId), isNull("deletedAt"),
                        within("createdAt", from, to)),
                OLDEST_FIRST, limit);
    }

    /**
     * Soft delete. Already deleted messages keep their original deletion marker.
     */
    public boolean markDeleted(String tenantId, String messageId, String deletedByUserId) {
        int updated = store.updateMany(tenantId,
                tenantAnd(tenantId, eq("id", messageId), isNull("deletedAt")),
                message -> {
                    message.setDeletedAt(Instant.now());
                    message.setDeletedByUserId(deletedByUserId);
                });
        log.debug("Soft delete: tenantId={}, messageId={}, updated={}", tenantId, messageId, updated);
        return updated > 0;
    }

    public boolean markDispatched(String tenantId, String messageId) {
        return store.updateMany(tenantId,
                tenantAnd(tenantId, eq("id", messageId), isNull("dispatchedAt")),
                message -> message.setDispatchedAt(Instant.now())) > 0;
    }
}
