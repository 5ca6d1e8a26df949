package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

@Component
public class EpisodeStore {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "createdAt");
    private static final Sort HIGHEST_NUMBER_FIRST = Sort.by(Sort.Direction.DESC, "episodeNumber");

    private final TenantScopedStore<AiEpisodeEntity> store;

    public EpisodeStore(AiEpisodeRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(AiEpisodeEntity.class, repository, guard);
    }

    public Optional<AiEpisodeEntity> findLatestOpen(String tenantId, String conversationId) {
        return store.findFirst(tenantId,
                tenantAnd(tenantId, eq("conversationId", conversationId), eq("open", true)),
                NEWEST_FIRST);
    }

    public Optional<AiEpisodeEntity> findHighestNumbered(String tenantId, String conversationId) {
        return store.findFirst(tenantId, tenantAnd(tenantId, eq("conversationId", conversationId)),
                HIGHEST_NUMBER_FIRST);
    }

    public List<AiEpisodeEntity> findAllForConversation(String tenantId, String conversationId, int limit) {
        return store.findMany(tenantId, tenantAnd(tenantId, eq("conversationId", conversationId)),
                Sort.by(Sort.Direction.ASC, "episodeNumber"), limit);
    }

    /**
     * Inserts a new episode. Fails with a DataIntegrityViolationException when another
     * worker already holds the conversation's open slot or episode number.
     */
    public AiEpisodeEntity create(String tenantId, AiEpisodeEntity episode) {
        return store.create(tenantId, episode);
    }

    public Optional<AiEpisodeEntity> update(String tenantId, String episodeId, Consumer<AiEpisodeEntity> mutation) {
        return store.update(tenantId, tenantAnd(tenantId, eq("id", episodeId)), mutation);
    }
}
