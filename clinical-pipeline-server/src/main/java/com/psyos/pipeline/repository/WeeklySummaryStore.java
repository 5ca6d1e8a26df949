package com.psyos.pipeline.repository;

import com.psyos.pipeline.domain.WeeklySummaryEntity;
import com.psyos.pipeline.repository.scope.ScopeFilter;
import com.psyos.pipeline.repository.scope.TenantScopeGuard;
import com.psyos.pipeline.repository.scope.TenantScopedStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static com.psyos.pipeline.repository.scope.ScopeFilter.eq;
import static com.psyos.pipeline.repository.scope.ScopeFilter.tenantAnd;

@Component
@Slf4j
public class WeeklySummaryStore {

    private final TenantScopedStore<WeeklySummaryEntity> store;

    public WeeklySummaryStore(WeeklySummaryRepository repository, TenantScopeGuard guard) {
        this.store = new TenantScopedStore<>(WeeklySummaryEntity.class, repository, guard);
    }

    public Optional<WeeklySummaryEntity> findWeek(String tenantId, String conversationId, Instant weekStart) {
        return store.findUnique(tenantId, weekScope(tenantId, conversationId, weekStart));
    }

    /**
     * Replaces the tally of a week. When another request stored the same week first,
     * its row wins and is returned.
     */
    public WeeklySummaryEntity save(String tenantId, String conversationId, Instant weekStart, Instant weekEnd,
                                    Map<String, Integer> signalCounts, int messageCount) {
        Instant generatedAt = Instant.now();
        try {
            return store.upsert(tenantId, weekScope(tenantId, conversationId, weekStart),
                    () -> WeeklySummaryEntity.builder()
                            .tenantId(tenantId)
                            .conversationId(conversationId)
                            .weekStart(weekStart)
                            .weekEnd(weekEnd)
                            .signalCounts(signalCounts)
                            .messageCount(messageCount)
                            .generatedAt(generatedAt)
                            .build(),
                    summary -> {
                        summary.setWeekEnd(weekEnd);
                        summary.setSignalCounts(signalCounts);
                        summary.setMessageCount(messageCount);
                        summary.setGeneratedAt(generatedAt);
                    });
        } catch (DataIntegrityViolationException e) {
            log.debug("Weekly summary stored concurrently: tenantId={}, conversationId={}, weekStart={}",
                    tenantId, conversationId, weekStart);
            return findWeek(tenantId, conversationId, weekStart).orElseThrow(() -> e);
        }
    }

    private ScopeFilter weekScope(String tenantId, String conversationId, Instant weekStart) {
        return tenantAnd(tenantId, eq("conversationId", conversationId), eq("weekStart", weekStart));
    }
}
