package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.domain.DetectedSignals;
import com.psyos.pipeline.repository.EpisodeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Per-conversation episode state machine: no episode, open, closed.
 *
 * At most one episode per conversation is open. Opening is a compare-and-set against
 * the episode table's unique constraints: when two workers race, the insert of the
 * loser fails and it continues with the winner's episode.
 */
@Service
@Slf4j
public class EpisodeOrchestrator {

    private final EpisodeStore episodeStore;

    public EpisodeOrchestrator(EpisodeStore episodeStore) {
        this.episodeStore = episodeStore;
    }

    public AiEpisodeEntity openOrCreate(String tenantId, String conversationId) {
        Optional<AiEpisodeEntity> open = episodeStore.findLatestOpen(tenantId, conversationId);
        if (open.isPresent()) {
            return open.get();
        }

        int nextNumber = episodeStore.findHighestNumbered(tenantId, conversationId)
                .map(AiEpisodeEntity::getEpisodeNumber)
                .orElse(0) + 1;

        AiEpisodeEntity candidate = AiEpisodeEntity.builder()
                .tenantId(tenantId)
                .conversationId(conversationId)
                .episodeNumber(nextNumber)
                .aiTurnsUsed(0)
                .open(true)
                .build();
        try {
            AiEpisodeEntity created = episodeStore.create(tenantId, candidate);
            log.info("Episode opened: tenantId={}, conversationId={}, episodeNumber={}",
                    tenantId, conversationId, nextNumber);
            return created;
        } catch (DataIntegrityViolationException e) {
            Optional<AiEpisodeEntity> winner = episodeStore.findLatestOpen(tenantId, conversationId);
            if (winner.isPresent()) {
                log.info("Episode creation lost race, using existing episode: tenantId={}, conversationId={}, episodeNumber={}",
                        tenantId, conversationId, winner.get().getEpisodeNumber());
                return winner.get();
            }
            // the winner already closed its episode; the job is retried
            throw e;
        }
    }

    public ReplyDecision decide(DetectedSignals signals, int remainingTurns) {
        if (signals.isHighRisk()) {
            return ReplyDecision.SAFETY_CLOSE;
        }
        if (remainingTurns <= 0) {
            return ReplyDecision.LIMIT_CLOSE;
        }
        return ReplyDecision.GENERATE;
    }

    /**
     * Resolves a {@link ReplyDecision#GENERATE} once the model call returned or failed.
     */
    public ReplyDecision afterGeneration(boolean providerFailed, String reply, int remainingTurns) {
        if (providerFailed) {
            return ReplyDecision.PROVIDER_CLOSE;
        }
        if (reply == null || reply.isBlank()) {
            return ReplyDecision.EMPTY_CLOSE;
        }
        if (remainingTurns == 1) {
            return ReplyDecision.LAST_TURN_CLOSE;
        }
        return ReplyDecision.CONTINUE;
    }

    /**
     * Counts one AI turn and closes the episode when asked. The counter never exceeds the
     * turn limit (unless the limit is disabled) and never decreases.
     */
    public AiEpisodeEntity recordTurn(AiEpisodeEntity episode, AiTuning tuning, boolean close) {
        int used = episode.getAiTurnsUsed();
        int updatedTurns = tuning.isTurnLimitDisabled()
                ? used + 1
                : Math.max(used, Math.min(used + 1, tuning.getMaxTurns()));

        return episodeStore.update(episode.getTenantId(), episode.getId(), row -> {
            row.setAiTurnsUsed(updatedTurns);
            if (close) {
                row.close();
            }
        }).map(updated -> {
            log.debug("Episode turn recorded: conversationId={}, episodeNumber={}, aiTurnsUsed={}, open={}",
                    updated.getConversationId(), updated.getEpisodeNumber(), updated.getAiTurnsUsed(), updated.isOpen());
            return updated;
        }).orElseThrow(() -> new IllegalStateException("Episode disappeared: " + episode.getId()));
    }

    public Optional<AiEpisodeEntity> currentEpisode(String tenantId, String conversationId) {
        return episodeStore.findLatestOpen(tenantId, conversationId);
    }
}
