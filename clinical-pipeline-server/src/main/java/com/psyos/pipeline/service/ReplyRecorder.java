package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.AuthorType;
import com.psyos.pipeline.domain.MessageEntity.Direction;
import com.psyos.pipeline.infrastructure.EncryptedPayload;
import com.psyos.pipeline.repository.MessageStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores an AI reply and counts its episode turn in one transaction. A failed turn
 * update leaves no reply behind, so the retried job starts from a clean history.
 */
@Service
@Slf4j
public class ReplyRecorder {

    private final MessageStore messageStore;
    private final EpisodeOrchestrator episodeOrchestrator;

    public ReplyRecorder(MessageStore messageStore, EpisodeOrchestrator episodeOrchestrator) {
        this.messageStore = messageStore;
        this.episodeOrchestrator = episodeOrchestrator;
    }

    @Transactional
    public MessageEntity record(String tenantId, String conversationId, String triggerMessageId,
                                EncryptedPayload reply, AiEpisodeEntity episode, AiTuning tuning,
                                boolean closeEpisode) {
        MessageEntity aiMessage = messageStore.create(tenantId, MessageEntity.builder()
                .tenantId(tenantId)
                .conversationId(conversationId)
                .direction(Direction.OUT)
                .authorType(AuthorType.AI)
                .ciphertext(reply.ciphertextBase64())
                .iv(reply.nonceBase64())
                .authTag(reply.tagBase64())
                .replyToMessageId(triggerMessageId)
                .build());

        episodeOrchestrator.recordTurn(episode, tuning, closeEpisode);
        log.debug("AI reply recorded: tenantId={}, conversationId={}, messageId={}",
                tenantId, conversationId, aiMessage.getId());
        return aiMessage;
    }
}
