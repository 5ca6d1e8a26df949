package com.psyos.pipeline.controller;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.infrastructure.PromptSnapshotStore;
import com.psyos.pipeline.service.AccessTokenValidator;
import com.psyos.pipeline.service.ConversationAccessGuard;
import com.psyos.pipeline.service.EpisodeOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator views of the AI path: last prompt sent to the model and the open episode.
 */
@RestController
@RequestMapping("/api/ai")
public class AiInspectionController {

    private final AccessTokenValidator tokenValidator;
    private final ConversationAccessGuard accessGuard;
    private final PromptSnapshotStore promptSnapshotStore;
    private final EpisodeOrchestrator episodeOrchestrator;

    public AiInspectionController(AccessTokenValidator tokenValidator,
                                  ConversationAccessGuard accessGuard,
                                  PromptSnapshotStore promptSnapshotStore,
                                  EpisodeOrchestrator episodeOrchestrator) {
        this.tokenValidator = tokenValidator;
        this.accessGuard = accessGuard;
        this.promptSnapshotStore = promptSnapshotStore;
        this.episodeOrchestrator = episodeOrchestrator;
    }

    @GetMapping("/prompt")
    public Map<String, Object> prompt(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                      @RequestParam String conversationId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        if (!context.hasRole(UserRole.ADMIN, UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Prompt inspection requires ADMIN or PSYCHOLOGIST");
        }
        ConversationEntity conversation = accessGuard.requireParticipantOrAdmin(context, conversationId);
        return Collections.singletonMap("item",
                promptSnapshotStore.find(context.getTenantId(), conversation.getId()).orElse(null));
    }

    @GetMapping("/episode")
    public Map<String, Object> episode(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                       @RequestParam String conversationId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        ConversationEntity conversation = accessGuard.requireParticipantOrAdmin(context, conversationId);
        AiEpisodeEntity episode = episodeOrchestrator.currentEpisode(context.getTenantId(), conversation.getId())
                .orElse(null);
        if (episode == null) {
            return Collections.singletonMap("item", null);
        }
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("aiTurnsUsed", episode.getAiTurnsUsed());
        item.put("isOpen", episode.isOpen());
        return Collections.singletonMap("item", item);
    }
}
