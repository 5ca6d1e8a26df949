package com.psyos.pipeline.controller;

import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.service.AccessTokenValidator;
import com.psyos.pipeline.service.ConversationService;
import lombok.Data;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/conversations")
public class ConversationController {

    private final AccessTokenValidator tokenValidator;
    private final ConversationService conversationService;

    public ConversationController(AccessTokenValidator tokenValidator, ConversationService conversationService) {
        this.tokenValidator = tokenValidator;
        this.conversationService = conversationService;
    }

    @PostMapping
    public Map<String, Object> open(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                    @RequestBody OpenConversationRequest request) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        ConversationEntity conversation = conversationService.open(context, request.getPatientUserId(), request.isAiEnabled());
        return Map.of("ok", true, "conversationId", conversation.getId());
    }

    @PostMapping("/{conversationId}/close")
    public Map<String, Object> close(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                     @PathVariable String conversationId) {
        TenantUserContext context = tokenValidator.authenticate(authorization);
        ConversationEntity conversation = conversationService.close(context, conversationId);
        return Map.of("ok", true, "status", conversation.getStatus().name());
    }

    @Data
    public static class OpenConversationRequest {
        private String patientUserId;
        private boolean aiEnabled = true;
    }
}
