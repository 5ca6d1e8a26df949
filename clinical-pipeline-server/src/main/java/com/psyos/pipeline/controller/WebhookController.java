package com.psyos.pipeline.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.psyos.pipeline.service.WebhookAuthenticator;
import com.psyos.pipeline.service.WebhookIngestService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Evolution (WhatsApp) webhook receiver.
 * POST /api/webhooks/evolution
 */
@Slf4j
@RestController
@RequestMapping("/api/webhooks")
public class WebhookController {

    private final WebhookAuthenticator authenticator;
    private final WebhookIngestService ingestService;

    public WebhookController(WebhookAuthenticator authenticator, WebhookIngestService ingestService) {
        this.authenticator = authenticator;
        this.ingestService = ingestService;
    }

    @PostMapping("/evolution")
    public ResponseEntity<Map<String, Object>> evolution(
            @RequestHeader(value = "x-webhook-secret", required = false) String webhookSecret,
            @RequestHeader(value = "x-evolution-secret", required = false) String evolutionSecret,
            @RequestHeader(value = "Authorization", required = false) String authorization,
            @RequestHeader(value = "x-tenant-id", required = false) String tenantId,
            @RequestBody(required = false) JsonNode payload) {

        if (!authenticator.isAuthorized(webhookSecret, evolutionSecret, authorization)) {
            log.warn("Webhook rejected: invalid secret");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Unauthorized"));
        }
        if (tenantId == null || tenantId.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Missing tenant"));
        }

        ingestService.accept(tenantId.trim(), payload);
        return ResponseEntity.ok(Map.of("ok", true));
    }
}
