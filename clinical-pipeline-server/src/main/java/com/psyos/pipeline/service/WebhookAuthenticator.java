package com.psyos.pipeline.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret check for channel webhooks.
 *
 * The secret may arrive in x-webhook-secret, x-evolution-secret or as a Bearer token.
 * Without a configured secret only non-production environments accept webhooks.
 */
@Component
@Slf4j
public class WebhookAuthenticator {

    private static final String PRODUCTION = "production";

    private final String configuredSecret;
    private final String environment;

    public WebhookAuthenticator(@Value("${webhook.secret:}") String configuredSecret,
                                @Value("${pipeline.environment:development}") String environment) {
        this.configuredSecret = configuredSecret;
        this.environment = environment;
    }

    public boolean isAuthorized(String webhookSecretHeader, String evolutionSecretHeader, String authorizationHeader) {
        if (configuredSecret == null || configuredSecret.isEmpty()) {
            boolean allowed = !PRODUCTION.equalsIgnoreCase(environment);
            if (!allowed) {
                log.error("Webhook rejected: no webhook.secret configured in production");
            }
            return allowed;
        }

        String provided = providedSecret(webhookSecretHeader, evolutionSecretHeader, authorizationHeader);
        if (provided.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                configuredSecret.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    static String providedSecret(String webhookSecretHeader, String evolutionSecretHeader, String authorizationHeader) {
        if (webhookSecretHeader != null && !webhookSecretHeader.isEmpty()) {
            return webhookSecretHeader;
        }
        if (evolutionSecretHeader != null && !evolutionSecretHeader.isEmpty()) {
            return evolutionSecretHeader;
        }
        if (authorizationHeader != null && authorizationHeader.startsWith("Bearer ")) {
            return authorizationHeader.substring("Bearer ".length()).trim();
        }
        return "";
    }
}
