package com.psyos.pipeline.infrastructure;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Extracts text, provider message id and sender from Evolution/WhatsApp webhook bodies.
 *
 * Known shapes, tried in order:
 * <ul>
 *   <li>text: data.message.conversation, data.message.text, data.body</li>
 *   <li>id: data.id, data.key.id, messageId</li>
 *   <li>sender: data.from, data.key.remoteJid (digits only)</li>
 * </ul>
 */
@Component
public class WebhookPayloadAdapter {

    static final int MAX_TEXT_LENGTH = 4000;

    public Optional<InboundWebhookMessage> extract(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        String messageId = extractMessageId(payload);
        String text = extractText(payload).trim();
        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH);
        }
        String from = extractFrom(payload);

        if (messageId.isEmpty() || text.isEmpty() || from.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new InboundWebhookMessage(messageId, from, text));
    }

    String extractText(JsonNode payload) {
        JsonNode data = payload.path("data");
        JsonNode message = data.path("message");
        return firstNonEmpty(message.path("conversation"), message.path("text"), data.path("body"));
    }

    String extractMessageId(JsonNode payload) {
        JsonNode data = payload.path("data");
        return firstNonEmpty(data.path("id"), data.path("key").path("id"), payload.path("messageId"));
    }

    String extractFrom(JsonNode payload) {
        JsonNode data = payload.path("data");
        String raw = firstNonEmpty(data.path("from"), data.path("key").path("remoteJid"));
        return raw.replaceAll("\\D", "");
    }

    private static String firstNonEmpty(JsonNode... candidates) {
        for (JsonNode candidate : candidates) {
            if (candidate.isTextual() && !candidate.asText().isEmpty()) {
                return candidate.asText();
            }
        }
        return "";
    }

    @Value
    public static class InboundWebhookMessage {
        String externalMessageId;
        String fromPhone;
        String text;
    }
}
