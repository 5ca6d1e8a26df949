package com.psyos.pipeline.infrastructure;

import com.psyos.pipeline.domain.ChatTurn;
import com.psyos.pipeline.exception.ConfigurationException;
import com.psyos.pipeline.exception.ProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.*;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * OpenAI-compatible chat completions client.
 * Round-robin across the configured endpoints, failing over to the next endpoint on error.
 */
@Slf4j
@Component
public class OpenAiChatClient implements LanguageModelClient {

    private static final String COMPLETIONS_PATH = "/v1/chat/completions";
    private static final int GPT5_MIN_COMPLETION_TOKENS = 600;

    private final RestTemplate restTemplate;
    private final List<String> baseUrls;
    private final String apiKey;
    private final String model;
    private final AtomicInteger currentIndex = new AtomicInteger(0);

    public OpenAiChatClient(RestTemplate providerRestTemplate,
                            @Value("${ai.openai.base-url:https://api.openai.com}") String baseUrlsConfig,
                            @Value("${ai.openai.api-key:}") String apiKey,
                            @Value("${ai.openai.model:gpt-4o-mini}") String model) {
        this.restTemplate = providerRestTemplate;
        this.baseUrls = parseUrls(baseUrlsConfig);
        this.apiKey = apiKey;
        this.model = model;

        log.info("OpenAiChatClient initialized: model={}, endpoints={}", model, baseUrls);
    }

    @Override
    public String modelName() {
        return model;
    }

    @Override
    public String complete(List<ChatTurn> messages, int maxTokens, double temperature) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("ai.openai.api-key is not configured");
        }
        if (baseUrls.isEmpty()) {
            throw new ConfigurationException("ai.openai.base-url is empty");
        }

        Map<String, Object> body = buildRequestBody(messages, maxTokens, temperature);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(body, headers);

        List<String> candidates = candidateUrls();
        RestClientException lastException = null;

        for (int attempt = 0; attempt < candidates.size(); attempt++) {
            String url = candidates.get(attempt) + COMPLETIONS_PATH;
            try {
                long started = System.nanoTime();
                ResponseEntity<Map> response = restTemplate.exchange(url, HttpMethod.POST, entity, Map.class);
                log.debug("Model call completed: url={}, status={}, latencyMs={}",
                        url, response.getStatusCode(), (System.nanoTime() - started) / 1_000_000);
                return extractContent(response.getBody());
            } catch (RestClientException e) {
                lastException = e;
                log.warn("Model call failed: url={}, attempt={}/{}, error={}",
                        url, attempt + 1, candidates.size(), e.getMessage());
            }
        }

        log.error("All model endpoints failed after {} attempts", candidates.size());
        throw new ProviderException("Language model request failed", lastException);
    }

    Map<String, Object> buildRequestBody(List<ChatTurn> messages, int maxTokens, double temperature) {
        boolean useMaxCompletionTokens = model.startsWith("gpt-5") || model.startsWith("o1");
        int effectiveMax = model.startsWith("gpt-5")
                ? Math.max(maxTokens, GPT5_MIN_COMPLETION_TOKENS)
                : maxTokens;

        List<Map<String, String>> wireMessages = new ArrayList<>();
        for (ChatTurn turn : messages) {
            wireMessages.add(Map.of("role", turn.getRole(), "content", turn.getContent()));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("messages", wireMessages);
        body.put("response_format", Map.of("type", "text"));
        body.put(useMaxCompletionTokens ? "max_completion_tokens" : "max_tokens", effectiveMax);
        body.put("temperature", temperature);
        return body;
    }

    /**
     * @return the trimmed completion, or an empty string when the model produced no text
     */
    private String extractContent(Map<?, ?> body) {
        String content = "";
        String finishReason = null;
        Object choices = body != null ? body.get("choices") : null;
        if (choices instanceof List && !((List<?>) choices).isEmpty()
                && ((List<?>) choices).get(0) instanceof Map) {
            Map<?, ?> choice = (Map<?, ?>) ((List<?>) choices).get(0);
            Object reason = choice.get("finish_reason");
            finishReason = reason != null ? reason.toString() : null;
            Object message = choice.get("message");
            if (message instanceof Map && ((Map<?, ?>) message).get("content") instanceof String) {
                content = ((String) ((Map<?, ?>) message).get("content")).trim();
            }
        }
        if (content.isEmpty()) {
            log.warn("Model returned empty content: finishReason={}", finishReason);
        }
        return content;
    }

    private List<String> candidateUrls() {
        int start = Math.floorMod(currentIndex.getAndIncrement(), baseUrls.size());
        List<String> candidates = new ArrayList<>(baseUrls.size());
        for (int i = 0; i < baseUrls.size(); i++) {
            candidates.add(baseUrls.get((start + i) % baseUrls.size()));
        }
        return candidates;
    }

    private static List<String> parseUrls(String urlsConfig) {
        List<String> urls = new ArrayList<>();
        if (urlsConfig == null) {
            return urls;
        }
        for (String url : urlsConfig.split(",")) {
            String trimmed = url.trim();
            if (!trimmed.isEmpty()) {
                urls.add(trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed);
            }
        }
        return urls;
    }
}
