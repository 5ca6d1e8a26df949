package com.psyos.pipeline.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psyos.pipeline.domain.PromptSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived Redis copy of the last prompt sent to the model, per tenant and conversation.
 */
@Component
@Slf4j
public class PromptSnapshotStore {

    private static final String SNAPSHOT_KEY = "ai:prompt:{tenantId}:{conversationId}";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;

    public PromptSnapshotStore(StringRedisTemplate redisTemplate,
                               ObjectMapper objectMapper,
                               @Value("${pipeline.ai.snapshot-ttl-minutes:60}") long ttlMinutes) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    public void save(PromptSnapshot snapshot) {
        String key = key(snapshot.getTenantId(), snapshot.getConversationId());
        try {
            redisTemplate.opsForValue().set(key, objectMapper.writeValueAsString(snapshot), ttl);
            log.debug("Stored prompt snapshot: tenantId={}, conversationId={}",
                    snapshot.getTenantId(), snapshot.getConversationId());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Prompt snapshot is not serializable", e);
        }
    }

    public Optional<PromptSnapshot> find(String tenantId, String conversationId) {
        String json = redisTemplate.opsForValue().get(key(tenantId, conversationId));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, PromptSnapshot.class));
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable prompt snapshot: tenantId={}, conversationId={}", tenantId, conversationId);
            return Optional.empty();
        }
    }

    private static String key(String tenantId, String conversationId) {
        return SNAPSHOT_KEY.replace("{tenantId}", tenantId).replace("{conversationId}", conversationId);
    }
}
