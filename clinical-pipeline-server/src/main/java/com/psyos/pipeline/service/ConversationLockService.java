package com.psyos.pipeline.service;

import com.psyos.pipeline.exception.LockUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Serializes AI reply generation per conversation across workers with a Redisson lock.
 */
@Service
@Slf4j
public class ConversationLockService {

    private static final String AI_REPLY_LOCK = "lock:ai-reply:{tenantId}:{conversationId}";

    private final RedissonClient redissonClient;
    private final Duration waitTime;
    private final Duration leaseTime;

    public ConversationLockService(RedissonClient redissonClient,
                                   @Value("${pipeline.ai.lock-wait-ms:10000}") long waitMs,
                                   @Value("${pipeline.ai.lock-lease-ms:120000}") long leaseMs) {
        this.redissonClient = redissonClient;
        this.waitTime = Duration.ofMillis(waitMs);
        this.leaseTime = Duration.ofMillis(leaseMs);
    }

    /**
     * Runs the operation while holding the conversation's AI reply lock.
     *
     * @throws LockUnavailableException when the lock is not acquired within the wait window
     */
    public <T> T withAiReplyLock(String tenantId, String conversationId, Supplier<T> operation) {
        String lockKey = AI_REPLY_LOCK.replace("{tenantId}", tenantId).replace("{conversationId}", conversationId);
        RLock lock = redissonClient.getLock(lockKey);

        boolean acquired;
        try {
            acquired = lock.tryLock(waitTime.toMillis(), leaseTime.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockUnavailableException(lockKey, e);
        }
        if (!acquired) {
            log.warn("AI reply lock busy: key={}, waitMs={}", lockKey, waitTime.toMillis());
            throw new LockUnavailableException(lockKey);
        }

        log.debug("Lock acquired: key={}", lockKey);
        try {
            return operation.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
                log.debug("Lock released: key={}", lockKey);
            }
        }
    }
}
