package com.psyos.pipeline.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.psyos.pipeline.exception.RateLimitExceededException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-window rate limiter on a shared Redis counter (INCR, EXPIRE on first hit).
 *
 * While Redis is unreachable the limit is enforced per process from a Caffeine-backed
 * counter instead. That fallback is best effort: each instance counts on its own.
 */
@Service
@Slf4j
public class RateLimiter {

    private static final String KEY_PREFIX = "ratelimit:";
    private static final Duration MAX_FALLBACK_WINDOW = Duration.ofHours(1);

    private final StringRedisTemplate redisTemplate;
    private final MetricsService metricsService;
    private final Cache<String, AtomicLong> fallbackCounters;

    public RateLimiter(StringRedisTemplate redisTemplate, MetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.metricsService = metricsService;
        this.fallbackCounters = Caffeine.newBuilder()
                .maximumSize(10_000)
                .expireAfterWrite(MAX_FALLBACK_WINDOW)
                .build();
    }

    /**
     * @throws RateLimitExceededException when the key exceeded {@code limit} hits in the window
     */
    public void enforce(String key, int limit, Duration window) {
        if (!tryAcquire(key, limit, window)) {
            metricsService.recordRateLimited(key.contains(":") ? key.substring(0, key.indexOf(':')) : key);
            throw new RateLimitExceededException(key);
        }
    }

    public boolean tryAcquire(String key, int limit, Duration window) {
        String redisKey = KEY_PREFIX + key;
        long count;
        try {
            Long incremented = redisTemplate.opsForValue().increment(redisKey);
            count = incremented != null ? incremented : 1L;
            if (count == 1L) {
                redisTemplate.expire(redisKey, window);
            }
        } catch (DataAccessException e) {
            log.warn("Rate limit store unavailable, using in-process counter: key={}, error={}", key, e.getMessage());
            count = incrementFallback(key, window);
        }
        return count <= limit;
    }

    long incrementFallback(String key, Duration window) {
        long windowMs = Math.max(1L, window.toMillis());
        long bucket = System.currentTimeMillis() / windowMs;
        return fallbackCounters.get(key + "#" + bucket, k -> new AtomicLong()).incrementAndGet();
    }
}
