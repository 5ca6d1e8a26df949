package com.psyos.pipeline.service;

import io.micrometer.core.instrument.Tags;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Log-based pipeline metrics.
 *
 * Counters are kept in memory and written to the log; nothing is exported.
 * Tag values are folded into the counter name so per-topic and per-decision
 * counts stay distinguishable.
 */
@Service
@Slf4j
public class MetricsService {

    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public MetricsService() {
        log.info("MetricsService initialized (log-only)");
    }

    // ===== Counters =====

    public void incrementCounter(String name) {
        long count = counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
        log.debug("[METRIC] Counter: {} = {}", name, count);
    }

    public void incrementCounter(String name, Tags tags) {
        incrementCounter(name + render(tags));
    }

    // ===== Timers =====

    public TimerSample startTimer() {
        return new TimerSample();
    }

    public void stopTimer(TimerSample sample, String name, Tags tags) {
        recordTimer(name, sample.stop(), tags);
    }

    public void recordTimer(String name, Duration duration, Tags tags) {
        log.debug("[METRIC] Timer: {}{} = {}ms", name, render(tags), duration.toMillis());
    }

    // ===== Pipeline metrics =====

    public void recordJobEnqueued(String topic) {
        incrementCounter("jobs.enqueued", Tags.of("topic", topic));
    }

    public void recordJobProcessed(String topic, Duration duration) {
        Tags tags = Tags.of("topic", topic);
        incrementCounter("jobs.processed", tags);
        recordTimer("jobs.duration", duration, tags);
    }

    public void recordJobFailed(String topic, String errorType) {
        incrementCounter("jobs.failed", Tags.of("topic", topic, "error", errorType));
    }

    public void recordAiDecision(String decision) {
        incrementCounter("ai.decisions", Tags.of("decision", decision));
        log.debug("AI decision recorded: decision={}", decision);
    }

    public void recordModelLatency(String model, Duration latency, boolean success) {
        recordTimer("ai.model.latency", latency, Tags.of("model", model, "success", String.valueOf(success)));
    }

    public void recordInboundIgnored(String reason) {
        incrementCounter("inbound.ignored", Tags.of("reason", reason));
    }

    public void recordRateLimited(String scope) {
        incrementCounter("ratelimit.rejected", Tags.of("scope", scope));
    }

    public void recordAuthenticationAttempt(boolean success) {
        incrementCounter("authentication.attempts", Tags.of("success", String.valueOf(success)));
    }

    public void recordError(String errorType, String component) {
        incrementCounter("errors", Tags.of("type", errorType, "component", component));
        log.error("Error recorded: type={}, component={}", errorType, component);
    }

    // ===== Utility Methods =====

    public long getCounterValue(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    public long getCounterValue(String name, Tags tags) {
        return getCounterValue(name + render(tags));
    }

    private static String render(Tags tags) {
        if (tags == null) {
            return "";
        }
        String rendered = StreamSupport.stream(tags.spliterator(), false)
                .map(tag -> tag.getKey() + "=" + tag.getValue())
                .collect(Collectors.joining(","));
        return rendered.isEmpty() ? "" : "{" + rendered + "}";
    }

    public static class TimerSample {
        private final long startTime = System.nanoTime();

        public Duration stop() {
            return Duration.ofNanos(System.nanoTime() - startTime);
        }
    }
}
