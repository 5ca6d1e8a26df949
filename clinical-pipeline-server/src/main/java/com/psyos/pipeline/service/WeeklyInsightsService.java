package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.DetectedSignals;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.PolicyFlags;
import com.psyos.pipeline.domain.SignalConfig;
import com.psyos.pipeline.domain.SignalKey;
import com.psyos.pipeline.domain.SignalOverrides;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.domain.WeeklyInsight;
import com.psyos.pipeline.domain.WeeklySummaryEntity;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.PolicyStore;
import com.psyos.pipeline.repository.WeeklySummaryStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Weekly signal tallies for the psychologist leading a conversation.
 *
 * Weeks run Monday to Monday in UTC. Each week's messages are decrypted and run through
 * the psychologist's signal configuration; the resulting counts are cached per week and
 * served from the cache until a refresh is requested.
 */
@Service
@Slf4j
public class WeeklyInsightsService {

    static final int DEFAULT_WEEKS = 8;
    static final int MAX_WEEKS = 26;
    static final int MAX_MESSAGES_PER_WEEK = 5000;
    private static final Duration WEEK = Duration.ofDays(7);

    private final ConversationAccessGuard accessGuard;
    private final MessageStore messageStore;
    private final PolicyStore policyStore;
    private final WeeklySummaryStore summaryStore;
    private final SignalDetector signalDetector;
    private final EnvelopeCryptoService cryptoService;

    public WeeklyInsightsService(ConversationAccessGuard accessGuard,
                                 MessageStore messageStore,
                                 PolicyStore policyStore,
                                 WeeklySummaryStore summaryStore,
                                 SignalDetector signalDetector,
                                 EnvelopeCryptoService cryptoService) {
        this.accessGuard = accessGuard;
        this.messageStore = messageStore;
        this.policyStore = policyStore;
        this.summaryStore = summaryStore;
        this.signalDetector = signalDetector;
        this.cryptoService = cryptoService;
    }

    /**
     * @param weekStart any day of the week to report; null reports the latest weeks of activity
     * @param weeks     how many weeks back from the latest activity, when weekStart is null
     * @param refresh   recompute even when a cached tally exists
     * @return one entry per week, newest first
     */
    public List<WeeklyInsight> weekly(TenantUserContext context, String conversationId,
                                      LocalDate weekStart, Integer weeks, boolean refresh) {
        if (!context.hasRole(UserRole.PSYCHOLOGIST)) {
            throw new AccessDeniedException("Weekly insights require PSYCHOLOGIST");
        }
        if (weeks != null && (weeks < 1 || weeks > MAX_WEEKS)) {
            throw new IllegalArgumentException("weeks must be between 1 and " + MAX_WEEKS);
        }
        ConversationEntity conversation = accessGuard.requireParticipant(context, conversationId);
        String tenantId = context.getTenantId();

        List<Instant> starts = weekStarts(tenantId, conversation.getId(), weekStart, weeks);
        SignalConfig signalConfig = signalDetector.resolveConfig(signalOverrides(tenantId, context.getUserId()));

        List<WeeklyInsight> items = new ArrayList<>(starts.size());
        int computed = 0;
        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.getEncryptedDek())) {
            for (Instant start : starts) {
                Optional<WeeklySummaryEntity> cached = refresh
                        ? Optional.empty()
                        : summaryStore.findWeek(tenantId, conversation.getId(), start);
                WeeklySummaryEntity summary;
                if (cached.isPresent()) {
                    summary = cached.get();
                } else {
                    summary = tally(tenantId, conversation.getId(), start, dek, signalConfig);
                    computed++;
                }
                items.add(WeeklyInsight.from(summary));
            }
        }
        items.sort(Comparator.comparing(WeeklyInsight::getWeekStart).reversed());

        log.info("Weekly insights served: tenantId={}, conversationId={}, weeks={}, computed={}",
                tenantId, conversation.getId(), items.size(), computed);
        return items;
    }

    static Instant startOfWeek(LocalDate day) {
        return day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY))
                .atStartOfDay(ZoneOffset.UTC)
                .toInstant();
    }

    private List<Instant> weekStarts(String tenantId, String conversationId, LocalDate weekStart, Integer weeks) {
        if (weekStart != null) {
            return List.of(startOfWeek(weekStart));
        }
        Instant latest = messageStore.findRecent(tenantId, conversationId, 1).stream()
                .findFirst()
                .map(MessageEntity::getCreatedAt)
                .orElseGet(Instant::now);
        Instant newest = startOfWeek(LocalDate.ofInstant(latest, ZoneOffset.UTC));
        int count = weeks != null ? weeks : DEFAULT_WEEKS;
        List<Instant> starts = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            starts.add(newest.minus(WEEK.multipliedBy(i)));
        }
        return starts;
    }

    private SignalOverrides signalOverrides(String tenantId, String psychologistUserId) {
        return policyStore.findPsychologistPolicy(tenantId, psychologistUserId)
                .map(AiPolicyEntity::getFlags)
                .map(PolicyFlags::getSignalConfig)
                .orElse(null);
    }

    private WeeklySummaryEntity tally(String tenantId, String conversationId, Instant start,
                                      DataKey dek, SignalConfig signalConfig) {
        Instant end = start.plus(WEEK);
        List<MessageEntity> messages =
                messageStore.findWindow(tenantId, conversationId, start, end, MAX_MESSAGES_PER_WEEK);

        Map<String, Integer> counts = new LinkedHashMap<>();
        for (MessageEntity message : messages) {
            String text = cryptoService.decryptText(message.getCiphertext(), message.getIv(), message.getAuthTag(), dek);
            DetectedSignals detected = signalDetector.detect(text, signalConfig);
            for (SignalKey key : SignalKey.values()) {
                if (detected.isFired(key)) {
                    counts.merge(key.jsonName(), 1, Integer::sum);
                }
            }
        }
        if (messages.size() == MAX_MESSAGES_PER_WEEK) {
            log.warn("Weekly tally truncated: tenantId={}, conversationId={}, weekStart={}, limit={}",
                    tenantId, conversationId, start, MAX_MESSAGES_PER_WEEK);
        }
        return summaryStore.save(tenantId, conversationId, start, end, counts, messages.size());
    }
}
