package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiPolicyEntity;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.PolicyFlags;
import com.psyos.pipeline.domain.SignalOverrides;
import com.psyos.pipeline.domain.SignalRule;
import com.psyos.pipeline.domain.TenantUserContext;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.domain.WeeklyInsight;
import com.psyos.pipeline.domain.WeeklySummaryEntity;
import com.psyos.pipeline.exception.AccessDeniedException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EncryptedPayload;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.infrastructure.MasterKeyProvider;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.PolicyStore;
import com.psyos.pipeline.repository.WeeklySummaryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WeeklyInsightsServiceTest {

    private static final String TENANT = "tenant-1";
    private static final Instant WEEK_OF_OCT_12 = Instant.parse("2026-10-12T00:00:00Z");
    private static final Instant WEEK_OF_OCT_19 = Instant.parse("2026-10-19T00:00:00Z");

    private final EnvelopeCryptoService crypto = new EnvelopeCryptoService(
            MasterKeyProvider.fromBase64(Base64.getEncoder().encodeToString(new byte[32])));

    private ConversationAccessGuard accessGuard;
    private MessageStore messageStore;
    private PolicyStore policyStore;
    private WeeklySummaryStore summaryStore;
    private WeeklyInsightsService service;

    private ConversationEntity conversation;
    private final TenantUserContext psychologist = new TenantUserContext(TENANT, "psy-1", UserRole.PSYCHOLOGIST);

    @BeforeEach
    void setUp() {
        accessGuard = mock(ConversationAccessGuard.class);
        messageStore = mock(MessageStore.class);
        policyStore = mock(PolicyStore.class);
        summaryStore = mock(WeeklySummaryStore.class);
        service = new WeeklyInsightsService(accessGuard, messageStore, policyStore, summaryStore,
                new SignalDetector(), crypto);

        conversation = ConversationEntity.builder()
                .id("conv-1").tenantId(TENANT).psychologistUserId("psy-1").patientUserId("patient-1")
                .encryptedDek(crypto.newWrappedConversationKey()).build();
        when(accessGuard.requireParticipant(psychologist, "conv-1")).thenReturn(conversation);
        when(summaryStore.save(eq(TENANT), eq("conv-1"), any(), any(), anyMap(), anyInt())).thenAnswer(inv ->
                WeeklySummaryEntity.builder()
                        .tenantId(TENANT).conversationId("conv-1")
                        .weekStart(inv.getArgument(2)).weekEnd(inv.getArgument(3))
                        .signalCounts(inv.getArgument(4)).messageCount(inv.getArgument(5))
                        .generatedAt(Instant.now()).build());
    }

    private List<MessageEntity> sealed(String... texts) {
        List<MessageEntity> messages = new ArrayList<>();
        try (DataKey dek = crypto.unwrapConversationKey(conversation.getEncryptedDek())) {
            for (String text : texts) {
                EncryptedPayload payload = crypto.encryptText(text, dek);
                messages.add(MessageEntity.builder()
                        .tenantId(TENANT).conversationId("conv-1")
                        .ciphertext(payload.ciphertextBase64()).iv(payload.nonceBase64()).authTag(payload.tagBase64())
                        .build());
            }
        }
        return messages;
    }

    private static WeeklySummaryEntity cachedWeek(Instant start, Map<String, Integer> counts, int messages) {
        return WeeklySummaryEntity.builder()
                .tenantId(TENANT).conversationId("conv-1")
                .weekStart(start).weekEnd(start.plusSeconds(7 * 86400))
                .signalCounts(counts).messageCount(messages).generatedAt(start).build();
    }

    @Nested
    @DisplayName("Access")
    class Access {

        @ParameterizedTest
        @CsvSource({"patient-1, PATIENT", "admin-1, ADMIN"})
        @DisplayName("Only the psychologist may read weekly insights")
        void psychologistOnly(String userId, UserRole role) {
            TenantUserContext caller = new TenantUserContext(TENANT, userId, role);

            assertThatThrownBy(() -> service.weekly(caller, "conv-1", null, null, false))
                    .isInstanceOf(AccessDeniedException.class);
            verifyNoInteractions(accessGuard, messageStore, summaryStore);
        }

        @ParameterizedTest
        @ValueSource(ints = {0, -1, 27})
        @DisplayName("Should reject a week count outside 1..26")
        void weekCountBounds(int weeks) {
            assertThatThrownBy(() -> service.weekly(psychologist, "conv-1", null, weeks, false))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Tallying a week")
    class Tally {

        @Test
        @DisplayName("Counts messages per fired signal with the psychologist's keywords")
        void countsSignals() {
            when(policyStore.findPsychologistPolicy(TENANT, "psy-1")).thenReturn(Optional.of(AiPolicyEntity.builder()
                    .flags(PolicyFlags.builder().signalConfig(SignalOverrides.builder()
                            .anger(SignalRule.builder().keywords(List.of("furiosa")).build()).build()).build())
                    .build()));
            when(messageStore.findWindow(TENANT, "conv-1", WEEK_OF_OCT_12, WEEK_OF_OCT_19,
                    WeeklyInsightsService.MAX_MESSAGES_PER_WEEK))
                    .thenReturn(sealed("Estou furiosa hoje", "me quiero morir", "tudo bem", "furiosa de novo"));

            List<WeeklyInsight> items = service.weekly(psychologist, "conv-1", LocalDate.of(2026, 10, 14), null, false);

            assertThat(items).singleElement().satisfies(item -> {
                assertThat(item.getWeekStart()).isEqualTo(WEEK_OF_OCT_12);
                assertThat(item.getWeekEnd()).isEqualTo(WEEK_OF_OCT_19);
                assertThat(item.getMessageCount()).isEqualTo(4);
                assertThat(item.getSignalCount()).isEqualTo(3);
                assertThat(item.getSignalsTriggered())
                        .extracting(WeeklyInsight.SignalCount::getKey, WeeklyInsight.SignalCount::getCount)
                        .containsExactly(tuple("anger", 2), tuple("highRisk", 1));
            });
            verify(summaryStore).save(TENANT, "conv-1", WEEK_OF_OCT_12, WEEK_OF_OCT_19,
                    Map.of("anger", 2, "highRisk", 1), 4);
        }

        @Test
        @DisplayName("A cached week is served without reading messages")
        void cachedWeek() {
            when(summaryStore.findWeek(TENANT, "conv-1", WEEK_OF_OCT_12))
                    .thenReturn(Optional.of(WeeklyInsightsServiceTest.cachedWeek(WEEK_OF_OCT_12, Map.of("rumination", 5), 9)));

            List<WeeklyInsight> items = service.weekly(psychologist, "conv-1", LocalDate.of(2026, 10, 18), null, false);

            assertThat(items).singleElement().satisfies(item -> {
                assertThat(item.getMessageCount()).isEqualTo(9);
                assertThat(item.getSignalCount()).isEqualTo(5);
            });
            verify(messageStore, never()).findWindow(any(), any(), any(), any(), anyInt());
            verify(summaryStore, never()).save(any(), any(), any(), any(), anyMap(), anyInt());
        }

        @Test
        @DisplayName("Refresh recomputes a cached week")
        void refreshRecomputes() {
            when(messageStore.findWindow(TENANT, "conv-1", WEEK_OF_OCT_12, WEEK_OF_OCT_19,
                    WeeklyInsightsService.MAX_MESSAGES_PER_WEEK)).thenReturn(sealed("no se"));

            List<WeeklyInsight> items = service.weekly(psychologist, "conv-1", LocalDate.of(2026, 10, 12), null, true);

            assertThat(items.get(0).getSignalsTriggered())
                    .extracting(WeeklyInsight.SignalCount::getKey).containsExactly("disconnect");
            verify(summaryStore, never()).findWeek(any(), any(), any());
        }
    }

    @Test
    @DisplayName("Without a week, reports the latest weeks of activity newest first")
    void latestWeeks() {
        when(messageStore.findRecent(TENANT, "conv-1", 1)).thenReturn(List.of(MessageEntity.builder()
                .createdAt(Instant.parse("2026-10-15T10:00:00Z")).build()));
        when(summaryStore.findWeek(eq(TENANT), eq("conv-1"), any())).thenAnswer(inv ->
                Optional.of(cachedWeek(inv.getArgument(2), Map.of(), 0)));

        List<WeeklyInsight> items = service.weekly(psychologist, "conv-1", null, 3, false);

        assertThat(items).extracting(WeeklyInsight::getWeekStart).containsExactly(
                WEEK_OF_OCT_12, Instant.parse("2026-10-05T00:00:00Z"), Instant.parse("2026-09-28T00:00:00Z"));
        assertThat(items).allSatisfy(item -> assertThat(item.getSignalsTriggered()).isEmpty());
    }

    @ParameterizedTest
    @CsvSource({
        "2026-10-12, 2026-10-12T00:00:00Z",
        "2026-10-14, 2026-10-12T00:00:00Z",
        "2026-10-18, 2026-10-12T00:00:00Z",
        "2026-10-19, 2026-10-19T00:00:00Z"
    })
    @DisplayName("Weeks start on Monday at midnight UTC")
    void startOfWeek(String day, String expected) {
        assertThat(WeeklyInsightsService.startOfWeek(LocalDate.parse(day))).isEqualTo(Instant.parse(expected));
    }
}
