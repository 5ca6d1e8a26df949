package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.ChatTurn;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.ConversationEntity.ConversationStatus;
import com.psyos.pipeline.domain.DetectedSignals;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.AuthorType;
import com.psyos.pipeline.domain.MessageEntity.Direction;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.domain.PatientLanguage;
import com.psyos.pipeline.domain.PromptSnapshot;
import com.psyos.pipeline.domain.SignalKey;
import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.domain.UserRole;
import com.psyos.pipeline.exception.ConfigurationException;
import com.psyos.pipeline.exception.ProviderException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EncryptedPayload;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.infrastructure.JobQueue;
import com.psyos.pipeline.infrastructure.LanguageModelClient;
import com.psyos.pipeline.infrastructure.MasterKeyProvider;
import com.psyos.pipeline.infrastructure.PromptSnapshotStore;
import com.psyos.pipeline.repository.ConversationStore;
import com.psyos.pipeline.repository.EpisodeStore;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.UserDirectory;
import com.psyos.pipeline.service.PolicyService.ResolvedPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.QueryTimeoutException;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AiReplyProcessorTest {

    private static final String TENANT = "tenant-1";
    private static final String CONVERSATION = "conv-1";
    private static final String PATIENT = "patient-1";
    private static final String PSYCHOLOGIST = "psy-1";

    private final EnvelopeCryptoService crypto = new EnvelopeCryptoService(
            MasterKeyProvider.fromBase64(Base64.getEncoder().encodeToString(new byte[32])));
    private final ReplyCopy copy = ReplyCopy.forLanguage(PatientLanguage.PT);

    private ConversationStore conversationStore;
    private MessageStore messageStore;
    private UserDirectory userDirectory;
    private PolicyService policyService;
    private EpisodeStore episodeStore;
    private LanguageModelClient model;
    private PromptSnapshotStore snapshotStore;
    private JobQueue jobQueue;
    private AuditService auditService;
    private ConversationLockService lockService;
    private AiReplyProcessor processor;

    private ConversationEntity conversation;
    private AiEpisodeEntity episode;
    private final List<MessageEntity> history = new ArrayList<>();

    @BeforeEach
    void setUp() {
        conversationStore = mock(ConversationStore.class);
        messageStore = mock(MessageStore.class);
        userDirectory = mock(UserDirectory.class);
        policyService = mock(PolicyService.class);
        episodeStore = mock(EpisodeStore.class);
        model = mock(LanguageModelClient.class);
        snapshotStore = mock(PromptSnapshotStore.class);
        jobQueue = mock(JobQueue.class);
        auditService = mock(AuditService.class);
        lockService = mock(ConversationLockService.class);

        conversation = ConversationEntity.builder()
                .id(CONVERSATION).tenantId(TENANT)
                .psychologistUserId(PSYCHOLOGIST).patientUserId(PATIENT)
                .status(ConversationStatus.OPEN).aiEnabled(true)
                .encryptedDek(crypto.newWrappedConversationKey())
                .build();
        episode = AiEpisodeEntity.builder()
                .id("ep-1").tenantId(TENANT).conversationId(CONVERSATION)
                .episodeNumber(1).aiTurnsUsed(0).open(true).build();

        when(conversationStore.findById(TENANT, CONVERSATION)).thenReturn(Optional.of(conversation));
        when(userDirectory.findById(TENANT, PATIENT)).thenReturn(Optional.of(UserEntity.builder()
                .id(PATIENT).tenantId(TENANT).role(UserRole.PATIENT).preferredLanguage(PatientLanguage.PT).build()));
        when(policyService.resolve(TENANT, conversation))
                .thenReturn(new ResolvedPolicy("Seja breve.", AiTuning.DEFAULTS, null));
        when(messageStore.findRecent(eq(TENANT), eq(CONVERSATION), anyInt())).thenAnswer(inv -> history);
        when(messageStore.create(eq(TENANT), any())).thenAnswer(inv -> {
            MessageEntity message = inv.getArgument(1);
            message.setId("ai-msg-1");
            return message;
        });
        when(episodeStore.findLatestOpen(TENANT, CONVERSATION)).thenAnswer(inv -> Optional.of(episode));
        when(episodeStore.update(eq(TENANT), eq("ep-1"), any())).thenAnswer(inv -> {
            Consumer<AiEpisodeEntity> mutation = inv.getArgument(2);
            mutation.accept(episode);
            return Optional.of(episode);
        });
        when(lockService.withAiReplyLock(eq(TENANT), eq(CONVERSATION), any()))
                .thenAnswer(inv -> ((Supplier<?>) inv.getArgument(2)).get());
        when(model.modelName()).thenReturn("gpt-4o-mini");

        EpisodeOrchestrator orchestrator = new EpisodeOrchestrator(episodeStore);
        processor = new AiReplyProcessor(conversationStore, messageStore, userDirectory, policyService,
                new SignalDetector(), orchestrator, crypto, model, snapshotStore,
                jobQueue, auditService, new MetricsService(), lockService,
                new ReplyRecorder(messageStore, orchestrator), 20);
    }

    /**
     * Adds a message to the conversation history; callers add oldest first.
     */
    private void said(AuthorType author, String text) {
        EncryptedPayload sealed;
        try (DataKey dek = crypto.unwrapConversationKey(conversation.getEncryptedDek())) {
            sealed = crypto.encryptText(text, dek);
        }
        history.add(0, MessageEntity.builder()
                .id("m" + history.size()).tenantId(TENANT).conversationId(CONVERSATION)
                .direction(author == AuthorType.PATIENT ? Direction.IN : Direction.OUT)
                .authorType(author)
                .ciphertext(sealed.ciphertextBase64()).iv(sealed.nonceBase64()).authTag(sealed.tagBase64())
                .build());
    }

    private Optional<ReplyDecision> run() {
        return processor.generateReply(AiReplyJob.builder()
                .tenantId(TENANT).conversationId(CONVERSATION).triggerMessageId("trigger-1").build());
    }

    private String storedReply() {
        ArgumentCaptor<MessageEntity> captor = ArgumentCaptor.forClass(MessageEntity.class);
        verify(messageStore).create(eq(TENANT), captor.capture());
        MessageEntity stored = captor.getValue();
        assertThat(stored.getAuthorType()).isEqualTo(AuthorType.AI);
        assertThat(stored.getDirection()).isEqualTo(Direction.OUT);
        try (DataKey dek = crypto.unwrapConversationKey(conversation.getEncryptedDek())) {
            return crypto.decryptText(stored.getCiphertext(), stored.getIv(), stored.getAuthTag(), dek);
        }
    }

    @SuppressWarnings("unchecked")
    private List<ChatTurn> promptSentToModel() {
        ArgumentCaptor<List<ChatTurn>> captor = ArgumentCaptor.forClass(List.class);
        verify(model).complete(captor.capture(), anyInt(), anyDouble());
        return captor.getValue();
    }

    @Nested
    @DisplayName("Safety and limits")
    class SafetyAndLimits {

        @Test
        @DisplayName("High risk sends the safety text without calling the model")
        void highRiskSkipsModel() {
            said(AuthorType.PATIENT, "me quiero morir");

            assertThat(run()).contains(ReplyDecision.SAFETY_CLOSE);

            verify(model, never()).complete(anyList(), anyInt(), anyDouble());
            assertThat(storedReply()).isEqualTo(copy.getSafety());
            assertThat(episode.isOpen()).isFalse();
            assertThat(episode.getAiTurnsUsed()).isEqualTo(1);
            verify(jobQueue).enqueueOutbound(new OutboundJob(TENANT, CONVERSATION, "ai-msg-1"));
        }

        @Test
        @DisplayName("High risk wins even when the episode is exhausted")
        void highRiskBeforeLimit() {
            episode.setAiTurnsUsed(3);
            said(AuthorType.PATIENT, "penso em suicidio");

            assertThat(run()).contains(ReplyDecision.SAFETY_CLOSE);
            assertThat(episode.getAiTurnsUsed()).isEqualTo(3);
        }

        @Test
        @DisplayName("An exhausted episode gets the closing text")
        void exhaustedEpisode() {
            episode.setAiTurnsUsed(3);
            said(AuthorType.PATIENT, "oi de novo");

            assertThat(run()).contains(ReplyDecision.LIMIT_CLOSE);

            verify(model, never()).complete(anyList(), anyInt(), anyDouble());
            assertThat(storedReply()).isEqualTo(copy.getClosing());
            assertThat(episode.isOpen()).isFalse();
        }

        @Test
        @DisplayName("The prompt snapshot is stored even for the safety path")
        void snapshotOnSafety() {
            said(AuthorType.PATIENT, "me quiero morir");

            run();

            ArgumentCaptor<PromptSnapshot> captor = ArgumentCaptor.forClass(PromptSnapshot.class);
            verify(snapshotStore).save(captor.capture());
            assertThat(captor.getValue().getConversationId()).isEqualTo(CONVERSATION);
            assertThat(captor.getValue().getMessages().get(0).getRole()).isEqualTo(ChatTurn.SYSTEM);
        }
    }

    @Nested
    @DisplayName("Model replies")
    class ModelReplies {

        @Test
        @DisplayName("A normal reply keeps the episode open")
        void continues() {
            said(AuthorType.PATIENT, "hoje foi um dia dificil");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("  Conte mais.  ");

            assertThat(run()).contains(ReplyDecision.CONTINUE);

            assertThat(storedReply()).isEqualTo("Conte mais.");
            assertThat(episode.isOpen()).isTrue();
            assertThat(episode.getAiTurnsUsed()).isEqualTo(1);
        }

        @Test
        @DisplayName("The last allowed turn appends the closing text")
        void lastTurn() {
            episode.setAiTurnsUsed(2);
            said(AuthorType.PATIENT, "ok");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Entendo.");

            assertThat(run()).contains(ReplyDecision.LAST_TURN_CLOSE);

            assertThat(storedReply()).isEqualTo("Entendo. " + copy.getClosing());
            assertThat(episode.isOpen()).isFalse();
            assertThat(episode.getAiTurnsUsed()).isEqualTo(3);
        }

        @Test
        @DisplayName("A provider failure sends the unavailable text and closes")
        void providerFailure() {
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenThrow(new ProviderException("HTTP 503"));

            assertThat(run()).contains(ReplyDecision.PROVIDER_CLOSE);

            assertThat(storedReply()).isEqualTo(copy.getUnavailable());
            assertThat(episode.isOpen()).isFalse();
        }

        @Test
        @DisplayName("A blank completion sends the closing text")
        void blankCompletion() {
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("   ");

            assertThat(run()).contains(ReplyDecision.EMPTY_CLOSE);

            assertThat(storedReply()).isEqualTo(copy.getClosing());
        }

        @Test
        @DisplayName("Missing credentials propagate and nothing is stored")
        void configurationErrorPropagates() {
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble()))
                    .thenThrow(new ConfigurationException("OPENAI_API_KEY not configured"));

            assertThatThrownBy(AiReplyProcessorTest.this::run).isInstanceOf(ConfigurationException.class);

            verify(messageStore, never()).create(any(), any());
            verifyNoInteractions(jobQueue);
        }

        @Test
        @DisplayName("Tuning from the policy reaches the model")
        void tuningReachesModel() {
            when(policyService.resolve(TENANT, conversation)).thenReturn(new ResolvedPolicy("Seja breve.",
                    new AiTuning(5, 120, 0.2, false), null));
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Oi!");

            run();

            verify(model).complete(anyList(), eq(120), eq(0.2));
        }

        @Test
        @DisplayName("A failing prompt snapshot does not block the reply")
        void snapshotFailureIgnored() {
            said(AuthorType.PATIENT, "oi");
            doThrow(new IllegalStateException("redis down")).when(snapshotStore).save(any());
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Oi!");

            assertThat(run()).contains(ReplyDecision.CONTINUE);
        }
    }

    @Nested
    @DisplayName("Prompt assembly")
    class PromptAssembly {

        @Test
        @DisplayName("History is chronological with labelled psychologist turns")
        void historyOrder() {
            said(AuthorType.PSYCHOLOGIST, "Como foi a semana?");
            said(AuthorType.PATIENT, "Ela me dijo coisas e eu contestei");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Entendo.");

            run();

            List<ChatTurn> prompt = promptSentToModel();
            assertThat(prompt).hasSize(3);
            assertThat(prompt.get(0).getRole()).isEqualTo(ChatTurn.SYSTEM);
            assertThat(prompt.get(0).getContent())
                    .startsWith("Seja breve.\n\n")
                    .contains(copy.getLanguageDirective())
                    .contains(copy.signalDirective(SignalKey.ANGER))
                    .endsWith(copy.getNoLeak());
            assertThat(prompt.get(1)).isEqualTo(ChatTurn.assistant("Psicologo: Como foi a semana?"));
            assertThat(prompt.get(2)).isEqualTo(ChatTurn.user("Ela me dijo coisas e eu contestei"));
        }

        @Test
        @DisplayName("The system prompt lists only fired directives")
        void systemPromptDirectives() {
            SignalDetector detector = new SignalDetector();
            String prompt = AiReplyProcessor.buildSystemPrompt("", copy,
                    new DetectedSignals(false, true, false, false), detector.defaults(PatientLanguage.PT));

            assertThat(prompt).isEqualTo(String.join(" ", copy.getLanguageDirective(),
                    copy.signalDirective(SignalKey.DISCONNECT), copy.getNoLeak()));
        }

        @Test
        @DisplayName("Audit metadata carries signals, decision and trigger")
        void auditMeta() {
            said(AuthorType.PATIENT, "me quiero morir");

            run();

            @SuppressWarnings("unchecked")
            ArgumentCaptor<Map<String, Object>> meta = ArgumentCaptor.forClass(Map.class);
            verify(auditService).record(eq(TENANT), eq(AuditService.AI_REPLY), eq("Message"), eq("ai-msg-1"), meta.capture());
            assertThat(meta.getValue())
                    .containsEntry("decision", "SAFETY_CLOSE")
                    .containsEntry("episodeNumber", 1)
                    .containsEntry("triggerMessageId", "trigger-1")
                    .containsKey("signals");
        }
    }

    @Test
    @DisplayName("Nothing happens when AI is disabled")
    void aiDisabled() {
        conversation.setAiEnabled(false);

        assertThat(run()).isEmpty();

        verifyNoInteractions(model, jobQueue, auditService, episodeStore);
    }

    @Nested
    @DisplayName("Redelivered jobs")
    class Redelivery {

        @Test
        @DisplayName("The reply remembers the message it answers")
        void replyLinksTrigger() {
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Conte mais.");

            run();

            ArgumentCaptor<MessageEntity> captor = ArgumentCaptor.forClass(MessageEntity.class);
            verify(messageStore).create(eq(TENANT), captor.capture());
            assertThat(captor.getValue().getReplyToMessageId()).isEqualTo("trigger-1");
        }

        @Test
        @DisplayName("An answered trigger only re-enqueues the existing reply")
        void answeredTrigger() {
            said(AuthorType.PATIENT, "oi");
            when(messageStore.findReplyTo(TENANT, "trigger-1")).thenReturn(Optional.of(MessageEntity.builder()
                    .id("ai-msg-0").tenantId(TENANT).conversationId(CONVERSATION)
                    .direction(Direction.OUT).authorType(AuthorType.AI).replyToMessageId("trigger-1").build()));

            assertThat(run()).isEmpty();

            verify(jobQueue).enqueueOutbound(new OutboundJob(TENANT, CONVERSATION, "ai-msg-0"));
            verify(messageStore, never()).create(any(), any());
            verify(episodeStore, never()).update(any(), any(), any());
            verifyNoInteractions(model, auditService);
        }

        @Test
        @DisplayName("A failed turn update fails the job before anything is dispatched")
        void turnUpdateFailure() {
            said(AuthorType.PATIENT, "oi");
            when(model.complete(anyList(), anyInt(), anyDouble())).thenReturn("Conte mais.");
            when(episodeStore.update(eq(TENANT), eq("ep-1"), any()))
                    .thenThrow(new QueryTimeoutException("db unavailable"));

            assertThatThrownBy(() -> run()).isInstanceOf(QueryTimeoutException.class);

            verify(jobQueue, never()).enqueueOutbound(any());
            verify(auditService, never()).record(any(), any(), any(), any(), any());
        }
    }
}
