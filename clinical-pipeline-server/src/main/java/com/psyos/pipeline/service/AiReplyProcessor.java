package com.psyos.pipeline.service;

import com.psyos.pipeline.domain.AiEpisodeEntity;
import com.psyos.pipeline.domain.AiReplyJob;
import com.psyos.pipeline.domain.ChatTurn;
import com.psyos.pipeline.domain.ConversationEntity;
import com.psyos.pipeline.domain.DetectedSignals;
import com.psyos.pipeline.domain.MessageEntity;
import com.psyos.pipeline.domain.MessageEntity.AuthorType;
import com.psyos.pipeline.domain.OutboundJob;
import com.psyos.pipeline.domain.PatientLanguage;
import com.psyos.pipeline.domain.PromptSnapshot;
import com.psyos.pipeline.domain.SignalConfig;
import com.psyos.pipeline.domain.SignalKey;
import com.psyos.pipeline.domain.UserEntity;
import com.psyos.pipeline.exception.ProviderException;
import com.psyos.pipeline.infrastructure.DataKey;
import com.psyos.pipeline.infrastructure.EnvelopeCryptoService;
import com.psyos.pipeline.infrastructure.JobQueue;
import com.psyos.pipeline.infrastructure.LanguageModelClient;
import com.psyos.pipeline.infrastructure.PromptSnapshotStore;
import com.psyos.pipeline.repository.ConversationStore;
import com.psyos.pipeline.repository.MessageStore;
import com.psyos.pipeline.repository.UserDirectory;
import com.psyos.pipeline.service.PolicyService.ResolvedPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generates the AI reply for a conversation after a patient message.
 *
 * Decision order: high-risk signal (fixed safety text), exhausted episode (fixed
 * closing text), then the model. Every outcome persists exactly one encrypted AI
 * message, counts one episode turn and enqueues its delivery. A redelivered job whose
 * trigger message already has a reply only enqueues that reply's delivery again.
 */
@Service
@Slf4j
public class AiReplyProcessor {

    static final String PSYCHOLOGIST_LABEL = "Psicologo: ";

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final UserDirectory userDirectory;
    private final PolicyService policyService;
    private final SignalDetector signalDetector;
    private final EpisodeOrchestrator episodeOrchestrator;
    private final EnvelopeCryptoService cryptoService;
    private final LanguageModelClient languageModelClient;
    private final PromptSnapshotStore promptSnapshotStore;
    private final JobQueue jobQueue;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final ConversationLockService lockService;
    private final ReplyRecorder replyRecorder;
    private final int contextSize;

    public AiReplyProcessor(ConversationStore conversationStore,
                            MessageStore messageStore,
                            UserDirectory userDirectory,
                            PolicyService policyService,
                            SignalDetector signalDetector,
                            EpisodeOrchestrator episodeOrchestrator,
                            EnvelopeCryptoService cryptoService,
                            LanguageModelClient languageModelClient,
                            PromptSnapshotStore promptSnapshotStore,
                            JobQueue jobQueue,
                            AuditService auditService,
                            MetricsService metricsService,
                            ConversationLockService lockService,
                            ReplyRecorder replyRecorder,
                            @Value("${pipeline.ai.context-size:20}") int contextSize) {
        this.conversationStore = conversationStore;
        this.messageStore = messageStore;
        this.userDirectory = userDirectory;
        this.policyService = policyService;
        this.signalDetector = signalDetector;
        this.episodeOrchestrator = episodeOrchestrator;
        this.cryptoService = cryptoService;
        this.languageModelClient = languageModelClient;
        this.promptSnapshotStore = promptSnapshotStore;
        this.jobQueue = jobQueue;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.lockService = lockService;
        this.replyRecorder = replyRecorder;
        this.contextSize = contextSize;
    }

    /**
     * @return the decision taken, or empty when the conversation is gone, has AI disabled or
     *         the trigger message was already answered
     */
    public Optional<ReplyDecision> generateReply(AiReplyJob job) {
        return lockService.withAiReplyLock(job.getTenantId(), job.getConversationId(), () -> generateLocked(job));
    }

    private Optional<ReplyDecision> generateLocked(AiReplyJob job) {
        String tenantId = job.getTenantId();
        Optional<ConversationEntity> found = conversationStore.findById(tenantId, job.getConversationId());
        if (found.isEmpty() || !found.get().isAiEnabled()) {
            log.debug("AI reply skipped: tenantId={}, conversationId={}, reason={}",
                    tenantId, job.getConversationId(), found.isEmpty() ? "conversation_not_found" : "ai_disabled");
            return Optional.empty();
        }
        ConversationEntity conversation = found.get();

        if (job.getTriggerMessageId() != null) {
            Optional<MessageEntity> answered = messageStore.findReplyTo(tenantId, job.getTriggerMessageId());
            if (answered.isPresent()) {
                // redelivery after the reply was committed: only the dispatch may be missing
                log.info("AI reply already stored, re-enqueueing dispatch: tenantId={}, conversationId={}, messageId={}",
                        tenantId, conversation.getId(), answered.get().getId());
                enqueueDispatch(tenantId, conversation.getId(), answered.get().getId());
                return Optional.empty();
            }
        }

        PatientLanguage language = userDirectory.findById(tenantId, conversation.getPatientUserId())
                .map(UserEntity::getPreferredLanguage)
                .map(PatientLanguage::orDefault)
                .orElse(PatientLanguage.orDefault(null));
        ReplyCopy copy = ReplyCopy.forLanguage(language);
        ResolvedPolicy policy = policyService.resolve(tenantId, conversation);
        AiTuning tuning = policy.getTuning();

        try (DataKey dek = cryptoService.unwrapConversationKey(conversation.getEncryptedDek())) {
            List<DecryptedMessage> history = loadHistory(tenantId, conversation.getId(), dek);

            String latestPatientText = "";
            for (int i = history.size() - 1; i >= 0; i--) {
                if (history.get(i).authorType == AuthorType.PATIENT) {
                    latestPatientText = history.get(i).content;
                    break;
                }
            }
            SignalConfig signalConfig = signalDetector.resolveConfig(policy.getSignalOverrides(), language);
            DetectedSignals signals = signalDetector.detect(latestPatientText, signalConfig);

            List<ChatTurn> prompt = new ArrayList<>();
            prompt.add(ChatTurn.system(buildSystemPrompt(policy.getPromptText(), copy, signals, signalConfig)));
            prompt.addAll(toContext(history));

            AiEpisodeEntity episode = episodeOrchestrator.openOrCreate(tenantId, conversation.getId());
            int remainingTurns = tuning.remainingTurns(episode.getAiTurnsUsed());

            storeSnapshot(tenantId, conversation.getId(), prompt);

            ReplyDecision decision = episodeOrchestrator.decide(signals, remainingTurns);
            String reply;
            switch (decision) {
                case SAFETY_CLOSE:
                    reply = copy.getSafety();
                    break;
                case LIMIT_CLOSE:
                    reply = copy.getClosing();
                    break;
                default: {
                    String completion = null;
                    boolean failed = false;
                    MetricsService.TimerSample timer = metricsService.startTimer();
                    try {
                        completion = languageModelClient.complete(prompt, tuning.getMaxTokens(), tuning.getTemperature());
                    } catch (ProviderException e) {
                        log.warn("Model call failed: tenantId={}, conversationId={}, error={}",
                                tenantId, conversation.getId(), e.getMessage());
                        failed = true;
                    }
                    metricsService.recordModelLatency(languageModelClient.modelName(), timer.stop(), !failed);

                    decision = episodeOrchestrator.afterGeneration(failed, completion, remainingTurns);
                    reply = switch (decision) {
                        case PROVIDER_CLOSE -> copy.getUnavailable();
                        case EMPTY_CLOSE -> copy.getClosing();
                        case LAST_TURN_CLOSE -> (completion.trim() + " " + copy.getClosing()).trim();
                        default -> completion.trim();
                    };
                }
            }

            MessageEntity aiMessage = replyRecorder.record(tenantId, conversation.getId(), job.getTriggerMessageId(),
                    cryptoService.encryptText(reply, dek), episode, tuning, decision.closesEpisode());

            enqueueDispatch(tenantId, conversation.getId(), aiMessage.getId());

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("signals", signals.toMap());
            meta.put("decision", decision.name());
            meta.put("episodeNumber", episode.getEpisodeNumber());
            if (job.getTriggerMessageId() != null) {
                meta.put("triggerMessageId", job.getTriggerMessageId());
            }
            auditService.record(tenantId, AuditService.AI_REPLY, "Message", aiMessage.getId(), meta);
            metricsService.recordAiDecision(decision.name());

            log.info("AI reply stored: tenantId={}, conversationId={}, messageId={}, decision={}, episodeNumber={}",
                    tenantId, conversation.getId(), aiMessage.getId(), decision, episode.getEpisodeNumber());
            return Optional.of(decision);
        }
    }

    private void enqueueDispatch(String tenantId, String conversationId, String messageId) {
        jobQueue.enqueueOutbound(OutboundJob.builder()
                .tenantId(tenantId)
                .conversationId(conversationId)
                .messageId(messageId)
                .build());
    }

    /**
     * Policy blocks, a blank line, then the directives: language, fired signals, no-leak.
     */
    static String buildSystemPrompt(String policyText, ReplyCopy copy, DetectedSignals signals, SignalConfig config) {
        List<String> directives = new ArrayList<>();
        directives.add(copy.getLanguageDirective());
        for (SignalKey key : SignalKey.values()) {
            if (signals.isFired(key)) {
                directives.add(config.directive(key));
            }
        }
        directives.add(copy.getNoLeak());
        directives.removeIf(directive -> directive == null || directive.isBlank());

        String policy = policyText != null ? policyText : "";
        return (policy + "\n\n" + String.join(" ", directives)).trim();
    }

    private List<DecryptedMessage> loadHistory(String tenantId, String conversationId, DataKey dek) {
        List<MessageEntity> newestFirst = messageStore.findRecent(tenantId, conversationId, contextSize);
        List<DecryptedMessage> history = new ArrayList<>(newestFirst.size());
        for (MessageEntity message : newestFirst) {
            String content = cryptoService.decryptText(message.getCiphertext(), message.getIv(), message.getAuthTag(), dek);
            history.add(new DecryptedMessage(message.getAuthorType(), content));
        }
        Collections.reverse(history);
        return history;
    }

    static List<ChatTurn> toContext(List<DecryptedMessage> history) {
        List<ChatTurn> context = new ArrayList<>(history.size());
        for (DecryptedMessage message : history) {
            switch (message.authorType) {
                case PATIENT -> context.add(ChatTurn.user(message.content));
                case PSYCHOLOGIST -> context.add(ChatTurn.assistant(PSYCHOLOGIST_LABEL + message.content));
                default -> context.add(ChatTurn.assistant(message.content));
            }
        }
        return context;
    }

    private void storeSnapshot(String tenantId, String conversationId, List<ChatTurn> prompt) {
        try {
            promptSnapshotStore.save(PromptSnapshot.builder()
                    .tenantId(tenantId)
                    .conversationId(conversationId)
                    .createdAt(Instant.now())
                    .model(languageModelClient.modelName())
                    .messages(prompt)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Prompt snapshot failed: tenantId={}, conversationId={}, error={}",
                    tenantId, conversationId, e.getMessage());
        }
    }

    static final class DecryptedMessage {
        final AuthorType authorType;
        final String content;

        DecryptedMessage(AuthorType authorType, String content) {
            this.authorType = authorType;
            this.content = content;
        }
    }
}
