package ch.so.arp.voice.chat;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import ch.so.arp.voice.InvalidRequestException;
import ch.so.arp.voice.ResourceNotFoundException;
import ch.so.arp.voice.persistence.ConversationRepository;
import ch.so.arp.voice.persistence.Message;
import ch.so.arp.voice.persistence.MessageRepository;
import ch.so.arp.voice.persistence.MessageRole;
import ch.so.arp.voice.persistence.VoiceProfile;
import ch.so.arp.voice.persistence.VoiceProfileRepository;
import ch.so.arp.voice.prompt.ComposedRequest;
import ch.so.arp.voice.provider.CancellationReason;
import ch.so.arp.voice.provider.CancellationToken;
import ch.so.arp.voice.provider.EmptyResponseException;
import ch.so.arp.voice.provider.ModelCatalog;

/**
 * Runs chat turns. The user message is stored on the caller thread, the
 * response is generated on the worker executor and streamed to the session's
 * subscriber. Every way a turn can end (provider end of stream, stop, client
 * gone, idle timeout, error) goes through one finalize step that stores the
 * assistant message at most once and releases the conversation.
 */
public class GenerationOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationOrchestrator.class);

    public static final String FALLBACK_MESSAGE =
            "I apologize, but I encountered an error generating a response. Please try again.";

    private static final long MIN_WATCHDOG_PERIOD_NANOS = TimeUnit.MILLISECONDS.toNanos(10);
    private static final int PREVIEW_LENGTH = 40;

    private final ConversationRepository conversationRepository;
    private final MessageRepository messageRepository;
    private final VoiceProfileRepository profileRepository;
    private final PromptAssembler promptAssembler;
    private final ModelCatalog modelCatalog;
    private final ConversationTitler titler;
    private final ChatProperties properties;
    private final Executor workerExecutor;
    private final Executor dispatchExecutor;
    private final ScheduledExecutorService watchdogScheduler;

    private final Map<Long, StreamSession> activeSessions = new ConcurrentHashMap<>();

    public GenerationOrchestrator(ConversationRepository conversationRepository, MessageRepository messageRepository,
            VoiceProfileRepository profileRepository, PromptAssembler promptAssembler, ModelCatalog modelCatalog,
            ConversationTitler titler, ChatProperties properties, Executor workerExecutor, Executor dispatchExecutor,
            ScheduledExecutorService watchdogScheduler) {
        this.conversationRepository = Objects.requireNonNull(conversationRepository, "conversationRepository");
        this.messageRepository = Objects.requireNonNull(messageRepository, "messageRepository");
        this.profileRepository = Objects.requireNonNull(profileRepository, "profileRepository");
        this.promptAssembler = Objects.requireNonNull(promptAssembler, "promptAssembler");
        this.modelCatalog = Objects.requireNonNull(modelCatalog, "modelCatalog");
        this.titler = titler;
        this.properties = Objects.requireNonNull(properties, "properties");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
        this.watchdogScheduler = Objects.requireNonNull(watchdogScheduler, "watchdogScheduler");
    }

    /**
     * Validates the request, stores the user message and starts streaming the
     * answer to {@code subscriber}.
     *
     * @throws InvalidRequestException    for a blank message or unknown model
     * @throws ResourceNotFoundException  for a missing or foreign conversation or
     *                                    voice profile
     * @throws ConversationBusyException  if the conversation is already generating
     * @throws GenerationException        if the user message could not be stored
     */
    public StreamSession startGeneration(String userId, ChatRequest request, StreamSubscriber subscriber) {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(subscriber, "subscriber");
        if (!StringUtils.hasText(userId)) {
            throw new InvalidRequestException("User id must not be blank");
        }
        if (request.conversationId() == null) {
            throw new InvalidRequestException("conversationId is required");
        }
        if (!StringUtils.hasText(request.message())) {
            throw new InvalidRequestException("Message must not be blank");
        }
        long conversationId = request.conversationId();
        conversationRepository.findById(conversationId)
                .filter(conversation -> conversation.isOwnedBy(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Conversation", conversationId));
        String modelId = StringUtils.hasText(request.model()) ? request.model().strip() : properties.getDefaultModel();
        ModelCatalog.ResolvedModel model = modelCatalog.resolve(modelId)
                .orElseThrow(() -> new InvalidRequestException("Unknown model: " + modelId));
        Long voiceProfileId = resolveVoiceProfile(userId, request.voiceProfileId());
        String correlationId = StringUtils.hasText(request.correlationId()) ? request.correlationId()
                : UUID.randomUUID().toString();

        StreamChannel channel = new StreamChannel(subscriber, dispatchExecutor);
        StreamSession session = new StreamSession(UUID.randomUUID().toString(), userId, conversationId,
                correlationId, modelId, voiceProfileId, channel);
        channel.onSubscriberFailure(ex -> {
            if (session.cancel(CancellationReason.CLIENT_DISCONNECT)) {
                LOGGER.warn("Client of conversation {} went away, cancelling generation", conversationId);
            }
        });
        if (activeSessions.putIfAbsent(conversationId, session) != null) {
            throw new ConversationBusyException(conversationId);
        }

        session.transition(SessionState.COMPOSING);
        try {
            Message userMessage = messageRepository.save(conversationId, MessageRole.USER, request.message(), null,
                    null);
            session.userMessageId(userMessage.id());
            conversationRepository.touch(conversationId);
        } catch (RuntimeException ex) {
            activeSessions.remove(conversationId, session);
            LOGGER.error("Failed to store user message for conversation {}: {}", conversationId, ex.getMessage(), ex);
            throw new GenerationException("Failed to store the user message", ex);
        }
        LOGGER.info("Session {} started for conversation {} with model {} (profile {}, correlation {})",
                session.sessionId(), conversationId, modelId, voiceProfileId, correlationId);

        startWatchdog(session);
        try {
            workerExecutor.execute(() -> run(session, model, request.message()));
        } catch (RejectedExecutionException ex) {
            LOGGER.error("No worker available for session {}", session.sessionId(), ex);
            finish(session, SessionState.FAILED, ex);
        }
        return session;
    }

    /**
     * Runs a turn and waits for its outcome.
     */
    public GenerationResult generate(String userId, ChatRequest request) {
        StreamSession session = startGeneration(userId, request, StreamSubscriber.NONE);
        try {
            return session.result().get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            session.cancel(CancellationReason.CLIENT_DISCONNECT);
            throw new GenerationException("Interrupted while waiting for the response", ex);
        } catch (ExecutionException ex) {
            throw new GenerationException("Generation failed", ex.getCause());
        }
    }

    /**
     * Requests the running generation of the conversation to stop. Does nothing
     * when the conversation is idle or belongs to another user.
     *
     * @return {@code true} if a running generation was cancelled
     */
    public boolean stop(String userId, long conversationId) {
        StreamSession session = activeSessions.get(conversationId);
        if (session == null || !session.ownerId().equals(userId)) {
            return false;
        }
        boolean cancelled = session.cancel(CancellationReason.USER_STOP);
        if (cancelled) {
            LOGGER.info("Stop requested for session {} of conversation {}", session.sessionId(), conversationId);
        }
        return cancelled;
    }

    public Optional<StreamSession> activeSession(long conversationId) {
        return Optional.ofNullable(activeSessions.get(conversationId));
    }

    private void run(StreamSession session, ModelCatalog.ResolvedModel model, String userText) {
        CancellationToken token = session.cancellationToken();
        SessionState outcome;
        Throwable failure = null;
        try {
            ComposedRequest request = promptAssembler.assemble(session, userText);
            if (token.isCancellationRequested()) {
                outcome = outcomeOf(token.reason());
            } else {
                session.transition(SessionState.STREAMING);
                session.touch();
                model.client().streamChat(request, model.vendorModel(), session::appendDelta, token);
                outcome = token.isCancellationRequested() ? outcomeOf(token.reason()) : SessionState.COMPLETED;
            }
        } catch (EmptyResponseException ex) {
            LOGGER.warn("Session {}: {}, storing fallback answer", session.sessionId(), ex.getMessage());
            outcome = SessionState.COMPLETED;
        } catch (RuntimeException ex) {
            if (token.isCancellationRequested()) {
                LOGGER.debug("Session {} ended with {} after cancellation ({})", session.sessionId(),
                        ex.getClass().getSimpleName(), token.reason());
                outcome = outcomeOf(token.reason());
            } else {
                outcome = SessionState.FAILED;
                failure = ex;
            }
        }
        finish(session, outcome, failure);
    }

    private void finish(StreamSession session, SessionState outcome, Throwable failure) {
        if (!session.beginFinalize()) {
            return;
        }
        session.stopWatchdog();
        session.transition(SessionState.FINALIZING);
        StreamChannel channel = session.channel();
        String correlationId = session.correlationId();

        String content = session.bufferedText();
        if (outcome == SessionState.COMPLETED && content.isBlank()) {
            content = FALLBACK_MESSAGE;
            channel.publish(StreamEvent.content(content, correlationId));
        }
        Long messageId = content.isBlank() ? null : persistAssistant(session, content);

        session.transition(outcome);
        activeSessions.remove(session.conversationId(), session);
        switch (outcome) {
            case COMPLETED -> channel.publish(StreamEvent.done(outcome, messageId, correlationId));
            case CANCELLED -> {
                channel.publish(StreamEvent.reset(correlationId));
                channel.publish(StreamEvent.done(outcome, messageId, correlationId));
            }
            default -> channel.publish(StreamEvent.error(FALLBACK_MESSAGE, correlationId));
        }

        if (outcome == SessionState.FAILED) {
            if (failure != null) {
                LOGGER.error("Session {} of conversation {} failed after {} chars: {}", session.sessionId(),
                        session.conversationId(), content.length(), failure.getMessage(), failure);
            } else {
                LOGGER.warn("Session {} of conversation {} failed ({}) after {} chars", session.sessionId(),
                        session.conversationId(), session.cancellationToken().reason(), content.length());
            }
        } else {
            LOGGER.info("Session {} of conversation {} finished as {} ({} chars, message {})", session.sessionId(),
                    session.conversationId(), outcome, content.length(), messageId);
        }
        session.result().complete(
                new GenerationResult(outcome, messageId != null ? content : "", messageId, correlationId));

        if (outcome == SessionState.COMPLETED && messageId != null && titler != null) {
            titler.titleIfMissing(session.conversationId(), content);
        }
    }

    private Long persistAssistant(StreamSession session, String content) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                return messageRepository.save(session.conversationId(), MessageRole.ASSISTANT, content,
                        session.modelId(), session.voiceProfileId()).id();
            } catch (RuntimeException ex) {
                lastFailure = ex;
                LOGGER.warn("Storing assistant message of session {} failed (attempt {}): {}", session.sessionId(),
                        attempt, ex.getMessage());
            }
        }
        LOGGER.error("Data loss: assistant message of conversation {} could not be stored, starting with '{}'",
                session.conversationId(), preview(content), lastFailure);
        return null;
    }

    private Long resolveVoiceProfile(String userId, Long requested) {
        if (requested != null) {
            return profileRepository.findById(requested)
                    .filter(profile -> profile.isOwnedBy(userId))
                    .map(VoiceProfile::id)
                    .orElseThrow(() -> new ResourceNotFoundException("Voice profile", requested));
        }
        return profileRepository.findActive(userId).map(VoiceProfile::id).orElse(null);
    }

    private void startWatchdog(StreamSession session) {
        long timeoutNanos = properties.getIdleTimeout().toNanos();
        if (timeoutNanos <= 0) {
            return;
        }
        long period = Math.max(MIN_WATCHDOG_PERIOD_NANOS, timeoutNanos / 4);
        session.watchdog(watchdogScheduler.scheduleWithFixedDelay(() -> {
            if (session.isFinalized()) {
                session.stopWatchdog();
            } else if (session.idleNanos() >= timeoutNanos && session.cancel(CancellationReason.IDLE_TIMEOUT)) {
                LOGGER.warn("Session {} idle for more than {}, failing it", session.sessionId(),
                        properties.getIdleTimeout());
                // the worker may stay blocked in the provider; whoever finishes first wins
                finish(session, SessionState.FAILED, null);
            }
        }, period, period, TimeUnit.NANOSECONDS));
        if (session.isFinalized()) {
            session.stopWatchdog();
        }
    }

    private static SessionState outcomeOf(CancellationReason reason) {
        return reason == CancellationReason.IDLE_TIMEOUT ? SessionState.FAILED : SessionState.CANCELLED;
    }

    private static String preview(String text) {
        return text.length() > PREVIEW_LENGTH ? text.substring(0, PREVIEW_LENGTH) + "..." : text;
    }
}
