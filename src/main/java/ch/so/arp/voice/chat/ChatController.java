package ch.so.arp.voice.chat;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import ch.so.arp.voice.provider.CancellationReason;
import jakarta.validation.Valid;

/**
 * REST endpoints running chat turns. {@code /stream} answers with server sent
 * events ({@code content}, {@code done}, {@code error}, {@code reset}),
 * {@code /complete} waits for the whole answer.
 */
@RestController
@RequestMapping(path = "/api/chat")
public class ChatController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatController.class);

    static final String USER_HEADER = "X-User-Id";

    private final GenerationOrchestrator orchestrator;
    private final SseEmitterFactory emitterFactory;

    public ChatController(GenerationOrchestrator orchestrator, SseEmitterFactory emitterFactory) {
        this.orchestrator = orchestrator;
        this.emitterFactory = emitterFactory;
    }

    @PostMapping(path = "/stream", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestHeader(USER_HEADER) String userId, @Valid @RequestBody ChatRequest request) {
        SseEmitter emitter = emitterFactory.create();
        StreamSession session = orchestrator.startGeneration(userId, request, new SseStreamSubscriber(emitter));
        emitter.onTimeout(() -> disconnect(session, "timed out"));
        emitter.onError(ex -> disconnect(session, ex.getMessage()));
        emitter.onCompletion(() -> disconnect(session, "closed"));
        return emitter;
    }

    @PostMapping(path = "/complete", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public GenerationResult complete(@RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ChatRequest request) {
        return orchestrator.generate(userId, request);
    }

    @PostMapping(path = "/{conversationId}/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> stop(@RequestHeader(USER_HEADER) String userId,
            @PathVariable long conversationId) {
        boolean stopped = orchestrator.stop(userId, conversationId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("stopped", stopped));
    }

    private void disconnect(StreamSession session, String cause) {
        if (session.cancel(CancellationReason.CLIENT_DISCONNECT)) {
            LOGGER.warn("SSE connection of session {} {} before the answer was complete", session.sessionId(), cause);
        }
    }
}
