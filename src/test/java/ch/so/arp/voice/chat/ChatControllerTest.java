package ch.so.arp.voice.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class ChatControllerTest {

    @Test
    void streamsSessionEventsThroughSseEmitter() throws IOException {
        GenerationOrchestrator orchestrator = mock(GenerationOrchestrator.class);
        RecordingSseEmitter emitter = new RecordingSseEmitter();
        AtomicReference<StreamSubscriber> subscriberReference = new AtomicReference<>();
        ChatRequest request = new ChatRequest(7L, "How are you?", null, null, "corr-1");
        doAnswer(invocation -> {
            subscriberReference.set(invocation.getArgument(2));
            return session(invocation.getArgument(2));
        }).when(orchestrator).startGeneration(eq("alice"), eq(request), any());

        ChatController controller = new ChatController(orchestrator, () -> emitter);
        SseEmitter returnedEmitter = controller.stream("alice", request);

        assertThat(returnedEmitter).isSameAs(emitter);
        StreamSubscriber subscriber = subscriberReference.get();
        subscriber.deliver(StreamEvent.content("Fine", "corr-1"));
        subscriber.deliver(StreamEvent.reset("corr-1"));
        subscriber.deliver(StreamEvent.done(SessionState.CANCELLED, 12L, "corr-1"));
        subscriber.complete();

        assertThat(emitter.getNames()).containsExactly("content", "reset", "done");
        assertThat(emitter.getPayloads()).containsExactly(new StreamEvent.Content("Fine", "corr-1"),
                new StreamEvent.Reset("corr-1"), new StreamEvent.Done(SessionState.CANCELLED, 12L, "corr-1"));
        assertThat(emitter.isCompleted()).isTrue();
    }

    @Test
    void completeReturnsGenerationResult() {
        GenerationOrchestrator orchestrator = mock(GenerationOrchestrator.class);
        ChatRequest request = new ChatRequest(7L, "Hi", "gpt-4o", null, null);
        GenerationResult result = new GenerationResult(SessionState.COMPLETED, "Hello", 3L, "corr");
        when(orchestrator.generate("alice", request)).thenReturn(result);

        ChatController controller = new ChatController(orchestrator, RecordingSseEmitter::new);

        assertThat(controller.complete("alice", request)).isSameAs(result);
    }

    @Test
    void stopAnswersAcceptedEvenWhenNothingRuns() {
        GenerationOrchestrator orchestrator = mock(GenerationOrchestrator.class);
        when(orchestrator.stop("alice", 7L)).thenReturn(false);

        ResponseEntity<Map<String, Object>> response = new ChatController(orchestrator, RecordingSseEmitter::new)
                .stop("alice", 7L);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody()).containsEntry("stopped", false);
    }

    private static StreamSession session(StreamSubscriber subscriber) {
        return new StreamSession("session-1", "alice", 7L, "corr-1", "gpt-4o", null,
                new StreamChannel(subscriber, Runnable::run));
    }

    private static final class RecordingSseEmitter extends SseEmitter {

        private final List<String> names = new CopyOnWriteArrayList<>();
        private final List<Object> payloads = new CopyOnWriteArrayList<>();
        private volatile boolean completed;

        private RecordingSseEmitter() {
            super(0L);
        }

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            for (ResponseBodyEmitter.DataWithMediaType part : builder.build()) {
                Object data = part.getData();
                if (data instanceof String text) {
                    int start = text.indexOf("event:");
                    if (start >= 0) {
                        names.add(text.substring(start + "event:".length(), text.indexOf('\n', start)));
                    }
                } else {
                    payloads.add(data);
                }
            }
        }

        @Override
        public void complete() {
            completed = true;
            super.complete();
        }

        List<String> getNames() {
            return new ArrayList<>(names);
        }

        List<Object> getPayloads() {
            return new ArrayList<>(payloads);
        }

        boolean isCompleted() {
            return completed;
        }
    }
}
