package ch.so.arp.voice.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

class ChatStreamClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<String, String> requestBodies = new ConcurrentHashMap<>();
    private final Map<String, String> userHeaders = new ConcurrentHashMap<>();

    private HttpServer server;
    private ExecutorService executor;
    private ChatStreamClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        URI baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        client = new ChatStreamClient(HttpClient.newHttpClient(), objectMapper, baseUri, "alice");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        executor.shutdownNow();
    }

    @Test
    void createsConversation() throws Exception {
        handle("/api/conversations", 201, "application/json", "{\"id\":42,\"title\":\"Notes\"}");

        long id = client.createConversation("Notes");

        assertThat(id).isEqualTo(42L);
        assertThat(userHeaders.get("/api/conversations")).isEqualTo("alice");
        assertThat(objectMapper.readTree(requestBodies.get("/api/conversations")).path("title").asText())
                .isEqualTo("Notes");
    }

    @Test
    void dispatchesStreamEventsUntilDone() throws Exception {
        handle("/api/chat/stream", 200, "text/event-stream", """
                event:content
                data:{"correlationId":"c-1","delta":"Hel"}

                event:reset
                data:{"correlationId":"c-1"}

                : keep-alive

                event:content
                data:{"correlationId":"c-1","delta":"Hello"}

                event:done
                data:{"correlationId":"c-1","status":"COMPLETED","messageId":9}

                event:content
                data:{"correlationId":"c-1","delta":"ignored"}

                """);
        RecordingListener listener = new RecordingListener();

        client.send(3L, "Hi", "gpt-4o", "c-1", listener);

        assertThat(listener.calls).containsExactly(
                "content c-1 Hel", "reset c-1", "content c-1 Hello", "done c-1 COMPLETED 9");
        JsonNode body = objectMapper.readTree(requestBodies.get("/api/chat/stream"));
        assertThat(body.path("conversationId").asLong()).isEqualTo(3L);
        assertThat(body.path("message").asText()).isEqualTo("Hi");
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("correlationId").asText()).isEqualTo("c-1");
        assertThat(body.has("voiceProfileId")).isFalse();
    }

    @Test
    void reportsDoneWithoutMessageId() {
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:done\ndata:{\"correlationId\":\"c-2\",\"status\":\"CANCELLED\",\"messageId\":null}\n\n");
        RecordingListener listener = new RecordingListener();

        client.send(3L, "Hi", "gpt-4o", "c-2", listener);

        assertThat(listener.calls).containsExactly("done c-2 CANCELLED null");
    }

    @Test
    void dispatchesErrorEvent() {
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:error\ndata:{\"correlationId\":\"c-3\",\"reason\":\"Sorry\"}\n\n");
        RecordingListener listener = new RecordingListener();

        client.send(3L, "Hi", "gpt-4o", "c-3", listener);

        assertThat(listener.calls).containsExactly("error c-3 Sorry");
    }

    @Test
    void dispatchesTrailingEventWithoutBlankLine() {
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:content\ndata:{\"correlationId\":\"c-4\",\"delta\":\"tail\"}\n");
        RecordingListener listener = new RecordingListener();

        client.send(3L, "Hi", "gpt-4o", "c-4", listener);

        assertThat(listener.calls).containsExactly("content c-4 tail", "error c-4 " + ChatStreamClient.STREAM_BROKEN);
    }

    @Test
    void truncatedStreamEndsTurnWithError() {
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:content\ndata:{\"correlationId\":\"c-6\",\"delta\":\"Half an ans\"}\n\n");
        RecordingListener listener = new RecordingListener();

        client.send(3L, "Hi", "gpt-4o", "c-6", listener);

        assertThat(listener.calls).containsExactly("content c-6 Half an ans",
                "error c-6 " + ChatStreamClient.STREAM_BROKEN);
    }

    @Test
    void truncatedStreamResolvesReconcilerTurn() {
        ConversationReconciler reconciler = new ConversationReconciler(List::of);
        String correlationId = reconciler.submit("Hi");
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:content\ndata:{\"correlationId\":\"" + correlationId + "\",\"delta\":\"Half\"}\n\n");

        client.send(3L, "Hi", "gpt-4o", correlationId, reconciler);

        assertThat(reconciler.isPending(correlationId)).isFalse();
        assertThat(reconciler.typingText()).isEmpty();
        assertThat(reconciler.view()).extracting(ChatBubble::kind).containsExactly(ChatBubble.Kind.FAILED);
    }

    @Test
    void rejectedRequestResolvesReconcilerTurn() {
        handle("/api/chat/stream", 409, "application/json",
                "{\"status\":409,\"error\":\"Conflict\",\"message\":\"busy\"}");
        ConversationReconciler reconciler = new ConversationReconciler(List::of);
        String correlationId = reconciler.submit("Hi");

        assertThatThrownBy(() -> client.send(3L, "Hi", "gpt-4o", correlationId, reconciler))
                .isInstanceOf(ChatClientException.class);

        assertThat(reconciler.isPending(correlationId)).isFalse();
        assertThat(reconciler.view()).singleElement()
                .satisfies(bubble -> {
                    assertThat(bubble.kind()).isEqualTo(ChatBubble.Kind.FAILED);
                    assertThat(bubble.content()).isEqualTo("busy");
                });
    }

    @Test
    void sendsExplicitVoiceProfile() throws Exception {
        handle("/api/chat/stream", 200, "text/event-stream",
                "event:done\ndata:{\"correlationId\":\"c-7\",\"status\":\"COMPLETED\",\"messageId\":1}\n\n");

        client.send(3L, "Hi", "gpt-4o", 12L, "c-7", new RecordingListener());

        JsonNode body = objectMapper.readTree(requestBodies.get("/api/chat/stream"));
        assertThat(body.path("voiceProfileId").asLong()).isEqualTo(12L);
    }

    @Test
    void rejectedStreamRaisesClientException() {
        handle("/api/chat/stream", 409, "application/json",
                "{\"status\":409,\"error\":\"Conflict\",\"message\":\"busy\"}");

        RecordingListener listener = new RecordingListener();

        assertThatThrownBy(() -> client.send(3L, "Hi", "gpt-4o", "c-5", listener))
                .isInstanceOf(ChatClientException.class)
                .hasMessage("busy")
                .satisfies(ex -> assertThat(((ChatClientException) ex).statusCode()).isEqualTo(409));
        assertThat(listener.calls).containsExactly("error c-5 busy");
    }

    @Test
    void stopsGeneration() {
        handle("/api/chat/3/stop", 202, "application/json", "{\"stopped\":true}");

        assertThat(client.stop(3L)).isTrue();
        assertThat(userHeaders.get("/api/chat/3/stop")).isEqualTo("alice");
    }

    @Test
    void loadsMessages() {
        handle("/api/conversations/3/messages", 200, "application/json", """
                [{"id":1,"role":"user","content":"Hi","model":null,"createdAt":"2026-01-01T10:00:00Z","extra":1},
                 {"id":2,"role":"assistant","content":"Hello","model":"gpt-4o","createdAt":"2026-01-01T10:00:01Z"}]
                """);

        List<PersistedMessage> messages = client.messages(3L);

        assertThat(messages).extracting(PersistedMessage::id).containsExactly(1L, 2L);
        assertThat(messages).extracting(PersistedMessage::content).containsExactly("Hi", "Hello");
        assertThat(messages.get(1).model()).isEqualTo("gpt-4o");
    }

    @Test
    void missingConversationRaisesClientException() {
        handle("/api/conversations/8/messages", 404, "text/plain", "not json");

        assertThatThrownBy(() -> client.messages(8L))
                .isInstanceOf(ChatClientException.class)
                .hasMessage("HTTP 404");
    }

    private void handle(String path, int status, String contentType, String body) {
        server.createContext(path, exchange -> {
            requestBodies.put(path, new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String user = exchange.getRequestHeaders().getFirst("X-User-Id");
            if (user != null) {
                userHeaders.put(path, user);
            }
            respond(exchange, status, contentType, body);
        });
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static final class RecordingListener implements StreamEventListener {

        private final List<String> calls = new ArrayList<>();

        @Override
        public void onContent(String correlationId, String delta) {
            calls.add("content " + correlationId + " " + delta);
        }

        @Override
        public void onReset(String correlationId) {
            calls.add("reset " + correlationId);
        }

        @Override
        public void onDone(String correlationId, String status, Long messageId) {
            calls.add("done " + correlationId + " " + status + " " + messageId);
        }

        @Override
        public void onError(String correlationId, String reason) {
            calls.add("error " + correlationId + " " + reason);
        }
    }
}
