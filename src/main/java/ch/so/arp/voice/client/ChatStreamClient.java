package ch.so.arp.voice.client;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Java client of the chat API. {@link #send} blocks while the answer streams
 * and hands every event to the listener; {@link #stop} may be called from any
 * other thread meanwhile.
 */
public class ChatStreamClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatStreamClient.class);

    private static final String USER_HEADER = "X-User-Id";

    static final String STREAM_BROKEN = "The connection to the server was lost before the answer was complete.";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final URI baseUri;
    private final String userId;

    public ChatStreamClient(HttpClient httpClient, ObjectMapper objectMapper, URI baseUri, String userId) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.userId = Objects.requireNonNull(userId, "userId");
    }

    public long createConversation(String title) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", title);
        JsonNode created = readJson(post("/api/conversations", body));
        return created.path("id").asLong();
    }

    /**
     * Sends a user turn and streams the answer into the listener until the
     * terminal event arrived. The listener always sees exactly one terminal
     * callback: when the request is rejected or the stream ends without
     * {@code done} or {@code error}, {@link StreamEventListener#onError} is
     * called before this method returns or throws.
     */
    public void send(long conversationId, String message, String model, String correlationId,
            StreamEventListener listener) {
        send(conversationId, message, model, null, correlationId, listener);
    }

    /**
     * Same as {@link #send(long, String, String, String, StreamEventListener)}
     * with an explicit voice profile instead of the user's active one.
     */
    public void send(long conversationId, String message, String model, Long voiceProfileId, String correlationId,
            StreamEventListener listener) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("conversationId", conversationId);
        body.put("message", message);
        body.put("model", model);
        if (voiceProfileId != null) {
            body.put("voiceProfileId", voiceProfileId);
        }
        body.put("correlationId", correlationId);
        HttpRequest request = requestBuilder("/api/chat/stream")
                .header("Accept", "text/event-stream, application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8))
                .build();
        HttpResponse<InputStream> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
        } catch (IOException ex) {
            listener.onError(correlationId, STREAM_BROKEN);
            throw new ChatClientException("Chat stream request failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            listener.onError(correlationId, STREAM_BROKEN);
            throw new ChatClientException("Interrupted while opening the chat stream", ex);
        }
        if (response.statusCode() != 200) {
            String reason = errorMessage(response);
            listener.onError(correlationId, reason);
            throw new ChatClientException(reason, response.statusCode());
        }

        SseEventParser parser = new SseEventParser();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(response.body(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                ServerSentEvent event = parser.line(line);
                if (event != null && dispatch(event, listener)) {
                    return;
                }
            }
            ServerSentEvent last = parser.line("");
            if (last != null && dispatch(last, listener)) {
                return;
            }
        } catch (IOException ex) {
            LOGGER.warn("Chat stream of turn {} broke: {}", correlationId, ex.getMessage());
            listener.onError(correlationId, STREAM_BROKEN);
            throw new ChatClientException("Reading the chat stream failed", ex);
        }
        LOGGER.warn("Chat stream of turn {} ended without a terminal event", correlationId);
        listener.onError(correlationId, STREAM_BROKEN);
    }

    public boolean stop(long conversationId) {
        JsonNode result = readJson(post("/api/chat/" + conversationId + "/stop", Map.of()));
        return result.path("stopped").asBoolean(false);
    }

    public List<PersistedMessage> messages(long conversationId) {
        HttpRequest request = requestBuilder("/api/conversations/" + conversationId + "/messages")
                .header("Accept", "application/json")
                .GET()
                .build();
        String body = execute(request);
        try {
            return objectMapper.readValue(body, new TypeReference<List<PersistedMessage>>() {
            });
        } catch (JsonProcessingException ex) {
            throw new ChatClientException("Unreadable message list", ex);
        }
    }

    /**
     * @return {@code true} for the terminal event
     */
    boolean dispatch(ServerSentEvent event, StreamEventListener listener) {
        JsonNode data;
        try {
            data = objectMapper.readTree(event.data());
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Ignoring '{}' event with malformed data", event.event());
            return false;
        }
        String correlationId = data.path("correlationId").asText(null);
        switch (event.event()) {
            case "content" -> listener.onContent(correlationId, data.path("delta").asText(""));
            case "reset" -> listener.onReset(correlationId);
            case "done" -> {
                JsonNode messageId = data.path("messageId");
                listener.onDone(correlationId, data.path("status").asText(),
                        messageId.isNumber() ? messageId.asLong() : null);
                return true;
            }
            case "error" -> {
                listener.onError(correlationId, data.path("reason").asText());
                return true;
            }
            default -> LOGGER.debug("Ignoring unknown event '{}'", event.event());
        }
        return false;
    }

    private String post(String path, Map<String, Object> body) {
        HttpRequest request = requestBuilder(path)
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(toJson(body), StandardCharsets.UTF_8))
                .build();
        return execute(request);
    }

    private String execute(HttpRequest request) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new ChatClientException("Request to " + request.uri() + " failed", ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ChatClientException("Interrupted while calling " + request.uri(), ex);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new ChatClientException(messageOf(response.body(), response.statusCode()), response.statusCode());
        }
        return response.body();
    }

    private HttpRequest.Builder requestBuilder(String path) {
        return HttpRequest.newBuilder(baseUri.resolve(path))
                .header("Content-Type", "application/json")
                .header(USER_HEADER, userId);
    }

    private String errorMessage(HttpResponse<InputStream> response) {
        try (InputStream in = response.body()) {
            return messageOf(new String(in.readAllBytes(), StandardCharsets.UTF_8), response.statusCode());
        } catch (IOException ex) {
            return "HTTP " + response.statusCode();
        }
    }

    private String messageOf(String body, int status) {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.hasNonNull("message")) {
                return node.get("message").asText();
            }
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Error body is not JSON: {}", ex.getOriginalMessage());
        }
        return "HTTP " + status;
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new ChatClientException("Unreadable response", ex);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new ChatClientException("Failed to serialise request", ex);
        }
    }
}
