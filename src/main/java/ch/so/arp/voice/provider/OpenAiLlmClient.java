package ch.so.arp.voice.provider;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.voice.persistence.MessageRole;
import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;

/**
 * Streams chat completions from the OpenAI API. The response is a
 * {@code text/event-stream} whose {@code data:} lines carry JSON chunks; the
 * text delta is {@code choices[0].delta.content}, and {@code data: [DONE]}
 * ends the stream.
 */
public class OpenAiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiLlmClient.class);

    static final String NAME = "openai";

    private static final String DATA_PREFIX = "data:";
    private static final String DONE_MARKER = "[DONE]";

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiLlmClient(OpenAiClientProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'voice.chat.openai.api-key' must be provided when mocks are disabled");
        }
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void streamChat(ComposedRequest request, String model, Consumer<String> deltaConsumer,
            CancellationToken token) {
        LOGGER.debug("Streaming response with model {} via base URL {} ({} messages)", model,
                properties.getBaseUrl(), request.messages().size());
        HttpRequest httpRequest = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Accept", "text/event-stream")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(request, model), StandardCharsets.UTF_8))
                .build();

        InputStream body = VendorHttp.openStream(httpClient, httpRequest, NAME, token);
        token.onCancel(() -> VendorHttp.closeQuietly(body));
        int deltas = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
            String line;
            while (!token.isCancellationRequested() && (line = reader.readLine()) != null) {
                if (!line.startsWith(DATA_PREFIX)) {
                    continue;
                }
                String data = line.substring(DATA_PREFIX.length()).strip();
                if (DONE_MARKER.equals(data)) {
                    break;
                }
                if (data.isEmpty()) {
                    continue;
                }
                String delta = extractDelta(data);
                if (!delta.isEmpty() && !token.isCancellationRequested()) {
                    deltas++;
                    deltaConsumer.accept(delta);
                }
            }
        } catch (IOException ex) {
            if (token.isCancellationRequested()) {
                LOGGER.debug("OpenAI stream closed after cancellation ({})", token.reason());
                return;
            }
            throw new ProviderException(NAME, "reading the stream failed", ex);
        }
        if (deltas == 0 && !token.isCancellationRequested()) {
            throw new EmptyResponseException(NAME, model);
        }
    }

    @Override
    public String name() {
        return NAME;
    }

    String requestBody(ComposedRequest request, String model) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("stream", true);
        root.put("temperature", properties.getTemperature());
        root.put("max_tokens", properties.getMaxTokens());
        ArrayNode messages = root.putArray("messages");
        if (StringUtils.hasText(request.systemInstruction())) {
            messages.addObject().put("role", "system").put("content", request.systemInstruction());
        }
        for (ChatTurn turn : request.messages()) {
            messages.addObject().put("role", turn.role() == MessageRole.ASSISTANT ? "assistant" : "user")
                    .put("content", turn.content());
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(NAME, "failed to serialise request", ex);
        }
    }

    private String extractDelta(String data) {
        JsonNode chunk;
        try {
            chunk = objectMapper.readTree(data);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(NAME, "malformed stream chunk: " + VendorHttp.truncate(data), ex);
        }
        if (chunk.has("error")) {
            throw new ProviderException(NAME, "stream error: " + VendorHttp.truncate(chunk.get("error").toString()));
        }
        JsonNode content = chunk.path("choices").path(0).path("delta").path("content");
        return content.isTextual() ? content.asText() : "";
    }
}
