package ch.so.arp.voice.provider;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.voice.persistence.MessageRole;
import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;

/**
 * Streams answers from the Gemini {@code streamGenerateContent} endpoint. Without
 * SSE framing the endpoint returns one JSON array whose elements arrive one by
 * one, so the body is consumed with a streaming parser and every element is
 * handed on as soon as it is complete.
 */
public class GeminiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiLlmClient.class);

    static final String NAME = "gemini";

    private final GeminiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiLlmClient(GeminiClientProperties properties, HttpClient httpClient, ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'voice.chat.gemini.api-key' must be provided when mocks are disabled");
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
                .uri(URI.create(properties.getBaseUrl() + "/models/" + model + ":streamGenerateContent"))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", properties.getApiKey())
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(request), StandardCharsets.UTF_8))
                .build();

        InputStream body = VendorHttp.openStream(httpClient, httpRequest, NAME, token);
        token.onCancel(() -> VendorHttp.closeQuietly(body));
        int deltas = 0;
        try (JsonParser parser = objectMapper.createParser(body)) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_ARRAY && first != JsonToken.START_OBJECT) {
                throw new ProviderException(NAME, "unexpected response start: " + first);
            }
            if (first == JsonToken.START_OBJECT) {
                // a single object instead of an array, e.g. an error envelope
                deltas += emit(objectMapper.readTree(parser), deltaConsumer, token);
            } else {
                JsonToken next;
                while (!token.isCancellationRequested() && (next = parser.nextToken()) != null
                        && next != JsonToken.END_ARRAY) {
                    if (next == JsonToken.START_OBJECT) {
                        deltas += emit(objectMapper.readTree(parser), deltaConsumer, token);
                    }
                }
            }
        } catch (JsonProcessingException ex) {
            if (token.isCancellationRequested()) {
                return;
            }
            throw new ProviderException(NAME, "malformed stream", ex);
        } catch (IOException ex) {
            if (token.isCancellationRequested()) {
                LOGGER.debug("Gemini stream closed after cancellation ({})", token.reason());
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

    String requestBody(ComposedRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        if (StringUtils.hasText(request.systemInstruction())) {
            root.putObject("systemInstruction").putArray("parts").addObject()
                    .put("text", request.systemInstruction());
        }
        ArrayNode contents = root.putArray("contents");
        for (ChatTurn turn : request.messages()) {
            ObjectNode content = contents.addObject();
            content.put("role", turn.role() == MessageRole.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", turn.content());
        }
        root.putObject("generationConfig")
                .put("temperature", properties.getTemperature())
                .put("maxOutputTokens", properties.getMaxOutputTokens());
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new ProviderException(NAME, "failed to serialise request", ex);
        }
    }

    private int emit(JsonNode element, Consumer<String> deltaConsumer, CancellationToken token) {
        if (element.has("error")) {
            throw new ProviderException(NAME, "stream error: " + VendorHttp.truncate(element.get("error").toString()));
        }
        int emitted = 0;
        for (JsonNode part : element.path("candidates").path(0).path("content").path("parts")) {
            JsonNode text = part.path("text");
            if (text.isTextual() && !text.asText().isEmpty() && !token.isCancellationRequested()) {
                deltaConsumer.accept(text.asText());
                emitted++;
            }
        }
        return emitted;
    }
}
