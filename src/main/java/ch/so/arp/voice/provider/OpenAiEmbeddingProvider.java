package ch.so.arp.voice.provider;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import ch.so.arp.voice.style.EmbeddingException;
import ch.so.arp.voice.style.EmbeddingProvider;

/**
 * Calls the OpenAI {@code /embeddings} endpoint.
 */
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiEmbeddingProvider.class);

    private static final int MAX_INPUT_CHARS = 8000;
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final OpenAiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenAiEmbeddingProvider(OpenAiClientProperties properties, HttpClient httpClient,
            ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException("Property 'voice.chat.openai.api-key' is required for OpenAI embeddings");
        }
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        String input = text.length() > MAX_INPUT_CHARS ? text.substring(0, MAX_INPUT_CHARS) : text;
        ObjectNode body = objectMapper.createObjectNode()
                .put("model", properties.getEmbeddingModel())
                .put("input", input)
                .put("dimensions", properties.getEmbeddingDimensions());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/embeddings"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + properties.getApiKey())
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        LOGGER.debug("Embedding {} chars with {}", input.length(), properties.getEmbeddingModel());
        String response;
        try {
            response = VendorHttp.send(httpClient, request, OpenAiLlmClient.NAME);
        } catch (ProviderException ex) {
            throw new EmbeddingException("OpenAI embedding request failed", ex);
        }
        return EmbeddingVectors.read(objectMapper, response, "/data/0/embedding", properties.getEmbeddingDimensions());
    }

    @Override
    public int dimensions() {
        return properties.getEmbeddingDimensions();
    }

    @Override
    public String name() {
        return OpenAiLlmClient.NAME;
    }
}
