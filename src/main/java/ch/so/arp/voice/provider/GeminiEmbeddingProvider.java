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
 * Calls the Gemini {@code embedContent} endpoint.
 */
public class GeminiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiEmbeddingProvider.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final GeminiClientProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public GeminiEmbeddingProvider(GeminiClientProperties properties, HttpClient httpClient,
            ObjectMapper objectMapper) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException("Property 'voice.chat.gemini.api-key' is required for Gemini embeddings");
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
        String model = properties.getEmbeddingModel();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", "models/" + model);
        body.putObject("content").putArray("parts").addObject().put("text", text);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + "/models/" + model + ":embedContent"))
                .header("Content-Type", "application/json")
                .header("x-goog-api-key", properties.getApiKey())
                .timeout(REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        LOGGER.debug("Embedding {} chars with {}", text.length(), model);
        String response;
        try {
            response = VendorHttp.send(httpClient, request, GeminiLlmClient.NAME);
        } catch (ProviderException ex) {
            throw new EmbeddingException("Gemini embedding request failed", ex);
        }
        return EmbeddingVectors.read(objectMapper, response, "/embedding/values", properties.getEmbeddingDimensions());
    }

    @Override
    public int dimensions() {
        return properties.getEmbeddingDimensions();
    }

    @Override
    public String name() {
        return GeminiLlmClient.NAME;
    }
}
