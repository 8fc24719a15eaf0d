package ch.so.arp.voice.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;

class GeminiLlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakeVendorServer server;
    private GeminiLlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = FakeVendorServer.start();
        GeminiClientProperties properties = new GeminiClientProperties();
        properties.setApiKey("gm-test");
        properties.setBaseUrl(server.baseUrl() + "/v1beta");
        client = new GeminiLlmClient(properties, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void emitsTextPartsOfEveryArrayElement() throws Exception {
        server.respondWith(200, "application/json", """
                [{"candidates":[{"content":{"role":"model","parts":[{"text":"Grüezi"}]}}]}
                ,{"candidates":[{"content":{"role":"model","parts":[{"text":" mit"},{"text":"enand"}]}}]}
                ,{"candidates":[{"finishReason":"STOP"}],"usageMetadata":{"totalTokenCount":12}}
                ]""");
        List<String> deltas = new ArrayList<>();

        client.streamChat(request(), "gemini-2.5-flash", deltas::add, new CancellationToken());

        assertThat(deltas).containsExactly("Grüezi", " mit", "enand");
        FakeVendorServer.RecordedRequest recorded = server.lastRequest();
        assertThat(recorded.path()).isEqualTo("/v1beta/models/gemini-2.5-flash:streamGenerateContent");
        assertThat(recorded.header("x-goog-api-key")).isEqualTo("gm-test");
        JsonNode body = objectMapper.readTree(recorded.body());
        assertThat(body.at("/systemInstruction/parts/0/text").asText()).isEqualTo("Be brief.");
        assertThat(body.findValuesAsText("role"))
                .containsExactly("user", "model", "user");
        assertThat(body.at("/generationConfig/maxOutputTokens").asInt()).isEqualTo(1000);
    }

    @Test
    void errorElementFailsTheStream() {
        server.respondWith(200, "application/json",
                "[{\"error\":{\"code\":429,\"message\":\"Resource has been exhausted\"}}]");

        assertThatThrownBy(() -> client.streamChat(request(), "gemini-2.5-flash", delta -> { },
                new CancellationToken())).isInstanceOf(ProviderException.class).hasMessageContaining("exhausted");
    }

    @Test
    void errorStatusBecomesProviderException() {
        server.respondWith(400, "application/json", "{\"error\":{\"message\":\"API key not valid\"}}");

        assertThatThrownBy(() -> client.streamChat(request(), "gemini-2.5-flash", delta -> { },
                new CancellationToken()))
                .isInstanceOfSatisfying(ProviderException.class, ex -> assertThat(ex.statusCode()).isEqualTo(400));
    }

    @Test
    void emptyArrayIsEmptyResponse() {
        server.respondWith(200, "application/json", "[]");

        assertThatThrownBy(() -> client.streamChat(request(), "gemini-2.5-flash", delta -> { },
                new CancellationToken())).isInstanceOf(EmptyResponseException.class);
    }

    private static ComposedRequest request() {
        return new ComposedRequest("Be brief.", List.of(ChatTurn.user("Hi"), ChatTurn.assistant("Hello!"),
                ChatTurn.user("What's new?")));
    }
}
