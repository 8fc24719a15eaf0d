package ch.so.arp.voice.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;

class OpenAiLlmClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakeVendorServer server;
    private OpenAiLlmClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = FakeVendorServer.start();
        OpenAiClientProperties properties = new OpenAiClientProperties();
        properties.setApiKey("sk-test");
        properties.setBaseUrl(server.baseUrl() + "/v1");
        client = new OpenAiLlmClient(properties, HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                objectMapper);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void streamsContentDeltasUntilDoneMarker() throws Exception {
        server.respondWith(200, "text/event-stream", """
                data: {"choices":[{"delta":{"role":"assistant"}}]}

                data: {"choices":[{"delta":{"content":"Hel"}}]}

                : keep-alive
                data: {"choices":[{"delta":{"content":"lo"}}]}

                data: [DONE]

                data: {"choices":[{"delta":{"content":"ignored"}}]}

                """);
        List<String> deltas = new ArrayList<>();

        client.streamChat(request(), "gpt-4o", deltas::add, new CancellationToken());

        assertThat(deltas).containsExactly("Hel", "lo");
        FakeVendorServer.RecordedRequest recorded = server.lastRequest();
        assertThat(recorded.path()).isEqualTo("/v1/chat/completions");
        assertThat(recorded.header("Authorization")).isEqualTo("Bearer sk-test");
        JsonNode body = objectMapper.readTree(recorded.body());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("stream").asBoolean()).isTrue();
        assertThat(body.findValuesAsText("role"))
                .containsExactly("system", "user", "assistant", "user");
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("Be brief.");
    }

    @Test
    void streamWithoutContentIsEmptyResponse() {
        server.respondWith(200, "text/event-stream", "data: [DONE]\n\n");

        assertThatThrownBy(() -> client.streamChat(request(), "gpt-4o", delta -> { }, new CancellationToken()))
                .isInstanceOf(EmptyResponseException.class);
    }

    @Test
    void errorStatusBecomesProviderException() {
        server.respondWith(401, "application/json", "{\"error\":{\"message\":\"Incorrect API key\"}}");

        assertThatThrownBy(() -> client.streamChat(request(), "gpt-4o", delta -> { }, new CancellationToken()))
                .isInstanceOfSatisfying(ProviderException.class, ex -> {
                    assertThat(ex.statusCode()).isEqualTo(401);
                    assertThat(ex.provider()).isEqualTo("openai");
                    assertThat(ex.getMessage()).contains("Incorrect API key");
                });
    }

    @Test
    void errorChunkInStreamFails() {
        server.respondWith(200, "text/event-stream", "data: {\"error\":{\"message\":\"overloaded\"}}\n\n");

        assertThatThrownBy(() -> client.streamChat(request(), "gpt-4o", delta -> { }, new CancellationToken()))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("overloaded");
    }

    @Test
    void stopsReadingWhenCancelled() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        server.respond(exchange -> {
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            OutputStream out = exchange.getResponseBody();
            FakeVendorServer.writeChunk(out, "data: {\"choices\":[{\"delta\":{\"content\":\"first\"}}]}\n\n");
            try {
                release.await(5, TimeUnit.SECONDS);
                FakeVendorServer.writeChunk(out, "data: {\"choices\":[{\"delta\":{\"content\":\"late\"}}]}\n\n");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (IOException ex) {
                // client already hung up
            }
        });
        CancellationToken token = new CancellationToken();
        List<String> deltas = new ArrayList<>();

        try {
            client.streamChat(request(), "gpt-4o", delta -> {
                deltas.add(delta);
                token.cancel(CancellationReason.USER_STOP);
            }, token);
        } finally {
            release.countDown();
        }

        assertThat(deltas).containsExactly("first");
    }

    @Test
    void cancellingAbandonsVendorThatNeverAnswers() throws Exception {
        try (ServerSocket silent = new ServerSocket(0, 1, InetAddress.getByName("127.0.0.1"))) {
            OpenAiClientProperties properties = new OpenAiClientProperties();
            properties.setApiKey("sk-test");
            properties.setBaseUrl("http://127.0.0.1:" + silent.getLocalPort() + "/v1");
            OpenAiLlmClient stalled = new OpenAiLlmClient(properties,
                    HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), objectMapper);
            CancellationToken token = new CancellationToken();
            ExecutorService caller = Executors.newSingleThreadExecutor();
            try {
                Future<?> call = caller.submit(() -> stalled.streamChat(request(), "gpt-4o", delta -> { }, token));
                Thread.sleep(200);
                assertThat(call.isDone()).isFalse();

                token.cancel(CancellationReason.IDLE_TIMEOUT);

                assertThatThrownBy(() -> call.get(5, TimeUnit.SECONDS))
                        .isInstanceOf(ExecutionException.class)
                        .cause()
                        .isInstanceOf(ProviderException.class)
                        .hasMessageContaining("IDLE_TIMEOUT");
            } finally {
                caller.shutdownNow();
            }
        }
    }

    @Test
    void requiresApiKey() {
        assertThatThrownBy(() -> new OpenAiLlmClient(new OpenAiClientProperties(), HttpClient.newHttpClient(),
                objectMapper)).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("api-key");
    }

    private static ComposedRequest request() {
        return new ComposedRequest("Be brief.", List.of(ChatTurn.user("Hi"), ChatTurn.assistant("Hello!"),
                ChatTurn.user("What's new?")));
    }
}
