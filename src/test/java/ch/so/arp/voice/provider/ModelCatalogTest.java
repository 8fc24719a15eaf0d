package ch.so.arp.voice.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;

class ModelCatalogTest {

    private final MockLlmClient openai = new MockLlmClient("openai");
    private final MockLlmClient gemini = new MockLlmClient("gemini");

    @Test
    void resolvesModelsToTheirProvider() {
        ModelCatalog catalog = new ModelCatalog(Map.of(
                "gpt-4o", new ModelDefinition("openai", null),
                "gemini-2.5-flash", new ModelDefinition("gemini", "gemini-2.5-flash-001")),
                List.of(openai, gemini));

        assertThat(catalog.resolve("gpt-4o")).hasValueSatisfying(model -> {
            assertThat(model.client()).isSameAs(openai);
            assertThat(model.vendorModel()).isEqualTo("gpt-4o");
        });
        assertThat(catalog.resolve("gemini-2.5-flash")).hasValueSatisfying(model -> {
            assertThat(model.client()).isSameAs(gemini);
            assertThat(model.vendorModel()).isEqualTo("gemini-2.5-flash-001");
        });
        assertThat(catalog.resolve("claude")).isEmpty();
        assertThat(catalog.resolve(null)).isEmpty();
        assertThat(catalog.modelIds()).containsExactlyInAnyOrder("gpt-4o", "gemini-2.5-flash");
    }

    @Test
    void rejectsUnknownProvider() {
        assertThatThrownBy(() -> new ModelCatalog(Map.of("x", new ModelDefinition("mistral", null)), List.of(openai)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mistral");
    }

    @Test
    void rejectsDuplicateClients() {
        assertThatThrownBy(() -> new ModelCatalog(Map.of(), List.of(openai, new MockLlmClient("openai"))))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void mockClientIsDeterministicAndMentionsVoiceContext() {
        ComposedRequest plain = new ComposedRequest("You are a helpful AI assistant.", List.of(ChatTurn.user("Hi")));
        ComposedRequest styled = new ComposedRequest("VOICE CONTEXT:\nsample", List.of(ChatTurn.user("Hi")));
        List<String> first = new ArrayList<>();
        List<String> second = new ArrayList<>();

        openai.streamChat(plain, "gpt-4o", first::add, new CancellationToken());
        openai.streamChat(plain, "gpt-4o", second::add, new CancellationToken());

        assertThat(first).isEqualTo(second).hasSize(4);
        assertThat(String.join("", first)).contains("openai (gpt-4o)", "You said: Hi");
        assertThat(openai.deltas(styled, "gpt-4o")).last().isEqualTo(" (styled with voice context)");
    }

    @Test
    void mockClientStopsOnCancellation() {
        CancellationToken token = new CancellationToken();
        List<String> deltas = new ArrayList<>();

        gemini.streamChat(new ComposedRequest("", List.of(ChatTurn.user("Hi"))), "gemini-2.5-flash", delta -> {
            deltas.add(delta);
            token.cancel(CancellationReason.USER_STOP);
        }, token);

        assertThat(deltas).hasSize(1);
    }
}
