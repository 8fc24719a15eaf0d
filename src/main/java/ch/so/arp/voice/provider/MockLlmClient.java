package ch.so.arp.voice.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import ch.so.arp.voice.prompt.ComposedRequest;

/**
 * Deterministic {@link LlmClient} used in tests and local development where no
 * vendor API should be contacted. It registers under the name of the provider
 * it stands in for, so the model catalog resolves as in production.
 */
public class MockLlmClient implements LlmClient {

    private final String name;

    public MockLlmClient(String name) {
        this.name = name;
    }

    @Override
    public void streamChat(ComposedRequest request, String model, Consumer<String> deltaConsumer,
            CancellationToken token) {
        for (String delta : deltas(request, model)) {
            if (token.isCancellationRequested()) {
                return;
            }
            deltaConsumer.accept(delta);
        }
    }

    @Override
    public String name() {
        return name;
    }

    List<String> deltas(ComposedRequest request, String model) {
        List<String> deltas = new ArrayList<>();
        deltas.add("[mocked answer] ");
        deltas.add("This is a mocked response from " + name + " (" + model + "). ");
        deltas.add("Provide an API key and disable mocks to reach the real service. ");
        deltas.add("You said: " + request.lastTurn().content());
        if (request.systemInstruction().contains("VOICE CONTEXT")) {
            deltas.add(" (styled with voice context)");
        }
        return deltas;
    }
}
