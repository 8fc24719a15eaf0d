package ch.so.arp.voice.provider;

import java.util.function.Consumer;

import ch.so.arp.voice.prompt.ComposedRequest;

/**
 * Abstraction over a streaming chat model vendor. Implementations are blocking:
 * {@link #streamChat} returns once the vendor stream has ended or the token was
 * cancelled.
 */
public interface LlmClient {

    /**
     * Streams the answer to the composed request, handing each text delta to
     * the consumer in arrival order.
     *
     * @param request       system instruction and role-tagged messages
     * @param model         vendor model identifier
     * @param deltaConsumer receives every non-empty text delta
     * @param token         checked between reads; a cancelled token ends the
     *                      stream without error
     * @throws EmptyResponseException if the stream ended without any delta
     * @throws ProviderException      for transport or vendor errors
     */
    void streamChat(ComposedRequest request, String model, Consumer<String> deltaConsumer, CancellationToken token);

    /**
     * @return provider name as referenced by the model catalog
     */
    String name();
}
