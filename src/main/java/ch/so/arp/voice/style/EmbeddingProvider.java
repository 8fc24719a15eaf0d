package ch.so.arp.voice.style;

/**
 * Strategy abstraction used to compute embeddings for style fragments and user
 * messages. Implementations can either call a remote embedding API or provide
 * deterministic placeholders that are suited for tests and local development.
 */
public interface EmbeddingProvider {

    /**
     * Create an embedding vector for the provided text.
     *
     * @param text the text to embed
     * @return the embedding, always {@link #dimensions()} long
     * @throws EmbeddingException if the vector could not be computed
     */
    float[] embed(String text);

    int dimensions();

    String name();
}
