package ch.so.arp.voice.style;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embeds batches of fragments. A fragment that fails to embed is logged and
 * left out; the remaining fragments are returned in input order.
 */
public class StyleEmbedder {

    private static final Logger LOGGER = LoggerFactory.getLogger(StyleEmbedder.class);

    private final EmbeddingProvider embeddingProvider;

    public StyleEmbedder(EmbeddingProvider embeddingProvider) {
        this.embeddingProvider = Objects.requireNonNull(embeddingProvider, "embeddingProvider");
    }

    public List<EmbeddedFragment> embedBatch(List<String> texts) {
        List<EmbeddedFragment> embedded = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            String text = texts.get(i);
            try {
                embedded.add(new EmbeddedFragment(i, text, embeddingProvider.embed(text)));
            } catch (RuntimeException ex) {
                LOGGER.warn("Skipping fragment {} of {}: embedding via {} failed: {}", i + 1, texts.size(),
                        embeddingProvider.name(), ex.getMessage());
            }
        }
        if (embedded.size() < texts.size()) {
            LOGGER.info("Embedded {} of {} fragments", embedded.size(), texts.size());
        }
        return embedded;
    }

    public float[] embed(String text) {
        return embeddingProvider.embed(text);
    }

    public EmbeddingProvider provider() {
        return embeddingProvider;
    }
}
