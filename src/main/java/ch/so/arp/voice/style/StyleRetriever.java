package ch.so.arp.voice.style;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the style fragments of a profile that are closest to a message.
 * Retrieval problems never fail a chat turn; they yield no fragments.
 */
public class StyleRetriever {

    private static final Logger LOGGER = LoggerFactory.getLogger(StyleRetriever.class);

    private final StyleEmbedder embedder;
    private final StyleIndex styleIndex;

    public StyleRetriever(StyleEmbedder embedder, StyleIndex styleIndex) {
        this.embedder = Objects.requireNonNull(embedder, "embedder");
        this.styleIndex = Objects.requireNonNull(styleIndex, "styleIndex");
    }

    public List<ScoredFragment> retrieve(long voiceProfileId, String queryText, int k) {
        if (queryText == null || queryText.isBlank() || k <= 0) {
            return List.of();
        }
        float[] queryVector;
        try {
            queryVector = embedder.embed(queryText);
        } catch (RuntimeException ex) {
            LOGGER.warn("Query embedding for profile {} failed, continuing without style context: {}",
                    voiceProfileId, ex.getMessage());
            return List.of();
        }
        List<ScoredFragment> fragments = styleIndex.topK(voiceProfileId, queryVector, k);
        LOGGER.debug("Retrieved {} style fragments for profile {}", fragments.size(), voiceProfileId);
        return fragments;
    }
}
