package ch.so.arp.voice.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ch.so.arp.voice.style.EmbeddingException;

final class EmbeddingVectors {

    private EmbeddingVectors() {
    }

    /**
     * Reads the numeric array at {@code pointer} and checks its length.
     */
    static float[] read(ObjectMapper objectMapper, String json, String pointer, int expectedDimensions) {
        JsonNode values;
        try {
            values = objectMapper.readTree(json).at(pointer);
        } catch (JsonProcessingException ex) {
            throw new EmbeddingException("Failed to parse embedding response", ex);
        }
        if (!values.isArray() || values.isEmpty()) {
            throw new EmbeddingException("Embedding response has no vector at " + pointer);
        }
        if (values.size() != expectedDimensions) {
            throw new EmbeddingException(
                    "Expected " + expectedDimensions + " dimensions but received " + values.size());
        }
        float[] vector = new float[values.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) values.get(i).asDouble();
        }
        return vector;
    }
}
