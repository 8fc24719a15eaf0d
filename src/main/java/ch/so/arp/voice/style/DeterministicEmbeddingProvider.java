package ch.so.arp.voice.style;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Random;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider deriving a unit vector from the SHA-256 digest of the
 * text. Equal texts map to equal vectors, which is all the style index needs
 * when running without an embedding API.
 */
public class DeterministicEmbeddingProvider implements EmbeddingProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(DeterministicEmbeddingProvider.class);

    private final int dimensions;

    public DeterministicEmbeddingProvider(int dimensions) {
        if (dimensions <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        this.dimensions = dimensions;
        LOGGER.info("Using deterministic embeddings with {} dimensions", dimensions);
    }

    @Override
    public float[] embed(String text) {
        if (text == null || text.isBlank()) {
            throw new EmbeddingException("Cannot embed blank text");
        }
        double[] raw = new Random(seedOf(text)).doubles(dimensions, -1.0d, 1.0d).toArray();
        return toUnitVector(raw);
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    @Override
    public String name() {
        return "deterministic";
    }

    private static long seedOf(String value) {
        byte[] digest;
        try {
            digest = MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm not available", ex);
        }
        return ByteBuffer.wrap(digest, 0, Long.BYTES).getLong();
    }

    private static float[] toUnitVector(double[] raw) {
        double length = Math.sqrt(Arrays.stream(raw).map(component -> component * component).sum());
        float[] vector = new float[raw.length];
        for (int i = 0; i < raw.length; i++) {
            vector[i] = length == 0.0d ? 0.0f : (float) (raw[i] / length);
        }
        return vector;
    }
}
