package ch.so.arp.voice.style;

import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;
import java.util.stream.Stream;

/**
 * Vector helpers shared by the style index implementations.
 */
public final class VectorMath {

    private VectorMath() {
    }

    /**
     * Cosine similarity of two vectors. Returns {@code 0} when either vector has
     * zero norm or the dimensions differ.
     */
    public static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0d;
        }
        double dot = 0.0d;
        double normA = 0.0d;
        double normB = 0.0d;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0d || normB == 0.0d) {
            return 0.0d;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    /**
     * Scores the fragments against the query and keeps the {@code k} best. The
     * sort is stable on insertion sequence, so ties keep insertion order.
     */
    static List<ScoredFragment> rank(Stream<StyleFragment> fragments, float[] query, int k) {
        if (k <= 0) {
            return List.of();
        }
        return fragments
                .sorted(Comparator.comparingLong(StyleFragment::sequence))
                .map(fragment -> new ScoredFragment(fragment, cosine(query, fragment.vector())))
                .sorted(Comparator.comparingDouble(ScoredFragment::score).reversed())
                .limit(k)
                .toList();
    }

    public static String toLiteral(float[] vector) {
        StringJoiner joiner = new StringJoiner(",", "[", "]");
        for (float value : vector) {
            joiner.add(Float.toString(value));
        }
        return joiner.toString();
    }

    public static float[] fromLiteral(String literal) {
        String trimmed = literal.strip();
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
            throw new IllegalArgumentException("Not a vector literal: " + abbreviate(trimmed));
        }
        String body = trimmed.substring(1, trimmed.length() - 1).strip();
        if (body.isEmpty()) {
            return new float[0];
        }
        String[] parts = body.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].strip());
        }
        return vector;
    }

    private static String abbreviate(String value) {
        return value.length() > 32 ? value.substring(0, 32) + "..." : value;
    }
}
