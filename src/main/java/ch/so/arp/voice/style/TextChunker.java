package ch.so.arp.voice.style;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into overlapping character windows. Chunk {@code i} starts at
 * {@code i * (chunkSize - overlap)} and the last chunk ends at the end of the
 * text, so concatenating the chunks without their overlaps yields the input.
 */
public final class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    private final int chunkSize;
    private final int overlap;

    public TextChunker(int chunkSize, int overlap) {
        validate(chunkSize, overlap);
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<String> chunk(String text) {
        return chunk(text, chunkSize, overlap);
    }

    public int chunkSize() {
        return chunkSize;
    }

    public int overlap() {
        return overlap;
    }

    public static List<String> chunk(String text, int chunkSize, int overlap) {
        validate(chunkSize, overlap);
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<String> chunks = new ArrayList<>();
        int length = text.length();
        int start = 0;
        while (start < length) {
            int end = Math.min(start + chunkSize, length);
            chunks.add(text.substring(start, end));
            if (end == length) {
                break;
            }
            start = end - overlap;
        }
        return chunks;
    }

    private static void validate(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive but was " + chunkSize);
        }
        if (overlap < 0) {
            throw new IllegalArgumentException("overlap must not be negative but was " + overlap);
        }
        if (overlap >= chunkSize) {
            throw new IllegalArgumentException(
                    "overlap (" + overlap + ") must be smaller than chunkSize (" + chunkSize + ")");
        }
    }
}
