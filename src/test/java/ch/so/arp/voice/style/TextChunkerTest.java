package ch.so.arp.voice.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class TextChunkerTest {

    @Test
    void splitsTextIntoOverlappingWindows() {
        List<String> chunks = TextChunker.chunk("abcdefghij", 4, 1);

        assertThat(chunks).containsExactly("abcd", "defg", "ghij");
    }

    @Test
    void reconstructsInputWhenOverlapsAreRemoved() {
        String text = sampleText(2_345);

        List<String> chunks = new TextChunker(300, 70).chunk(text);

        StringBuilder rebuilt = new StringBuilder(chunks.get(0));
        for (int i = 1; i < chunks.size(); i++) {
            rebuilt.append(chunks.get(i).substring(70));
        }
        assertThat(rebuilt.toString()).isEqualTo(text);
    }

    @Test
    void producesExpectedNumberOfChunks() {
        int size = 1_000;
        int overlap = 200;
        for (int length : new int[] {1, 999, 1_000, 1_001, 1_800, 1_801, 2_500, 10_000}) {
            int expected = length <= size ? 1 : 1 + (int) Math.ceil((length - size) / (double) (size - overlap));

            assertThat(TextChunker.chunk(sampleText(length), size, overlap))
                    .as("chunks for %d characters", length)
                    .hasSize(expected);
        }
    }

    @Test
    void defaultSettingsSplitTwentyFiveHundredCharactersIntoThreeChunks() {
        List<String> chunks = new TextChunker(TextChunker.DEFAULT_CHUNK_SIZE, TextChunker.DEFAULT_OVERLAP)
                .chunk(sampleText(2_500));

        assertThat(chunks).hasSize(3);
        assertThat(chunks.get(0)).hasSize(1_000);
        assertThat(chunks.get(1)).hasSize(1_000);
        assertThat(chunks.get(2)).hasSize(900);
    }

    @Test
    void emptyTextHasNoChunks() {
        assertThat(TextChunker.chunk("", 10, 2)).isEmpty();
        assertThat(TextChunker.chunk(null, 10, 2)).isEmpty();
    }

    @Test
    void rejectsInvalidParameters() {
        assertThatThrownBy(() -> new TextChunker(0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextChunker(10, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TextChunker(10, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("smaller than chunkSize");
    }

    static String sampleText(int length) {
        StringBuilder builder = new StringBuilder(length);
        for (int i = 0; builder.length() < length; i++) {
            builder.append("Sentence ").append(i).append(" keeps the rhythm. ");
        }
        return builder.substring(0, length);
    }
}
