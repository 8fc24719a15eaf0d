package ch.so.arp.voice.prompt;

import java.util.List;

/**
 * Style characteristics observed across the writing samples of a profile.
 */
public record WritingStyleTraits(int sampleCount, List<String> characteristics) {

    public static final WritingStyleTraits NONE = new WritingStyleTraits(0, List.of());

    public WritingStyleTraits {
        characteristics = List.copyOf(characteristics);
    }

    public boolean isEmpty() {
        return sampleCount == 0;
    }

    public String summary() {
        return characteristics.isEmpty() ? "maintains consistent writing style across samples"
                : String.join(", ", characteristics);
    }
}
