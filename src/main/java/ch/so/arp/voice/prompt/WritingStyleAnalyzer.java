package ch.so.arp.voice.prompt;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic analysis of raw writing samples: sentence and paragraph length,
 * punctuation habits, markdown usage and vocabulary register.
 */
public class WritingStyleAnalyzer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
    private static final Pattern EXCLAMATION = Pattern.compile("!");
    private static final Pattern QUESTION = Pattern.compile("\\?");
    private static final Pattern DASH = Pattern.compile("\u2014|--");
    private static final Pattern BOLD = Pattern.compile("\\*\\*[^*]+\\*\\*");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*•]\\s", Pattern.MULTILINE);
    private static final Pattern NUMBERED = Pattern.compile("^\\d+\\.\\s", Pattern.MULTILINE);
    private static final Pattern SHOUTED_WORD = Pattern.compile("\\b[A-Z][A-Z]+\\b");

    private static final List<String> PROFESSIONAL_WORDS = List.of("however", "therefore", "furthermore",
            "consequently", "nevertheless");
    private static final List<String> CASUAL_WORDS = List.of("yeah", "gonna", "wanna", "kinda", "sorta", "hey",
            "cool", "awesome");

    public WritingStyleTraits analyze(List<String> samples) {
        List<String> nonBlank = samples.stream().filter(s -> s != null && !s.isBlank()).toList();
        if (nonBlank.isEmpty()) {
            return WritingStyleTraits.NONE;
        }
        String text = String.join("\n\n", nonBlank);
        int words = WHITESPACE.split(text.strip()).length;
        List<String> traits = new ArrayList<>();

        long sentences = Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.isBlank()).count();
        double wordsPerSentence = sentences > 0 ? (double) words / sentences : 0;
        if (wordsPerSentence < 10) {
            traits.add("uses short, punchy sentences");
        } else if (wordsPerSentence > 20) {
            traits.add("writes in long, complex sentences");
        } else {
            traits.add("uses balanced sentence lengths");
        }

        if (count(EXCLAMATION, text) > words / 100.0) {
            traits.add("uses exclamation points frequently for emphasis");
        }
        if (count(QUESTION, text) > words / 150.0) {
            traits.add("engages readers with questions");
        }
        if (count(DASH, text) > words / 200.0) {
            traits.add("uses dashes for emphasis and breaks");
        }
        if (count(BOLD, text) > 0) {
            traits.add("uses bold text for emphasis");
        }
        if (count(BULLET, text) > 0 || count(NUMBERED, text) > 0) {
            traits.add("structures information with lists and bullet points");
        }
        if (count(SHOUTED_WORD, text) > words / 100.0) {
            traits.add("uses capitalized words for emphasis");
        }

        long paragraphs = Arrays.stream(PARAGRAPH_BREAK.split(text)).filter(p -> !p.isBlank()).count();
        double wordsPerParagraph = paragraphs > 0 ? (double) words / paragraphs : 0;
        if (wordsPerParagraph < 30) {
            traits.add("writes in short, concise paragraphs");
        } else if (wordsPerParagraph > 100) {
            traits.add("writes in long, detailed paragraphs");
        }

        String lower = text.toLowerCase(Locale.ROOT);
        long professional = PROFESSIONAL_WORDS.stream().filter(lower::contains).count();
        long casual = CASUAL_WORDS.stream().filter(lower::contains).count();
        if (professional > casual) {
            traits.add("maintains professional vocabulary");
        } else if (casual > professional) {
            traits.add("uses casual, conversational language");
        }
        return new WritingStyleTraits(nonBlank.size(), traits);
    }

    private static int count(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
