package ch.so.arp.voice.prompt;

import java.util.EnumMap;
import java.util.Map;

/**
 * Formatting features controlled by a {@link StyleLevel}, each with one
 * directive per level.
 */
enum FormattingAspect {

    BOLD(
            "Never use bold text or emphasis formatting",
            "Use **bold text** sparingly for only the most important concepts",
            "Use **bold text** selectively for important concepts",
            "Use **bold text** frequently for emphasis and key points",
            "Use **bold text** extensively throughout for maximum emphasis"),
    LINE_SPACING(
            "Write in compact, dense paragraphs with minimal line breaks",
            "Use tight spacing with mostly dense paragraphs",
            "Use moderate spacing with balanced paragraph lengths",
            "Use generous spacing with shorter paragraphs and frequent line breaks",
            "Use maximum spacing with very short paragraphs and extensive line breaks"),
    EMOJI(
            "Never use emojis, keep the communication purely text based",
            "Use emojis very sparingly and only for essential context",
            "Use emojis occasionally when they add meaningful context",
            "Use emojis frequently to enhance expression and engagement",
            "Use emojis extensively throughout responses for maximum expression"),
    LISTS(
            "Write in flowing paragraphs and avoid bullet points and lists completely",
            "Prefer paragraphs, use lists only when absolutely necessary",
            "Balance paragraphs with lists based on content type",
            "Favor lists and bullet points over paragraphs when possible",
            "Structure information as bullet points and numbered lists whenever possible");

    private final Map<StyleLevel, String> directives = new EnumMap<>(StyleLevel.class);

    FormattingAspect(String never, String sparingly, String sometimes, String often, String asMuchAsPossible) {
        directives.put(StyleLevel.NEVER, never);
        directives.put(StyleLevel.SPARINGLY, sparingly);
        directives.put(StyleLevel.SOMETIMES, sometimes);
        directives.put(StyleLevel.OFTEN, often);
        directives.put(StyleLevel.AS_MUCH_AS_POSSIBLE, asMuchAsPossible);
    }

    String directive(StyleLevel level) {
        return directives.get(level);
    }
}
