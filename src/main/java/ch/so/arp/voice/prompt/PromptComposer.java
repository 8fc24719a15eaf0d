package ch.so.arp.voice.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import ch.so.arp.voice.persistence.MessageRole;
import ch.so.arp.voice.persistence.VoiceProfile;
import ch.so.arp.voice.style.ScoredFragment;

/**
 * Builds the provider-neutral request for one chat turn. The system
 * instruction is derived from the active voice profile and the retrieved style
 * fragments; the message list carries the conversation history followed by the
 * new user turn. Composition is deterministic and tolerates incomplete
 * profiles.
 */
public class PromptComposer {

    public static final String GENERIC_INSTRUCTION = "You are a helpful AI assistant.";

    static final String CLOSING_INSTRUCTION = "CRITICAL INSTRUCTION: You must consistently apply ALL these "
            + "guidelines in every response. This is your core communication identity, never deviate from these "
            + "characteristics.";

    private static final String FRAGMENT_SEPARATOR = "\n\n---\n\n";

    public ComposedRequest compose(VoiceProfile profile, List<ScoredFragment> fragments, List<ChatTurn> history,
            String userText) {
        return compose(profile, WritingStyleTraits.NONE, fragments, history, userText);
    }

    public ComposedRequest compose(VoiceProfile profile, WritingStyleTraits traits, List<ScoredFragment> fragments,
            List<ChatTurn> history, String userText) {
        StringBuilder instruction = new StringBuilder(
                profile != null ? voiceInstruction(profile, traits) : GENERIC_INSTRUCTION);
        if (fragments != null && !fragments.isEmpty()) {
            instruction.append("\n\n").append(voiceContext(fragments));
        }

        List<ChatTurn> messages = new ArrayList<>();
        if (history != null) {
            history.stream()
                    .filter(turn -> turn.role() != MessageRole.SYSTEM)
                    .filter(turn -> !turn.content().isBlank())
                    .forEach(messages::add);
        }
        messages.add(ChatTurn.user(userText));
        return new ComposedRequest(instruction.toString(), messages);
    }

    String voiceInstruction(VoiceProfile profile, WritingStyleTraits traits) {
        List<String> sections = new ArrayList<>();
        sections.add("You are an AI assistant embodying the voice profile \"" + nameOf(profile) + "\".");
        if (hasText(profile.description())) {
            sections.add("Context: " + profile.description().strip());
        }
        if (hasText(profile.purpose())) {
            sections.add("PRIMARY OBJECTIVE: " + profile.purpose().strip());
        }

        List<String> toneRules = new ArrayList<>();
        if (!profile.toneOptions().isEmpty()) {
            toneRules.add("Maintain these tones: " + String.join(", ", profile.toneOptions()));
        }
        if (!profile.customTones().isEmpty()) {
            toneRules.add("Custom tone requirements: " + String.join(", ", profile.customTones()));
        }
        if (hasText(profile.moralTone())) {
            toneRules.add("Moral perspective: " + profile.moralTone().strip());
        }
        if (hasText(profile.humourLevel())) {
            toneRules.add("Humor approach: " + profile.humourLevel().strip());
        }
        addBulletSection(sections, "TONE REQUIREMENTS", toneRules);

        List<String> formatRules = new ArrayList<>();
        addDirective(formatRules, FormattingAspect.BOLD, profile.boldUsage());
        addDirective(formatRules, FormattingAspect.LINE_SPACING, profile.lineSpacing());
        addDirective(formatRules, FormattingAspect.EMOJI, profile.emojiUsage());
        addDirective(formatRules, FormattingAspect.LISTS, profile.listVsParagraphs());
        if (profile.markupStyle() != null) {
            formatRules.add(markupDirective(profile.markupStyle()));
        }
        addBulletSection(sections, "FORMATTING RULES", formatRules);

        if (hasText(profile.structurePreferences())) {
            sections.add("CONTENT STRUCTURE: " + profile.structurePreferences().strip());
        }
        if (hasText(profile.preferredStance())) {
            sections.add("COMMUNICATION STANCE: " + profile.preferredStance().strip());
        }
        if (!profile.ethicalBoundaries().isEmpty()) {
            sections.add("ETHICAL BOUNDARIES: Strictly respect these limits: "
                    + String.join(", ", profile.ethicalBoundaries()));
        }
        if (traits != null && !traits.isEmpty()) {
            sections.add("WRITING STYLE ANALYSIS: Based on " + traits.sampleCount() + " uploaded samples - "
                    + traits.summary());
        }
        sections.add(CLOSING_INSTRUCTION);
        return String.join("\n\n", sections);
    }

    static String voiceContext(List<ScoredFragment> fragments) {
        String body = fragments.stream()
                .sorted((a, b) -> Double.compare(b.score(), a.score()))
                .map(fragment -> "[Similarity: " + String.format(Locale.ROOT, "%.3f", fragment.score()) + "]\n"
                        + fragment.text())
                .collect(Collectors.joining(FRAGMENT_SEPARATOR));
        return "VOICE CONTEXT:\nMatch the tone, vocabulary and sentence structure of these writing samples.\n\n"
                + body;
    }

    static String markupDirective(int markupStyle) {
        if (markupStyle <= 1) {
            return "Use plain text with minimal formatting";
        }
        if (markupStyle >= 4) {
            return "Use rich formatting: headers, code blocks, tables, and structured markup";
        }
        return "Use moderate formatting with basic markdown elements";
    }

    private static void addDirective(List<String> rules, FormattingAspect aspect, Integer value) {
        StyleLevel level = StyleLevel.fromOrdinal(value);
        if (level != null) {
            rules.add(aspect.directive(level));
        }
    }

    private static void addBulletSection(List<String> sections, String title, List<String> rules) {
        if (!rules.isEmpty()) {
            sections.add(title + ":\n" + rules.stream().map(rule -> "• " + rule).collect(Collectors.joining("\n")));
        }
    }

    private static String nameOf(VoiceProfile profile) {
        return hasText(profile.name()) ? profile.name().strip() : "Custom voice";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
