package ch.so.arp.voice.chat;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.so.arp.voice.persistence.MessageRepository;
import ch.so.arp.voice.persistence.VoiceProfile;
import ch.so.arp.voice.persistence.VoiceProfileRepository;
import ch.so.arp.voice.persistence.WritingSample;
import ch.so.arp.voice.persistence.WritingSampleRepository;
import ch.so.arp.voice.prompt.ChatTurn;
import ch.so.arp.voice.prompt.ComposedRequest;
import ch.so.arp.voice.prompt.PromptComposer;
import ch.so.arp.voice.prompt.WritingStyleAnalyzer;
import ch.so.arp.voice.prompt.WritingStyleTraits;
import ch.so.arp.voice.style.ScoredFragment;
import ch.so.arp.voice.style.StyleRetriever;

/**
 * Gathers what a turn's prompt is built from: the recent history, the voice
 * profile, its closest style fragments and the traits of its samples.
 */
public class PromptAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PromptAssembler.class);

    private final MessageRepository messageRepository;
    private final VoiceProfileRepository profileRepository;
    private final WritingSampleRepository sampleRepository;
    private final StyleRetriever styleRetriever;
    private final PromptComposer promptComposer;
    private final WritingStyleAnalyzer styleAnalyzer;
    private final int contextLimit;
    private final int styleFragments;

    public PromptAssembler(MessageRepository messageRepository, VoiceProfileRepository profileRepository,
            WritingSampleRepository sampleRepository, StyleRetriever styleRetriever, PromptComposer promptComposer,
            WritingStyleAnalyzer styleAnalyzer, int contextLimit, int styleFragments) {
        this.messageRepository = Objects.requireNonNull(messageRepository, "messageRepository");
        this.profileRepository = Objects.requireNonNull(profileRepository, "profileRepository");
        this.sampleRepository = Objects.requireNonNull(sampleRepository, "sampleRepository");
        this.styleRetriever = Objects.requireNonNull(styleRetriever, "styleRetriever");
        this.promptComposer = Objects.requireNonNull(promptComposer, "promptComposer");
        this.styleAnalyzer = Objects.requireNonNull(styleAnalyzer, "styleAnalyzer");
        this.contextLimit = contextLimit;
        this.styleFragments = styleFragments;
    }

    ComposedRequest assemble(StreamSession session, String userText) {
        List<ChatTurn> history = history(session);
        VoiceProfile profile = session.voiceProfileId() == null ? null
                : profileRepository.findById(session.voiceProfileId()).orElse(null);
        if (profile == null) {
            LOGGER.debug("Composing turn for conversation {} without voice profile ({} earlier messages)",
                    session.conversationId(), history.size());
            return promptComposer.compose(null, List.of(), history, userText);
        }
        List<ScoredFragment> fragments = styleRetriever.retrieve(profile.id(), userText, styleFragments);
        WritingStyleTraits traits = styleAnalyzer.analyze(
                sampleRepository.findByProfile(profile.id()).stream().map(WritingSample::content).toList());
        ComposedRequest request = promptComposer.compose(profile, traits, fragments, history, userText);
        LOGGER.debug("Composed turn for conversation {} with profile {}: {} fragments, {} earlier messages, "
                + "instruction of {} chars", session.conversationId(), profile.id(), fragments.size(), history.size(),
                request.systemInstruction().length());
        return request;
    }

    private List<ChatTurn> history(StreamSession session) {
        if (contextLimit <= 0) {
            return List.of();
        }
        List<ChatTurn> turns = messageRepository.findRecent(session.conversationId(), contextLimit + 1).stream()
                .filter(message -> message.id() != session.userMessageId())
                .map(message -> new ChatTurn(message.role(), message.content()))
                .toList();
        return turns.size() > contextLimit ? turns.subList(turns.size() - contextLimit, turns.size()) : turns;
    }
}
