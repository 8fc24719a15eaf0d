package ch.so.arp.voice.persistence;

import java.util.List;

/**
 * Structured writing style preferences of a user. The usage levels
 * ({@code boldUsage}, {@code lineSpacing}, {@code emojiUsage},
 * {@code listVsParagraphs}) are ordinals from 0 (never) to 4 (as much as
 * possible); {@code markupStyle} ranges from 0 (plain text) to 5 (rich markup).
 * Any of them may be {@code null} when the user did not set a preference.
 *
 * @param id                   database id, {@code 0} before insertion
 * @param ownerId              user owning the profile
 * @param name                 display name used in the system instruction
 * @param description          optional free text describing the voice
 * @param purpose              optional primary objective
 * @param toneOptions          selected tone tags
 * @param customTones          user defined tone tags
 * @param structurePreferences optional content structure hint
 * @param boldUsage            bold usage level
 * @param lineSpacing          paragraph spacing level
 * @param emojiUsage           emoji usage level
 * @param listVsParagraphs     preference for lists over paragraphs
 * @param markupStyle          markup richness
 * @param moralTone            optional moral perspective
 * @param preferredStance      optional stance, e.g. Challenger or Coach
 * @param ethicalBoundaries    limits the assistant has to respect
 * @param humourLevel          optional humour approach
 * @param active               whether this is the owner's active profile
 */
public record VoiceProfile(
        long id,
        String ownerId,
        String name,
        String description,
        String purpose,
        List<String> toneOptions,
        List<String> customTones,
        String structurePreferences,
        Integer boldUsage,
        Integer lineSpacing,
        Integer emojiUsage,
        Integer listVsParagraphs,
        Integer markupStyle,
        String moralTone,
        String preferredStance,
        List<String> ethicalBoundaries,
        String humourLevel,
        boolean active) {

    public VoiceProfile {
        toneOptions = toneOptions == null ? List.of() : List.copyOf(toneOptions);
        customTones = customTones == null ? List.of() : List.copyOf(customTones);
        ethicalBoundaries = ethicalBoundaries == null ? List.of() : List.copyOf(ethicalBoundaries);
    }

    /**
     * Creates a profile that only carries a name, all preferences unset.
     */
    public static VoiceProfile named(String ownerId, String name) {
        return new VoiceProfile(0L, ownerId, name, null, null, List.of(), List.of(), null, null, null, null, null,
                null, null, null, List.of(), null, false);
    }

    public boolean isOwnedBy(String userId) {
        return ownerId.equals(userId);
    }
}
