package ch.so.arp.voice.style;

import java.util.List;

import ch.so.arp.voice.persistence.VoiceProfile;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public record VoiceProfileRequest(
        @NotBlank String name,
        String description,
        String purpose,
        List<String> toneOptions,
        List<String> customTones,
        String structurePreferences,
        @Min(0) @Max(4) Integer boldUsage,
        @Min(0) @Max(4) Integer lineSpacing,
        @Min(0) @Max(4) Integer emojiUsage,
        @Min(0) @Max(4) Integer listVsParagraphs,
        @Min(0) @Max(5) Integer markupStyle,
        String moralTone,
        String preferredStance,
        List<String> ethicalBoundaries,
        String humourLevel) {

    VoiceProfile toProfile(String ownerId) {
        return new VoiceProfile(0L, ownerId, name.strip(), description, purpose, toneOptions, customTones,
                structurePreferences, boldUsage, lineSpacing, emojiUsage, listVsParagraphs, markupStyle, moralTone,
                preferredStance, ethicalBoundaries, humourLevel, false);
    }
}
