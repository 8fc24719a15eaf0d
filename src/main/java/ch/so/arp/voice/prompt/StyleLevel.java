package ch.so.arp.voice.prompt;

/**
 * Ordinal usage level of a formatting feature as stored on a voice profile.
 */
public enum StyleLevel {
    NEVER,
    SPARINGLY,
    SOMETIMES,
    OFTEN,
    AS_MUCH_AS_POSSIBLE;

    /**
     * Maps a stored ordinal to its level. Values outside the table resolve to
     * the moderate {@link #SOMETIMES}.
     *
     * @return the level, or {@code null} when no preference is stored
     */
    public static StyleLevel fromOrdinal(Integer value) {
        if (value == null) {
            return null;
        }
        StyleLevel[] levels = values();
        if (value < 0 || value >= levels.length) {
            return SOMETIMES;
        }
        return levels[value];
    }
}
