package ch.so.arp.voice.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JDBC access to the {@code voice_profiles} table. Profile editing happens
 * elsewhere; this repository covers what the chat pipeline needs: reading a
 * profile, creating one and switching the active profile of a user.
 */
@Repository
public class VoiceProfileRepository {

    private static final Logger LOGGER = LoggerFactory.getLogger(VoiceProfileRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT id, owner_id, name, description, purpose, tone_options, custom_tones, structure_preferences,
                   bold_usage, line_spacing, emoji_usage, list_vs_paragraphs, markup_style, moral_tone,
                   preferred_stance, ethical_boundaries, humour_level, is_active
            FROM voice_profiles
            """;

    private static final RowMapper<VoiceProfile> ROW_MAPPER = VoiceProfileRepository::mapRow;

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public VoiceProfileRepository(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public VoiceProfile create(VoiceProfile profile) {
        Objects.requireNonNull(profile, "profile");
        OffsetDateTime now = JdbcColumns.now(clock);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("""
                INSERT INTO voice_profiles (owner_id, name, description, purpose, tone_options, custom_tones,
                    structure_preferences, bold_usage, line_spacing, emoji_usage, list_vs_paragraphs, markup_style,
                    moral_tone, preferred_stance, ethical_boundaries, humour_level, is_active, created_at, updated_at)
                VALUES (:ownerId, :name, :description, :purpose, :toneOptions, :customTones, :structure, :bold,
                    :spacing, :emoji, :lists, :markup, :moralTone, :stance, :ethics, :humour, FALSE, :now, :now)
                """)
                .param("ownerId", profile.ownerId())
                .param("name", profile.name())
                .param("description", profile.description())
                .param("purpose", profile.purpose())
                .param("toneOptions", JdbcColumns.joinList(profile.toneOptions()))
                .param("customTones", JdbcColumns.joinList(profile.customTones()))
                .param("structure", profile.structurePreferences())
                .param("bold", profile.boldUsage())
                .param("spacing", profile.lineSpacing())
                .param("emoji", profile.emojiUsage())
                .param("lists", profile.listVsParagraphs())
                .param("markup", profile.markupStyle())
                .param("moralTone", profile.moralTone())
                .param("stance", profile.preferredStance())
                .param("ethics", JdbcColumns.joinList(profile.ethicalBoundaries()))
                .param("humour", profile.humourLevel())
                .param("now", now)
                .update(keyHolder, "id");
        long id = Objects.requireNonNull(keyHolder.getKeyAs(Long.class), "generated id");
        LOGGER.debug("Created voice profile {} for owner {}", id, profile.ownerId());
        return findById(id).orElseThrow();
    }

    public Optional<VoiceProfile> findById(long id) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE id = :id")
                .param("id", id)
                .query(ROW_MAPPER)
                .optional();
    }

    public List<VoiceProfile> findByOwner(String ownerId) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE owner_id = :ownerId ORDER BY id")
                .param("ownerId", ownerId)
                .query(ROW_MAPPER)
                .list();
    }

    public Optional<VoiceProfile> findActive(String ownerId) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE owner_id = :ownerId AND is_active = TRUE ORDER BY id")
                .param("ownerId", ownerId)
                .query(ROW_MAPPER)
                .list()
                .stream()
                .findFirst();
    }

    /**
     * Makes the given profile the only active profile of its owner. Both steps
     * run in one transaction; calling it twice leaves the same state.
     *
     * @return {@code false} if the profile does not exist or belongs to someone else
     */
    public boolean setActive(String ownerId, long profileId) {
        Boolean activated = transactionTemplate.execute(status -> {
            OffsetDateTime now = JdbcColumns.now(clock);
            int owned = jdbcClient.sql("SELECT COUNT(*) FROM voice_profiles WHERE id = :id AND owner_id = :ownerId")
                    .param("id", profileId)
                    .param("ownerId", ownerId)
                    .query(Integer.class)
                    .single();
            if (owned == 0) {
                return false;
            }
            jdbcClient.sql("""
                    UPDATE voice_profiles SET is_active = FALSE, updated_at = :now
                    WHERE owner_id = :ownerId AND is_active = TRUE
                    """)
                    .param("ownerId", ownerId)
                    .param("now", now)
                    .update();
            jdbcClient.sql("UPDATE voice_profiles SET is_active = TRUE, updated_at = :now WHERE id = :id")
                    .param("id", profileId)
                    .param("now", now)
                    .update();
            return true;
        });
        if (Boolean.TRUE.equals(activated)) {
            LOGGER.info("Activated voice profile {} for owner {}", profileId, ownerId);
            return true;
        }
        return false;
    }

    public boolean delete(String ownerId, long profileId) {
        return jdbcClient.sql("DELETE FROM voice_profiles WHERE id = :id AND owner_id = :ownerId")
                .param("id", profileId)
                .param("ownerId", ownerId)
                .update() > 0;
    }

    private static VoiceProfile mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new VoiceProfile(
                rs.getLong("id"),
                rs.getString("owner_id"),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("purpose"),
                JdbcColumns.splitList(rs.getString("tone_options")),
                JdbcColumns.splitList(rs.getString("custom_tones")),
                rs.getString("structure_preferences"),
                JdbcColumns.readInteger(rs, "bold_usage"),
                JdbcColumns.readInteger(rs, "line_spacing"),
                JdbcColumns.readInteger(rs, "emoji_usage"),
                JdbcColumns.readInteger(rs, "list_vs_paragraphs"),
                JdbcColumns.readInteger(rs, "markup_style"),
                rs.getString("moral_tone"),
                rs.getString("preferred_stance"),
                JdbcColumns.splitList(rs.getString("ethical_boundaries")),
                rs.getString("humour_level"),
                rs.getBoolean("is_active"));
    }
}
