package ch.so.arp.voice.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class WritingSampleRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, voice_profile_id, file_name, content, created_at FROM writing_samples
            """;

    private final JdbcClient jdbcClient;
    private final Clock clock;

    public WritingSampleRepository(JdbcClient jdbcClient, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public WritingSample create(long voiceProfileId, String fileName, String content) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("""
                INSERT INTO writing_samples (voice_profile_id, file_name, content, created_at)
                VALUES (:profileId, :fileName, :content, :now)
                """)
                .param("profileId", voiceProfileId)
                .param("fileName", fileName)
                .param("content", content)
                .param("now", JdbcColumns.now(clock))
                .update(keyHolder, "id");
        long id = Objects.requireNonNull(keyHolder.getKeyAs(Long.class), "generated id");
        return findById(id).orElseThrow();
    }

    public Optional<WritingSample> findById(long id) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE id = :id")
                .param("id", id)
                .query(WritingSampleRepository::mapRow)
                .optional();
    }

    public List<WritingSample> findByProfile(long voiceProfileId) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE voice_profile_id = :profileId ORDER BY created_at, id")
                .param("profileId", voiceProfileId)
                .query(WritingSampleRepository::mapRow)
                .list();
    }

    /**
     * Deletes the sample. Its style fragments go with it through the foreign key.
     */
    public boolean delete(long voiceProfileId, long sampleId) {
        return jdbcClient.sql("DELETE FROM writing_samples WHERE id = :id AND voice_profile_id = :profileId")
                .param("id", sampleId)
                .param("profileId", voiceProfileId)
                .update() > 0;
    }

    private static WritingSample mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new WritingSample(rs.getLong("id"), rs.getLong("voice_profile_id"), rs.getString("file_name"),
                rs.getString("content"), JdbcColumns.read(rs, "created_at"));
    }
}
