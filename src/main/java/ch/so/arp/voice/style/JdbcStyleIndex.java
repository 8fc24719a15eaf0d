package ch.so.arp.voice.style;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link StyleIndex} backed by the {@code style_fragments} table. Vectors are
 * stored as text literals ({@code [0.1,0.2,...]}); similarity is computed in
 * Java over the rows of one profile, which keeps the schema portable between
 * PostgreSQL and H2.
 */
public class JdbcStyleIndex implements StyleIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdbcStyleIndex.class);

    private final JdbcClient jdbcClient;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public JdbcStyleIndex(JdbcClient jdbcClient, TransactionTemplate transactionTemplate, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public int append(long voiceProfileId, long sampleId, List<EmbeddedFragment> fragments) {
        if (fragments.isEmpty()) {
            return 0;
        }
        Integer stored = transactionTemplate.execute(status -> {
            int expected = storedDimensions(voiceProfileId).orElse(fragments.get(0).vector().length);
            for (EmbeddedFragment fragment : fragments) {
                if (fragment.vector().length != expected) {
                    throw new IllegalArgumentException("Vector has " + fragment.vector().length
                            + " dimensions but profile " + voiceProfileId + " stores " + expected);
                }
            }
            OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
            for (EmbeddedFragment fragment : fragments) {
                jdbcClient.sql("""
                        INSERT INTO style_fragments (voice_profile_id, sample_id, text_chunk, embedding, dimensions,
                            created_at)
                        VALUES (:profileId, :sampleId, :text, :embedding, :dimensions, :now)
                        """)
                        .param("profileId", voiceProfileId)
                        .param("sampleId", sampleId)
                        .param("text", fragment.text())
                        .param("embedding", VectorMath.toLiteral(fragment.vector()))
                        .param("dimensions", fragment.vector().length)
                        .param("now", now)
                        .update();
            }
            return fragments.size();
        });
        LOGGER.debug("Stored {} fragments for profile {} (sample {})", stored, voiceProfileId, sampleId);
        return stored != null ? stored : 0;
    }

    @Override
    public List<ScoredFragment> topK(long voiceProfileId, float[] queryVector, int k) {
        List<StyleFragment> fragments = jdbcClient.sql("""
                SELECT id, voice_profile_id, sample_id, text_chunk, embedding
                FROM style_fragments
                WHERE voice_profile_id = :profileId
                ORDER BY id
                """)
                .param("profileId", voiceProfileId)
                .query(JdbcStyleIndex::mapRow)
                .list();
        return VectorMath.rank(fragments.stream(), queryVector, k);
    }

    @Override
    public int deleteByProfile(long voiceProfileId) {
        return jdbcClient.sql("DELETE FROM style_fragments WHERE voice_profile_id = :profileId")
                .param("profileId", voiceProfileId)
                .update();
    }

    @Override
    public int deleteBySample(long voiceProfileId, long sampleId) {
        return jdbcClient.sql("DELETE FROM style_fragments WHERE voice_profile_id = :profileId AND sample_id = :sampleId")
                .param("profileId", voiceProfileId)
                .param("sampleId", sampleId)
                .update();
    }

    @Override
    public int count(long voiceProfileId) {
        return jdbcClient.sql("SELECT COUNT(*) FROM style_fragments WHERE voice_profile_id = :profileId")
                .param("profileId", voiceProfileId)
                .query(Integer.class)
                .single();
    }

    private Optional<Integer> storedDimensions(long voiceProfileId) {
        return jdbcClient.sql("SELECT dimensions FROM style_fragments WHERE voice_profile_id = :profileId LIMIT 1")
                .param("profileId", voiceProfileId)
                .query(Integer.class)
                .optional();
    }

    private static StyleFragment mapRow(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        return new StyleFragment(id, rs.getLong("voice_profile_id"), rs.getLong("sample_id"),
                rs.getString("text_chunk"), VectorMath.fromLiteral(rs.getString("embedding")), id);
    }
}
