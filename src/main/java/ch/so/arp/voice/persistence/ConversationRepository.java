package ch.so.arp.voice.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
public class ConversationRepository {

    private final JdbcClient jdbcClient;
    private final Clock clock;

    public ConversationRepository(JdbcClient jdbcClient, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Conversation create(String ownerId, String title) {
        OffsetDateTime now = JdbcColumns.now(clock);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("""
                INSERT INTO conversations (owner_id, title, created_at, updated_at)
                VALUES (:ownerId, :title, :now, :now)
                """)
                .param("ownerId", ownerId)
                .param("title", title)
                .param("now", now)
                .update(keyHolder, "id");
        long id = Objects.requireNonNull(keyHolder.getKeyAs(Long.class), "generated id");
        return findById(id).orElseThrow();
    }

    public Optional<Conversation> findById(long id) {
        return jdbcClient.sql("SELECT id, owner_id, title, created_at, updated_at FROM conversations WHERE id = :id")
                .param("id", id)
                .query(ConversationRepository::mapRow)
                .optional();
    }

    public void updateTitle(long id, String title) {
        jdbcClient.sql("UPDATE conversations SET title = :title, updated_at = :now WHERE id = :id")
                .param("id", id)
                .param("title", title)
                .param("now", JdbcColumns.now(clock))
                .update();
    }

    public void touch(long id) {
        jdbcClient.sql("UPDATE conversations SET updated_at = :now WHERE id = :id")
                .param("id", id)
                .param("now", JdbcColumns.now(clock))
                .update();
    }

    private static Conversation mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Conversation(rs.getLong("id"), rs.getString("owner_id"), rs.getString("title"),
                JdbcColumns.read(rs, "created_at"), JdbcColumns.read(rs, "updated_at"));
    }
}
