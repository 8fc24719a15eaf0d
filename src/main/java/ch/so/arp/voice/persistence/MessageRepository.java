package ch.so.arp.voice.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

/**
 * Messages of a conversation, ordered by creation time with the id as tie
 * breaker.
 */
@Repository
public class MessageRepository {

    private static final String SELECT_COLUMNS = """
            SELECT id, conversation_id, role, content, model, voice_profile_id, created_at FROM messages
            """;

    private final JdbcClient jdbcClient;
    private final Clock clock;

    public MessageRepository(JdbcClient jdbcClient, Clock clock) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Message save(long conversationId, MessageRole role, String content, String model, Long voiceProfileId) {
        Objects.requireNonNull(role, "role");
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("""
                INSERT INTO messages (conversation_id, role, content, model, voice_profile_id, created_at)
                VALUES (:conversationId, :role, :content, :model, :profileId, :now)
                """)
                .param("conversationId", conversationId)
                .param("role", role.dbValue())
                .param("content", content)
                .param("model", model)
                .param("profileId", voiceProfileId)
                .param("now", JdbcColumns.now(clock))
                .update(keyHolder, "id");
        long id = Objects.requireNonNull(keyHolder.getKeyAs(Long.class), "generated id");
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE id = :id")
                .param("id", id)
                .query(MessageRepository::mapRow)
                .single();
    }

    public List<Message> findByConversation(long conversationId) {
        return jdbcClient.sql(SELECT_COLUMNS + "WHERE conversation_id = :conversationId ORDER BY created_at, id")
                .param("conversationId", conversationId)
                .query(MessageRepository::mapRow)
                .list();
    }

    /**
     * Returns at most {@code limit} of the newest messages, oldest first.
     */
    public List<Message> findRecent(long conversationId, int limit) {
        List<Message> newestFirst = jdbcClient.sql(SELECT_COLUMNS
                + "WHERE conversation_id = :conversationId ORDER BY created_at DESC, id DESC LIMIT :limit")
                .param("conversationId", conversationId)
                .param("limit", limit)
                .query(MessageRepository::mapRow)
                .list();
        List<Message> oldestFirst = new ArrayList<>(newestFirst);
        Collections.reverse(oldestFirst);
        return oldestFirst;
    }

    public int countByConversation(long conversationId, MessageRole role) {
        return jdbcClient.sql("SELECT COUNT(*) FROM messages WHERE conversation_id = :conversationId AND role = :role")
                .param("conversationId", conversationId)
                .param("role", role.dbValue())
                .query(Integer.class)
                .single();
    }

    private static Message mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new Message(rs.getLong("id"), rs.getLong("conversation_id"),
                MessageRole.fromDbValue(rs.getString("role")), rs.getString("content"), rs.getString("model"),
                JdbcColumns.readLong(rs, "voice_profile_id"), JdbcColumns.read(rs, "created_at"));
    }
}
