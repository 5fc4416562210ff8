package com.sagarmitra.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import com.sagarmitra.service.impl.entity.MessageEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@ConditionalOnProperty(name = "agent.store.type", havingValue = "database")
@RequiredArgsConstructor
@Slf4j
public class JdbcConversationStore implements ConversationStore {

    private static final String CONVERSATION_SELECT = """
            SELECT conversation_id, user_id, title, language, summary, message_count, created_at, updated_at
            FROM conversations
            """;

    private static final String MESSAGE_SELECT = """
            SELECT conversation_id, message_key, message_id, role, content, tool_calls, metadata
            FROM conversation_messages
            """;

    private static final TypeReference<List<Map<String, Object>>> TOOL_CALLS_TYPE = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final MessageKeyGenerator keyGenerator;

    @Override
    public ConversationEntity create(String userId, String title, String language) {
        Instant now = Instant.now();
        ConversationEntity entity = ConversationEntity.builder()
                .conversationId(keyGenerator.newConversationId())
                .userId(userId)
                .title(title)
                .language(language)
                .messageCount(0)
                .createdAt(now)
                .updatedAt(now)
                .build();

        jdbcTemplate.update("""
                        INSERT INTO conversations (conversation_id, user_id, title, language, summary, message_count, created_at, updated_at)
                        VALUES (:conversationId, :userId, :title, :language, NULL, 0, :createdAt, :updatedAt)
                        """,
                new MapSqlParameterSource()
                        .addValue("conversationId", entity.getConversationId())
                        .addValue("userId", userId)
                        .addValue("title", title)
                        .addValue("language", language)
                        .addValue("createdAt", Timestamp.from(now))
                        .addValue("updatedAt", Timestamp.from(now)));
        log.debug("Database conversation created userId={} conversationId={}", userId, entity.getConversationId());
        return entity;
    }

    @Override
    public Optional<ConversationEntity> get(String conversationId) {
        List<ConversationEntity> rows = jdbcTemplate.query(
                CONVERSATION_SELECT + " WHERE conversation_id = :conversationId",
                new MapSqlParameterSource("conversationId", conversationId),
                new ConversationRowMapper());
        return rows.stream().findFirst();
    }

    @Override
    public List<ConversationEntity> listByUser(String userId, int limit) {
        return jdbcTemplate.query(
                CONVERSATION_SELECT + """
                        WHERE user_id = :userId
                        ORDER BY updated_at DESC
                        LIMIT :limit
                        """,
                new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("limit", Math.max(0, limit)),
                new ConversationRowMapper());
    }

    @Override
    public void update(String conversationId, ConversationUpdate update) {
        List<String> assignments = new ArrayList<>();
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("conversationId", conversationId)
                .addValue("updatedAt", Timestamp.from(Instant.now()));

        if (update.getTitle() != null) {
            assignments.add("title = :title");
            params.addValue("title", update.getTitle());
        }
        if (update.getLanguage() != null) {
            assignments.add("language = :language");
            params.addValue("language", update.getLanguage());
        }
        if (update.getSummary() != null) {
            assignments.add("summary = :summary");
            params.addValue("summary", update.getSummary());
        }
        if (update.getMessageCount() != null) {
            assignments.add("message_count = :messageCount");
            params.addValue("messageCount", update.getMessageCount());
        }
        assignments.add("updated_at = :updatedAt");

        int updated = jdbcTemplate.update(
                "UPDATE conversations SET " + String.join(", ", assignments) + " WHERE conversation_id = :conversationId",
                params);
        log.debug("Database conversation update conversationId={} rows={} update={}", conversationId, updated, update);
    }

    @Override
    public void delete(String conversationId) {
        MapSqlParameterSource params = new MapSqlParameterSource("conversationId", conversationId);
        int messages = jdbcTemplate.update("DELETE FROM conversation_messages WHERE conversation_id = :conversationId", params);
        int conversations = jdbcTemplate.update("DELETE FROM conversations WHERE conversation_id = :conversationId", params);
        log.debug("Database conversation deleted conversationId={} found={} removedMessages={}",
                conversationId, conversations > 0, messages);
    }

    @Override
    public MessageEntity appendMessage(String conversationId,
                                       String role,
                                       String content,
                                       @Nullable List<Map<String, Object>> toolCalls,
                                       @Nullable Map<String, Object> metadata) {
        MessageEntity entity = MessageEntity.builder()
                .conversationId(conversationId)
                .messageKey(keyGenerator.nextMessageKey())
                .messageId(keyGenerator.newMessageId())
                .role(role)
                .content(content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : toolCalls)
                .metadata(metadata == null || metadata.isEmpty() ? null : metadata)
                .build();

        jdbcTemplate.update("""
                        INSERT INTO conversation_messages (conversation_id, message_key, message_id, role, content, tool_calls, metadata)
                        VALUES (:conversationId, :messageKey, :messageId, :role, :content, :toolCalls, :metadata)
                        """,
                new MapSqlParameterSource()
                        .addValue("conversationId", conversationId)
                        .addValue("messageKey", entity.getMessageKey())
                        .addValue("messageId", entity.getMessageId())
                        .addValue("role", role)
                        .addValue("content", content)
                        .addValue("toolCalls", writeJson(entity.getToolCalls()))
                        .addValue("metadata", writeJson(entity.getMetadata())));
        log.debug("Database message appended conversationId={} role={} messageKey={}",
                conversationId, role, entity.getMessageKey());
        return entity;
    }

    @Override
    public List<MessageEntity> listMessages(String conversationId, int limit, boolean ascending) {
        List<MessageEntity> newestFirst = jdbcTemplate.query(
                MESSAGE_SELECT + """
                        WHERE conversation_id = :conversationId
                        ORDER BY message_key DESC
                        LIMIT :limit
                        """,
                new MapSqlParameterSource()
                        .addValue("conversationId", conversationId)
                        .addValue("limit", Math.max(0, limit)),
                new MessageRowMapper());
        if (ascending) {
            Collections.reverse(newestFirst);
        }
        return newestFirst;
    }

    @Override
    public int countMessages(String conversationId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM conversation_messages WHERE conversation_id = :conversationId",
                new MapSqlParameterSource("conversationId", conversationId),
                Integer.class);
        return count == null ? 0 : count;
    }

    @Override
    public Optional<String> getUserFacts(String userId) {
        List<String> facts = jdbcTemplate.query(
                "SELECT facts FROM user_memory WHERE user_id = :userId",
                new MapSqlParameterSource("userId", userId),
                (rs, rowNum) -> rs.getString("facts"));
        return facts.stream().findFirst();
    }

    @Override
    public void putUserFacts(String userId, String facts) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("userId", userId)
                .addValue("facts", facts)
                .addValue("updatedAt", Timestamp.from(Instant.now()));

        // portable upsert: H2 and MySQL disagree on MERGE syntax
        int updated = jdbcTemplate.update(
                "UPDATE user_memory SET facts = :facts, updated_at = :updatedAt WHERE user_id = :userId", params);
        if (updated == 0) {
            jdbcTemplate.update(
                    "INSERT INTO user_memory (user_id, facts, updated_at) VALUES (:userId, :facts, :updatedAt)", params);
        }
        log.debug("Database durable facts replaced userId={} length={}", userId, facts.length());
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Message payload is not serializable", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type, String messageKey) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize message payload messageKey={}", messageKey, e);
            return null;
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private static class ConversationRowMapper implements RowMapper<ConversationEntity> {
        @Override
        public ConversationEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            return ConversationEntity.builder()
                    .conversationId(rs.getString("conversation_id"))
                    .userId(rs.getString("user_id"))
                    .title(rs.getString("title"))
                    .language(rs.getString("language"))
                    .summary(rs.getString("summary"))
                    .messageCount(rs.getInt("message_count"))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }

    private class MessageRowMapper implements RowMapper<MessageEntity> {
        @Override
        public MessageEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            String messageKey = rs.getString("message_key");
            return MessageEntity.builder()
                    .conversationId(rs.getString("conversation_id"))
                    .messageKey(messageKey)
                    .messageId(rs.getString("message_id"))
                    .role(rs.getString("role"))
                    .content(rs.getString("content"))
                    .toolCalls(readJson(rs.getString("tool_calls"), TOOL_CALLS_TYPE, messageKey))
                    .metadata(readJson(rs.getString("metadata"), MAP_TYPE, messageKey))
                    .build();
        }
    }
}
