package com.sagarmitra.service;

import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import com.sagarmitra.service.impl.entity.MessageEntity;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversations, their append-only message logs and per-user durable facts.
 */
public interface ConversationStore {

    ConversationEntity create(String userId, String title, String language);

    Optional<ConversationEntity> get(String conversationId);

    /** Conversations owned by {@code userId}, most recently updated first. */
    List<ConversationEntity> listByUser(String userId, int limit);

    void update(String conversationId, ConversationUpdate update);

    /** Removes the conversation together with all of its messages. */
    void delete(String conversationId);

    MessageEntity appendMessage(String conversationId,
                                String role,
                                String content,
                                @Nullable List<Map<String, Object>> toolCalls,
                                @Nullable Map<String, Object> metadata);

    /**
     * Most recent {@code limit} messages of the conversation, returned oldest-first when
     * {@code ascending} and newest-first otherwise.
     */
    List<MessageEntity> listMessages(String conversationId, int limit, boolean ascending);

    int countMessages(String conversationId);

    Optional<String> getUserFacts(String userId);

    void putUserFacts(String userId, String facts);
}
