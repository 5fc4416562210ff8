package com.sagarmitra.service;

import com.sagarmitra.service.impl.dto.ConversationHistory;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Conversation management on behalf of a user. Every operation on an existing conversation
 * checks that {@code userId} owns it.
 */
public interface ConversationService {

    Mono<ConversationEntity> create(String userId, @Nullable String title, @Nullable String language);

    Mono<List<ConversationEntity>> list(String userId, int limit);

    Mono<ConversationEntity> requireOwned(String userId, String conversationId);

    Mono<ConversationEntity> update(String userId, String conversationId, @Nullable String title, @Nullable String language);

    Mono<Void> delete(String userId, String conversationId);

    Mono<ConversationHistory> history(String userId, String conversationId, int limit);
}
