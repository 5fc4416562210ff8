package com.sagarmitra.service.impl;

import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import com.sagarmitra.service.impl.entity.MessageEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@ConditionalOnProperty(name = "agent.store.type", havingValue = "in-memory", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InMemoryConversationStore implements ConversationStore {

    private final Map<String, ConversationEntity> conversations = new ConcurrentHashMap<>();
    private final Map<String, List<MessageEntity>> messages = new ConcurrentHashMap<>();
    private final Map<String, String> userFacts = new ConcurrentHashMap<>();

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
        conversations.put(entity.getConversationId(), entity);
        log.debug("Created conversation userId={} conversationId={}", userId, entity.getConversationId());
        return entity.toBuilder().build();
    }

    @Override
    public Optional<ConversationEntity> get(String conversationId) {
        ConversationEntity entity = conversations.get(conversationId);
        return entity == null ? Optional.empty() : Optional.of(entity.toBuilder().build());
    }

    @Override
    public List<ConversationEntity> listByUser(String userId, int limit) {
        return conversations.values().stream()
                .filter(entity -> userId.equals(entity.getUserId()))
                .sorted(Comparator.comparing(ConversationEntity::getUpdatedAt).reversed())
                .limit(Math.max(0, limit))
                .map(entity -> entity.toBuilder().build())
                .toList();
    }

    @Override
    public void update(String conversationId, ConversationUpdate update) {
        conversations.computeIfPresent(conversationId, (id, existing) -> {
            ConversationEntity.ConversationEntityBuilder builder = existing.toBuilder().updatedAt(Instant.now());
            if (update.getTitle() != null) {
                builder.title(update.getTitle());
            }
            if (update.getLanguage() != null) {
                builder.language(update.getLanguage());
            }
            if (update.getSummary() != null) {
                builder.summary(update.getSummary());
            }
            if (update.getMessageCount() != null) {
                builder.messageCount(update.getMessageCount());
            }
            log.debug("Updated conversation conversationId={} update={}", conversationId, update);
            return builder.build();
        });
    }

    @Override
    public void delete(String conversationId) {
        ConversationEntity removed = conversations.remove(conversationId);
        List<MessageEntity> removedMessages = messages.remove(conversationId);
        log.debug("Deleted conversation conversationId={} found={} removedMessages={}",
                conversationId, removed != null, removedMessages == null ? 0 : removedMessages.size());
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
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : new ArrayList<>(toolCalls))
                .metadata(metadata == null || metadata.isEmpty() ? null : new LinkedHashMap<>(metadata))
                .build();
        messages.compute(conversationId, (id, existing) -> {
            List<MessageEntity> target = existing == null ? new ArrayList<>() : new ArrayList<>(existing);
            target.add(entity);
            target.sort(Comparator.comparing(MessageEntity::getMessageKey));
            log.debug("Appended message conversationId={} role={} -> total={}", conversationId, role, target.size());
            return target;
        });
        return entity;
    }

    @Override
    public List<MessageEntity> listMessages(String conversationId, int limit, boolean ascending) {
        List<MessageEntity> history = messages.getOrDefault(conversationId, Collections.emptyList());
        int start = Math.max(0, history.size() - Math.max(0, limit));
        List<MessageEntity> window = new ArrayList<>(history.subList(start, history.size()));
        if (!ascending) {
            Collections.reverse(window);
        }
        return window;
    }

    @Override
    public int countMessages(String conversationId) {
        return messages.getOrDefault(conversationId, Collections.emptyList()).size();
    }

    @Override
    public Optional<String> getUserFacts(String userId) {
        return Optional.ofNullable(userFacts.get(userId));
    }

    @Override
    public void putUserFacts(String userId, String facts) {
        userFacts.put(userId, facts);
        log.debug("Replaced durable facts userId={} length={}", userId, facts.length());
    }
}
