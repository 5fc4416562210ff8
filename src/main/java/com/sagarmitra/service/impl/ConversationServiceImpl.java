package com.sagarmitra.service.impl;

import com.sagarmitra.service.ConversationService;
import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.exception.ConversationAccessDeniedException;
import com.sagarmitra.service.exception.ConversationNotFoundException;
import com.sagarmitra.service.impl.dto.ConversationHistory;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationServiceImpl implements ConversationService {

    static final String DEFAULT_LANGUAGE = "en";

    private final ConversationStore store;

    @Override
    public Mono<ConversationEntity> create(String userId, @Nullable String title, @Nullable String language) {
        String resolvedTitle = StringUtils.hasText(title) ? title.trim() : ConversationEntity.DEFAULT_TITLE;
        String resolvedLanguage = normalizeLanguage(language).orElse(DEFAULT_LANGUAGE);
        return StoreCalls.call("create conversation", () -> store.create(userId, resolvedTitle, resolvedLanguage))
                .doOnSuccess(created -> log.info("Conversation created userId={} conversationId={} language={}",
                        userId, created.getConversationId(), resolvedLanguage));
    }

    @Override
    public Mono<List<ConversationEntity>> list(String userId, int limit) {
        return StoreCalls.call("list conversations", () -> store.listByUser(userId, Math.max(1, limit)));
    }

    @Override
    public Mono<ConversationEntity> requireOwned(String userId, String conversationId) {
        return StoreCalls.call("load conversation", () -> store.get(conversationId))
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Mono.error(new ConversationNotFoundException(conversationId));
                    }
                    ConversationEntity conversation = found.get();
                    if (!conversation.getUserId().equals(userId)) {
                        log.warn("Conversation access denied userId={} conversationId={}", userId, conversationId);
                        return Mono.error(new ConversationAccessDeniedException(conversationId, userId));
                    }
                    return Mono.just(conversation);
                });
    }

    @Override
    public Mono<ConversationEntity> update(String userId,
                                           String conversationId,
                                           @Nullable String title,
                                           @Nullable String language) {
        ConversationUpdate update = ConversationUpdate.builder()
                .title(StringUtils.hasText(title) ? title.trim() : null)
                .language(normalizeLanguage(language).orElse(null))
                .build();
        return requireOwned(userId, conversationId)
                .flatMap(owned -> update.isEmpty()
                        ? Mono.just(owned)
                        : StoreCalls.run("update conversation", () -> store.update(conversationId, update))
                        .then(requireOwned(userId, conversationId)));
    }

    @Override
    public Mono<Void> delete(String userId, String conversationId) {
        return requireOwned(userId, conversationId)
                .flatMap(owned -> StoreCalls.run("delete conversation", () -> store.delete(conversationId)))
                .doOnSuccess(unused -> log.info("Conversation deleted userId={} conversationId={}", userId, conversationId));
    }

    @Override
    public Mono<ConversationHistory> history(String userId, String conversationId, int limit) {
        return requireOwned(userId, conversationId)
                .flatMap(owned -> StoreCalls.call("list messages",
                                () -> store.listMessages(conversationId, Math.max(1, limit), true))
                        .map(messages -> new ConversationHistory(messages, owned.getSummary())));
    }

    private static Optional<String> normalizeLanguage(@Nullable String language) {
        if (!StringUtils.hasText(language)) {
            return Optional.empty();
        }
        return Optional.of(language.trim().toLowerCase(Locale.ROOT));
    }
}
