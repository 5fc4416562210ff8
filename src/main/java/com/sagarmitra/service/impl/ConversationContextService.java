package com.sagarmitra.service.impl;

import com.sagarmitra.ai.SpringAiChatGateway;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.impl.dto.AgentMessage;
import com.sagarmitra.service.impl.dto.ConversationContext;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import com.sagarmitra.service.impl.entity.MessageEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the bounded context of a conversation: the trailing {@code shortTermLimit} messages
 * verbatim plus a rolling summary of everything older.
 *
 * <p>The summary is cached on the conversation record. {@link #build(String)} only generates
 * one when none is cached, so repeated builds over unchanged state never call the model twice;
 * {@link #refreshSummary(String)} re-derives it unconditionally once the log outgrows the window.
 * A failed summarisation yields {@link #SUMMARY_PLACEHOLDER}, which is stored and used like a
 * real summary. Store failures propagate.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextService {

    static final String SUMMARY_PLACEHOLDER = "(Summary unavailable — model not configured)";

    private final ConversationStore store;
    private final SpringAiChatGateway gateway;
    private final AgentProperties properties;

    public Mono<ConversationContext> build(String conversationId) {
        int window = shortTermLimit();
        return StoreCalls.call("load messages",
                        () -> store.listMessages(conversationId, properties.getMemory().getHistoryCap(), true))
                .zipWith(StoreCalls.call("load conversation", () -> store.get(conversationId)))
                .flatMap(loaded -> {
                    List<MessageEntity> all = loaded.getT1();
                    Optional<ConversationEntity> conversation = loaded.getT2();
                    int split = Math.max(0, all.size() - window);
                    List<AgentMessage> recent = toAgentMessages(all.subList(split, all.size()));

                    String cached = conversation.map(ConversationEntity::getSummary)
                            .filter(StringUtils::hasText)
                            .orElse(null);
                    if (cached != null) {
                        log.debug("Context built conversationId={} recent={} summary=cached", conversationId, recent.size());
                        return Mono.just(new ConversationContext(recent, cached));
                    }
                    if (split == 0) {
                        log.debug("Context built conversationId={} recent={} summary=none", conversationId, recent.size());
                        return Mono.just(new ConversationContext(recent, null));
                    }

                    List<MessageEntity> older = all.subList(0, split);
                    return summarize(conversationId, older)
                            .flatMap(summary -> (conversation.isPresent()
                                    ? persistSummary(conversationId, summary)
                                    : Mono.<Void>empty())
                                    .thenReturn(new ConversationContext(recent, summary)))
                            .doOnNext(context -> log.debug("Context built conversationId={} recent={} summary=generated older={}",
                                    conversationId, recent.size(), older.size()));
                });
    }

    public Mono<Optional<String>> durableFacts(String userId) {
        return StoreCalls.call("load user facts", () -> store.getUserFacts(userId))
                .map(facts -> facts.filter(StringUtils::hasText));
    }

    /**
     * Re-derives and stores the summary whenever the conversation holds more messages than the
     * short-term window, regardless of any cached summary.
     */
    public Mono<Void> refreshSummary(String conversationId) {
        int window = shortTermLimit();
        return StoreCalls.call("count messages", () -> store.countMessages(conversationId))
                .filter(total -> total > window)
                .flatMap(total -> StoreCalls.call("load messages",
                        () -> store.listMessages(conversationId, properties.getMemory().getHistoryCap(), true)))
                .map(all -> all.subList(0, Math.max(0, all.size() - window)))
                .filter(older -> !older.isEmpty())
                .flatMap(older -> summarize(conversationId, older))
                .flatMap(summary -> persistSummary(conversationId, summary))
                .doOnSuccess(unused -> log.debug("Summary refresh finished conversationId={}", conversationId));
    }

    Mono<String> summarize(String conversationId, List<MessageEntity> older) {
        return gateway.complete(summaryPrompt(older))
                .timeout(Duration.ofMillis(Math.max(properties.getClient().getTimeoutMs(), 1000)))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .switchIfEmpty(Mono.error(new IllegalStateException("model returned an empty summary")))
                .onErrorResume(ex -> {
                    log.warn("Summarisation failed conversationId={} messages={}, using placeholder",
                            conversationId, older.size(), ex);
                    return Mono.just(SUMMARY_PLACEHOLDER);
                });
    }

    String summaryPrompt(List<MessageEntity> older) {
        int lineChars = Math.max(1, properties.getMemory().getSummaryLineChars());
        String transcript = older.stream()
                .map(message -> (isUser(message.getRole()) ? "User" : "Assistant") + ": "
                        + truncate(message.getContent(), lineChars))
                .collect(Collectors.joining("\n"));
        return "Summarise the following conversation between a fisherman and an AI assistant. "
                + "Keep the summary under 200 words. Focus on: topics discussed, decisions made, "
                + "any specific data mentioned (species, locations, dates). Write in plain language.\n\n"
                + transcript + "\n\nSummary:";
    }

    private Mono<Void> persistSummary(String conversationId, String summary) {
        return StoreCalls.run("store summary",
                () -> store.update(conversationId, ConversationUpdate.builder().summary(summary).build()));
    }

    private List<AgentMessage> toAgentMessages(List<MessageEntity> messages) {
        List<AgentMessage> converted = new ArrayList<>(messages.size());
        for (MessageEntity message : messages) {
            String role = message.getRole() == null ? "" : message.getRole().toLowerCase(Locale.ROOT);
            String content = message.getContent() == null ? "" : message.getContent();
            switch (role) {
                case "user", "human" -> converted.add(AgentMessage.user(content));
                case "assistant", "ai" -> converted.add(AgentMessage.assistant(content));
                case "system" -> converted.add(AgentMessage.system(content));
                default -> log.trace("Skipping message role={} key={}", role, message.getMessageKey());
            }
        }
        return converted;
    }

    private int shortTermLimit() {
        return Math.max(1, properties.getMemory().getShortTermLimit());
    }

    private static boolean isUser(String role) {
        return "user".equalsIgnoreCase(role) || "human".equalsIgnoreCase(role);
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
