package com.sagarmitra.service.impl;

import com.sagarmitra.ai.SpringAiChatGateway;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.ConversationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Keeps the per-user durable fact list current. The model is asked for the complete merged list,
 * old facts plus any new ones, or the existing list unchanged, and its answer replaces the
 * stored blob. Feeding the same exchange twice therefore leaves the blob as it was.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LongTermMemoryService {

    static final String NO_FACTS = "No facts recorded yet.";

    private final ConversationStore store;
    private final SpringAiChatGateway gateway;
    private final AgentProperties properties;

    /**
     * Completes empty in every case; failures are logged and dropped.
     */
    public Mono<Void> update(String userId, String userMessage, String assistantResponse) {
        if (!StringUtils.hasText(assistantResponse)) {
            return Mono.empty();
        }
        return StoreCalls.call("load user facts", () -> store.getUserFacts(userId))
                .map(existing -> existing.filter(StringUtils::hasText).orElse(NO_FACTS))
                .flatMap(existing -> gateway.complete(extractionPrompt(existing, userMessage, assistantResponse))
                        .timeout(Duration.ofMillis(Math.max(properties.getClient().getTimeoutMs(), 1000))))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .flatMap(updated -> StoreCalls.run("store user facts", () -> store.putUserFacts(userId, updated)))
                .doOnSuccess(unused -> log.debug("Long-term memory update finished userId={}", userId))
                .onErrorResume(ex -> {
                    log.warn("Long-term memory update failed userId={}", userId, ex);
                    return Mono.empty();
                });
    }

    String extractionPrompt(String existingFacts, String userMessage, String assistantResponse) {
        return "You are a memory extraction system. Given the EXISTING facts about a fisherman user "
                + "and their LATEST conversation exchange, determine if there are any NEW permanent facts "
                + "worth remembering (e.g. home port, boat type, preferred fish, family details, experience).\n\n"
                + "EXISTING FACTS:\n" + existingFacts + "\n\n"
                + "USER MESSAGE:\n" + userMessage + "\n\n"
                + "ASSISTANT RESPONSE:\n" + assistantResponse + "\n\n"
                + "If there are new facts, output the COMPLETE updated fact list (merge old + new). "
                + "If nothing new, output the existing facts unchanged. "
                + "Keep the format as a simple bullet list. Be concise.\n\n"
                + "UPDATED FACTS:";
    }
}
