package com.sagarmitra.service;

import com.sagarmitra.service.impl.dto.TurnResult;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

public interface AgentService {

    /**
     * Runs one turn: language check, context assembly, the model and tool loop, persistence of
     * both messages and the best-effort long-term memory update.
     *
     * @param language overrides the conversation's language for this turn when not blank
     * @return the assistant reply; fails with a persistence error only when the store is unusable
     */
    Mono<TurnResult> processTurn(String userId, String conversationId, @Nullable String language, String humanText);
}
