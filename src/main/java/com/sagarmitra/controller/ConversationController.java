package com.sagarmitra.controller;

import com.sagarmitra.service.AgentService;
import com.sagarmitra.service.ConversationService;
import com.sagarmitra.service.impl.dto.ApiResponse;
import com.sagarmitra.service.impl.dto.ConversationHistory;
import com.sagarmitra.service.impl.dto.CreateConversationRequest;
import com.sagarmitra.service.impl.dto.SendMessageRequest;
import com.sagarmitra.service.impl.dto.TurnResult;
import com.sagarmitra.service.impl.dto.UpdateConversationRequest;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Conversations and turns. The caller is identified by the {@value #USER_HEADER} header;
 * authentication happens upstream.
 */
@Tag(name = "Conversations")
@RestController
@RequestMapping("/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationController {

    static final String USER_HEADER = "X-User-Id";

    private final ConversationService conversationService;
    private final AgentService agentService;

    @Operation(summary = "Create a conversation")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<ConversationEntity>> create(@RequestHeader(USER_HEADER) String userId,
                                                        @Valid @RequestBody(required = false) CreateConversationRequest request) {
        CreateConversationRequest body = request != null ? request : new CreateConversationRequest(null, null);
        log.debug("Handling create conversation userId={} language={}", userId, body.language());
        return conversationService.create(userId, body.title(), body.language())
                .map(ApiResponse::ok);
    }

    @Operation(summary = "List the caller's conversations", description = "Most recently updated first.")
    @GetMapping
    public Mono<ApiResponse<List<ConversationEntity>>> list(@RequestHeader(USER_HEADER) String userId,
                                                            @RequestParam(value = "limit", defaultValue = "20") int limit) {
        log.debug("Handling list conversations userId={} limit={}", userId, limit);
        return conversationService.list(userId, limit)
                .map(ApiResponse::ok);
    }

    @Operation(summary = "Get a conversation")
    @GetMapping("/{conversationId}")
    public Mono<ApiResponse<ConversationEntity>> get(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable("conversationId") String conversationId) {
        return conversationService.requireOwned(userId, conversationId)
                .map(ApiResponse::ok);
    }

    @Operation(summary = "Rename a conversation or change its language")
    @PatchMapping("/{conversationId}")
    public Mono<ApiResponse<ConversationEntity>> update(@RequestHeader(USER_HEADER) String userId,
                                                        @PathVariable("conversationId") String conversationId,
                                                        @Valid @RequestBody UpdateConversationRequest request) {
        log.debug("Handling update conversation userId={} conversationId={}", userId, conversationId);
        return conversationService.update(userId, conversationId, request.title(), request.language())
                .map(ApiResponse::ok);
    }

    @Operation(summary = "Delete a conversation and all of its messages")
    @DeleteMapping("/{conversationId}")
    public Mono<ApiResponse<String>> delete(@RequestHeader(USER_HEADER) String userId,
                                            @PathVariable("conversationId") String conversationId) {
        log.debug("Handling delete conversation userId={} conversationId={}", userId, conversationId);
        return conversationService.delete(userId, conversationId)
                .thenReturn(ApiResponse.ok(conversationId));
    }

    @Operation(summary = "Send a message", description = "Runs one agent turn and returns the assistant reply.")
    @PostMapping("/{conversationId}/messages")
    public Mono<ApiResponse<TurnResult>> sendMessage(@RequestHeader(USER_HEADER) String userId,
                                                     @PathVariable("conversationId") String conversationId,
                                                     @Valid @RequestBody SendMessageRequest request) {
        log.debug("Handling send message userId={} conversationId={} languageOverride={}",
                userId, conversationId, request.language());
        return agentService.processTurn(userId, conversationId, request.language(), request.message())
                .map(ApiResponse::ok)
                .doOnError(error -> log.error("Send message failed userId={} conversationId={}",
                        userId, conversationId, error));
    }

    @Operation(summary = "Message history", description = "Latest messages, oldest first, with the rolling summary.")
    @GetMapping("/{conversationId}/messages")
    public Mono<ApiResponse<ConversationHistory>> history(@RequestHeader(USER_HEADER) String userId,
                                                          @PathVariable("conversationId") String conversationId,
                                                          @Parameter(description = "Maximum messages to return")
                                                          @RequestParam(value = "limit", defaultValue = "50") int limit) {
        return conversationService.history(userId, conversationId, limit)
                .map(ApiResponse::ok);
    }
}
