package com.sagarmitra.service.impl;

import com.sagarmitra.ai.SpringAiChatGateway;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.language.LanguageGuard;
import com.sagarmitra.language.LanguageVerdict;
import com.sagarmitra.language.SupportedLanguage;
import com.sagarmitra.service.AgentService;
import com.sagarmitra.service.ConversationService;
import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.impl.dto.AgentMessage;
import com.sagarmitra.service.impl.dto.AgentTurnState;
import com.sagarmitra.service.impl.dto.ToolCallSummary;
import com.sagarmitra.service.impl.dto.ToolOutput;
import com.sagarmitra.service.impl.dto.TurnResult;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.ConversationUpdate;
import com.sagarmitra.service.impl.entity.MessageEntity;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.AgentToolExecutor;
import com.sagarmitra.tools.ToolExecutionResult;
import com.sagarmitra.tools.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turn state machine:
 * <pre>
 * LANGUAGE_GUARD -rejected-> terminal
 *       | accepted
 * LOAD_CONTEXT -> AGENT_INVOKE <-> TOOL_EXECUTOR
 *                      | no tool calls
 *                MEMORY_UPDATE -> terminal
 * </pre>
 * The model never sees a rejected turn. A failed model call degrades to a keyword-routed canned
 * reply, tool failures become text results, and the memory update cannot affect the reply.
 * Only store failures end a turn with an error.
 */
@Service
@Slf4j
public class AgentServiceImpl implements AgentService {

    static final String USER_ROLE = "user";
    static final String ASSISTANT_ROLE = "assistant";
    /** Assistant message metadata entry holding the truncated tool outputs of the turn. */
    static final String TOOL_OUTPUTS_KEY = "toolOutputs";

    private static final int TITLE_MAX_CHARS = 60;

    private final ConversationService conversationService;
    private final ConversationStore store;
    private final LanguageGuard languageGuard;
    private final ConversationContextService contextService;
    private final LongTermMemoryService memoryService;
    private final SpringAiChatGateway chatGateway;
    private final ToolRegistry toolRegistry;
    private final AgentToolExecutor toolExecutor;
    private final SystemPromptBuilder promptBuilder;
    private final FallbackResponder fallbackResponder;
    private final AgentProperties properties;

    public AgentServiceImpl(ConversationService conversationService,
                            ConversationStore store,
                            LanguageGuard languageGuard,
                            ConversationContextService contextService,
                            LongTermMemoryService memoryService,
                            SpringAiChatGateway chatGateway,
                            ToolRegistry toolRegistry,
                            AgentToolExecutor toolExecutor,
                            SystemPromptBuilder promptBuilder,
                            FallbackResponder fallbackResponder,
                            AgentProperties properties) {
        this.conversationService = conversationService;
        this.store = store;
        this.languageGuard = languageGuard;
        this.contextService = contextService;
        this.memoryService = memoryService;
        this.chatGateway = chatGateway;
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
        this.promptBuilder = promptBuilder;
        this.fallbackResponder = fallbackResponder;
        this.properties = properties;
        log.info("Agent service initialized with mode={} model={} tools={} maxLoops={}",
                properties.getMode(), properties.getModel(),
                toolRegistry.tools().stream().map(AgentTool::name).toList(),
                properties.getTools().getMaxLoops());
    }

    @Override
    public Mono<TurnResult> processTurn(String userId,
                                        String conversationId,
                                        @Nullable String language,
                                        String humanText) {
        log.debug("processTurn invoked userId={} conversationId={} languageOverride={} inputLength={}",
                userId, conversationId, language, humanText != null ? humanText.length() : 0);
        String input = humanText == null ? "" : humanText;

        return conversationService.requireOwned(userId, conversationId)
                .flatMap(conversation -> {
                    AgentTurnState state = new AgentTurnState(userId, conversationId,
                            resolveLanguage(language, conversation), input);
                    return runMachine(state).flatMap(done -> recordTurn(conversation, done));
                })
                .doOnSuccess(result -> log.debug("processTurn completed userId={} conversationId={} rejected={} toolCalls={} responseLength={}",
                        userId, conversationId, result.isLanguageRejected(), result.getToolCallsUsed().size(),
                        result.getResponseText().length()))
                .doOnError(error -> log.error("processTurn failed userId={} conversationId={}",
                        userId, conversationId, error));
    }

    private Mono<AgentTurnState> runMachine(AgentTurnState state) {
        if (!languageGuardStage(state)) {
            return Mono.just(state);
        }
        return loadContextStage(state)
                .flatMap(this::agentLoop)
                .flatMap(this::memoryUpdateStage);
    }

    boolean languageGuardStage(AgentTurnState state) {
        LanguageVerdict verdict = languageGuard.validate(state.getHumanInput(), state.getSelectedLanguage());
        state.setLanguageAccepted(verdict.accepted());
        if (!verdict.accepted()) {
            String refusal = SupportedLanguage.rejectionMessageFor(state.getSelectedLanguage());
            state.setLanguageRejection(StringUtils.hasText(verdict.reason())
                    ? verdict.reason() + "\n\n" + refusal
                    : refusal);
            log.info("Turn rejected by language guard conversationId={} language={}",
                    state.getConversationId(), state.getSelectedLanguage());
        }
        return verdict.accepted();
    }

    private Mono<AgentTurnState> loadContextStage(AgentTurnState state) {
        return contextService.build(state.getConversationId())
                .zipWith(contextService.durableFacts(state.getUserId()))
                .flatMap(loaded -> {
                    String systemPrompt = promptBuilder.build(
                            state.getSelectedLanguage(),
                            loaded.getT1().summary(),
                            loaded.getT2().orElse(null),
                            toolRegistry.tools());
                    state.getMessages().add(AgentMessage.system(systemPrompt));
                    state.getMessages().addAll(loaded.getT1().recentMessages());
                    state.getMessages().add(AgentMessage.user(state.getHumanInput()));
                    log.debug("[LOAD_CONTEXT] conversationId={} history={} summary={} facts={}",
                            state.getConversationId(), loaded.getT1().recentMessages().size(),
                            loaded.getT1().summary() != null, loaded.getT2().isPresent());
                    // persisted only now, so the new input is not also part of the verbatim history
                    return appendMessage(state.getConversationId(), USER_ROLE, state.getHumanInput(), null, null)
                            .thenReturn(state);
                });
    }

    private Mono<AgentTurnState> agentLoop(AgentTurnState state) {
        return agentInvokeStage(state).flatMap(current -> {
            AgentMessage last = current.lastMessage();
            if (last == null || !last.hasToolCalls()) {
                String text = last != null ? last.content() : "";
                current.setFinalAnswer(StringUtils.hasText(text) ? text : fallbackResponder.emptyResponse());
                return Mono.just(current);
            }
            int maxLoops = Math.max(1, properties.getTools().getMaxLoops());
            if (current.getToolRounds() >= maxLoops) {
                log.warn("Reached max tool loops {} conversationId={}; model still requested {} tool call(s)",
                        maxLoops, current.getConversationId(), last.toolCalls().size());
                current.setFinalAnswer(fallbackResponder.incomplete(current.getSelectedLanguage()));
                return Mono.just(current);
            }
            return toolExecutorStage(current).flatMap(this::agentLoop);
        });
    }

    private Mono<AgentTurnState> agentInvokeStage(AgentTurnState state) {
        List<AgentMessage> snapshot = List.copyOf(state.getMessages());
        return Mono.defer(() -> chatGateway.invoke(snapshot, toolRegistry))
                .timeout(requestTimeout())
                .retryWhen(retrySpec())
                .onErrorResume(ex -> {
                    log.warn("Model call failed conversationId={} round={}, using canned reply",
                            state.getConversationId(), state.getToolRounds(), ex);
                    return Mono.just(AgentMessage.assistant(
                            fallbackResponder.reply(state.getHumanInput(), state.getSelectedLanguage())));
                })
                .map(reply -> {
                    state.getMessages().add(reply);
                    reply.toolCalls().forEach(call -> state.getToolCallsUsed().add(ToolCallSummary.of(call)));
                    log.debug("[AGENT_INVOKE] conversationId={} round={} toolCalls={}",
                            state.getConversationId(), state.getToolRounds(), reply.toolCalls().size());
                    return state;
                });
    }

    private Mono<AgentTurnState> toolExecutorStage(AgentTurnState state) {
        int previewChars = Math.max(1, properties.getTools().getOutputPreviewChars());
        return toolExecutor.executeRound(state.getUserId(), state.lastMessage().toolCalls())
                .map(results -> {
                    for (ToolExecutionResult result : results) {
                        state.getMessages().add(AgentMessage.toolResult(result.callId(), result.name(), result.content()));
                        state.getToolOutputs().add(new ToolOutput(result.name(), result.args(),
                                truncate(result.content(), previewChars)));
                    }
                    state.setToolRounds(state.getToolRounds() + 1);
                    log.debug("[TOOL_EXECUTOR] conversationId={} round={} results={}",
                            state.getConversationId(), state.getToolRounds(), results.size());
                    return state;
                });
    }

    private Mono<AgentTurnState> memoryUpdateStage(AgentTurnState state) {
        Mono<Void> update = memoryService.update(state.getUserId(), state.getHumanInput(), state.getFinalAnswer());
        if (properties.getMemory().isAwaitUpdate()) {
            return update.thenReturn(state);
        }
        update.subscribe(
                unused -> {
                },
                error -> log.warn("Detached memory update failed userId={}", state.getUserId(), error));
        return Mono.just(state);
    }

    private Mono<TurnResult> recordTurn(ConversationEntity conversation, AgentTurnState state) {
        String conversationId = conversation.getConversationId();
        Mono<Void> userMessage = state.isLanguageAccepted()
                ? Mono.empty()
                : appendMessage(conversationId, USER_ROLE, state.getHumanInput(), null, null).then();
        String responseText = state.isLanguageAccepted() ? state.getFinalAnswer() : state.getLanguageRejection();
        List<Map<String, Object>> toolRecord = state.getToolCallsUsed().stream()
                .map(ToolCallSummary::toRecord)
                .toList();

        Map<String, Object> metadata = state.getToolOutputs().isEmpty()
                ? null
                : Map.of(TOOL_OUTPUTS_KEY, state.getToolOutputs().stream().map(ToolOutput::toRecord).toList());

        return userMessage
                .then(appendMessage(conversationId, ASSISTANT_ROLE, responseText,
                        toolRecord.isEmpty() ? null : toolRecord, metadata))
                .flatMap(saved -> StoreCalls.run("update conversation", () -> store.update(conversationId,
                                ConversationUpdate.builder()
                                        .messageCount(conversation.getMessageCount() + 2)
                                        // a rejected message never names the conversation
                                        .title(state.isLanguageAccepted()
                                                ? autoTitle(conversation, state.getHumanInput())
                                                : null)
                                        .build()))
                        .then(state.isLanguageAccepted() ? resummarize(conversationId) : Mono.<Void>empty())
                        .thenReturn(TurnResult.builder()
                                .responseText(responseText)
                                .languageRejected(!state.isLanguageAccepted())
                                .toolCallsUsed(List.copyOf(state.getToolCallsUsed()))
                                .messageId(saved.getMessageId())
                                .build()));
    }

    private Mono<Void> resummarize(String conversationId) {
        if (!properties.getMemory().isResummarizeAfterTurn()) {
            return Mono.empty();
        }
        return contextService.refreshSummary(conversationId)
                .onErrorResume(ex -> {
                    log.warn("Opportunistic summary refresh failed conversationId={}", conversationId, ex);
                    return Mono.empty();
                });
    }

    private Mono<MessageEntity> appendMessage(String conversationId,
                                              String role,
                                              String content,
                                              @Nullable List<Map<String, Object>> toolCalls,
                                              @Nullable Map<String, Object> metadata) {
        return StoreCalls.call("append " + role + " message",
                () -> store.appendMessage(conversationId, role, content, toolCalls, metadata));
    }

    static String resolveLanguage(@Nullable String override, ConversationEntity conversation) {
        if (StringUtils.hasText(override)) {
            return override.trim().toLowerCase(Locale.ROOT);
        }
        return StringUtils.hasText(conversation.getLanguage())
                ? conversation.getLanguage()
                : ConversationServiceImpl.DEFAULT_LANGUAGE;
    }

    /** New title from the first message while the conversation still has the default one, else null. */
    static String autoTitle(ConversationEntity conversation, String humanInput) {
        if (!ConversationEntity.DEFAULT_TITLE.equals(conversation.getTitle()) || !StringUtils.hasText(humanInput)) {
            return null;
        }
        if (humanInput.codePointCount(0, humanInput.length()) <= TITLE_MAX_CHARS) {
            return humanInput;
        }
        return humanInput.substring(0, humanInput.offsetByCodePoints(0, TITLE_MAX_CHARS)) + "…";
    }

    private Retry retrySpec() {
        int retries = Math.max(properties.getClient().getRetry().getMaxRetries(), 0);
        Duration backoff = Duration.ofMillis(Math.max(properties.getClient().getRetry().getBackoffMs(), 100));
        return Retry.backoff(retries, backoff)
                .filter(this::isRetryableError);
    }

    private boolean isRetryableError(Throwable throwable) {
        return !(throwable instanceof IllegalArgumentException);
    }

    private Duration requestTimeout() {
        return Duration.ofMillis(Math.max(properties.getClient().getTimeoutMs(), 1000));
    }

    private static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max);
    }
}
