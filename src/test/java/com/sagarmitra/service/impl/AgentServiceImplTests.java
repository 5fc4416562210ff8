package com.sagarmitra.service.impl;

import com.sagarmitra.ai.SpringAiChatGateway;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.language.LanguageGuard;
import com.sagarmitra.language.SupportedLanguage;
import com.sagarmitra.service.ConversationStore;
import com.sagarmitra.service.exception.ConversationAccessDeniedException;
import com.sagarmitra.service.exception.ConversationNotFoundException;
import com.sagarmitra.service.exception.ConversationPersistenceException;
import com.sagarmitra.service.impl.dto.AgentMessage;
import com.sagarmitra.service.impl.dto.ToolCall;
import com.sagarmitra.service.impl.dto.ToolCallSummary;
import com.sagarmitra.service.impl.dto.TurnResult;
import com.sagarmitra.service.impl.entity.ConversationEntity;
import com.sagarmitra.service.impl.entity.MessageEntity;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.AgentToolExecutor;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolRegistry;
import com.sagarmitra.tools.ToolResult;
import com.sagarmitra.tools.impl.MarketPricesTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentServiceImplTests {

    private static final String TAMIL_INPUT = "வணக்கம், இன்று வானிலை எப்படி?";

    private InMemoryConversationStore store;
    private SpringAiChatGateway gateway;
    private AgentProperties properties;
    private AgentServiceImpl service;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore(new MessageKeyGenerator());
        gateway = mock(SpringAiChatGateway.class);
        when(gateway.complete(anyString())).thenReturn(Mono.just("- Home port: Mumbai"));

        properties = new AgentProperties();
        properties.getMemory().setAwaitUpdate(true);
        properties.getClient().getRetry().setMaxRetries(0);
        properties.getTools().setMaxLoops(2);

        service = newService(store);
    }

    @Test
    void foreignScriptIsRejectedWithoutCallingTheModel() {
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "hi").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, TAMIL_INPUT).block();

        assertThat(result.isLanguageRejected()).isTrue();
        assertThat(result.getResponseText()).startsWith("Detected tamil script");
        assertThat(result.getResponseText()).endsWith("\n\n" + SupportedLanguage.HI.rejectionMessage());
        assertThat(result.getToolCallsUsed()).isEmpty();
        verify(gateway, never()).invoke(anyList(), any());
        verify(gateway, never()).complete(anyString());

        List<MessageEntity> stored = store.listMessages(conversationId, 10, true);
        assertThat(stored).extracting(MessageEntity::getRole).containsExactly("user", "assistant");
        assertThat(stored.get(0).getContent()).isEqualTo(TAMIL_INPUT);
        assertThat(stored.get(1).getMessageId()).isEqualTo(result.getMessageId());
        assertThat(store.get(conversationId).orElseThrow().getMessageCount()).isEqualTo(2);
    }

    @Test
    void unreachableModelFallsBackToKeywordRoutedReply() {
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.error(new IllegalStateException("connection refused")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "What's the weather like?").block();

        assertThat(result.isLanguageRejected()).isFalse();
        assertThat(result.getResponseText()).isEqualTo(new FallbackResponder().reply("weather", "en"));
        assertThat(result.getToolCallsUsed()).isEmpty();

        List<MessageEntity> stored = store.listMessages(conversationId, 10, true);
        assertThat(stored).extracting(MessageEntity::getContent)
                .containsExactly("What's the weather like?", result.getResponseText());
        assertThat(stored.get(1).getToolCalls()).isNull();
        assertThat(store.getUserFacts("u1")).contains("- Home port: Mumbai");
    }

    @Test
    void toolCallsAreExecutedAndFedBackToTheModel() {
        ToolCall call = new ToolCall("call-1", "get_market_prices", Map.of("port_name", "Mumbai"));
        when(gateway.invoke(anyList(), any())).thenReturn(
                Mono.just(AgentMessage.assistant("", List.of(call))),
                Mono.just(AgentMessage.assistant("Pomfret sells at ₹800/kg in Mumbai today.")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "Pomfret price in Mumbai?").block();

        assertThat(result.getResponseText()).isEqualTo("Pomfret sells at ₹800/kg in Mumbai today.");
        assertThat(result.getToolCallsUsed())
                .containsExactly(new ToolCallSummary("get_market_prices", Map.of("port_name", "Mumbai")));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AgentMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway, times(2)).invoke(captor.capture(), any());
        List<AgentMessage> firstRequest = captor.getAllValues().get(0);
        assertThat(firstRequest.get(0).role()).isEqualTo(AgentMessage.Role.SYSTEM);
        assertThat(firstRequest.get(0).content()).contains("SagarMitra").contains("get_market_prices");
        assertThat(firstRequest.get(firstRequest.size() - 1)).isEqualTo(AgentMessage.user("Pomfret price in Mumbai?"));

        List<AgentMessage> secondRequest = captor.getAllValues().get(1);
        AgentMessage toolMessage = secondRequest.get(secondRequest.size() - 1);
        assertThat(toolMessage.role()).isEqualTo(AgentMessage.Role.TOOL);
        assertThat(toolMessage.toolCallId()).isEqualTo("call-1");
        assertThat(toolMessage.content()).contains("**Fish Prices at Mumbai**");

        MessageEntity assistant = store.listMessages(conversationId, 1, false).get(0);
        assertThat(assistant.getToolCalls()).containsExactly(Map.of("name", "get_market_prices",
                "args", Map.of("port_name", "Mumbai")));
        assertThat(assistant.getMetadata()).containsKey(AgentServiceImpl.TOOL_OUTPUTS_KEY);
    }

    @Test
    void stopsAfterMaxToolRounds() {
        ToolCall call = new ToolCall("call-x", "get_market_prices", Map.of());
        when(gateway.invoke(anyList(), any())).thenAnswer(invocation -> Mono.just(AgentMessage.assistant("", List.of(call))));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "markets?").block();

        assertThat(result.getResponseText()).isEqualTo(new FallbackResponder().incomplete("en"));
        verify(gateway, times(3)).invoke(anyList(), any());
        assertThat(result.getToolCallsUsed()).hasSize(3);
    }

    @Test
    void blankModelReplyUsesEmptyResponseText() {
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("  ")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "hello there").block();

        assertThat(result.getResponseText()).isEqualTo(FallbackResponder.EMPTY_RESPONSE);
    }

    @Test
    void languageOverrideTakesPrecedenceOverConversationLanguage() {
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("சரி")));

        TurnResult result = service.processTurn("u1", conversationId, "TA", TAMIL_INPUT).block();

        assertThat(result.isLanguageRejected()).isFalse();
        assertThat(result.getResponseText()).isEqualTo("சரி");
    }

    @Test
    void firstMessageBecomesTitle() {
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("ok")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        service.processTurn("u1", conversationId, null, "Tuna season near Goa").block();
        service.processTurn("u1", conversationId, null, "And mackerel?").block();

        ConversationEntity conversation = store.get(conversationId).orElseThrow();
        assertThat(conversation.getTitle()).isEqualTo("Tuna season near Goa");
        assertThat(conversation.getMessageCount()).isEqualTo(4);
    }

    @Test
    void autoTitleTruncatesLongInputAndKeepsCustomTitles() {
        ConversationEntity fresh = ConversationEntity.builder().title(ConversationEntity.DEFAULT_TITLE).build();
        ConversationEntity named = ConversationEntity.builder().title("My trip").build();
        String longInput = "a".repeat(75);

        assertThat(AgentServiceImpl.autoTitle(fresh, longInput)).isEqualTo("a".repeat(60) + "…");
        assertThat(AgentServiceImpl.autoTitle(named, "anything")).isNull();
        assertThat(AgentServiceImpl.autoTitle(fresh, "  ")).isNull();
    }

    @Test
    void rejectedFirstMessageDoesNotBecomeTitle() {
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "hi").getConversationId();

        service.processTurn("u1", conversationId, null, TAMIL_INPUT).block();

        ConversationEntity conversation = store.get(conversationId).orElseThrow();
        assertThat(conversation.getTitle()).isEqualTo(ConversationEntity.DEFAULT_TITLE);
        assertThat(conversation.getMessageCount()).isEqualTo(2);
    }

    @Test
    void failingModelIsRetriedBeforeFallingBack() {
        properties.getClient().getRetry().setMaxRetries(2);
        properties.getClient().getRetry().setBackoffMs(100);
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.error(new IllegalStateException("503 from model")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "Fish price today?").block();

        assertThat(result.getResponseText()).isEqualTo(new FallbackResponder().reply("price", "en"));
        verify(gateway, times(3)).invoke(anyList(), any());
    }

    @Test
    void detachedMemoryFailureDoesNotAffectTheTurn() {
        properties.getMemory().setAwaitUpdate(false);
        store.putUserFacts("u1", "- Boat: Lakshmi");
        when(gateway.complete(anyString())).thenReturn(Mono.error(new IllegalStateException("quota exceeded")));
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("Seas are calm today.")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        TurnResult result = service.processTurn("u1", conversationId, null, "My home port is Kochi").block();

        assertThat(result.isLanguageRejected()).isFalse();
        assertThat(result.getResponseText()).isEqualTo("Seas are calm today.");
        verify(gateway, timeout(2_000)).complete(anyString());
        assertThat(store.getUserFacts("u1")).contains("- Boat: Lakshmi");
        assertThat(store.countMessages(conversationId)).isEqualTo(2);
    }

    @Test
    void storedToolOutputsAreTruncatedButTheModelSeesFullOutput() {
        String longOutput = "x".repeat(700);
        ToolCall call = new ToolCall("call-1", "get_map_data", Map.of("query", "harbour"));
        when(gateway.invoke(anyList(), any())).thenReturn(
                Mono.just(AgentMessage.assistant("", List.of(call))),
                Mono.just(AgentMessage.assistant("Three harbours nearby.")));
        AgentServiceImpl withLongTool = newService(store, new FixedOutputTool(ToolName.GET_MAP_DATA, longOutput));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        withLongTool.processTurn("u1", conversationId, null, "Harbours near me?").block();

        MessageEntity assistant = store.listMessages(conversationId, 1, false).get(0);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> outputs = (List<Map<String, Object>>) assistant.getMetadata()
                .get(AgentServiceImpl.TOOL_OUTPUTS_KEY);
        assertThat(outputs).hasSize(1);
        assertThat(outputs.get(0)).containsEntry("tool", "get_map_data")
                .containsEntry("args", Map.of("query", "harbour"));
        assertThat((String) outputs.get(0).get("result")).hasSize(500).isEqualTo("x".repeat(500));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AgentMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway, times(2)).invoke(captor.capture(), any());
        List<AgentMessage> secondRequest = captor.getAllValues().get(1);
        assertThat(secondRequest.get(secondRequest.size() - 1).content()).isEqualTo(longOutput);
    }

    @Test
    void summaryIsCachedOnceHistoryOutgrowsTheWindow() {
        properties.getMemory().setShortTermLimit(2);
        when(gateway.complete(startsWith("Summarise"))).thenReturn(Mono.just("Asked about tuna near Goa."));
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("ok")));
        String conversationId = store.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        service.processTurn("u1", conversationId, null, "Tuna near Goa?").block();
        assertThat(store.get(conversationId).orElseThrow().getSummary()).isNull();

        service.processTurn("u1", conversationId, null, "Best bait?").block();
        assertThat(store.get(conversationId).orElseThrow().getSummary()).isEqualTo("Asked about tuna near Goa.");

        service.processTurn("u1", conversationId, null, "And the weather?").block();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<AgentMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(gateway, times(3)).invoke(captor.capture(), any());
        List<AgentMessage> thirdRequest = captor.getAllValues().get(2);
        assertThat(thirdRequest.get(0).content()).contains("## Earlier Conversation Summary\nAsked about tuna near Goa.");
        assertThat(thirdRequest).hasSize(4);
        assertThat(thirdRequest.get(1)).isEqualTo(AgentMessage.user("Best bait?"));
        verify(gateway, times(2)).complete(startsWith("Summarise"));
        assertThat(store.get(conversationId).orElseThrow().getMessageCount()).isEqualTo(6);
    }

    @Test
    void unknownConversationFails() {
        assertThatThrownBy(() -> service.processTurn("u1", "conv_missing", null, "hello").block())
                .isInstanceOf(ConversationNotFoundException.class);
        verify(gateway, never()).invoke(anyList(), any());
    }

    @Test
    void foreignConversationIsDenied() {
        String conversationId = store.create("owner", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();

        assertThatThrownBy(() -> service.processTurn("intruder", conversationId, null, "hello").block())
                .isInstanceOf(ConversationAccessDeniedException.class);
        assertThat(store.countMessages(conversationId)).isZero();
    }

    @Test
    void storeFailureFailsTheTurn() {
        ConversationStore failing = new InMemoryConversationStore(new MessageKeyGenerator()) {
            @Override
            public MessageEntity appendMessage(String conversationId, String role, String content,
                                               List<Map<String, Object>> toolCalls, Map<String, Object> metadata) {
                throw new IllegalStateException("disk full");
            }
        };
        String conversationId = failing.create("u1", ConversationEntity.DEFAULT_TITLE, "en").getConversationId();
        when(gateway.invoke(anyList(), any())).thenReturn(Mono.just(AgentMessage.assistant("ok")));

        assertThatThrownBy(() -> newService(failing).processTurn("u1", conversationId, null, "hello").block())
                .isInstanceOf(ConversationPersistenceException.class)
                .hasRootCauseMessage("disk full");
    }

    private AgentServiceImpl newService(ConversationStore backingStore) {
        return newService(backingStore, new MarketPricesTool());
    }

    private AgentServiceImpl newService(ConversationStore backingStore, AgentTool... tools) {
        ToolRegistry registry = new ToolRegistry(List.of(tools));
        return new AgentServiceImpl(
                new ConversationServiceImpl(backingStore),
                backingStore,
                new LanguageGuard(),
                new ConversationContextService(backingStore, gateway, properties),
                new LongTermMemoryService(backingStore, gateway, properties),
                gateway,
                registry,
                new AgentToolExecutor(registry, properties),
                new SystemPromptBuilder(),
                new FallbackResponder(),
                properties
        );
    }

    private record FixedOutputTool(ToolName toolName, String output) implements AgentTool {

        @Override
        public String description() {
            return "returns a fixed output";
        }

        @Override
        public Map<String, Object> parametersSchema() {
            return Map.of("type", "object");
        }

        @Override
        public ToolResult execute(Map<String, Object> args) {
            return new ToolResult(name(), output);
        }
    }
}
