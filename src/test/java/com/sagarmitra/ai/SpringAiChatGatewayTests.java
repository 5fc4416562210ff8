package com.sagarmitra.ai;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.impl.dto.AgentMessage;
import com.sagarmitra.service.impl.dto.ToolCall;
import com.sagarmitra.tools.ToolRegistry;
import com.sagarmitra.tools.impl.MarketPricesTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SpringAiChatGatewayTests {

    private ChatModel chatModel;
    private SpringAiChatGateway gateway;
    private ToolRegistry registry;

    @BeforeEach
    void setUp() {
        chatModel = mock(ChatModel.class);
        AgentProperties properties = new AgentProperties();
        properties.setModel("test-model");
        gateway = new SpringAiChatGateway(chatModel, new ObjectMapper(), properties);
        registry = new ToolRegistry(List.of(new MarketPricesTool()));
    }

    @Test
    void invokeAdvertisesToolsWithoutExecutingThem() {
        when(chatModel.call(any(Prompt.class))).thenReturn(response(new AssistantMessage("Hello!")));

        AgentMessage reply = gateway.invoke(List.of(AgentMessage.system("sys"), AgentMessage.user("hi")), registry).block();

        assertThat(reply).isEqualTo(AgentMessage.assistant("Hello!"));
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();
        assertThat(prompt.getInstructions()).extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER);

        ToolCallingChatOptions options = (ToolCallingChatOptions) prompt.getOptions();
        assertThat(options.getInternalToolExecutionEnabled()).isFalse();
        assertThat(options.getModel()).isEqualTo("test-model");
        assertThat(options.getToolCallbacks()).hasSize(1);
        ToolCallback callback = options.getToolCallbacks().get(0);
        assertThat(callback.getToolDefinition().name()).isEqualTo("get_market_prices");
        assertThat(callback.getToolDefinition().inputSchema()).contains("\"port_name\"");
        assertThatThrownBy(() -> callback.call("{}")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toolCallsAreParsedIntoArgumentMaps() {
        AssistantMessage output = new AssistantMessage("", Map.of(), List.of(
                new AssistantMessage.ToolCall("call-1", "function", "get_market_prices", "{\"port_name\":\"Kochi\"}"),
                new AssistantMessage.ToolCall("call-2", "function", "get_weather", "not json")));
        when(chatModel.call(any(Prompt.class))).thenReturn(response(output));

        AgentMessage reply = gateway.invoke(List.of(AgentMessage.user("prices?")), registry).block();

        assertThat(reply.hasToolCalls()).isTrue();
        assertThat(reply.toolCalls()).containsExactly(
                new ToolCall("call-1", "get_market_prices", Map.of("port_name", "Kochi")),
                new ToolCall("call-2", "get_weather", Map.of()));
    }

    @Test
    void consecutiveToolResultsTravelAsOneMessage() {
        List<AgentMessage> messages = List.of(
                AgentMessage.user("weather and prices"),
                AgentMessage.assistant("", List.of(
                        new ToolCall("a", "get_weather", Map.of("latitude", 15.0)),
                        new ToolCall("b", "get_market_prices", Map.of()))),
                AgentMessage.toolResult("a", "get_weather", "sunny"),
                AgentMessage.toolResult("b", "get_market_prices", "cheap"));

        List<Message> converted = gateway.toSpringMessages(messages);

        assertThat(converted).extracting(Message::getMessageType)
                .containsExactly(MessageType.USER, MessageType.ASSISTANT, MessageType.TOOL);
        AssistantMessage assistant = (AssistantMessage) converted.get(1);
        assertThat(assistant.getToolCalls()).extracting(AssistantMessage.ToolCall::arguments)
                .containsExactly("{\"latitude\":15.0}", "{}");
        ToolResponseMessage responses = (ToolResponseMessage) converted.get(2);
        assertThat(responses.getResponses()).extracting(ToolResponseMessage.ToolResponse::responseData)
                .containsExactly("sunny", "cheap");
    }

    @Test
    void completeReturnsTextAndToleratesEmptyResponse() {
        when(chatModel.call(any(Prompt.class)))
                .thenReturn(response(new AssistantMessage("- Home port: Kochi")))
                .thenReturn(new ChatResponse(List.of()));

        assertThat(gateway.complete("extract").block()).isEqualTo("- Home port: Kochi");
        assertThat(gateway.complete("extract").block()).isEmpty();
    }

    @Test
    void modelErrorsPropagate() {
        when(chatModel.call(any(Prompt.class))).thenThrow(new IllegalStateException("503 from provider"));

        assertThatThrownBy(() -> gateway.invoke(List.of(AgentMessage.user("hi")), registry).block())
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("503 from provider");
    }

    private static ChatResponse response(AssistantMessage output) {
        return new ChatResponse(List.of(new Generation(output)));
    }
}
