package com.sagarmitra.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.impl.dto.AgentMessage;
import com.sagarmitra.service.impl.dto.ToolCall;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.model.tool.ToolCallingChatOptions;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Model client. Translates the agent's message list into a Spring AI {@link Prompt}, binds the
 * registered tools as definitions only and returns the model's reply, including any tool calls,
 * without executing them. Tool execution and looping belong to the caller.
 *
 * <p>Calls run on the bounded-elastic scheduler. Timeouts, retries and fallbacks are applied by
 * the callers, which own those policies.</p>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SpringAiChatGateway {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ChatModel chatModel;
    private final ObjectMapper mapper;
    private final AgentProperties properties;

    public Mono<AgentMessage> invoke(List<AgentMessage> messages, ToolRegistry toolRegistry) {
        return Mono.fromCallable(() -> executeInvoke(messages, toolRegistry))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /** Single-prompt text completion without tools, used for summaries and fact extraction. */
    public Mono<String> complete(String prompt) {
        return Mono.fromCallable(() -> executeComplete(prompt))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private AgentMessage executeInvoke(List<AgentMessage> messages, ToolRegistry toolRegistry) {
        List<ToolCallback> callbacks = toolRegistry.tools().stream()
                .map(this::toCallback)
                .toList();
        Prompt prompt = new Prompt(toSpringMessages(messages), buildOptions(callbacks));
        log.debug("Executing chat call with model={} messages={} tools={}",
                properties.getModel(), messages.size(), callbacks.size());

        AssistantMessage output = outputOf(chatModel.call(prompt));
        if (output == null) {
            return AgentMessage.assistant("");
        }
        List<ToolCall> toolCalls = output.hasToolCalls()
                ? output.getToolCalls().stream().map(this::toToolCall).toList()
                : List.of();
        if (!toolCalls.isEmpty()) {
            log.debug("Model requested {} tool call(s): {}", toolCalls.size(),
                    toolCalls.stream().map(ToolCall::name).toList());
        }
        return AgentMessage.assistant(output.getText(), toolCalls);
    }

    private String executeComplete(String prompt) {
        Prompt request = new Prompt(List.of(new UserMessage(prompt)), buildOptions(List.of()));
        AssistantMessage output = outputOf(chatModel.call(request));
        return output != null && output.getText() != null ? output.getText() : "";
    }

    private ToolCallingChatOptions buildOptions(List<ToolCallback> callbacks) {
        ToolCallingChatOptions.Builder builder = ToolCallingChatOptions.builder()
                .temperature(properties.getTemperature())
                .internalToolExecutionEnabled(false);
        if (StringUtils.hasText(properties.getModel())) {
            builder.model(properties.getModel());
        }
        if (!callbacks.isEmpty()) {
            builder.toolCallbacks(callbacks);
        }
        return builder.build();
    }

    List<Message> toSpringMessages(List<AgentMessage> messages) {
        List<Message> converted = new ArrayList<>(messages.size());
        List<ToolResponseMessage.ToolResponse> pendingResponses = new ArrayList<>();
        for (AgentMessage message : messages) {
            if (message.role() == AgentMessage.Role.TOOL) {
                pendingResponses.add(new ToolResponseMessage.ToolResponse(
                        message.toolCallId() != null ? message.toolCallId() : "tool-" + UUID.randomUUID(),
                        message.toolName() != null ? message.toolName() : "",
                        message.content()));
                continue;
            }
            flushToolResponses(converted, pendingResponses);
            switch (message.role()) {
                case SYSTEM -> converted.add(new SystemMessage(message.content()));
                case USER -> converted.add(new UserMessage(message.content()));
                case ASSISTANT -> converted.add(new AssistantMessage(
                        message.content(),
                        Map.of(),
                        message.toolCalls().stream().map(this::toSpringToolCall).toList()));
                default -> throw new IllegalStateException("Unexpected role " + message.role());
            }
        }
        flushToolResponses(converted, pendingResponses);
        return converted;
    }

    // consecutive tool results answer one assistant turn and travel as one message
    private void flushToolResponses(List<Message> converted, List<ToolResponseMessage.ToolResponse> pending) {
        if (pending.isEmpty()) {
            return;
        }
        converted.add(new ToolResponseMessage(new ArrayList<>(pending)));
        pending.clear();
    }

    private AssistantMessage.ToolCall toSpringToolCall(ToolCall call) {
        String arguments;
        try {
            arguments = mapper.writeValueAsString(call.arguments());
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize arguments for tool call id={} name={}", call.id(), call.name(), e);
            arguments = "{}";
        }
        return new AssistantMessage.ToolCall(call.id(), "function", call.name(), arguments);
    }

    ToolCall toToolCall(AssistantMessage.ToolCall call) {
        String id = StringUtils.hasText(call.id()) ? call.id() : "call-" + UUID.randomUUID();
        return new ToolCall(id, call.name(), parseArguments(call.name(), call.arguments()));
    }

    private Map<String, Object> parseArguments(String toolName, String json) {
        if (!StringUtils.hasText(json)) {
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> parsed = mapper.readValue(json, MAP_TYPE);
            return parsed != null ? parsed : Collections.emptyMap();
        } catch (JsonProcessingException e) {
            log.warn("Model sent unparseable arguments for tool '{}': {}", toolName, json);
            return Collections.emptyMap();
        }
    }

    private ToolCallback toCallback(AgentTool tool) {
        String schema;
        try {
            schema = mapper.writeValueAsString(tool.parametersSchema());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid parameter schema for tool " + tool.name(), e);
        }
        return new DefinitionOnlyToolCallback(ToolDefinition.builder()
                .name(tool.name())
                .description(tool.description())
                .inputSchema(schema)
                .build());
    }

    private static AssistantMessage outputOf(ChatResponse response) {
        if (response == null) {
            return null;
        }
        Generation generation = response.getResult();
        return generation != null ? generation.getOutput() : null;
    }

    /**
     * Advertises a tool to the model. Internal tool execution is disabled, so Spring AI never calls it.
     */
    private record DefinitionOnlyToolCallback(ToolDefinition definition) implements ToolCallback {

        @Override
        public ToolDefinition getToolDefinition() {
            return definition;
        }

        @Override
        public String call(String toolInput) {
            throw new UnsupportedOperationException("tool " + definition.name() + " is executed by the agent loop");
        }
    }
}
