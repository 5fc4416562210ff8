package com.sagarmitra.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.ollama.OllamaChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Spring AI wiring. Both the OpenAI and Ollama starters are on the classpath; the one
 * enabled through {@code spring.ai.model.chat} contributes its {@link ChatModel} and
 * {@link AgentProperties#getMode()} selects it as the primary model for the gateway.
 *
 * <p>The model is constructed once at startup and injected into the gateway; it is never
 * looked up lazily from a turn.</p>
 */
@Configuration
@EnableConfigurationProperties(AgentProperties.class)
@Slf4j
public class SpringAiConfig {

    private final AgentProperties properties;

    public SpringAiConfig(AgentProperties properties) {
        this.properties = properties;
    }

    @Bean
    @Primary
    public ChatModel routingChatModel(
            ObjectProvider<OpenAiChatModel> openAiChatModelProvider,
            ObjectProvider<OllamaChatModel> ollamaChatModelProvider) {
        AgentProperties.Mode mode = properties.getMode();
        log.info("Configuring Spring AI chat model for mode={}", mode);
        return switch (mode) {
            case OPENAI -> openAiChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("OpenAI mode selected but OpenAiChatModel bean is missing. " +
                        "Set spring.ai.model.chat=openai and configure spring.ai.openai.*.");
            });
            case OLLAMA -> ollamaChatModelProvider.getIfAvailable(() -> {
                throw new IllegalStateException("Ollama mode selected but OllamaChatModel bean is missing. " +
                        "Set spring.ai.model.chat=ollama and configure spring.ai.ollama.*.");
            });
        };
    }
}
