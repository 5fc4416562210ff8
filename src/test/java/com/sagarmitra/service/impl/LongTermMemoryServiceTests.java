package com.sagarmitra.service.impl;

import com.sagarmitra.ai.SpringAiChatGateway;
import com.sagarmitra.config.AgentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LongTermMemoryServiceTests {

    private InMemoryConversationStore store;
    private SpringAiChatGateway gateway;
    private LongTermMemoryService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore(new MessageKeyGenerator());
        gateway = mock(SpringAiChatGateway.class);
        service = new LongTermMemoryService(store, gateway, new AgentProperties());
    }

    @Test
    void firstExchangeSeesPlaceholderAndStoresModelOutput() {
        when(gateway.complete(anyString())).thenReturn(Mono.just("  - Home port: Kochi\n"));

        service.update("u1", "I fish out of Kochi", "Great, Kochi has good seer fish.").block();

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(gateway).complete(prompt.capture());
        assertThat(prompt.getValue()).contains("EXISTING FACTS:\n" + LongTermMemoryService.NO_FACTS);
        assertThat(prompt.getValue()).contains("USER MESSAGE:\nI fish out of Kochi");
        assertThat(store.getUserFacts("u1")).contains("- Home port: Kochi");
    }

    @Test
    void repeatingAnExchangeLeavesFactsUnchanged() {
        store.putUserFacts("u1", "- Home port: Kochi");
        // nothing new, so the model echoes the existing list
        when(gateway.complete(anyString())).thenReturn(Mono.just("- Home port: Kochi"));

        service.update("u1", "I fish out of Kochi", "Noted.").block();
        service.update("u1", "I fish out of Kochi", "Noted.").block();

        ArgumentCaptor<String> prompts = ArgumentCaptor.forClass(String.class);
        verify(gateway, times(2)).complete(prompts.capture());
        assertThat(prompts.getAllValues()).allMatch(prompt -> prompt.contains("EXISTING FACTS:\n- Home port: Kochi"));
        assertThat(store.getUserFacts("u1")).contains("- Home port: Kochi");
    }

    @Test
    void modelFailureIsSwallowedAndFactsKept() {
        store.putUserFacts("u1", "- Boat: trawler");
        when(gateway.complete(anyString())).thenReturn(Mono.error(new RuntimeException("model down")));

        assertThatCode(() -> service.update("u1", "hi", "hello").block()).doesNotThrowAnyException();

        assertThat(store.getUserFacts("u1")).contains("- Boat: trawler");
    }

    @Test
    void blankModelOutputDoesNotEraseFacts() {
        store.putUserFacts("u1", "- Boat: trawler");
        when(gateway.complete(anyString())).thenReturn(Mono.just("   "));

        service.update("u1", "hi", "hello").block();

        assertThat(store.getUserFacts("u1")).contains("- Boat: trawler");
    }

    @Test
    void blankAssistantResponseSkipsExtraction() {
        service.update("u1", "hi", " ").block();

        verify(gateway, never()).complete(anyString());
        assertThat(store.getUserFacts("u1")).isEmpty();
    }
}
