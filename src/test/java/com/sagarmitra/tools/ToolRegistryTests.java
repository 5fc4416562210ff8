package com.sagarmitra.tools;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolRegistryTests {

    @Test
    void lookupResolvesWireNamesCaseInsensitively() {
        StubTool weather = new StubTool(ToolName.GET_WEATHER);
        ToolRegistry registry = new ToolRegistry(List.of(weather));

        assertThat(registry.lookup("get_weather")).containsSame(weather);
        assertThat(registry.lookup(" GET_WEATHER ")).containsSame(weather);
        assertThat(registry.lookup("get_market_prices")).isEmpty();
        assertThat(registry.lookup("delete_everything")).isEmpty();
        assertThat(registry.lookup(null)).isEmpty();
    }

    @Test
    void toolsAreListedInDeclarationOrder() {
        StubTool weather = new StubTool(ToolName.GET_WEATHER);
        StubTool prices = new StubTool(ToolName.GET_MARKET_PRICES);

        ToolRegistry registry = new ToolRegistry(List.of(weather, prices));

        assertThat(registry.tools()).containsExactly(prices, weather);
        assertThat(registry.get(ToolName.GET_WEATHER)).containsSame(weather);
        assertThat(registry.isEmpty()).isFalse();
        assertThat(new ToolRegistry(List.of()).isEmpty()).isTrue();
    }

    @Test
    void duplicateRegistrationIsRejected() {
        assertThatThrownBy(() -> new ToolRegistry(List.of(
                new StubTool(ToolName.GET_WEATHER), new StubTool(ToolName.GET_WEATHER))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("GET_WEATHER");
    }

    private record StubTool(ToolName toolName) implements AgentTool {

        @Override
        public String description() {
            return "stub";
        }

        @Override
        public Map<String, Object> parametersSchema() {
            return Map.of("type", "object");
        }

        @Override
        public ToolResult execute(Map<String, Object> args) {
            return new ToolResult(name(), "ok");
        }
    }
}
