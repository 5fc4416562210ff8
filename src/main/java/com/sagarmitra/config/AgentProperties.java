package com.sagarmitra.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Central application properties for the agent core.
 *
 * <p>The model itself is configured through the Spring AI starters ({@code spring.ai.*});
 * {@link #getMode()} only picks which of the contributed chat models is routed to.
 * Everything else here tunes the turn pipeline: tool loop bounds, the short-term
 * window and summarisation, external call timeouts and the backing store.</p>
 */
@Data
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    public enum Mode {
        OPENAI, OLLAMA
    }

    private Mode mode = Mode.OPENAI;
    private String model;
    private Double temperature = 0.7;

    private Tools tools = new Tools();
    private Memory memory = new Memory();
    private Client client = new Client();
    private Store store = new Store();
    private Weather weather = new Weather();

    @Data
    public static class Tools {
        private int maxLoops = 6;
        private long timeoutMs = 15_000;
        private int outputPreviewChars = 500;
        private int catchHistoryPageSize = 10;
    }

    @Data
    public static class Memory {
        private int shortTermLimit = 10;
        private int historyCap = 500;
        private int summaryLineChars = 300;
        private boolean resummarizeAfterTurn = true;
        /**
         * Joins the long-term memory update into the turn instead of detaching it.
         * Failures stay suppressed either way.
         */
        private boolean awaitUpdate = false;
    }

    @Data
    public static class Client {
        private long timeoutMs = 60_000;
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        /** Retries after the first model call, so at most {@code maxRetries + 1} calls per round. */
        private int maxRetries = 2;
        private long backoffMs = 300;
    }

    @Data
    public static class Store {
        private String type = "in-memory";
        private boolean initSchema = false;
    }

    @Data
    public static class Weather {
        private String baseUrl = "https://api.openweathermap.org";
        private String apiKey;
    }
}
