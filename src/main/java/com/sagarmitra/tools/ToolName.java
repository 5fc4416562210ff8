package com.sagarmitra.tools;

import java.util.Locale;
import java.util.Optional;

/**
 * The fixed set of tools the agent may call. The wire name is what the model sees and sends back.
 */
public enum ToolName {
    GET_MARKET_PRICES("get_market_prices"),
    GET_WEATHER("get_weather"),
    GET_CATCH_HISTORY("get_catch_history"),
    GET_CATCH_DETAILS("get_catch_details"),
    GET_MAP_DATA("get_map_data");

    private final String wireName;

    ToolName(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Exact match first, then case-insensitive. */
    public static Optional<ToolName> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (ToolName candidate : values()) {
            if (candidate.wireName.equals(name)) {
                return Optional.of(candidate);
            }
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ToolName candidate : values()) {
            if (candidate.wireName.equals(normalized)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
