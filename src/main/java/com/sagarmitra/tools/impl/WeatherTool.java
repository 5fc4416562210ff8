package com.sagarmitra.tools.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Current sea weather and a 12-hour forecast from OpenWeatherMap, formatted for fishermen
 * with a Beaufort-scale wind advisory.
 */
@Slf4j
@Component
public class WeatherTool implements AgentTool {

    static final String NOT_CONFIGURED = "Weather API not configured. Please set agent.weather.api-key.";

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);
    private static final int FORECAST_ENTRIES = 4;

    /** Ascending by upper bound; a speed falls in the first band whose bound it does not exceed. */
    private static final List<WindBand> BEAUFORT = List.of(
            new WindBand(0.2, "शांत (Calm)", "Mirror-smooth sea"),
            new WindBand(1.5, "हल्की हवा (Light air)", "Small ripples"),
            new WindBand(3.3, "हल्की बयार (Light breeze)", "Small wavelets"),
            new WindBand(5.4, "मंद बयार (Gentle breeze)", "Large wavelets, some crests"),
            new WindBand(7.9, "तेज़ बयार (Moderate breeze)", "Small waves, frequent whitecaps"),
            new WindBand(10.7, "ताज़ा हवा (Fresh breeze)", "Moderate waves, be cautious!"),
            new WindBand(13.8, "तेज़ हवा (Strong breeze)", "Large waves, avoid deep sea!"),
            new WindBand(17.1, "भारी हवा (Near gale)", "Dangerous, return to shore!"),
            new WindBand(Double.POSITIVE_INFINITY, "तूफ़ान (Gale+)", "DANGER, DO NOT GO TO SEA!")
    );

    private final WebClient webClient;
    private final AgentProperties properties;

    public WeatherTool(@Qualifier("weatherWebClient") WebClient webClient, AgentProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    @Override
    public ToolName toolName() {
        return ToolName.GET_WEATHER;
    }

    @Override
    public String description() {
        return "Get current sea weather and the next 12-hour forecast for fishing at a latitude/longitude. "
                + "Optionally provide a human-readable location name.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "latitude", Map.of("type", "number", "description", "Latitude, e.g. 15.4909 for Goa"),
                        "longitude", Map.of("type", "number", "description", "Longitude, e.g. 73.8278 for Goa"),
                        "location_name", Map.of("type", "string", "description", "Optional human-readable place name")),
                "required", List.of("latitude", "longitude")
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        double latitude = requiredCoordinate(args, "latitude", 90);
        double longitude = requiredCoordinate(args, "longitude", 180);

        String apiKey = properties.getWeather().getApiKey();
        if (!StringUtils.hasText(apiKey)) {
            return new ToolResult(name(), NOT_CONFIGURED);
        }

        String locationName = ToolArgs.text(args.get("location_name"));
        String label = locationName != null
                ? locationName
                : String.format(Locale.ROOT, "%.2f°N, %.2f°E", latitude, longitude);

        JsonNode current;
        JsonNode forecast;
        try {
            current = fetch("/data/2.5/weather", latitude, longitude, apiKey, null);
            forecast = fetch("/data/2.5/forecast", latitude, longitude, apiKey, FORECAST_ENTRIES);
        } catch (WebClientException e) {
            log.warn("Weather lookup failed lat={} lon={}", latitude, longitude, e);
            return new ToolResult(name(), "Could not fetch weather: " + e.getMessage());
        }
        if (current == null || forecast == null) {
            return new ToolResult(name(), "Could not fetch weather: empty response");
        }
        return new ToolResult(name(), format(label, current, forecast));
    }

    private JsonNode fetch(String path, double latitude, double longitude, String apiKey, Integer count) {
        return webClient.get()
                .uri(builder -> {
                    builder.path(path)
                            .queryParam("lat", latitude)
                            .queryParam("lon", longitude)
                            .queryParam("appid", apiKey)
                            .queryParam("units", "metric");
                    if (count != null) {
                        builder.queryParam("cnt", count);
                    }
                    return builder.build();
                })
                .retrieve()
                .bodyToMono(JsonNode.class)
                .block(REQUEST_TIMEOUT);
    }

    String format(String label, JsonNode current, JsonNode forecast) {
        double windSpeed = current.path("wind").path("speed").asDouble(0);
        int windDeg = current.path("wind").path("deg").asInt(0);
        double temp = current.path("main").path("temp").asDouble();
        int humidity = current.path("main").path("humidity").asInt();
        String description = titleCase(current.path("weather").path(0).path("description").asText(""));
        int clouds = current.path("clouds").path("all").asInt(0);
        double rain = current.path("rain").path("1h").asDouble(0);
        double visibilityKm = current.path("visibility").asDouble(10_000) / 1000;

        List<String> lines = new ArrayList<>();
        lines.add("**" + label + "** - Current Conditions");
        lines.add("  " + description);
        lines.add(String.format(Locale.ROOT, "  Temperature: %.0f°C | Humidity: %d%%", temp, humidity));
        lines.add(String.format(Locale.ROOT, "  Wind: %.1f m/s (%d°) - %s", windSpeed, windDeg, windAdvisory(windSpeed)));
        lines.add(String.format(Locale.ROOT, "  Cloud cover: %d%% | Visibility: %.1f km", clouds, visibilityKm));
        if (rain > 0) {
            lines.add(String.format(Locale.ROOT, "  Rain (last 1h): %s mm", rain));
        }

        lines.add("");
        lines.add("**Next 12-Hour Forecast**:");
        for (JsonNode entry : forecast.path("list")) {
            String time = entry.path("dt_txt").asText("");
            String hhmm = time.length() >= 16 ? time.substring(11, 16) : time;
            double entryWind = entry.path("wind").path("speed").asDouble(0);
            StringBuilder line = new StringBuilder(String.format(Locale.ROOT, "  %s - %s, %.0f°C, Wind %.1fm/s (%s)",
                    hhmm,
                    titleCase(entry.path("weather").path(0).path("description").asText("")),
                    entry.path("main").path("temp").asDouble(),
                    entryWind,
                    windAdvisory(entryWind)));
            double entryRain = entry.path("rain").path("3h").asDouble(0);
            if (entryRain > 0) {
                line.append(", Rain ").append(entryRain).append("mm");
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    static String windAdvisory(double speedMs) {
        for (WindBand band : BEAUFORT) {
            if (speedMs <= band.high()) {
                return band.label() + " - " + band.advice();
            }
        }
        return "Unknown";
    }

    private static double requiredCoordinate(Map<String, Object> args, String key, double bound) {
        Double value = ToolArgs.coordinate(args.get(key), key, bound);
        if (value == null) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    private static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean capitalize = true;
        for (char c : text.toCharArray()) {
            out.append(capitalize ? Character.toUpperCase(c) : c);
            capitalize = Character.isWhitespace(c);
        }
        return out.toString();
    }

    private record WindBand(double high, String label, String advice) {
    }
}
