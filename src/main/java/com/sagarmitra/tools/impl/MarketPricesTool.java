package com.sagarmitra.tools.impl;

import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Indicative fish prices (INR per kg) at major Indian fishing ports, from a static table.
 */
@Slf4j
@Component
public class MarketPricesTool implements AgentTool {

    static final Map<String, Map<String, Integer>> MARKET_DATA = new LinkedHashMap<>();

    static {
        MARKET_DATA.put("Mumbai", prices(
                "Pomfret (Paplet)", 800,
                "Bombay Duck (Bombil)", 250,
                "Surmai (Seer Fish)", 700,
                "Rawas (Indian Salmon)", 600,
                "Prawns (Jhinga)", 500,
                "Mackerel (Bangda)", 200,
                "Hilsa (Ilish)", 1200));
        MARKET_DATA.put("Kochi", prices(
                "Karimeen (Pearl Spot)", 800,
                "King Fish (Neymeen)", 600,
                "Prawns", 450,
                "Sardine (Mathi)", 150,
                "Tuna (Choora)", 350,
                "Mackerel (Ayala)", 180,
                "Seer Fish (Neymeen)", 650));
        MARKET_DATA.put("Chennai", prices(
                "Seer Fish (Vanjiram)", 700,
                "Pomfret (Vavval)", 750,
                "Prawns (Eral)", 480,
                "Sardine (Mathi)", 130,
                "Tuna", 300,
                "Crab (Nandu)", 400));
        MARKET_DATA.put("Visakhapatnam", prices(
                "Pomfret", 700,
                "Prawns", 420,
                "Mackerel", 180,
                "Sardine", 120,
                "Tuna", 280,
                "Seer Fish", 650));
        MARKET_DATA.put("Mangalore", prices(
                "Mackerel (Bangude)", 200,
                "Sardine (Bhoothai)", 100,
                "Pomfret", 750,
                "Prawns", 450,
                "Seer Fish (Anjal)", 680,
                "Lady Fish (Kane)", 350));
        MARKET_DATA.put("Porbandar", prices(
                "Pomfret (Paplet)", 850,
                "Surmai", 720,
                "Lobster", 1500,
                "Prawns", 500,
                "Mackerel", 190));
    }

    @Override
    public ToolName toolName() {
        return ToolName.GET_MARKET_PRICES;
    }

    @Override
    public String description() {
        return "Get current fish market prices at Indian fishing ports. Provide port_name to see prices "
                + "at a specific port, or fish_species to find where that fish is sold and at what price.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "port_name", Map.of(
                                "type", "string",
                                "description", "Name of the port or city, e.g. 'Mumbai' or 'Kochi'"),
                        "fish_species", Map.of(
                                "type", "string",
                                "description", "Fish species to look up across all ports")),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String port = ToolArgs.text(args.get("port_name"));
        String species = ToolArgs.text(args.get("fish_species"));
        log.debug("Market price lookup port={} species={}", port, species);

        String content;
        if (port != null) {
            content = portPrices(port);
        } else if (species != null) {
            content = speciesPrices(species);
        } else {
            content = overview();
        }
        return new ToolResult(name(), content);
    }

    private String portPrices(String port) {
        Optional<String> match = matchPort(port);
        if (match.isEmpty()) {
            return "No price data for '" + port + "'. Available ports: " + String.join(", ", MARKET_DATA.keySet());
        }
        List<String> lines = new ArrayList<>();
        lines.add("**Fish Prices at " + match.get() + "** (per kg):");
        MARKET_DATA.get(match.get()).entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .forEach(entry -> lines.add("  • " + entry.getKey() + ": ₹" + entry.getValue()));
        return String.join("\n", lines);
    }

    private String speciesPrices(String species) {
        String query = species.toLowerCase(Locale.ROOT);
        List<PortPrice> found = new ArrayList<>();
        MARKET_DATA.forEach((port, prices) -> prices.forEach((name, price) -> {
            if (name.toLowerCase(Locale.ROOT).contains(query)) {
                found.add(new PortPrice(port, name, price));
            }
        }));
        if (found.isEmpty()) {
            return "No price data for '" + species + "'. Try a broader search.";
        }
        found.sort(Comparator.comparingInt(PortPrice::price));
        List<String> lines = new ArrayList<>();
        lines.add("**Prices for '" + species + "' across ports:**");
        for (PortPrice entry : found) {
            lines.add("  • " + entry.port() + ": " + entry.species() + " - ₹" + entry.price() + "/kg");
        }
        return String.join("\n", lines);
    }

    private String overview() {
        List<String> lines = new ArrayList<>();
        lines.add("**Available Fish Markets:**");
        MARKET_DATA.forEach((port, prices) -> lines.add("  • " + port + " (" + prices.size() + " species tracked)"));
        lines.add("");
        lines.add("Ask about a specific port or fish species for detailed prices.");
        return String.join("\n", lines);
    }

    /** Substring match in either direction, so "Kochi port" and "koch" both resolve to Kochi. */
    static Optional<String> matchPort(String requested) {
        String query = requested.toLowerCase(Locale.ROOT);
        return MARKET_DATA.keySet().stream()
                .filter(port -> {
                    String candidate = port.toLowerCase(Locale.ROOT);
                    return candidate.contains(query) || query.contains(candidate);
                })
                .findFirst();
    }

    private static Map<String, Integer> prices(Object... pairs) {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((String) pairs[i], (Integer) pairs[i + 1]);
        }
        return map;
    }

    private record PortPrice(String port, String species, int price) {
    }
}
