package com.sagarmitra.tools.impl;

import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ocean zones, harbours, fish markets and seasonal ban areas along the Indian coast, from a
 * static table. Coordinates rank the nearest locations; a text query searches marker names.
 */
@Slf4j
@Component
public class MapDataTool implements AgentTool {

    static final int NEAREST_LIMIT = 5;
    /** Ban areas are reported when within their radius plus this margin. */
    static final double RESTRICTED_MARGIN_KM = 100;

    private static final double EARTH_RADIUS_KM = 6371;

    static final List<OceanZone> OCEAN_ZONES = List.of(
            new OceanZone("Exclusive Economic Zone (EEZ), India",
                    "India's 200 nautical mile exclusive economic zone. Fishing permitted with valid license."),
            new OceanZone("Territorial Waters",
                    "12 nautical miles from coastline. Traditional fishing allowed.")
    );

    static final List<Marker> MARKERS = List.of(
            new Marker("Mumbai Fishing Harbor", 18.9485, 72.8372, "harbor"),
            new Marker("Sassoon Docks", 18.9265, 72.8312, "market"),
            new Marker("Versova Jetty", 19.1347, 72.8120, "harbor"),
            new Marker("Mangalore Fishing Port", 12.8650, 74.8302, "harbor"),
            new Marker("Kochi Fishing Harbour", 9.9370, 76.2614, "harbor"),
            new Marker("Visakhapatnam Fishing Harbour", 17.6915, 83.2974, "harbor"),
            new Marker("Chennai Fishing Harbour", 13.1007, 80.2945, "harbor"),
            new Marker("Paradip Port", 20.3166, 86.6114, "harbor"),
            new Marker("Porbandar Fisheries", 21.6417, 69.6293, "harbor"),
            new Marker("Tuticorin Harbour", 8.7642, 78.1348, "harbor"),
            new Marker("Veraval Fish Market", 20.9067, 70.3679, "market"),
            new Marker("Rameswaram", 9.2876, 79.3129, "harbor")
    );

    static final List<RestrictedArea> RESTRICTED_AREAS = List.of(
            new RestrictedArea("Monsoon Fishing Ban Zone (West Coast)",
                    "Fishing banned June 1 to July 31 along west coast (mechanised boats).", 15.0, 72.0, 200),
            new RestrictedArea("Monsoon Fishing Ban Zone (East Coast)",
                    "Fishing banned April 15 to June 14 along east coast (mechanised boats).", 14.0, 81.0, 200)
    );

    @Override
    public ToolName toolName() {
        return ToolName.GET_MAP_DATA;
    }

    @Override
    public String description() {
        return "Get ocean zone data, nearby harbors and fish markets, and restricted fishing areas. "
                + "Provide latitude/longitude for the nearest locations, or a text query to search by name.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "latitude", Map.of("type", "number", "description", "User's latitude"),
                        "longitude", Map.of("type", "number", "description", "User's longitude"),
                        "query", Map.of("type", "string", "description", "Free text such as 'Mumbai' or 'market'")),
                "required", List.of()
        );
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        Double latitude = ToolArgs.coordinate(args.get("latitude"), "latitude", 90);
        Double longitude = ToolArgs.coordinate(args.get("longitude"), "longitude", 180);
        String query = ToolArgs.text(args.get("query"));
        log.debug("Map data lookup lat={} lon={} query={}", latitude, longitude, query);

        String content;
        if (latitude != null && longitude != null) {
            content = nearby(latitude, longitude);
        } else if (query != null) {
            content = search(query);
        } else {
            content = overview();
        }
        return new ToolResult(name(), content);
    }

    private String nearby(double latitude, double longitude) {
        List<String> lines = new ArrayList<>();
        lines.add("**Nearest Fishing Locations:**");
        MARKERS.stream()
                .sorted(Comparator.comparingDouble(marker -> distanceKm(latitude, longitude, marker.lat(), marker.lon())))
                .limit(NEAREST_LIMIT)
                .forEach(marker -> lines.add(String.format(Locale.ROOT, "  • %s (%s) - ~%.0f km away",
                        marker.name(), marker.type(), distanceKm(latitude, longitude, marker.lat(), marker.lon()))));

        lines.add("");
        lines.add("**Restricted/Ban Zones Nearby:**");
        boolean anyRestricted = false;
        for (RestrictedArea area : RESTRICTED_AREAS) {
            double distance = distanceKm(latitude, longitude, area.lat(), area.lon());
            if (distance < area.radiusKm() + RESTRICTED_MARGIN_KM) {
                lines.add(String.format(Locale.ROOT, "  • %s: %s (~%.0f km)", area.name(), area.description(), distance));
                anyRestricted = true;
            }
        }
        if (!anyRestricted) {
            lines.add("  None within range.");
        }
        return String.join("\n", lines);
    }

    private String search(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<Marker> matches = MARKERS.stream()
                .filter(marker -> marker.name().toLowerCase(Locale.ROOT).contains(needle)
                        || marker.type().equals(needle))
                .toList();
        if (matches.isEmpty()) {
            return "No markers found matching '" + query + "'. Try with a broader term.";
        }
        List<String> lines = new ArrayList<>();
        lines.add("**Search results for '" + query + "':**");
        for (Marker marker : matches) {
            lines.add(String.format(Locale.ROOT, "  • %s (%s) - %.4f°N, %.4f°E",
                    marker.name(), marker.type(), marker.lat(), marker.lon()));
        }
        return String.join("\n", lines);
    }

    private String overview() {
        List<String> lines = new ArrayList<>();
        lines.add("**Indian Ocean Fishing Zones:**");
        OCEAN_ZONES.forEach(zone -> lines.add("  • " + zone.name() + ": " + zone.description()));
        lines.add("");
        lines.add("  Total harbors/markets: " + MARKERS.size());
        lines.add("  Known restricted areas: " + RESTRICTED_AREAS.size());
        return String.join("\n", lines);
    }

    /** Great-circle distance by the haversine formula. */
    static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        return EARTH_RADIUS_KM * 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
    }

    record OceanZone(String name, String description) {
    }

    record Marker(String name, double lat, double lon, String type) {
    }

    record RestrictedArea(String name, String description, double lat, double lon, double radiusKm) {
    }
}
