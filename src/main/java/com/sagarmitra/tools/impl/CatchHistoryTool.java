package com.sagarmitra.tools.impl;

import com.sagarmitra.config.AgentProperties;
import com.sagarmitra.service.CatchRecordStore;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The calling user's analysed catches, newest first, one page at a time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatchHistoryTool implements AgentTool {

    static final int MAX_PAGE_SIZE = 50;
    static final String NO_RECORDS = "No catch records found yet. Upload a photo of your catch to start tracking!";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final CatchRecordStore catchRecords;
    private final AgentProperties properties;

    @Override
    public ToolName toolName() {
        return ToolName.GET_CATCH_HISTORY;
    }

    @Override
    public String description() {
        return "Get the user's recent catch history (fish species detected from uploaded photos). "
                + "Results are paginated and page 1 is the most recent.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "page", Map.of("type", "integer", "description", "Page number, starting at 1"),
                        "limit", Map.of("type", "integer", "description", "Records per page, at most " + MAX_PAGE_SIZE)),
                "required", List.of()
        );
    }

    @Override
    public boolean userScoped() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> args) {
        String userId = ToolArgs.text(args.get(USER_ID_ARG));
        if (userId == null) {
            throw new IllegalArgumentException("user_id is required");
        }
        int page = ToolArgs.positiveInt(args.get("page"), "page", 1, 1);
        int pageSize = Math.min(MAX_PAGE_SIZE,
                ToolArgs.positiveInt(args.get("limit"), "limit", 1, defaultPageSize()));
        int offset = (page - 1) * pageSize;

        List<CatchRecordEntity> records;
        try {
            // one extra row tells whether another page exists
            records = catchRecords.listByUser(userId, offset, pageSize + 1);
        } catch (DataAccessException e) {
            log.warn("Catch history lookup failed userId={} page={}", userId, page, e);
            return new ToolResult(name(), "Could not fetch catch history: " + e.getMessage());
        }
        log.debug("Catch history lookup userId={} page={} pageSize={} found={}", userId, page, pageSize, records.size());

        if (records.isEmpty()) {
            return new ToolResult(name(), page == 1 ? NO_RECORDS : "No more records on page " + page + ".");
        }
        boolean more = records.size() > pageSize;
        List<CatchRecordEntity> shown = more ? records.subList(0, pageSize) : records;

        List<String> lines = new ArrayList<>();
        lines.add("**Catch History** (Page " + page + ", showing " + shown.size() + " records):");
        for (int i = 0; i < shown.size(); i++) {
            lines.add(line(offset + i + 1, shown.get(i)));
        }
        if (more) {
            lines.add("");
            lines.add("  More records available. Ask for page " + (page + 1) + ".");
        }
        return new ToolResult(name(), String.join("\n", lines));
    }

    private static String line(int position, CatchRecordEntity record) {
        StringBuilder line = new StringBuilder("  ")
                .append(position).append(". **").append(orDefault(record.getSpecies(), "Unknown")).append("** - ")
                .append(orDefault(record.getLocation(), "Unknown location"))
                .append(" (").append(date(record.getCreatedAt())).append(')');
        if (record.getConfidence() != null) {
            line.append(String.format(Locale.ROOT, " [Confidence: %.1f%%]", record.getConfidence() * 100));
        }
        if (!CatchRecordEntity.STATUS_COMPLETED.equals(record.getAnalysisStatus())) {
            line.append(" [").append(orDefault(record.getAnalysisStatus(), "unknown")).append(']');
        }
        return line.toString();
    }

    static String date(Instant instant) {
        return instant == null ? "Unknown date" : DATE.format(instant);
    }

    static String orDefault(String value, String fallback) {
        String text = ToolArgs.text(value);
        return text != null ? text : fallback;
    }

    private int defaultPageSize() {
        return Math.max(1, properties.getTools().getCatchHistoryPageSize());
    }
}
