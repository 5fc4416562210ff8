package com.sagarmitra.tools.impl;

import com.sagarmitra.service.CatchRecordStore;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import com.sagarmitra.tools.AgentTool;
import com.sagarmitra.tools.ToolName;
import com.sagarmitra.tools.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Full analysis of one of the calling user's catches: size, grade, value and sustainability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatchDetailsTool implements AgentTool {

    private final CatchRecordStore catchRecords;

    @Override
    public ToolName toolName() {
        return ToolName.GET_CATCH_DETAILS;
    }

    @Override
    public String description() {
        return "Get the detailed analysis of a specific catch by its image_id: weight, quality grade, "
                + "market value and sustainability.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "image_id", Map.of("type", "string", "description", "Identifier of the catch photo")),
                "required", List.of("image_id")
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
        String imageId = ToolArgs.text(args.get("image_id"));
        if (imageId == null) {
            throw new IllegalArgumentException("image_id is required");
        }

        Optional<CatchRecordEntity> found;
        try {
            found = catchRecords.get(imageId);
        } catch (DataAccessException e) {
            log.warn("Catch details lookup failed imageId={}", imageId, e);
            return new ToolResult(name(), "Could not fetch details for catch " + imageId + ": " + e.getMessage());
        }
        if (found.isEmpty()) {
            return new ToolResult(name(), "Could not find any catch record with ID " + imageId + ".");
        }
        CatchRecordEntity record = found.get();
        if (!userId.equals(record.getUserId())) {
            log.info("Catch details denied imageId={} userId={}", imageId, userId);
            return new ToolResult(name(), "You do not have permission to view catch " + imageId + ".");
        }
        return new ToolResult(name(), format(record));
    }

    String format(CatchRecordEntity record) {
        double confidence = record.getConfidence() == null ? 0 : record.getConfidence() * 100;
        double weight = record.getWeightEstimateKg() == null ? 0 : record.getWeightEstimateKg();
        int pricePerKg = record.getMarketPricePerKg() == null ? 0 : record.getMarketPricePerKg();

        List<String> lines = new ArrayList<>();
        lines.add("**Catch Details: " + CatchHistoryTool.orDefault(record.getSpecies(), "Unknown") + "** ("
                + CatchHistoryTool.date(record.getCreatedAt()) + ")");
        lines.add("  • Image ID: " + record.getImageId());
        lines.add("  • Location: " + CatchHistoryTool.orDefault(record.getLocation(), "Unknown location"));
        lines.add(String.format(Locale.ROOT, "  • Confidence: %.1f%%", confidence));
        lines.add("  • Quality Grade: " + CatchHistoryTool.orDefault(record.getQualityGrade(), "Unknown"));
        lines.add(String.format(Locale.ROOT, "  • Weight Estimate: %.2f kg", weight));
        lines.add("  • Estimated Value: ₹" + Math.round(weight * pricePerKg) + " (@ ₹" + pricePerKg + "/kg)");
        lines.add("  • Sustainability: " + (Boolean.TRUE.equals(record.getSustainable())
                ? "Sustainable"
                : "Limited/Not Sustainable"));

        if (!CatchRecordEntity.STATUS_COMPLETED.equals(record.getAnalysisStatus())) {
            lines.add("");
            lines.add("Note: Analysis status is currently '" + CatchHistoryTool.orDefault(record.getAnalysisStatus(), "unknown")
                    + "'. Some metrics may be missing or inaccurate until completed.");
        }
        return String.join("\n", lines);
    }
}
