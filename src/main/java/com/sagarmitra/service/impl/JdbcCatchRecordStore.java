package com.sagarmitra.service.impl;

import com.sagarmitra.service.CatchRecordStore;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Service;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

@Service
@ConditionalOnProperty(name = "agent.store.type", havingValue = "database")
@RequiredArgsConstructor
@Slf4j
public class JdbcCatchRecordStore implements CatchRecordStore {

    private static final String CATCH_SELECT = """
            SELECT image_id, user_id, species, location, confidence, weight_estimate_kg, market_price_per_kg,
                   quality_grade, sustainable, analysis_status, created_at
            FROM catch_records
            """;

    private static final RowMapper<CatchRecordEntity> ROW_MAPPER = new CatchRecordRowMapper();

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public void save(CatchRecordEntity record) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("imageId", record.getImageId())
                .addValue("userId", record.getUserId())
                .addValue("species", record.getSpecies())
                .addValue("location", record.getLocation())
                .addValue("confidence", record.getConfidence())
                .addValue("weightEstimateKg", record.getWeightEstimateKg())
                .addValue("marketPricePerKg", record.getMarketPricePerKg())
                .addValue("qualityGrade", record.getQualityGrade())
                .addValue("sustainable", record.getSustainable())
                .addValue("analysisStatus", record.getAnalysisStatus())
                .addValue("createdAt", record.getCreatedAt() == null ? null : Timestamp.from(record.getCreatedAt()));

        int updated = jdbcTemplate.update("""
                UPDATE catch_records
                SET user_id = :userId, species = :species, location = :location, confidence = :confidence,
                    weight_estimate_kg = :weightEstimateKg, market_price_per_kg = :marketPricePerKg,
                    quality_grade = :qualityGrade, sustainable = :sustainable, analysis_status = :analysisStatus,
                    created_at = :createdAt
                WHERE image_id = :imageId
                """, params);
        if (updated == 0) {
            jdbcTemplate.update("""
                    INSERT INTO catch_records (image_id, user_id, species, location, confidence, weight_estimate_kg,
                                               market_price_per_kg, quality_grade, sustainable, analysis_status, created_at)
                    VALUES (:imageId, :userId, :species, :location, :confidence, :weightEstimateKg,
                            :marketPricePerKg, :qualityGrade, :sustainable, :analysisStatus, :createdAt)
                    """, params);
        }
        log.debug("Database catch record saved imageId={} userId={} replaced={}",
                record.getImageId(), record.getUserId(), updated > 0);
    }

    @Override
    public Optional<CatchRecordEntity> get(String imageId) {
        return jdbcTemplate.query(
                CATCH_SELECT + " WHERE image_id = :imageId",
                new MapSqlParameterSource("imageId", imageId),
                ROW_MAPPER).stream().findFirst();
    }

    @Override
    public List<CatchRecordEntity> listByUser(String userId, int offset, int limit) {
        return jdbcTemplate.query(
                CATCH_SELECT + """
                        WHERE user_id = :userId
                        ORDER BY created_at DESC, image_id
                        LIMIT :limit OFFSET :offset
                        """,
                new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("limit", Math.max(0, limit))
                        .addValue("offset", Math.max(0, offset)),
                ROW_MAPPER);
    }

    private static class CatchRecordRowMapper implements RowMapper<CatchRecordEntity> {
        @Override
        public CatchRecordEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp createdAt = rs.getTimestamp("created_at");
            return CatchRecordEntity.builder()
                    .imageId(rs.getString("image_id"))
                    .userId(rs.getString("user_id"))
                    .species(rs.getString("species"))
                    .location(rs.getString("location"))
                    .confidence(rs.getObject("confidence", Double.class))
                    .weightEstimateKg(rs.getObject("weight_estimate_kg", Double.class))
                    .marketPricePerKg(rs.getObject("market_price_per_kg", Integer.class))
                    .qualityGrade(rs.getString("quality_grade"))
                    .sustainable(rs.getObject("sustainable", Boolean.class))
                    .analysisStatus(rs.getString("analysis_status"))
                    .createdAt(createdAt == null ? null : createdAt.toInstant())
                    .build();
        }
    }
}
