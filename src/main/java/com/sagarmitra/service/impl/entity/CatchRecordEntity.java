package com.sagarmitra.service.impl.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One analysed catch photo. Written by the image analysis pipeline and only read by the agent.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CatchRecordEntity {
    public static final String STATUS_COMPLETED = "completed";

    private String imageId;
    private String userId;
    private String species;
    private String location;
    /** Species detection confidence as a fraction in [0, 1]. */
    private Double confidence;
    private Double weightEstimateKg;
    /** Estimated market price in INR per kg. */
    private Integer marketPricePerKg;
    private String qualityGrade;
    private Boolean sustainable;
    private String analysisStatus;
    private Instant createdAt;
}
