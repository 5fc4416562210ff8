package com.sagarmitra.service.impl.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * Result of one catch photo analysis, as posted by the image pipeline.
 */
public record RecordCatchRequest(@NotBlank @Size(max = 64) String imageId,
                                 @Size(max = 128) String species,
                                 @Size(max = 255) String location,
                                 @DecimalMin("0.0") @DecimalMax("1.0") Double confidence,
                                 @PositiveOrZero Double weightEstimateKg,
                                 @PositiveOrZero Integer marketPricePerKg,
                                 @Size(max = 32) String qualityGrade,
                                 Boolean sustainable,
                                 @Size(max = 32) String analysisStatus) {
}
