package com.sagarmitra.controller;

import com.sagarmitra.service.CatchRecordStore;
import com.sagarmitra.service.impl.dto.ApiResponse;
import com.sagarmitra.service.impl.dto.RecordCatchRequest;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;

/**
 * Analysed catches read by the catch history tools. Records are written here by the image
 * analysis pipeline on behalf of the user named in {@value ConversationController#USER_HEADER}.
 */
@Tag(name = "Catches")
@RestController
@RequestMapping("/catches")
@RequiredArgsConstructor
@Slf4j
public class CatchRecordController {

    private final CatchRecordStore catchRecords;

    @Operation(summary = "Record an analysed catch", description = "Replaces an earlier record with the same image id.")
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ApiResponse<CatchRecordEntity>> record(@RequestHeader(ConversationController.USER_HEADER) String userId,
                                                       @Valid @RequestBody RecordCatchRequest request) {
        log.debug("Handling record catch userId={} imageId={}", userId, request.imageId());
        return Mono.fromCallable(() -> {
                    catchRecords.get(request.imageId())
                            .filter(existing -> !userId.equals(existing.getUserId()))
                            .ifPresent(existing -> {
                                throw new IllegalArgumentException("Image " + request.imageId() + " belongs to another user");
                            });
                    CatchRecordEntity entity = CatchRecordEntity.builder()
                            .imageId(request.imageId())
                            .userId(userId)
                            .species(request.species())
                            .location(request.location())
                            .confidence(request.confidence())
                            .weightEstimateKg(request.weightEstimateKg())
                            .marketPricePerKg(request.marketPricePerKg())
                            .qualityGrade(request.qualityGrade())
                            .sustainable(request.sustainable())
                            .analysisStatus(StringUtils.hasText(request.analysisStatus())
                                    ? request.analysisStatus()
                                    : CatchRecordEntity.STATUS_COMPLETED)
                            .createdAt(Instant.now())
                            .build();
                    catchRecords.save(entity);
                    return entity;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::ok);
    }

    @Operation(summary = "List the caller's catches", description = "Newest first.")
    @GetMapping
    public Mono<ApiResponse<List<CatchRecordEntity>>> list(@RequestHeader(ConversationController.USER_HEADER) String userId,
                                                           @RequestParam(value = "offset", defaultValue = "0") int offset,
                                                           @RequestParam(value = "limit", defaultValue = "20") int limit) {
        return Mono.fromCallable(() -> catchRecords.listByUser(userId, offset, Math.min(Math.max(limit, 1), 100)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::ok);
    }
}
