package com.sagarmitra.service;

import com.sagarmitra.service.impl.entity.CatchRecordEntity;

import java.util.List;
import java.util.Optional;

/**
 * Per-user catch records produced by image analysis.
 */
public interface CatchRecordStore {

    /** Inserts the record or replaces the one with the same image id. */
    void save(CatchRecordEntity record);

    Optional<CatchRecordEntity> get(String imageId);

    /** Records of {@code userId}, newest first, skipping the first {@code offset}. */
    List<CatchRecordEntity> listByUser(String userId, int offset, int limit);
}
