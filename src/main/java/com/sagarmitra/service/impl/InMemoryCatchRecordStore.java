package com.sagarmitra.service.impl;

import com.sagarmitra.service.CatchRecordStore;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
@ConditionalOnProperty(name = "agent.store.type", havingValue = "in-memory", matchIfMissing = true)
@Slf4j
public class InMemoryCatchRecordStore implements CatchRecordStore {

    private static final Comparator<CatchRecordEntity> NEWEST_FIRST = Comparator
            .comparing(CatchRecordEntity::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(CatchRecordEntity::getImageId);

    private final Map<String, CatchRecordEntity> records = new ConcurrentHashMap<>();

    @Override
    public void save(CatchRecordEntity record) {
        Objects.requireNonNull(record.getImageId(), "imageId");
        records.put(record.getImageId(), record.toBuilder().build());
        log.debug("Saved catch record imageId={} userId={}", record.getImageId(), record.getUserId());
    }

    @Override
    public Optional<CatchRecordEntity> get(String imageId) {
        CatchRecordEntity record = records.get(imageId);
        return record == null ? Optional.empty() : Optional.of(record.toBuilder().build());
    }

    @Override
    public List<CatchRecordEntity> listByUser(String userId, int offset, int limit) {
        return records.values().stream()
                .filter(record -> userId.equals(record.getUserId()))
                .sorted(NEWEST_FIRST)
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .map(record -> record.toBuilder().build())
                .toList();
    }
}
