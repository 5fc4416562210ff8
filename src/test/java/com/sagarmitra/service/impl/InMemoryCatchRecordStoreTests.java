package com.sagarmitra.service.impl;

import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryCatchRecordStoreTests {

    private final InMemoryCatchRecordStore store = new InMemoryCatchRecordStore();

    @Test
    void returnedRecordsAreCopies() {
        store.save(CatchRecordEntity.builder().imageId("img-1").userId("u1").species("Sardine").build());

        store.get("img-1").orElseThrow().setSpecies("Changed");

        assertThat(store.get("img-1").orElseThrow().getSpecies()).isEqualTo("Sardine");
    }

    @Test
    void undatedRecordsSortLast() {
        Instant now = Instant.parse("2024-10-01T00:00:00Z");
        store.save(CatchRecordEntity.builder().imageId("b").userId("u1").build());
        store.save(CatchRecordEntity.builder().imageId("a").userId("u1").createdAt(now).build());
        store.save(CatchRecordEntity.builder().imageId("c").userId("u1").createdAt(now.plusSeconds(60)).build());

        assertThat(store.listByUser("u1", 0, 10)).extracting(CatchRecordEntity::getImageId)
                .containsExactly("c", "a", "b");
        assertThat(store.listByUser("u1", 1, 1)).extracting(CatchRecordEntity::getImageId).containsExactly("a");
    }

    @Test
    void imageIdIsRequired() {
        assertThatThrownBy(() -> store.save(CatchRecordEntity.builder().userId("u1").build()))
                .isInstanceOf(NullPointerException.class);
    }
}
