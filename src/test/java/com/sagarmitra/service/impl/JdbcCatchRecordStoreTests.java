package com.sagarmitra.service.impl;

import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcCatchRecordStoreTests {

    private static final Instant BASE = Instant.parse("2024-11-01T06:00:00Z");

    private EmbeddedDatabase database;
    private JdbcCatchRecordStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("classpath:schema.sql")
                .build();
        store = new JdbcCatchRecordStore(new NamedParameterJdbcTemplate(database));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void savedRecordRoundTrips() {
        CatchRecordEntity saved = CatchRecordEntity.builder()
                .imageId("img-1")
                .userId("u1")
                .species("Pomfret")
                .location("Veraval")
                .confidence(0.93)
                .weightEstimateKg(0.8)
                .marketPricePerKg(750)
                .qualityGrade("B")
                .sustainable(false)
                .analysisStatus(CatchRecordEntity.STATUS_COMPLETED)
                .createdAt(BASE)
                .build();
        store.save(saved);

        assertThat(store.get("img-1")).contains(saved);
        assertThat(store.get("img-2")).isEmpty();
    }

    @Test
    void saveReplacesExistingRecord() {
        store.save(CatchRecordEntity.builder().imageId("img-1").userId("u1").analysisStatus("pending").createdAt(BASE).build());
        store.save(CatchRecordEntity.builder().imageId("img-1").userId("u1").species("Tuna")
                .analysisStatus(CatchRecordEntity.STATUS_COMPLETED).createdAt(BASE).build());

        CatchRecordEntity loaded = store.get("img-1").orElseThrow();
        assertThat(loaded.getSpecies()).isEqualTo("Tuna");
        assertThat(loaded.getAnalysisStatus()).isEqualTo(CatchRecordEntity.STATUS_COMPLETED);
        assertThat(loaded.getConfidence()).isNull();
        assertThat(store.listByUser("u1", 0, 10)).hasSize(1);
    }

    @Test
    void listByUserPagesNewestFirst() {
        for (int i = 1; i <= 5; i++) {
            store.save(CatchRecordEntity.builder().imageId("img-" + i).userId("u1")
                    .createdAt(BASE.plusSeconds(i * 3_600L)).build());
        }
        store.save(CatchRecordEntity.builder().imageId("img-x").userId("u2").createdAt(BASE).build());

        List<CatchRecordEntity> first = store.listByUser("u1", 0, 2);
        List<CatchRecordEntity> second = store.listByUser("u1", 2, 2);
        List<CatchRecordEntity> beyond = store.listByUser("u1", 10, 2);

        assertThat(first).extracting(CatchRecordEntity::getImageId).containsExactly("img-5", "img-4");
        assertThat(second).extracting(CatchRecordEntity::getImageId).containsExactly("img-3", "img-2");
        assertThat(beyond).isEmpty();
    }
}
