package com.sagarmitra.controller;

import com.sagarmitra.service.impl.InMemoryCatchRecordStore;
import com.sagarmitra.service.impl.entity.CatchRecordEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.assertj.core.api.Assertions.assertThat;

class CatchRecordControllerTests {

    private InMemoryCatchRecordStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryCatchRecordStore();
        client = WebTestClient.bindToController(new CatchRecordController(store))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void recordedCatchIsOwnedByTheCaller() {
        client.post().uri("/catches")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"imageId":"img-9","species":"Seer Fish","location":"Kochi","confidence":0.82,
                         "weightEstimateKg":2.4,"marketPricePerKg":650}
                        """)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.data.imageId").isEqualTo("img-9")
                .jsonPath("$.data.analysisStatus").isEqualTo("completed");

        CatchRecordEntity stored = store.get("img-9").orElseThrow();
        assertThat(stored.getUserId()).isEqualTo("u1");
        assertThat(stored.getCreatedAt()).isNotNull();

        client.get().uri("/catches")
                .header("X-User-Id", "u1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.length()").isEqualTo(1)
                .jsonPath("$.data[0].species").isEqualTo("Seer Fish");
    }

    @Test
    void anotherUsersImageCannotBeOverwritten() {
        store.save(CatchRecordEntity.builder().imageId("img-1").userId("owner").species("Tuna").build());

        client.post().uri("/catches")
                .header("X-User-Id", "intruder")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"imageId\":\"img-1\",\"species\":\"Shark\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");

        assertThat(store.get("img-1").orElseThrow().getSpecies()).isEqualTo("Tuna");
    }

    @Test
    void invalidConfidenceIsRejected() {
        client.post().uri("/catches")
                .header("X-User-Id", "u1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"imageId\":\"img-2\",\"confidence\":87}")
                .exchange()
                .expectStatus().isBadRequest();
    }
}
