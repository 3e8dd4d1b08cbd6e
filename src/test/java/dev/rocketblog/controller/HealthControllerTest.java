package dev.rocketblog.controller;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.test.web.reactive.server.WebTestClient;

class HealthControllerTest {

    private final WebTestClient webTestClient = WebTestClient.bindToController(new HealthController()).build();

    @ParameterizedTest
    @ValueSource(strings = {"/", "/api/v1/health"})
    void shouldReportLiveness(String path) {
        webTestClient.get()
                .uri(path)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.message").isEqualTo("ok");
    }
}
