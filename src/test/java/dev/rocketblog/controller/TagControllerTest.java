package dev.rocketblog.controller;

import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PageMeta;
import dev.rocketblog.dto.TagResponse;
import dev.rocketblog.service.TagService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TagControllerTest {

    @Mock
    private TagService tagService;

    @InjectMocks
    private TagController controller;

    private final TagResponse javaTag = TagResponse.builder().id("1").name("java").build();
    private final TagResponse rustTag = TagResponse.builder().id("2").name("rust").build();

    @Test
    @DisplayName("Should return the tag page from the service")
    void shouldReturnTags() {
        when(tagService.getTags(0, 50))
                .thenReturn(Mono.just(ApiResponse.withMeta(List.of(javaTag, rustTag), PageMeta.of(2, 50, 0))));

        StepVerifier.create(controller.getTags(0, 50))
                .assertNext(result -> {
                    assertThat(result.getData()).extracting("name").containsExactly("java", "rust");
                    assertThat(result.getMeta().getTotalPages()).isEqualTo(1);
                })
                .verifyComplete();

        verify(tagService).getTags(0, 50);
    }

    @Test
    @DisplayName("GET /api/v1/tags should apply default offset and limit")
    void shouldApplyDefaults() {
        when(tagService.getTags(0, 50))
                .thenReturn(Mono.just(ApiResponse.withMeta(List.of(javaTag), PageMeta.of(1, 50, 0))));

        WebTestClient.bindToController(controller).build()
                .get()
                .uri("/api/v1/tags")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data[0].name").isEqualTo("java")
                .jsonPath("$.meta.limit").isEqualTo(50)
                .jsonPath("$.meta.total_pages").isEqualTo(1);
    }
}
