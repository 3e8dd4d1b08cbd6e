package dev.rocketblog.service;

import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PostResponse;
import dev.rocketblog.entity.Post;
import dev.rocketblog.entity.Tag;
import dev.rocketblog.entity.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PostResponseAssemblerTest {

    private final PostResponseAssembler assembler = new PostResponseAssembler(10);

    private static Post post(String title, String body) {
        UUID authorId = UUID.randomUUID();
        return Post.builder()
                .id(UUID.randomUUID())
                .title(title)
                .body(body)
                .slug(title.toLowerCase())
                .createdBy(authorId)
                .publishedAt(OffsetDateTime.parse("2024-05-01T10:00:00Z"))
                .viewCount(12)
                .author(User.builder().id(authorId).username("alice").build())
                .build();
    }

    @Test
    @DisplayName("Should attach tags and an empty list for untagged posts")
    void shouldAttachTags() {
        Post tagged = post("Tagged", "short");
        Post untagged = post("Untagged", "short");
        Tag java = Tag.builder().id(UUID.randomUUID()).name("java").build();

        ApiResponse<List<PostResponse>> response = assembler.toPage(
                List.of(tagged, untagged), Map.of(tagged.getId(), List.of(java)), 2, 20, 0);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getData()).hasSize(2);
        assertThat(response.getData().get(0).getTags()).extracting("name").containsExactly("java");
        assertThat(response.getData().get(1).getTags()).isNotNull().isEmpty();
    }

    @Test
    @DisplayName("Should nest author and keep post order")
    void shouldNestAuthor() {
        Post first = post("First", "a");
        Post second = post("Second", "b");

        ApiResponse<List<PostResponse>> response = assembler.toPage(List.of(first, second), Map.of(), 2, 20, 0);

        assertThat(response.getData()).extracting(PostResponse::getTitle).containsExactly("First", "Second");
        PostResponse firstResponse = response.getData().get(0);
        assertThat(firstResponse.getAuthor().getUsername()).isEqualTo("alice");
        assertThat(firstResponse.getAuthor().getId()).isEqualTo(first.getCreatedBy().toString());
        assertThat(firstResponse.getViewCount()).isEqualTo(12);
        assertThat(firstResponse.getLikeCount()).isZero();
    }

    @Test
    @DisplayName("Should compute pagination metadata")
    void shouldComputeMeta() {
        ApiResponse<List<PostResponse>> response = assembler.toPage(List.of(), Map.of(), 5, 2, 4);

        assertThat(response.getMeta().getTotalItems()).isEqualTo(5);
        assertThat(response.getMeta().getTotalPages()).isEqualTo(3);
        assertThat(response.getMeta().getLimit()).isEqualTo(2);
        assertThat(response.getMeta().getOffset()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should truncate long bodies in list views only")
    void shouldTruncateListBodies() {
        Post post = post("Long", "0123456789abcdef");

        ApiResponse<List<PostResponse>> list = assembler.toPage(List.of(post), Map.of(), 1, 20, 0);
        ApiResponse<PostResponse> detail = assembler.toDetail(post, List.of());

        assertThat(list.getData().get(0).getBody()).isEqualTo("0123456789...");
        assertThat(detail.getData().getBody()).isEqualTo("0123456789abcdef");
        assertThat(detail.getMeta()).isNull();
    }

    @Test
    @DisplayName("Should not truncate when the limit is disabled")
    void shouldNotTruncateWhenDisabled() {
        PostResponseAssembler unlimited = new PostResponseAssembler(0);
        Post post = post("Long", "0123456789abcdef");

        ApiResponse<List<PostResponse>> list = unlimited.toPage(List.of(post), Map.of(), 1, 20, 0);

        assertThat(list.getData().get(0).getBody()).isEqualTo("0123456789abcdef");
    }
}
