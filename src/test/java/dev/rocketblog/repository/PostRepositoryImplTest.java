package dev.rocketblog.repository;

import dev.rocketblog.entity.Post;
import dev.rocketblog.query.SqlStatement;
import io.r2dbc.spi.Row;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostRepositoryImplTest {

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private DatabaseClient.GenericExecuteSpec executeSpec;

    @SuppressWarnings("rawtypes")
    @Mock
    private RowsFetchSpec fetchSpec;

    @InjectMocks
    private PostRepositoryImpl postRepository;

    @SuppressWarnings("unchecked")
    @BeforeEach
    void setUp() {
        lenient().when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        lenient().when(executeSpec.bind(anyInt(), any())).thenReturn(executeSpec);
        lenient().when(executeSpec.map(any(BiFunction.class))).thenReturn(fetchSpec);
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should bind every value positionally in statement order")
    void shouldBindPositionally() {
        when(fetchSpec.all()).thenReturn(Flux.empty());
        SqlStatement statement = new SqlStatement("SELECT ... LIMIT $2 OFFSET $3", List.of("%java%", 20, 40));

        StepVerifier.create(postRepository.findPage(statement)).verifyComplete();

        verify(databaseClient).sql("SELECT ... LIMIT $2 OFFSET $3");
        InOrder inOrder = inOrder(executeSpec);
        inOrder.verify(executeSpec).bind(0, "%java%");
        inOrder.verify(executeSpec).bind(1, 20);
        inOrder.verify(executeSpec).bind(2, 40);
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should return the count from the single result row")
    void shouldReturnCount() {
        when(fetchSpec.one()).thenReturn(Mono.just(42L));

        StepVerifier.create(postRepository.count(new SqlStatement("SELECT COUNT(*) FROM posts p", List.of())))
                .expectNext(42L)
                .verifyComplete();

        verify(executeSpec, never()).bind(anyInt(), any());
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should treat an empty count result as zero")
    void shouldDefaultCountToZero() {
        when(fetchSpec.one()).thenReturn(Mono.empty());

        StepVerifier.create(postRepository.count(new SqlStatement("SELECT COUNT(*) FROM posts p", List.of())))
                .expectNext(0L)
                .verifyComplete();
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should bind the random sample size")
    void shouldBindRandomLimit() {
        when(fetchSpec.all()).thenReturn(Flux.empty());

        StepVerifier.create(postRepository.findRandom(6)).verifyComplete();

        verify(databaseClient).sql(contains("ORDER BY RANDOM()"));
        verify(executeSpec).bind(0, 6);
    }

    @SuppressWarnings("unchecked")
    @Test
    @DisplayName("Should bind username before slug")
    void shouldBindUsernameAndSlug() {
        when(fetchSpec.one()).thenReturn(Mono.empty());

        StepVerifier.create(postRepository.findByUsernameAndSlug("alice", "hello-world")).verifyComplete();

        verify(executeSpec).bind(0, "alice");
        verify(executeSpec).bind(1, "hello-world");
    }

    @Test
    @DisplayName("Should map a joined row to a post with its author")
    void shouldMapRow() {
        Row row = mock(Row.class);
        UUID postId = UUID.randomUUID();
        UUID authorId = UUID.randomUUID();
        OffsetDateTime publishedAt = OffsetDateTime.parse("2024-03-01T10:15:30Z");
        lenient().when(row.get("id", UUID.class)).thenReturn(postId);
        lenient().when(row.get("created_by", UUID.class)).thenReturn(authorId);
        lenient().when(row.get("title", String.class)).thenReturn("Hello");
        lenient().when(row.get("body", String.class)).thenReturn("World");
        lenient().when(row.get("slug", String.class)).thenReturn("hello");
        lenient().when(row.get("published_at", OffsetDateTime.class)).thenReturn(publishedAt);
        lenient().when(row.get("view_count", Integer.class)).thenReturn(7);
        lenient().when(row.get("username", String.class)).thenReturn("alice");

        Post post = PostRepositoryImpl.mapRowToPost(row);

        assertThat(post.getId()).isEqualTo(postId);
        assertThat(post.getTitle()).isEqualTo("Hello");
        assertThat(post.getSlug()).isEqualTo("hello");
        assertThat(post.getPublishedAt()).isEqualTo(publishedAt);
        assertThat(post.getViewCount()).isEqualTo(7);
        assertThat(post.getPhotoUrl()).isNull();
        assertThat(post.getAuthor().getId()).isEqualTo(authorId);
        assertThat(post.getAuthor().getUsername()).isEqualTo("alice");
        assertThat(post.getTags()).isEmpty();
    }
}
