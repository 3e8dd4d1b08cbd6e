package dev.rocketblog.repository;

import dev.rocketblog.entity.Post;
import dev.rocketblog.entity.User;
import dev.rocketblog.query.SqlStatement;
import io.r2dbc.spi.Row;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.UUID;

/**
 * {@link PostRepository} on top of {@link DatabaseClient}. Each statement borrows a
 * pooled connection for its own execution and hands it back on completion, error
 * or cancellation.
 */
@Repository
@RequiredArgsConstructor
public class PostRepositoryImpl implements PostRepository {

    private final DatabaseClient databaseClient;

    private static final String FIND_RANDOM = """
            SELECT p.id, p.title, p.body, p.created_by, p.slug, p.photo_url, p.published,
                   p.published_at, p.created_at, p.updated_at, p.view_count, p.like_count, u.username
            FROM posts p
            INNER JOIN users u ON p.created_by = u.id
            WHERE p.published = true AND p.deleted_at IS NULL
            ORDER BY RANDOM()
            LIMIT $1""";

    private static final String FIND_BY_USERNAME_AND_SLUG = """
            SELECT p.id, p.title, p.body, p.created_by, p.slug, p.photo_url, p.published,
                   p.published_at, p.created_at, p.updated_at, p.view_count, p.like_count, u.username
            FROM posts p
            INNER JOIN users u ON p.created_by = u.id
            WHERE u.username = $1 AND p.slug = $2
              AND p.published = true AND p.deleted_at IS NULL""";

    @Override
    public Flux<Post> findPage(SqlStatement statement) {
        return bind(statement)
                .map((row, meta) -> mapRowToPost(row))
                .all();
    }

    @Override
    public Mono<Long> count(SqlStatement statement) {
        return bind(statement)
                .map((row, meta) -> row.get(0, Long.class))
                .one()
                .defaultIfEmpty(0L);
    }

    @Override
    public Flux<Post> findRandom(int limit) {
        return databaseClient.sql(FIND_RANDOM)
                .bind(0, limit)
                .map((row, meta) -> mapRowToPost(row))
                .all();
    }

    @Override
    public Mono<Post> findByUsernameAndSlug(String username, String slug) {
        return databaseClient.sql(FIND_BY_USERNAME_AND_SLUG)
                .bind(0, username)
                .bind(1, slug)
                .map((row, meta) -> mapRowToPost(row))
                .one();
    }

    private DatabaseClient.GenericExecuteSpec bind(SqlStatement statement) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(statement.sql());
        for (int i = 0; i < statement.bindings().size(); i++) {
            spec = spec.bind(i, statement.bindings().get(i));
        }
        return spec;
    }

    static Post mapRowToPost(Row row) {
        UUID authorId = row.get("created_by", UUID.class);
        return Post.builder()
                .id(row.get("id", UUID.class))
                .title(row.get("title", String.class))
                .body(row.get("body", String.class))
                .createdBy(authorId)
                .slug(row.get("slug", String.class))
                .photoUrl(row.get("photo_url", String.class))
                .published(row.get("published", Boolean.class))
                .publishedAt(row.get("published_at", OffsetDateTime.class))
                .createdAt(row.get("created_at", OffsetDateTime.class))
                .updatedAt(row.get("updated_at", OffsetDateTime.class))
                .viewCount(row.get("view_count", Integer.class))
                .likeCount(row.get("like_count", Integer.class))
                .author(User.builder()
                        .id(authorId)
                        .username(row.get("username", String.class))
                        .build())
                .tags(new ArrayList<>())
                .build();
    }
}
