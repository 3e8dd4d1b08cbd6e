package dev.rocketblog.repository;

import dev.rocketblog.entity.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.OffsetDateTime;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class PostTagRepositoryImpl implements PostTagRepository {

    private final DatabaseClient databaseClient;

    static final String FIND_TAGS_BY_POST_IDS = """
            SELECT ptt.post_id, t.id, t.name, t.created_at
            FROM tags t
            INNER JOIN posts_to_tags ptt ON t.id = ptt.tag_id
            WHERE ptt.post_id = ANY($1)
            ORDER BY t.name, t.id""";

    @Override
    public Flux<PostTag> findTagsByPostIds(UUID[] postIds) {
        return databaseClient.sql(FIND_TAGS_BY_POST_IDS)
                .bind(0, postIds)
                .map((row, meta) -> new PostTag(
                        row.get("post_id", UUID.class),
                        Tag.builder()
                                .id(row.get("id", UUID.class))
                                .name(row.get("name", String.class))
                                .createdAt(row.get("created_at", OffsetDateTime.class))
                                .build()))
                .all();
    }
}
