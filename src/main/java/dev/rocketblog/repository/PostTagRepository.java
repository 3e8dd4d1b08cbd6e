package dev.rocketblog.repository;

import reactor.core.publisher.Flux;

import java.util.UUID;

/**
 * Repository for the posts_to_tags many-to-many relationship.
 * R2DBC has no join entities, so the implementation goes through DatabaseClient.
 */
public interface PostTagRepository {

    /**
     * All tags of the given posts in a single statement, ordered by tag name.
     */
    Flux<PostTag> findTagsByPostIds(UUID[] postIds);
}
