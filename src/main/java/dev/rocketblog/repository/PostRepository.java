package dev.rocketblog.repository;

import dev.rocketblog.entity.Post;
import dev.rocketblog.query.SqlStatement;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to published posts joined with their author.
 * Listing statements are built by {@link dev.rocketblog.query.PostQueryBuilder};
 * the fixed lookups live in the implementation.
 */
public interface PostRepository {

    Flux<Post> findPage(SqlStatement statement);

    Mono<Long> count(SqlStatement statement);

    Flux<Post> findRandom(int limit);

    Mono<Post> findByUsernameAndSlug(String username, String slug);
}
