package dev.rocketblog.repository;

import dev.rocketblog.entity.Tag;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Repository
public interface TagRepository extends ReactiveCrudRepository<Tag, UUID> {

    @Query("SELECT id, name, created_at FROM tags ORDER BY name, id LIMIT :limit OFFSET :offset")
    Flux<Tag> findAllOrderByName(int limit, int offset);

    @Query("SELECT COUNT(*) FROM tags")
    Mono<Long> countAll();
}
