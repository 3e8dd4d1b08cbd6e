package dev.rocketblog.service;

import dev.rocketblog.entity.Tag;
import dev.rocketblog.repository.PostTag;
import dev.rocketblog.repository.PostTagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Resolves the tags of a whole page of posts with one statement instead of one per post.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TagBatchResolver {

    private final PostTagRepository postTagRepository;

    /**
     * Fetch and group tags for the given posts.
     * <p>
     * An empty id collection completes with an empty map without a round trip.
     * Otherwise exactly one query is issued; each list keeps the store order
     * (tag name). Posts without tags have no key in the result.
     *
     * @param postIds ids of the posts on the current page
     * @return tags per post id
     */
    public Mono<Map<UUID, List<Tag>>> resolve(Collection<UUID> postIds) {
        if (postIds == null || postIds.isEmpty()) {
            return Mono.just(Map.of());
        }
        UUID[] ids = new LinkedHashSet<>(postIds).toArray(new UUID[0]);
        log.debug("Resolving tags for {} posts", ids.length);

        return postTagRepository.findTagsByPostIds(ids)
                .<Map<UUID, List<Tag>>>collect(LinkedHashMap::new, TagBatchResolver::addToGroup);
    }

    private static void addToGroup(Map<UUID, List<Tag>> groups, PostTag row) {
        groups.computeIfAbsent(row.postId(), id -> new ArrayList<>()).add(row.tag());
    }
}
