package dev.rocketblog.service;

import dev.rocketblog.config.ResilienceConfig;
import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PostListRequest;
import dev.rocketblog.dto.PostResponse;
import dev.rocketblog.entity.Post;
import dev.rocketblog.exception.ResourceNotFoundException;
import dev.rocketblog.query.PostQuery;
import dev.rocketblog.query.PostQueryBuilder;
import dev.rocketblog.repository.PostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PostService {

    public static final int DEFAULT_RANDOM_LIMIT = 6;

    private final PostRepository postRepository;
    private final PostQueryBuilder queryBuilder;
    private final TagBatchResolver tagBatchResolver;
    private final PostResponseAssembler assembler;
    private final ResilienceConfig resilience;

    public Mono<ApiResponse<List<PostResponse>>> listPosts(PostListRequest request) {
        return Mono.fromCallable(() -> queryBuilder.build(request))
                .flatMap(query -> executeListing("listPosts", query));
    }

    public Mono<ApiResponse<List<PostResponse>>> listPostsByTag(String tagName, PostListRequest request) {
        return Mono.fromCallable(() -> queryBuilder.build(request, tagName))
                .flatMap(query -> executeListing("listPostsByTag", query));
    }

    /**
     * Page and count statements are independent and run concurrently; the tag batch
     * needs the page ids and runs after.
     */
    private Mono<ApiResponse<List<PostResponse>>> executeListing(String operation, PostQuery query) {
        String intent = operation + " " + query.describe();
        log.debug("Running {}", intent);

        Mono<List<Post>> pageMono = postRepository.findPage(query.page()).collectList();
        Mono<Long> countMono = postRepository.count(query.count());

        return Mono.zip(pageMono, countMono)
                .flatMap(tuple -> {
                    List<Post> posts = tuple.getT1();
                    long total = tuple.getT2();
                    return tagBatchResolver.resolve(ids(posts))
                            .map(tags -> assembler.toPage(posts, tags, total, query.limit(), query.offset()));
                })
                .transform(op -> resilience.bounded(op, intent));
    }

    public Mono<ApiResponse<List<PostResponse>>> getRandomPosts(int limit) {
        return postRepository.findRandom(limit)
                .collectList()
                .flatMap(posts -> tagBatchResolver.resolve(ids(posts))
                        .map(tags -> assembler.toPage(posts, tags, posts.size(), limit, 0)))
                .transform(op -> resilience.bounded(op, "getRandomPosts limit=" + limit));
    }

    public Mono<ApiResponse<PostResponse>> getPostByUsernameAndSlug(String username, String slug) {
        return postRepository.findByUsernameAndSlug(username, slug)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Post", "slug", username + "/" + slug)))
                .flatMap(post -> tagBatchResolver.resolve(List.of(post.getId()))
                        .map(tags -> assembler.toDetail(post, tags.getOrDefault(post.getId(), List.of()))))
                .transform(op -> resilience.bounded(op, "getPostByUsernameAndSlug"));
    }

    private static List<UUID> ids(List<Post> posts) {
        return posts.stream().map(Post::getId).toList();
    }
}
