package dev.rocketblog.controller;

import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.PostListRequest;
import dev.rocketblog.dto.PostResponse;
import dev.rocketblog.service.PostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/posts")
@Validated
@RequiredArgsConstructor
@Tag(name = "Posts", description = "Public post endpoints")
@Slf4j
public class PostController {

    private final PostService postService;

    @GetMapping
    @Operation(summary = "List published posts", description = "Paginated, searchable and sortable list of published posts with their tags")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Posts retrieved successfully"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid pagination, search or sort parameters")
    })
    public Mono<ApiResponse<List<PostResponse>>> getPosts(
            @RequestParam(defaultValue = "0") @Min(0) @Max(PostListRequest.MAX_OFFSET) int offset,
            @RequestParam(defaultValue = "20") @Min(1) @Max(PostListRequest.MAX_LIMIT) int limit,
            @Parameter(description = "Substring matched against title, body and author username")
            @RequestParam(required = false) @Size(max = PostListRequest.MAX_SEARCH_LENGTH) String search,
            @Parameter(description = "One of id, title, published_at, created_at, updated_at, view_count, like_count")
            @RequestParam(name = "order_by", required = false) String orderBy,
            @Parameter(description = "asc or desc")
            @RequestParam(name = "sort_direction", required = false) String sortDirection) {
        log.debug("Fetching posts: offset={}, limit={}, orderBy={}, sortDirection={}", offset, limit, orderBy, sortDirection);
        return postService.listPosts(toRequest(offset, limit, search, orderBy, sortDirection));
    }

    @GetMapping("/random")
    @Operation(summary = "Random published posts", description = "A random selection of published posts")
    public Mono<ApiResponse<List<PostResponse>>> getRandomPosts(
            @RequestParam(defaultValue = "6") @Min(1) @Max(PostListRequest.MAX_LIMIT) int limit) {
        log.debug("Fetching {} random posts", limit);
        return postService.getRandomPosts(limit);
    }

    @GetMapping("/u/{username}/{slug}")
    @Operation(summary = "Get post by author and slug", description = "A single published post with its full body and tags")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Post found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Post not found")
    })
    public Mono<ApiResponse<PostResponse>> getPostByUsernameAndSlug(
            @PathVariable @Size(min = 1, max = 100) String username,
            @PathVariable @Size(min = 1, max = 255) String slug) {
        log.debug("Fetching post by username={} slug={}", username, slug);
        return postService.getPostByUsernameAndSlug(username, slug);
    }

    @GetMapping("/tag/{tagName}")
    @Operation(summary = "List posts by tag", description = "Published posts carrying the given tag, paginated like the main listing")
    public Mono<ApiResponse<List<PostResponse>>> getPostsByTag(
            @PathVariable @Size(min = 1, max = 100) String tagName,
            @RequestParam(defaultValue = "0") @Min(0) @Max(PostListRequest.MAX_OFFSET) int offset,
            @RequestParam(defaultValue = "20") @Min(1) @Max(PostListRequest.MAX_LIMIT) int limit,
            @RequestParam(required = false) @Size(max = PostListRequest.MAX_SEARCH_LENGTH) String search,
            @RequestParam(name = "order_by", required = false) String orderBy,
            @RequestParam(name = "sort_direction", required = false) String sortDirection) {
        log.debug("Fetching posts by tag={}: offset={}, limit={}", tagName, offset, limit);
        return postService.listPostsByTag(tagName, toRequest(offset, limit, search, orderBy, sortDirection));
    }

    private static PostListRequest toRequest(int offset, int limit, String search, String orderBy, String sortDirection) {
        return PostListRequest.builder()
                .offset(offset)
                .limit(limit)
                .search(search)
                .orderBy(orderBy)
                .sortDirection(sortDirection)
                .build();
    }
}
