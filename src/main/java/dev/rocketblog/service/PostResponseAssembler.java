package dev.rocketblog.service;

import dev.rocketblog.dto.ApiResponse;
import dev.rocketblog.dto.AuthorResponse;
import dev.rocketblog.dto.PageMeta;
import dev.rocketblog.dto.PostResponse;
import dev.rocketblog.dto.TagResponse;
import dev.rocketblog.entity.Post;
import dev.rocketblog.entity.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Maps posts, their resolved tags and the page window into the outward envelope.
 */
@Component
public class PostResponseAssembler {

    private static final String ELLIPSIS = "...";

    private final int listBodyMaxLength;

    public PostResponseAssembler(@Value("${app.posts.list-body-max-length:300}") int listBodyMaxLength) {
        this.listBodyMaxLength = listBodyMaxLength;
    }

    public ApiResponse<List<PostResponse>> toPage(List<Post> posts, Map<UUID, List<Tag>> tagsByPost,
                                                  long totalItems, int limit, int offset) {
        List<PostResponse> data = posts.stream()
                .map(post -> toResponse(post, tagsByPost.getOrDefault(post.getId(), List.of()), true))
                .toList();
        return ApiResponse.withMeta(data, PageMeta.of(totalItems, limit, offset));
    }

    public ApiResponse<PostResponse> toDetail(Post post, List<Tag> tags) {
        return ApiResponse.success(toResponse(post, tags, false));
    }

    private PostResponse toResponse(Post post, List<Tag> tags, boolean listView) {
        return PostResponse.builder()
                .id(String.valueOf(post.getId()))
                .title(post.getTitle())
                .body(listView ? truncate(post.getBody()) : post.getBody())
                .slug(post.getSlug())
                .photoUrl(post.getPhotoUrl())
                .publishedAt(post.getPublishedAt())
                .createdAt(post.getCreatedAt())
                .updatedAt(post.getUpdatedAt())
                .viewCount(post.getViewCount() != null ? post.getViewCount() : 0)
                .likeCount(post.getLikeCount() != null ? post.getLikeCount() : 0)
                .author(post.getAuthor() != null
                        ? AuthorResponse.builder()
                                .id(String.valueOf(post.getAuthor().getId()))
                                .username(post.getAuthor().getUsername())
                                .build()
                        : null)
                .tags(tags.stream().map(PostResponseAssembler::toTagResponse).toList())
                .build();
    }

    static TagResponse toTagResponse(Tag tag) {
        return TagResponse.builder()
                .id(String.valueOf(tag.getId()))
                .name(tag.getName())
                .createdAt(tag.getCreatedAt())
                .build();
    }

    private String truncate(String body) {
        if (body == null || listBodyMaxLength <= 0 || body.length() <= listBodyMaxLength) {
            return body;
        }
        return body.substring(0, listBodyMaxLength) + ELLIPSIS;
    }
}
