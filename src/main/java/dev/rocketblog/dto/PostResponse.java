package dev.rocketblog.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PostResponse {
    private String id;
    private String title;
    private String body;
    private String slug;
    @JsonProperty("photo_url")
    private String photoUrl;
    @JsonProperty("published_at")
    private OffsetDateTime publishedAt;
    @JsonProperty("created_at")
    private OffsetDateTime createdAt;
    @JsonProperty("updated_at")
    private OffsetDateTime updatedAt;
    @JsonProperty("view_count")
    private Integer viewCount;
    @JsonProperty("like_count")
    private Integer likeCount;
    private AuthorResponse author;
    // always present, empty when the post has no tags
    @JsonInclude(JsonInclude.Include.ALWAYS)
    @Builder.Default
    private List<TagResponse> tags = List.of();
}
