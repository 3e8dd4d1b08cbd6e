package dev.rocketblog.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Read projection of a row in {@code posts}. The author is joined in by the
 * list queries; tags are attached afterwards in one batch per page.
 */
@Table("posts")
@Getter
@Setter
@ToString(exclude = {"body", "tags"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Post {

    @Id
    private UUID id;

    private String title;

    private String body;

    @Column("created_by")
    private UUID createdBy;

    private String slug;

    @Column("photo_url")
    private String photoUrl;

    private Boolean published;

    @Column("published_at")
    private OffsetDateTime publishedAt;

    @Column("created_at")
    private OffsetDateTime createdAt;

    @Column("updated_at")
    private OffsetDateTime updatedAt;

    @Column("view_count")
    private Integer viewCount;

    @Column("like_count")
    private Integer likeCount;

    @Transient
    private User author;

    @Transient
    @Builder.Default
    private List<Tag> tags = new ArrayList<>();
}
