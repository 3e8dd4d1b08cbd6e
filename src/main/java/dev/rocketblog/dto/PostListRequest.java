package dev.rocketblog.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Page request for post listings: offset/limit window, optional search text and
 * optional ordering. {@code orderBy} and {@code sortDirection} stay raw strings here;
 * they are resolved against the whitelist by the query builder, which also
 * enforces the window and search-length bounds below.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostListRequest {

    public static final int DEFAULT_OFFSET = 0;
    public static final int MAX_OFFSET = 10_000;
    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;
    public static final int MAX_SEARCH_LENGTH = 200;

    @Builder.Default
    private int offset = DEFAULT_OFFSET;

    @Builder.Default
    private int limit = DEFAULT_LIMIT;

    private String search;

    private String orderBy;

    private String sortDirection;

    public boolean hasSearch() {
        return search != null && !search.isBlank();
    }
}
