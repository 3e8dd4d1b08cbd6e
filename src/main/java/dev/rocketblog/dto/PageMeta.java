package dev.rocketblog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageMeta {

    @JsonProperty("total_items")
    private long totalItems;

    private int offset;

    private int limit;

    @JsonProperty("total_pages")
    private long totalPages;

    /**
     * Pagination metadata for one page of results.
     * {@code totalPages} is {@code ceil(totalItems / limit)}, zero when there are no items.
     * {@code limit} must already be validated as positive.
     */
    public static PageMeta of(long totalItems, int limit, int offset) {
        long totalPages = totalItems <= 0 ? 0 : (totalItems + limit - 1) / limit;
        return PageMeta.builder()
                .totalItems(totalItems)
                .offset(offset)
                .limit(limit)
                .totalPages(totalPages)
                .build();
    }
}
