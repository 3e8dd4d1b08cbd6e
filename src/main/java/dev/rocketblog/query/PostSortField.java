package dev.rocketblog.query;

import dev.rocketblog.exception.InvalidRequestException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of fields a post listing may be ordered by. Only the column
 * references declared here ever reach an ORDER BY clause.
 */
public enum PostSortField {
    ID("id", "p.id"),
    TITLE("title", "p.title"),
    PUBLISHED_AT("published_at", "p.published_at"),
    CREATED_AT("created_at", "p.created_at"),
    UPDATED_AT("updated_at", "p.updated_at"),
    VIEW_COUNT("view_count", "p.view_count"),
    LIKE_COUNT("like_count", "p.like_count");

    public static final PostSortField DEFAULT = PUBLISHED_AT;

    private static final Map<String, PostSortField> BY_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(PostSortField::getValue, Function.identity()));

    private final String value;
    private final String column;

    PostSortField(String value, String column) {
        this.value = value;
        this.column = column;
    }

    public String getValue() {
        return value;
    }

    public String getColumn() {
        return column;
    }

    /**
     * Resolve a client-supplied {@code order_by} value. Null or blank yields {@link #DEFAULT}.
     *
     * @throws InvalidRequestException when the value is not whitelisted
     */
    public static PostSortField fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        PostSortField field = BY_VALUE.get(value.trim().toLowerCase(Locale.ROOT));
        if (field == null) {
            throw new InvalidRequestException("order_by", "error.invalid_order_by");
        }
        return field;
    }
}
