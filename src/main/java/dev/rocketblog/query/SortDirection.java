package dev.rocketblog.query;

import dev.rocketblog.exception.InvalidRequestException;

import java.util.Locale;

public enum SortDirection {
    ASC,
    DESC;

    public static final SortDirection DEFAULT = DESC;

    /**
     * Parse a client-supplied direction ({@code asc}/{@code desc}, any case).
     * Null or blank yields {@link #DEFAULT}.
     *
     * @throws InvalidRequestException for any other value
     */
    public static SortDirection fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "asc" -> ASC;
            case "desc" -> DESC;
            default -> throw new InvalidRequestException("sort_direction", "error.invalid_sort_direction");
        };
    }

    public String sql() {
        return name();
    }
}
