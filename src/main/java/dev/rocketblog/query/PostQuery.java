package dev.rocketblog.query;

/**
 * The page statement and its count twin for one listing request, plus the
 * resolved window so callers can build pagination metadata.
 */
public record PostQuery(
        SqlStatement page,
        SqlStatement count,
        PostSortField sortField,
        SortDirection direction,
        int limit,
        int offset
) {

    /**
     * Sort and window of this query for log lines. Never includes search text or tag names.
     */
    public String describe() {
        return "orderBy=" + sortField.getValue() + " direction=" + direction + " limit=" + limit + " offset=" + offset;
    }
}
