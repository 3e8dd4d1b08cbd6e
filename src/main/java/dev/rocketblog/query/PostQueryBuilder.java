package dev.rocketblog.query;

import dev.rocketblog.dto.PostListRequest;
import dev.rocketblog.exception.InvalidRequestException;
import dev.rocketblog.util.LikePatterns;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the parameterized page and count statements for post listings.
 * <p>
 * User input only ever reaches the SQL as bound values. The ORDER BY column comes
 * from {@link PostSortField} and the direction from {@link SortDirection}; both are
 * resolved before any text is assembled, so an unknown value fails the request
 * without touching the store.
 */
@Component
public class PostQueryBuilder {

    static final String ALIAS_POSTS = "p";
    static final String ALIAS_USERS = "u";

    static final String POST_COLUMNS = """
            p.id, p.title, p.body, p.created_by, p.slug, p.photo_url, p.published, \
            p.published_at, p.created_at, p.updated_at, p.view_count, p.like_count, \
            u.username""";

    private static final String FROM_POSTS_JOIN_USERS = """
            FROM posts p
            INNER JOIN users u ON p.created_by = u.id
            WHERE p.published = true AND p.deleted_at IS NULL""";

    public PostQuery build(PostListRequest request) {
        return build(request, null);
    }

    /**
     * @param request page request; its window and search length are checked here
     * @param tagName when non-null, restrict to posts carrying a tag with exactly this name
     */
    public PostQuery build(PostListRequest request, String tagName) {
        checkBounds(request);
        PostSortField sortField = PostSortField.fromValue(request.getOrderBy());
        SortDirection direction = SortDirection.fromValue(request.getSortDirection());

        List<Object> filterBindings = new ArrayList<>();
        String where = whereClause(request, tagName, filterBindings);

        String countSql = "SELECT COUNT(*)\n" + FROM_POSTS_JOIN_USERS + where;

        List<Object> pageBindings = new ArrayList<>(filterBindings);
        int limitIdx = pageBindings.size() + 1;
        pageBindings.add(request.getLimit());
        pageBindings.add(request.getOffset());

        String pageSql = "SELECT " + POST_COLUMNS + "\n" + FROM_POSTS_JOIN_USERS + where
                + "\nORDER BY " + orderBy(sortField, direction)
                + "\nLIMIT $" + limitIdx + " OFFSET $" + (limitIdx + 1);

        return new PostQuery(
                new SqlStatement(pageSql, pageBindings),
                new SqlStatement(countSql, filterBindings),
                sortField,
                direction,
                request.getLimit(),
                request.getOffset());
    }

    private String whereClause(PostListRequest request, String tagName, List<Object> bindings) {
        StringBuilder sql = new StringBuilder();
        if (tagName != null) {
            bindings.add(tagName);
            int idx = bindings.size();
            sql.append("""

                    AND EXISTS (SELECT 1 FROM posts_to_tags ptt
                        INNER JOIN tags t ON t.id = ptt.tag_id
                        WHERE ptt.post_id = p.id AND t.name = $%d)""".formatted(idx));
        }
        if (request.hasSearch()) {
            bindings.add(LikePatterns.contains(request.getSearch()));
            String param = "$" + bindings.size();
            sql.append("\nAND (")
                    .append(ilike("p.title", param)).append(" OR ")
                    .append(ilike("p.body", param)).append(" OR ")
                    .append(ilike("u.username", param))
                    .append(")");
        }
        return sql.toString();
    }

    private static String ilike(String column, String param) {
        return column + " ILIKE " + param + " " + LikePatterns.ESCAPE_CLAUSE;
    }

    // p.id breaks ties so that rows with equal sort keys keep their page across requests
    private static String orderBy(PostSortField field, SortDirection direction) {
        String clause = field.getColumn() + " " + direction.sql();
        if (field == PostSortField.PUBLISHED_AT) {
            clause += " NULLS LAST";
        }
        if (field != PostSortField.ID) {
            clause += ", p.id ASC";
        }
        return clause;
    }

    private static void checkBounds(PostListRequest request) {
        if (request.getOffset() < 0 || request.getOffset() > PostListRequest.MAX_OFFSET) {
            throw new InvalidRequestException("offset", "error.invalid_offset");
        }
        if (request.getLimit() < 1 || request.getLimit() > PostListRequest.MAX_LIMIT) {
            throw new InvalidRequestException("limit", "error.invalid_limit");
        }
        if (request.getSearch() != null && request.getSearch().length() > PostListRequest.MAX_SEARCH_LENGTH) {
            throw new InvalidRequestException("search", "error.invalid_search");
        }
    }
}
