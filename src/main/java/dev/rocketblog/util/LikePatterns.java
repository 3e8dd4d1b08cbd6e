package dev.rocketblog.util;

/**
 * Escaping helpers for user text that ends up inside a SQL {@code LIKE}/{@code ILIKE}
 * pattern. The result is always passed as a bound parameter; escaping only keeps
 * {@code %} and {@code _} in the input from acting as wildcards.
 * <p>
 * Statements consuming these patterns must declare {@code ESCAPE '\'}.
 */
public final class LikePatterns {

    public static final char ESCAPE_CHAR = '\\';

    /** SQL fragment to append after a LIKE operand built by this class. */
    public static final String ESCAPE_CLAUSE = "ESCAPE '\\'";

    private LikePatterns() {
        // utility class
    }

    /**
     * Escape the LIKE metacharacters ({@code %}, {@code _} and the escape character itself).
     *
     * @param text raw user text, may be null
     * @return text safe to embed literally in a LIKE pattern; empty for null input
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ESCAPE_CHAR || c == '%' || c == '_') {
                sb.append(ESCAPE_CHAR);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Build a substring-match pattern: {@code %<escaped text>%}.
     *
     * @param text raw user text, may be null
     * @return pattern matching any value that contains {@code text} literally
     */
    public static String contains(String text) {
        return "%" + escape(text) + "%";
    }
}
