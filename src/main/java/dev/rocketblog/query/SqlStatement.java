package dev.rocketblog.query;

import java.util.List;

/**
 * SQL text with PostgreSQL positional markers ({@code $1..$n}) and the values bound
 * to them, in marker order.
 */
public record SqlStatement(String sql, List<Object> bindings) {

    public SqlStatement {
        bindings = List.copyOf(bindings);
    }
}
