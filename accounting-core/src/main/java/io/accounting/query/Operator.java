package io.accounting.query;

import java.util.Optional;

public enum Operator {
    EQUALS("equals", "="),
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    CONTAINS("c", null),
    DOES_NOT_CONTAIN("dnc", null);

    private final String token;
    private final String sql;

    Operator(String token, String sql) {
        this.token = token;
        this.sql = sql;
    }

    /** Short form used when rendering query strings. */
    public String token() { return token; }

    /** Comparison symbol for scalar operators, null for the list operators. */
    public String sql() { return sql; }

    public static Optional<Operator> fromToken(String token) {
        return switch (token) {
            case "equals" -> Optional.of(EQUALS);
            case "gt" -> Optional.of(GT);
            case "gte" -> Optional.of(GTE);
            case "lt" -> Optional.of(LT);
            case "lte" -> Optional.of(LTE);
            case "c", "contains" -> Optional.of(CONTAINS);
            case "dnc", "does_not_contain" -> Optional.of(DOES_NOT_CONTAIN);
            default -> Optional.empty();
        };
    }
}
