package io.accounting.query;

import io.accounting.error.InvalidQueryException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Conjunction of clauses plus an optional sort and limit.
 */
public final class RecordQuery {
    private static final RecordQuery ALL = new RecordQuery(List.of(), null, null);

    private final List<Clause> clauses;
    private final SortSpec sort;
    private final Integer limit;

    private RecordQuery(List<Clause> clauses, SortSpec sort, Integer limit) {
        this.clauses = List.copyOf(clauses);
        this.sort = sort;
        this.limit = limit;
    }

    public static RecordQuery all() { return ALL; }

    public static Builder builder() { return new Builder(); }

    public List<Clause> clauses() { return clauses; }
    public Optional<SortSpec> sort() { return Optional.ofNullable(sort); }
    public OptionalInt limit() { return limit == null ? OptionalInt.empty() : OptionalInt.of(limit); }

    /** Renders the query in the form accepted by {@code GET /records}. */
    public String toQueryString() {
        List<String> parts = new ArrayList<>();
        for (Clause c : clauses) parts.add(pair(c.queryKey(), c.queryValue()));
        if (sort != null) parts.add(pair("sort_by[" + (sort.descending() ? "desc" : "asc") + "]", sort.field().column()));
        if (limit != null) parts.add(pair("limit", String.valueOf(limit)));
        return String.join("&", parts);
    }

    private static String pair(String key, String value) {
        return URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() { return toQueryString(); }

    public static final class Builder {
        private final List<Clause> clauses = new ArrayList<>();
        private SortSpec sort;
        private Integer limit;

        public Builder where(Clause clause) {
            clauses.add(clause);
            return this;
        }

        public Builder sortBy(SortSpec spec) {
            if (sort != null) throw new InvalidQueryException("only one sort_by is allowed");
            this.sort = spec;
            return this;
        }

        public Builder limit(int limit) {
            if (this.limit != null) throw new InvalidQueryException("only one limit is allowed");
            if (limit <= 0) throw new InvalidQueryException("limit must be a positive integer, got " + limit);
            this.limit = limit;
            return this;
        }

        public RecordQuery build() {
            if (clauses.isEmpty() && sort == null && limit == null) return ALL;
            return new RecordQuery(clauses, sort, limit);
        }
    }
}
