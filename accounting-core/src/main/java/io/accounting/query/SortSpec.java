package io.accounting.query;

import java.util.Objects;

public record SortSpec(SortField field, boolean descending) {
    public SortSpec {
        Objects.requireNonNull(field, "field");
    }

    public static SortSpec asc(SortField field) { return new SortSpec(field, false); }

    public static SortSpec desc(SortField field) { return new SortSpec(field, true); }
}
