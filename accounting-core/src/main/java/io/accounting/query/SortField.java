package io.accounting.query;

import java.util.Optional;

public enum SortField {
    START_TIME("start_time"),
    STOP_TIME("stop_time"),
    RUNTIME("runtime"),
    RECORD_ID("record_id");

    private final String column;

    SortField(String column) { this.column = column; }

    public String column() { return column; }

    public static Optional<SortField> fromName(String name) {
        for (SortField f : values()) {
            if (f.column.equals(name)) return Optional.of(f);
        }
        return Optional.empty();
    }
}
