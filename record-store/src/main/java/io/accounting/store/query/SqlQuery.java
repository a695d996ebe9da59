package io.accounting.store.query;

import io.accounting.jdbc.Database;
import io.accounting.query.Clause;
import io.accounting.query.RecordQuery;
import io.accounting.query.SortSpec;
import io.accounting.store.RecordRows;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SQL text plus positional parameters for a {@link RecordQuery}. Only fixed fragments chosen
 * from the query enums reach the SQL text; every user value is a bound parameter.
 */
final class SqlQuery {
    private static final String META_MATCH =
            "SELECT 1 FROM record_meta m WHERE m.record_pk = r.id AND m.meta_key = ? AND m.meta_value";
    private static final String COMPONENT_MATCH =
            "EXISTS (SELECT 1 FROM record_component c WHERE c.record_pk = r.id AND c.component_name = ? AND c.amount ";

    private final String sql;
    private final List<Object> params;

    private SqlQuery(String sql, List<Object> params) {
        this.sql = sql;
        this.params = Collections.unmodifiableList(params);
    }

    static SqlQuery of(RecordQuery query) {
        StringBuilder sql = new StringBuilder("SELECT ").append(RecordRows.COLUMNS).append(" FROM accounting_record r");
        List<Object> params = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        for (Clause c : query.clauses()) conditions.add(condition(c, params));
        if (!conditions.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", conditions));

        sql.append(" ORDER BY ");
        SortSpec sort = query.sort().orElse(null);
        if (sort == null) {
            sql.append("r.stop_time ASC NULLS LAST");
        } else {
            sql.append("r.").append(sort.field().column()).append(sort.descending() ? " DESC" : " ASC").append(" NULLS LAST");
        }
        sql.append(", r.id ASC");

        if (query.limit().isPresent()) {
            sql.append(" FETCH FIRST ? ROWS ONLY");
            params.add(query.limit().getAsInt());
        }
        return new SqlQuery(sql.toString(), params);
    }

    private static String condition(Clause c, List<Object> params) {
        return switch (c.field()) {
            case RECORD_ID -> {
                params.add(c.text());
                yield "r.record_id = ?";
            }
            case START_TIME, STOP_TIME -> {
                params.add(c.instant());
                yield "r." + c.field().queryName() + " " + c.operator().sql() + " ?";
            }
            case RUNTIME -> {
                params.add(c.number());
                yield "r.runtime " + c.operator().sql() + " ?";
            }
            case COMPONENT -> {
                params.add(c.key());
                params.add(c.number());
                yield COMPONENT_MATCH + c.operator().sql() + " ?)";
            }
            case META -> meta(c, params);
        };
    }

    private static String meta(Clause c, List<Object> params) {
        List<String> values = c.values();
        return switch (c.operator()) {
            case CONTAINS -> {
                List<String> parts = new ArrayList<>();
                for (String v : values) {
                    params.add(c.key());
                    params.add(v);
                    parts.add("EXISTS (" + META_MATCH + " = ?)");
                }
                yield String.join(" AND ", parts);
            }
            case DOES_NOT_CONTAIN -> {
                params.add(c.key());
                params.addAll(values);
                yield "NOT EXISTS (" + META_MATCH + " IN (" + String.join(", ", Collections.nCopies(values.size(), "?")) + "))";
            }
            default -> throw new IllegalStateException("unhandled meta operator " + c.operator());
        };
    }

    String sql() { return sql; }

    List<Object> params() { return params; }

    void bind(PreparedStatement ps) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object p = params.get(i);
            int idx = i + 1;
            if (p instanceof Instant) ps.setObject(idx, Database.utc((Instant) p));
            else if (p instanceof Long) ps.setLong(idx, (Long) p);
            else if (p instanceof Integer) ps.setInt(idx, (Integer) p);
            else ps.setString(idx, (String) p);
        }
    }
}
