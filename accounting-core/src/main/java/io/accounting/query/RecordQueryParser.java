package io.accounting.query;

import io.accounting.core.Timestamps;
import io.accounting.error.InvalidQueryException;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the query-string grammar of {@code GET /records}, e.g.
 * {@code start_time[gt]=2024-01-01T00:00:00Z&meta[site][c]=[A]&component[cpu][gte]=4&sort_by[desc]=stop_time&limit=500}.
 *
 * <p>Any unknown key, unsupported operator or malformed value rejects the whole query.
 */
public final class RecordQueryParser {
    private static final Pattern KEY = Pattern.compile("^([a-z_]+)((?:\\[[^\\[\\]]*])*)$");
    private static final Pattern SEGMENT = Pattern.compile("\\[([^\\[\\]]*)]");

    private RecordQueryParser() {}

    public static RecordQuery parse(String rawQuery) {
        RecordQuery.Builder b = RecordQuery.builder();
        if (rawQuery == null || rawQuery.isBlank()) return b.build();
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            int eq = pair.indexOf('=');
            if (eq < 0) throw new InvalidQueryException("query parameter without value: " + decode(pair));
            apply(b, decode(pair.substring(0, eq)), decode(pair.substring(eq + 1)));
        }
        return b.build();
    }

    private static void apply(RecordQuery.Builder b, String key, String value) {
        Matcher m = KEY.matcher(key);
        if (!m.matches()) throw new InvalidQueryException("malformed query key: " + key);
        String name = m.group(1);
        List<String> segments = new ArrayList<>();
        Matcher s = SEGMENT.matcher(m.group(2));
        while (s.find()) segments.add(s.group(1));

        switch (name) {
            case "record_id" -> {
                if (!segments.isEmpty() && !(segments.size() == 1 && segments.get(0).equals("equals"))) {
                    throw new InvalidQueryException("record_id only supports equality");
                }
                b.where(Clause.recordId(value));
            }
            case "start_time" -> b.where(Clause.startTime(operator(key, segments, 1, 0), timestamp(key, value)));
            case "stop_time" -> b.where(Clause.stopTime(operator(key, segments, 1, 0), timestamp(key, value)));
            case "runtime" -> b.where(Clause.runtime(operator(key, segments, 1, 0), number(key, value)));
            case "meta" -> b.where(new Clause(FieldClass.META, segments.isEmpty() ? null : segments.get(0),
                    operator(key, segments, 2, 1), list(key, value)));
            case "component" -> b.where(Clause.component(segments.isEmpty() ? null : segments.get(0),
                    operator(key, segments, 2, 1), number(key, value)));
            case "sort_by" -> b.sortBy(sort(key, segments, value));
            case "limit" -> {
                if (!segments.isEmpty()) throw new InvalidQueryException("malformed query key: " + key);
                long limit = number(key, value);
                if (limit <= 0 || limit > Integer.MAX_VALUE) throw new InvalidQueryException("limit must be a positive integer, got " + value);
                b.limit((int) limit);
            }
            default -> throw new InvalidQueryException("unsupported query field: " + name);
        }
    }

    private static Operator operator(String key, List<String> segments, int expected, int index) {
        if (segments.size() != expected) throw new InvalidQueryException("malformed query key: " + key);
        String token = segments.get(index);
        return Operator.fromToken(token)
                .orElseThrow(() -> new InvalidQueryException("unknown operator " + token + " in " + key));
    }

    private static SortSpec sort(String key, List<String> segments, String value) {
        if (segments.size() != 1) throw new InvalidQueryException("malformed query key: " + key);
        SortField field = SortField.fromName(value.trim())
                .orElseThrow(() -> new InvalidQueryException("cannot sort by " + value));
        return switch (segments.get(0)) {
            case "asc" -> SortSpec.asc(field);
            case "desc" -> SortSpec.desc(field);
            default -> throw new InvalidQueryException("sort direction must be asc or desc: " + key);
        };
    }

    private static Instant timestamp(String key, String value) {
        // an unencoded '+' in the offset arrives as a space
        String text = value.trim().replace(' ', '+');
        try {
            return Timestamps.parse(text);
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException(key + " is not an RFC 3339 timestamp: " + value);
        }
    }

    private static long number(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidQueryException(key + " is not an integer: " + value);
        }
    }

    private static List<String> list(String key, String value) {
        String v = value.trim();
        if (v.startsWith("[")) {
            if (!v.endsWith("]")) throw new InvalidQueryException(key + " has an unterminated list: " + value);
            v = v.substring(1, v.length() - 1);
        }
        List<String> values = new ArrayList<>();
        for (String item : v.split(",", -1)) {
            String t = item.trim();
            if (t.isEmpty()) throw new InvalidQueryException(key + " has an empty list element: " + value);
            values.add(t);
        }
        return values;
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryException("malformed escape in query: " + s);
        }
    }
}
