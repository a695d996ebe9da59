package io.accounting.query;

import io.accounting.core.Timestamps;
import io.accounting.error.InvalidQueryException;

import java.time.Instant;
import java.util.List;

/**
 * One filter term. Construction rejects operator/field combinations the engine does not
 * support and values of the wrong type, so executors never see an invalid clause.
 *
 * @param key meta key or component name; null for unkeyed fields
 */
public record Clause(FieldClass field, String key, Operator operator, Object value) {
    public Clause {
        if (field == null || operator == null || value == null) {
            throw new InvalidQueryException("clause needs a field, an operator and a value");
        }
        if (!field.supports(operator)) {
            throw new InvalidQueryException(field.queryName() + " does not support operator " + operator.token());
        }
        if (field.isKeyed() && (key == null || key.isBlank())) {
            throw new InvalidQueryException(field.queryName() + " clause needs a name");
        }
        if (!field.valueType().isInstance(value)) {
            throw new InvalidQueryException(field.queryName() + " expects a " + field.valueType().getSimpleName() + " value");
        }
        if (field == FieldClass.META) {
            List<?> values = (List<?>) value;
            if (values.isEmpty()) throw new InvalidQueryException("meta " + key + " clause has no values");
            for (Object v : values) {
                if (!(v instanceof String) || ((String) v).isBlank()) {
                    throw new InvalidQueryException("meta " + key + " clause has an empty value");
                }
            }
            value = List.copyOf(values);
        }
    }

    public static Clause recordId(String id) {
        return new Clause(FieldClass.RECORD_ID, null, Operator.EQUALS, id);
    }

    public static Clause startTime(Operator op, Instant t) {
        return new Clause(FieldClass.START_TIME, null, op, t);
    }

    public static Clause stopTime(Operator op, Instant t) {
        return new Clause(FieldClass.STOP_TIME, null, op, t);
    }

    public static Clause runtime(Operator op, long seconds) {
        return new Clause(FieldClass.RUNTIME, null, op, seconds);
    }

    public static Clause metaContains(String key, String... values) {
        return new Clause(FieldClass.META, key, Operator.CONTAINS, List.of(values));
    }

    public static Clause metaDoesNotContain(String key, String... values) {
        return new Clause(FieldClass.META, key, Operator.DOES_NOT_CONTAIN, List.of(values));
    }

    public static Clause component(String name, Operator op, long amount) {
        return new Clause(FieldClass.COMPONENT, name, op, amount);
    }

    public Instant instant() { return (Instant) value; }

    public long number() { return (Long) value; }

    public String text() { return (String) value; }

    @SuppressWarnings("unchecked")
    public List<String> values() { return (List<String>) value; }

    String queryKey() {
        return switch (field) {
            case RECORD_ID -> field.queryName();
            case META, COMPONENT -> field.queryName() + "[" + key + "][" + operator.token() + "]";
            default -> field.queryName() + "[" + operator.token() + "]";
        };
    }

    String queryValue() {
        return switch (field) {
            case START_TIME, STOP_TIME -> Timestamps.format(instant());
            case META -> "[" + String.join(",", values()) + "]";
            default -> String.valueOf(value);
        };
    }
}
