package io.accounting.query;

import java.util.EnumSet;
import java.util.Set;

import static io.accounting.query.Operator.*;

/**
 * Queryable fields and the operators each accepts.
 */
public enum FieldClass {
    RECORD_ID("record_id", EnumSet.of(EQUALS), String.class),
    START_TIME("start_time", EnumSet.of(GT, GTE, LT, LTE), java.time.Instant.class),
    STOP_TIME("stop_time", EnumSet.of(GT, GTE, LT, LTE), java.time.Instant.class),
    RUNTIME("runtime", EnumSet.of(GT, GTE, LT, LTE), Long.class),
    META("meta", EnumSet.of(CONTAINS, DOES_NOT_CONTAIN), java.util.List.class),
    COMPONENT("component", EnumSet.of(GT, GTE, LT, LTE, EQUALS), Long.class);

    private final String queryName;
    private final Set<Operator> operators;
    private final Class<?> valueType;

    FieldClass(String queryName, Set<Operator> operators, Class<?> valueType) {
        this.queryName = queryName;
        this.operators = operators;
        this.valueType = valueType;
    }

    public String queryName() { return queryName; }

    public boolean supports(Operator op) { return operators.contains(op); }

    public boolean isKeyed() { return this == META || this == COMPONENT; }

    Class<?> valueType() { return valueType; }
}
